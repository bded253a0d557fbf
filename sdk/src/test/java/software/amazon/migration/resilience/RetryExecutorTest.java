// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.http.SdkHttpResponse;
import software.amazon.migration.resilience.TestUtils.RecordingSleeper;
import software.amazon.migration.resilience.exception.RetryInterruptedException;
import software.amazon.migration.resilience.failure.RemoteServiceException;
import software.amazon.migration.resilience.logging.RetryLogger;
import software.amazon.migration.resilience.retry.RetryCategory;
import software.amazon.migration.resilience.stats.RetryStatistics;

class RetryExecutorTest {

    private RecordingSleeper sleeper;
    private RetryStatistics statistics;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        statistics = new RetryStatistics();
        executor = RetryExecutor.builder()
                .sleeper(sleeper)
                .statistics(statistics)
                .scheduler(TestUtils.noJitterScheduler())
                .clock(TestUtils.fixedClock())
                .operationName("describe-source-servers")
                .build();
    }

    @Test
    void testSuccessOnFirstAttempt() {
        var calls = new AtomicInteger();

        var result = executor.execute(() -> {
            calls.incrementAndGet();
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(1, calls.get());
        assertTrue(sleeper.delays().isEmpty());
        var snapshot = statistics.snapshot();
        assertEquals(1, snapshot.totalCalls());
        assertEquals(1, snapshot.successfulCalls());
        assertEquals(0, snapshot.totalRetries());
    }

    @Test
    void testRecoversFromTransientServiceFailures() {
        var calls = new AtomicInteger();

        var result = executor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw TestUtils.httpFailure(503);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.delays());

        var snapshot = statistics.snapshot();
        assertEquals(1, snapshot.totalCalls());
        assertEquals(1, snapshot.successfulCalls());
        assertEquals(0, snapshot.failedCalls());
        assertEquals(2, snapshot.totalRetries());
        assertEquals(Map.of(RetryCategory.SERVICE_UNAVAILABLE, 2L), snapshot.retriesByCategory());
        assertEquals(100.0, snapshot.successRate());

        var first = snapshot.attempts().get(0);
        assertEquals(1, first.attemptNumber());
        assertEquals("HTTP 503", first.failureMessage());
        assertEquals(TestUtils.NOW, first.timestamp());
    }

    @Test
    void testExhaustsAttemptsAndRethrowsLastFailure() {
        var calls = new AtomicInteger();
        var failure = TestUtils.httpFailure(503);

        var thrown = assertThrows(RemoteServiceException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw failure;
        }));

        assertSame(failure, thrown);
        assertEquals(3, calls.get());
        assertEquals(2, sleeper.delays().size());
        var snapshot = statistics.snapshot();
        assertEquals(1, snapshot.failedCalls());
        assertEquals(2, snapshot.totalRetries());
    }

    @Test
    void testRunsExactlyMaxAttemptsForAlwaysRetryableFailure() {
        var calls = new AtomicInteger();
        var fiveAttempts = executor.withPolicy(RetryPolicy.builder().maxAttempts(5).build());

        assertThrows(ConnectException.class, () -> fiveAttempts.execute(() -> {
            calls.incrementAndGet();
            throw new ConnectException("Connection refused");
        }));

        assertEquals(5, calls.get());
        assertEquals(4, sleeper.delays().size());
    }

    @Test
    void testNonRetryableFailureIsRethrownImmediately() {
        var calls = new AtomicInteger();
        var notFound = TestUtils.httpFailure(404);

        var thrown = assertThrows(RemoteServiceException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw notFound;
        }));

        assertSame(notFound, thrown);
        assertEquals(1, calls.get());
        assertTrue(sleeper.delays().isEmpty());
        var snapshot = statistics.snapshot();
        assertEquals(1, snapshot.totalCalls());
        assertEquals(1, snapshot.failedCalls());
        assertEquals(0, snapshot.totalRetries());
    }

    @Test
    void testThrottlingHonoursRetryAfterHint() {
        var calls = new AtomicInteger();

        var result = executor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw RemoteServiceException.builder("Too Many Requests")
                        .statusCode(429)
                        .retryAfter("3.0")
                        .build();
            }
            return 42;
        });

        assertEquals(42, result);
        assertEquals(List.of(Duration.ofSeconds(3)), sleeper.delays());
        assertEquals(Map.of(RetryCategory.THROTTLING, 1L), statistics.snapshot().retriesByCategory());
    }

    @Test
    void testAwsServiceExceptionWithRetryAfterHeader() {
        var calls = new AtomicInteger();
        var throttled = AwsServiceException.builder()
                .message("Rate exceeded")
                .awsErrorDetails(AwsErrorDetails.builder()
                        .errorCode("ThrottlingException")
                        .sdkHttpResponse(SdkHttpResponse.builder()
                                .statusCode(429)
                                .putHeader("Retry-After", "3")
                                .build())
                        .build())
                .statusCode(429)
                .build();

        var result = executor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw throttled;
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(List.of(Duration.ofSeconds(3)), sleeper.delays());
    }

    @Test
    void testCheckedExceptionIsRethrownUnchanged() {
        var original = new IOException("disk full");

        var thrown = assertThrows(IOException.class, () -> executor.execute(() -> {
            throw original;
        }));

        assertSame(original, thrown);
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void testErrorsAreNotRetried() {
        var calls = new AtomicInteger();

        assertThrows(LinkageError.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new LinkageError("connection timeout");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void testCompletionExceptionIsClassifiedByCauseAndRethrownAsIs() {
        var calls = new AtomicInteger();
        var wrapped = new CompletionException(TestUtils.httpFailure(503));

        var thrown = assertThrows(CompletionException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw wrapped;
        }));

        assertSame(wrapped, thrown);
        assertEquals(3, calls.get());
    }

    @Test
    void testInterruptedWhileWaiting() {
        var calls = new AtomicInteger();
        var failure = TestUtils.httpFailure(503);
        var interrupting = executor.toBuilder()
                .sleeper(duration -> {
                    throw new InterruptedException("shutdown");
                })
                .build();

        try {
            var thrown = assertThrows(RetryInterruptedException.class, () -> interrupting.execute(() -> {
                calls.incrementAndGet();
                throw failure;
            }));

            assertEquals(1, calls.get());
            assertEquals(1, thrown.getAttemptNumber());
            assertEquals("describe-source-servers", thrown.getOperationName());
            assertInstanceOf(InterruptedException.class, thrown.getCause());
            assertSame(failure, thrown.getSuppressed()[0]);
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, statistics.snapshot().failedCalls());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testSingleAttemptPolicyNeverSleeps() {
        var calls = new AtomicInteger();
        var noRetry = executor.withPolicy(RetryPolicies.Presets.NO_RETRY);

        assertThrows(RemoteServiceException.class, () -> noRetry.execute(() -> {
            calls.incrementAndGet();
            throw TestUtils.httpFailure(503);
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeper.delays().isEmpty());
    }

    @Test
    void testWithPolicySharesStatistics() {
        var scoped = executor.withPolicy(RetryPolicies.Presets.CRITICAL_OPERATION);

        assertSame(statistics, scoped.getStatistics());
        assertSame(RetryPolicies.Presets.CRITICAL_OPERATION, scoped.getPolicy());
        assertSame(RetryPolicy.defaults(), executor.getPolicy());
    }

    @Test
    void testDecideIgnoresAttemptBudget() {
        var decision = executor.decide(TestUtils.httpFailure(429), 1);

        assertTrue(decision.shouldRetry());
        assertEquals(RetryCategory.THROTTLING, decision.category().orElseThrow());
        assertEquals(Duration.ofSeconds(4), decision.delay());
        assertFalse(executor.decide(TestUtils.httpFailure(404), 0).shouldRetry());
    }

    @Test
    void testDecorateRetriesEachCall() {
        var calls = new AtomicInteger();
        RemoteOperation<Integer> flaky = () -> {
            if (calls.incrementAndGet() % 2 == 1) {
                throw new RuntimeException("Request timed out");
            }
            return calls.get();
        };

        var decorated = executor.decorate(flaky);

        assertEquals(2, decorated.call());
        assertEquals(4, decorated.call());
        assertEquals(2, statistics.snapshot().successfulCalls());
        assertEquals(Map.of(RetryCategory.TIMEOUT, 2L), statistics.snapshot().retriesByCategory());
    }

    @Test
    void testLogsRetryNoticesAndRecovery() {
        var logger = mock(Logger.class);
        var logging = executor.toBuilder()
                .retryLogger(new RetryLogger(logger, null))
                .build();
        var calls = new AtomicInteger();

        logging.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw TestUtils.httpFailure(503);
            }
            return "ok";
        });

        verify(logger, times(2)).warn(eq("{} - Retrying in {} (attempt {}/{}), reason: {}"), any(Object[].class));
        verify(logger).info("Operation succeeded after {} retry attempt(s)", 2);
    }

    @Test
    void testLogsExhaustion() {
        var logger = mock(Logger.class);
        var logging = executor.toBuilder()
                .retryLogger(new RetryLogger(logger, null))
                .build();

        assertThrows(RemoteServiceException.class, () -> logging.execute(() -> {
            throw TestUtils.httpFailure(503);
        }));

        verify(logger).warn("Operation failed after {} attempts: {}", 3, "HTTP 503");
        verify(logger, never()).info(anyString(), any(Object.class));
    }

    @Test
    void testNullOperationIsRejected() {
        assertThrows(NullPointerException.class, () -> executor.execute(null));
    }

    @Test
    void testRecoversFromTransientServiceFailuresWithoutJitter() {
        var calls = new AtomicInteger();
        var withoutJitter = RetryExecutor.builder()
                .policy(RetryPolicy.builder().jitterEnabled(false).build())
                .sleeper(sleeper)
                .statistics(statistics)
                .build();

        var result = withoutJitter.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw TestUtils.httpFailure(503);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.delays());
        var snapshot = statistics.snapshot();
        assertEquals(1, snapshot.totalCalls());
        assertEquals(1, snapshot.successfulCalls());
        assertEquals(2, snapshot.totalRetries());
    }

    @Test
    void testVeryLargeMaxDelayStillRethrowsOperationFailure() {
        var failure = TestUtils.httpFailure(503);
        var centuries = executor.withPolicy(
                RetryPolicy.builder().maxDelay(Duration.ofDays(365L * 400)).build());

        var thrown = assertThrows(RemoteServiceException.class, () -> centuries.execute(() -> {
            throw failure;
        }));

        assertSame(failure, thrown);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.delays());
        assertEquals(1, statistics.snapshot().failedCalls());
    }

    @Test
    void testMessagelessFailureIsNotRetriedOnItsClassName() {
        var calls = new AtomicInteger();

        assertThrows(ConnectionStringMissingException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new ConnectionStringMissingException();
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeper.delays().isEmpty());
        assertTrue(statistics.snapshot().attempts().isEmpty());
    }

    @Test
    void testMessagelessRetryableFailureIsRecordedByClassName() {
        var calls = new AtomicInteger();

        var result = executor.execute(() -> {
            if (calls.incrementAndGet() < 2) {
                throw new ConnectException();
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals("java.net.ConnectException", statistics.snapshot().attempts().get(0).failureMessage());
    }

    private static class ConnectionStringMissingException extends RuntimeException {}
}
