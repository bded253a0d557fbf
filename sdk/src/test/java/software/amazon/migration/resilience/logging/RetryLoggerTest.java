// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.logging;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.slf4j.Logger;
import org.slf4j.MDC;
import software.amazon.migration.resilience.retry.RetryCategory;
import software.amazon.migration.resilience.stats.AttemptRecord;

class RetryLoggerTest {

    private Logger mockLogger;

    @BeforeEach
    void setUp() {
        mockLogger = mock(Logger.class);
    }

    private static AttemptRecord throttledAttempt() {
        return new AttemptRecord(
                2,
                Duration.ofMillis(2500),
                RetryCategory.THROTTLING,
                "Rate exceeded",
                Instant.parse("2026-01-15T10:00:00Z"));
    }

    @Test
    void logsRetryNotice() {
        var logger = new RetryLogger(mockLogger, "replicate");

        logger.retryScheduled(throttledAttempt(), 5);

        verify(mockLogger)
                .warn(
                        "{} - Retrying in {} (attempt {}/{}), reason: {}",
                        "API rate limit exceeded",
                        "2.5s",
                        2,
                        5,
                        "Rate exceeded");
    }

    @Test
    void setsMdcDuringRetryNoticeAndClearsAfter() {
        try (MockedStatic<MDC> mdcMock = mockStatic(MDC.class)) {
            var logger = new RetryLogger(mockLogger, "replicate");

            logger.retryScheduled(throttledAttempt(), 5);

            mdcMock.verify(() -> MDC.put("operationName", "replicate"));
            mdcMock.verify(() -> MDC.put("attempt", "2"));
            mdcMock.verify(() -> MDC.put("retryCategory", "THROTTLING"));
            mdcMock.verify(() -> MDC.remove("operationName"));
            mdcMock.verify(() -> MDC.remove("attempt"));
            mdcMock.verify(() -> MDC.remove("retryCategory"));
        }
    }

    @Test
    void omitsOptionalMdcKeys() {
        try (MockedStatic<MDC> mdcMock = mockStatic(MDC.class)) {
            var logger = new RetryLogger(mockLogger, null);

            logger.recovered(3);

            mdcMock.verify(() -> MDC.put("attempt", "3"));
            mdcMock.verify(() -> MDC.put(eq("operationName"), anyString()), never());
            mdcMock.verify(() -> MDC.put(eq("retryCategory"), anyString()), never());
        }
    }

    @Test
    void clearsMdcWhenDelegateThrows() {
        doThrow(new IllegalStateException("appender failed"))
                .when(mockLogger)
                .warn(anyString(), any(), any());

        try (MockedStatic<MDC> mdcMock = mockStatic(MDC.class)) {
            var logger = new RetryLogger(mockLogger, "replicate");

            assertThrows(IllegalStateException.class, () -> logger.exhausted(3, new RuntimeException("HTTP 503")));

            mdcMock.verify(() -> MDC.remove("operationName"));
            mdcMock.verify(() -> MDC.remove("attempt"));
        }
    }

    @Test
    void logsOutcomes() {
        var logger = new RetryLogger(mockLogger, null);

        logger.recovered(3);
        logger.exhausted(3, new RuntimeException("HTTP 503"));
        logger.notRetryable(1, new IllegalArgumentException());
        logger.interrupted(2);

        verify(mockLogger).info("Operation succeeded after {} retry attempt(s)", 2);
        verify(mockLogger).warn("Operation failed after {} attempts: {}", 3, "HTTP 503");
        verify(mockLogger)
                .debug("Failure on attempt {} is not retryable: {}", 1, "java.lang.IllegalArgumentException");
        verify(mockLogger).warn("Interrupted while waiting to retry attempt {}", 2);
    }

    @Test
    void forOperationKeepsDelegate() {
        var logger = new RetryLogger(mockLogger, null).forOperation("inventory");

        logger.interrupted(1);

        assertEquals("inventory", logger.getOperationName());
        verify(mockLogger).warn("Interrupted while waiting to retry attempt {}", 1);
    }
}
