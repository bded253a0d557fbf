// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience;

import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.migration.resilience.exception.RetryInterruptedException;
import software.amazon.migration.resilience.logging.RetryLogger;
import software.amazon.migration.resilience.retry.BackoffScheduler;
import software.amazon.migration.resilience.retry.ErrorClassifier;
import software.amazon.migration.resilience.retry.RetryDecision;
import software.amazon.migration.resilience.retry.Sleeper;
import software.amazon.migration.resilience.stats.AttemptRecord;
import software.amazon.migration.resilience.stats.RetryStatistics;
import software.amazon.migration.resilience.util.ExceptionHelper;

/**
 * Runs remote operations, retrying transient failures according to a {@link RetryPolicy}.
 *
 * <p>Each call to {@link #execute(RemoteOperation)} invokes the operation synchronously on the calling thread, one
 * attempt at a time. When an attempt fails and attempts remain, the failure is classified by {@link ErrorClassifier};
 * transient failures are retried after a delay computed by {@link BackoffScheduler}, anything else is rethrown
 * immediately. Once the attempts are exhausted the last failure is rethrown. Failures are always rethrown exactly as
 * the operation raised them, checked exceptions included.
 *
 * <p>Every final outcome and every scheduled retry is recorded in the executor's {@link RetryStatistics}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder()
 *     .policy(RetryPolicies.Presets.CLOUD_API)
 *     .operationName("describe-source-servers")
 *     .build();
 *
 * DescribeSourceServersResponse response = executor.execute(() -> mgnClient.describeSourceServers(request));
 * }</pre>
 *
 * <p>Executors are immutable and may be shared between threads. Waiting between attempts suspends only the calling
 * thread.
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final BackoffScheduler scheduler;
    private final RetryStatistics statistics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RetryLogger retryLogger;

    private RetryExecutor(Builder builder) {
        this.policy = builder.policy != null ? builder.policy : RetryPolicy.defaults();
        this.classifier = new ErrorClassifier(policy);
        this.scheduler = builder.scheduler != null ? builder.scheduler : new BackoffScheduler();
        this.statistics = builder.statistics != null ? builder.statistics : RetryStatistics.shared();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD_SLEEP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.retryLogger = builder.retryLogger != null
                ? builder.retryLogger.forOperation(builder.operationName)
                : new RetryLogger(logger, builder.operationName);
    }

    /**
     * Creates an executor with the default policy, recording into {@link RetryStatistics#shared()}.
     *
     * @return RetryExecutor with default configuration
     */
    public static RetryExecutor create() {
        return builder().build();
    }

    /**
     * Creates an executor with the given policy, recording into {@link RetryStatistics#shared()}.
     *
     * @param policy the retry policy
     * @return RetryExecutor using the policy
     */
    public static RetryExecutor create(RetryPolicy policy) {
        return builder().policy(policy).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder initialized with this executor's collaborators */
    public Builder toBuilder() {
        return new Builder()
                .policy(policy)
                .scheduler(scheduler)
                .statistics(statistics)
                .sleeper(sleeper)
                .clock(clock)
                .retryLogger(retryLogger)
                .operationName(retryLogger.getOperationName());
    }

    /**
     * Returns an executor that applies a different policy but shares everything else, including the statistics.
     * Useful for scoped overrides such as a critical call inside an otherwise default workflow.
     *
     * @param policy the policy to apply
     * @return a new executor
     */
    public RetryExecutor withPolicy(RetryPolicy policy) {
        return toBuilder()
                .policy(Objects.requireNonNull(policy, "policy cannot be null"))
                .build();
    }

    /**
     * Returns an executor that tags its log entries with the given operation name.
     *
     * @param operationName name shown in retry notices, may be null
     * @return a new executor
     */
    public RetryExecutor withOperationName(String operationName) {
        return toBuilder().operationName(operationName).build();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public RetryStatistics getStatistics() {
        return statistics;
    }

    /**
     * Runs the operation, retrying transient failures.
     *
     * @param operation the operation to run
     * @param <T> the result type
     * @return the result of the first successful attempt
     * @throws RetryInterruptedException if the thread is interrupted while waiting between attempts
     */
    public <T> T execute(RemoteOperation<T> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        var maxAttempts = policy.maxAttempts();

        for (int attemptNumber = 1; ; attemptNumber++) {
            Throwable failure;
            try {
                T result = operation.call();
                statistics.recordCallResult(true);
                if (attemptNumber > 1) {
                    retryLogger.recovered(attemptNumber);
                }
                return result;
            } catch (Throwable t) {
                failure = t;
            }

            if (attemptNumber >= maxAttempts) {
                statistics.recordCallResult(false);
                retryLogger.exhausted(maxAttempts, failure);
                throw ExceptionHelper.sneakyThrow(failure);
            }

            var decision = decide(failure, attemptNumber - 1);
            if (!decision.shouldRetry()) {
                statistics.recordCallResult(false);
                retryLogger.notRetryable(attemptNumber, failure);
                throw ExceptionHelper.sneakyThrow(failure);
            }

            var attempt = new AttemptRecord(
                    attemptNumber,
                    decision.delay(),
                    decision.category().orElseThrow(),
                    ExceptionHelper.describe(failure),
                    clock.instant());
            statistics.recordAttempt(attempt);
            retryLogger.retryScheduled(attempt, maxAttempts);

            try {
                sleeper.sleep(decision.delay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                statistics.recordCallResult(false);
                retryLogger.interrupted(attemptNumber);
                throw new RetryInterruptedException(retryLogger.getOperationName(), attemptNumber, e, failure);
            }
        }
    }

    /**
     * Wraps an operation so that every call through the returned operation is retried by this executor.
     *
     * @param operation the operation to wrap
     * @param <T> the result type
     * @return the retrying operation
     */
    public <T> RetryingOperation<T> decorate(RemoteOperation<T> operation) {
        return new RetryingOperation<>(operation, this);
    }

    /**
     * Decides whether a failure should be retried and how long to wait, ignoring the attempt budget.
     *
     * @param failure the failure raised by the operation
     * @param attemptIndex zero-based index of the retry that would follow
     * @return the decision
     */
    public RetryDecision decide(Throwable failure, int attemptIndex) {
        var unwrapped = ExceptionHelper.unwrapCompletion(failure);
        return classifier
                .classify(unwrapped)
                .map(category ->
                        RetryDecision.retry(category, scheduler.computeDelay(attemptIndex, category, unwrapped, policy)))
                .orElseGet(RetryDecision::fail);
    }

    /** Builder for RetryExecutor. Every collaborator is optional. */
    public static final class Builder {
        private RetryPolicy policy;
        private BackoffScheduler scheduler;
        private RetryStatistics statistics;
        private Sleeper sleeper;
        private Clock clock;
        private RetryLogger retryLogger;
        private String operationName;

        private Builder() {}

        /**
         * Sets the retry policy. Defaults to {@link RetryPolicy#defaults()}.
         *
         * @param policy the policy
         * @return this builder
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = policy;
            return this;
        }

        /**
         * Sets the backoff scheduler, e.g. one with a deterministic random source.
         *
         * @param scheduler the scheduler
         * @return this builder
         */
        public Builder scheduler(BackoffScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Sets where outcomes are recorded. Defaults to {@link RetryStatistics#shared()}.
         *
         * @param statistics the statistics recorder
         * @return this builder
         */
        public Builder statistics(RetryStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        /**
         * Sets how the executor waits between attempts. Defaults to {@link Sleeper#THREAD_SLEEP}.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Sets the clock used to timestamp attempt records. Defaults to the UTC system clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the logger used for retry notices.
         *
         * @param retryLogger the logger
         * @return this builder
         */
        public Builder retryLogger(RetryLogger retryLogger) {
            this.retryLogger = retryLogger;
            return this;
        }

        /**
         * Sets the name added to retry notices via MDC.
         *
         * @param operationName the operation name, may be null
         * @return this builder
         */
        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
