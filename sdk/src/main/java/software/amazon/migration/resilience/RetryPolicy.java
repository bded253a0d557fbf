// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import software.amazon.migration.resilience.retry.ClassificationRules;
import software.amazon.migration.resilience.validation.ParameterValidator;

/**
 * Configuration of how a remote operation is retried.
 *
 * <p>A policy is immutable once built and can be shared freely between executors and threads.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .backoffMultiplier(1.5)
 *     .build();
 * }</pre>
 */
public final class RetryPolicy {
    static final int DEFAULT_MAX_ATTEMPTS = 3;
    static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);
    static final Set<Class<? extends Throwable>> DEFAULT_RETRYABLE_ERROR_KINDS =
            Set.of(ConnectException.class, SocketTimeoutException.class, TimeoutException.class);

    private static final RetryPolicy DEFAULTS = builder().build();

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final boolean jitterEnabled;
    private final Set<Integer> retryableStatusCodes;
    private final Set<Class<? extends Throwable>> retryableErrorKinds;
    private final ClassificationRules classificationRules;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.jitterEnabled = builder.jitterEnabled;
        this.retryableStatusCodes = Set.copyOf(builder.retryableStatusCodes);
        this.retryableErrorKinds = Set.copyOf(builder.retryableErrorKinds);
        this.classificationRules = builder.classificationRules;
    }

    /**
     * Policy with 3 attempts, 1 second base delay, 60 seconds max delay, 2x backoff, jitter enabled and the usual
     * transient HTTP status codes (408, 429, 500, 502, 503, 504).
     *
     * @return the default policy
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder initialized with this policy's settings */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitterEnabled(jitterEnabled)
                .retryableStatusCodes(retryableStatusCodes)
                .retryableErrorKinds(retryableErrorKinds)
                .classificationRules(classificationRules);
    }

    /** @return total number of attempts, including the first one */
    public int maxAttempts() {
        return maxAttempts;
    }

    /** @return delay before the first retry, before jitter and category scaling */
    public Duration baseDelay() {
        return baseDelay;
    }

    /** @return upper bound of any delay, including server-supplied retry-after hints */
    public Duration maxDelay() {
        return maxDelay;
    }

    /** @return factor applied to the delay for each additional retry */
    public double backoffMultiplier() {
        return backoffMultiplier;
    }

    /** @return true if computed delays are randomized by up to 10% in either direction */
    public boolean jitterEnabled() {
        return jitterEnabled;
    }

    /** @return status codes treated as transient */
    public Set<Integer> retryableStatusCodes() {
        return retryableStatusCodes;
    }

    /** @return exception types treated as transient regardless of their message */
    public Set<Class<? extends Throwable>> retryableErrorKinds() {
        return retryableErrorKinds;
    }

    /** @return message keywords and error codes used for classification */
    public ClassificationRules classificationRules() {
        return classificationRules;
    }

    /**
     * @param failure the failure to test
     * @return true if the failure is an instance of one of the retryable error kinds
     */
    public boolean isRetryableErrorKind(Throwable failure) {
        for (var kind : retryableErrorKinds) {
            if (kind.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format(
                "RetryPolicy{maxAttempts=%d, baseDelay=%s, maxDelay=%s, backoffMultiplier=%s, jitterEnabled=%s}",
                maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterEnabled);
    }

    /** Builder for RetryPolicy. Unset fields keep their defaults. */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private boolean jitterEnabled = true;
        private Set<Integer> retryableStatusCodes = DEFAULT_RETRYABLE_STATUS_CODES;
        private Set<Class<? extends Throwable>> retryableErrorKinds = DEFAULT_RETRYABLE_ERROR_KINDS;
        private ClassificationRules classificationRules = ClassificationRules.defaults();

        private Builder() {}

        /**
         * @param maxAttempts total attempts including the first, at least 1
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * @param baseDelay delay before the first retry, must be positive
         * @return this builder
         */
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        /**
         * @param maxDelay upper bound for any delay, must be positive and not below the base delay
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * @param backoffMultiplier growth factor per retry, at least 1
         * @return this builder
         */
        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterEnabled(boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
            return this;
        }

        public Builder retryableStatusCodes(Set<Integer> retryableStatusCodes) {
            this.retryableStatusCodes =
                    Objects.requireNonNull(retryableStatusCodes, "retryableStatusCodes cannot be null");
            return this;
        }

        public Builder retryableErrorKinds(Set<Class<? extends Throwable>> retryableErrorKinds) {
            this.retryableErrorKinds =
                    Objects.requireNonNull(retryableErrorKinds, "retryableErrorKinds cannot be null");
            return this;
        }

        public Builder classificationRules(ClassificationRules classificationRules) {
            this.classificationRules =
                    Objects.requireNonNull(classificationRules, "classificationRules cannot be null");
            return this;
        }

        /**
         * Builds the RetryPolicy instance.
         *
         * @return immutable RetryPolicy
         * @throws IllegalArgumentException if a parameter is out of range
         */
        public RetryPolicy build() {
            ParameterValidator.validatePositiveInteger(maxAttempts, "maxAttempts");
            ParameterValidator.validatePositiveDuration(baseDelay, "baseDelay");
            ParameterValidator.validatePositiveDuration(maxDelay, "maxDelay");
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException(
                        "baseDelay must not exceed maxDelay, got: " + baseDelay + " > " + maxDelay);
            }
            ParameterValidator.validateMultiplier(backoffMultiplier, "backoffMultiplier");
            return new RetryPolicy(this);
        }
    }
}
