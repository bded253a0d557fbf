// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience;

import java.time.Duration;

/**
 * Factory class for common retry policies.
 *
 * <p>Provides presets for the kinds of calls a migration tool makes, as well as factory methods for tuning their
 * attempt count and base delay.
 */
public final class RetryPolicies {

    private RetryPolicies() {}

    /** Preset retry policies for common use cases. */
    public static final class Presets {

        private Presets() {}

        /** Same as {@link RetryPolicy#defaults()}. */
        public static final RetryPolicy DEFAULT = RetryPolicy.defaults();

        /** Cloud management API calls: 3 attempts, 1 second base delay, 60 seconds max delay, 2x backoff. */
        public static final RetryPolicy CLOUD_API = cloudApi(3, Duration.ofSeconds(1));

        /**
         * Raw network operations: 5 attempts, 500 ms base delay, 30 seconds max delay and a gentler 1.5x backoff.
         */
        public static final RetryPolicy NETWORK = network(5, Duration.ofMillis(500));

        /** Operations that must succeed: 5 attempts, 2 seconds base delay, up to 120 seconds between attempts. */
        public static final RetryPolicy CRITICAL_OPERATION = criticalOperation(5, Duration.ofSeconds(2));

        /** Single attempt; failures propagate immediately. */
        public static final RetryPolicy NO_RETRY = RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * Creates a policy for cloud management API calls.
     *
     * @param maxAttempts maximum number of attempts (including initial attempt)
     * @param baseDelay delay before the first retry
     * @return RetryPolicy with a 60 seconds max delay and 2x backoff
     */
    public static RetryPolicy cloudApi(int maxAttempts, Duration baseDelay) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(Duration.ofSeconds(60))
                .backoffMultiplier(2.0)
                .build();
    }

    /**
     * Creates a policy for network operations.
     *
     * @param maxAttempts maximum number of attempts (including initial attempt)
     * @param baseDelay delay before the first retry
     * @return RetryPolicy with a 30 seconds max delay and 1.5x backoff
     */
    public static RetryPolicy network(int maxAttempts, Duration baseDelay) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(Duration.ofSeconds(30))
                .backoffMultiplier(1.5)
                .build();
    }

    /**
     * Creates a policy for critical operations.
     *
     * @param maxAttempts maximum number of attempts (including initial attempt)
     * @param baseDelay delay before the first retry
     * @return RetryPolicy with a 120 seconds max delay and 2x backoff
     */
    public static RetryPolicy criticalOperation(int maxAttempts, Duration baseDelay) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(Duration.ofSeconds(120))
                .backoffMultiplier(2.0)
                .build();
    }
}
