// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import software.amazon.migration.resilience.RetryPolicy;
import software.amazon.migration.resilience.failure.FailureInspector;

/**
 * Computes how long to wait before the next attempt.
 *
 * <p>A well-formed retry-after hint from the server wins, capped at the policy's max delay. Otherwise the delay
 * follows the formula {@code baseDelay × backoffMultiplier^attemptIndex}, optionally jittered by up to ±10%, scaled by
 * the category's {@link RetryCategory#delayFactor() delay factor} and clamped to {@code [100ms, maxDelay]}.
 */
public class BackoffScheduler {
    static final Duration MIN_DELAY = Duration.ofMillis(100);
    static final double JITTER_FRACTION = 0.1;

    private final DoubleSupplier random;

    /** Creates a scheduler drawing jitter from {@link ThreadLocalRandom}. */
    public BackoffScheduler() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a scheduler with a custom random source.
     *
     * @param random supplier of uniformly distributed values in {@code [0, 1)}
     */
    public BackoffScheduler(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Computes the delay before the next attempt.
     *
     * @param attemptIndex zero-based index of the retry (the first retry uses 0)
     * @param category why the failure is considered transient
     * @param failure the failure that triggered the retry, may carry a retry-after hint
     * @param policy the policy bounding the delay
     * @return the delay, never negative and never above {@code policy.maxDelay()}
     */
    public Duration computeDelay(int attemptIndex, RetryCategory category, Throwable failure, RetryPolicy policy) {
        if (failure != null) {
            var hint = FailureInspector.inspect(failure).retryAfter().flatMap(RetryAfterHint::parse);
            if (hint.isPresent()) {
                return hint.get().compareTo(policy.maxDelay()) > 0 ? policy.maxDelay() : hint.get();
            }
        }

        var delay = Durations.toSeconds(policy.baseDelay()) * Math.pow(policy.backoffMultiplier(), attemptIndex);

        if (policy.jitterEnabled()) {
            delay += delay * JITTER_FRACTION * (2 * random.getAsDouble() - 1);
        }

        delay *= category.delayFactor();

        // NaN arises once the exponential term overflows to infinity
        if (Double.isNaN(delay) || delay >= Durations.toSeconds(policy.maxDelay())) {
            return policy.maxDelay();
        }
        var computed = Durations.ofSeconds(delay);
        if (computed.compareTo(MIN_DELAY) < 0) {
            return MIN_DELAY.compareTo(policy.maxDelay()) < 0 ? MIN_DELAY : policy.maxDelay();
        }
        return computed;
    }
}
