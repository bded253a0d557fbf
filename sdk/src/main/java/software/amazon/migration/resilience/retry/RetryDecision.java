// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/** Represents a decision about whether to retry a failed operation, why, and how long to wait. */
public class RetryDecision {
    private static final RetryDecision FAIL = new RetryDecision(null, Duration.ZERO);

    private final RetryCategory category;
    private final Duration delay;

    private RetryDecision(RetryCategory category, Duration delay) {
        this.category = category;
        this.delay = delay != null ? delay : Duration.ZERO;
    }

    /**
     * Creates a retry decision indicating the operation should be retried after the specified delay.
     *
     * @param category why the failure is considered transient
     * @param delay the duration to wait before retrying
     * @return a RetryDecision indicating retry with the specified delay
     */
    public static RetryDecision retry(RetryCategory category, Duration delay) {
        return new RetryDecision(Objects.requireNonNull(category, "category cannot be null"), delay);
    }

    /**
     * Creates a retry decision indicating the operation should not be retried.
     *
     * @return a RetryDecision indicating no retry should be attempted
     */
    public static RetryDecision fail() {
        return FAIL;
    }

    /** @return true if the operation should be retried, false otherwise */
    public boolean shouldRetry() {
        return category != null;
    }

    /** @return the retry category, or empty if no retry */
    public Optional<RetryCategory> category() {
        return Optional.ofNullable(category);
    }

    /** @return the duration to wait before retrying, or Duration.ZERO if no retry */
    public Duration delay() {
        return delay;
    }

    @Override
    public String toString() {
        return shouldRetry()
                ? String.format("RetryDecision{retry after %s, category=%s}", delay, category)
                : "RetryDecision{fail}";
    }
}
