// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.stats;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import software.amazon.migration.resilience.retry.RetryCategory;

/**
 * A scheduled retry.
 *
 * @param attemptNumber 1-based number of the attempt that failed and is about to be retried
 * @param delay how long the executor waits before the next attempt
 * @param category why the failure was considered transient
 * @param failureMessage description of the failure
 * @param timestamp when the retry was scheduled
 */
public record AttemptRecord(
        int attemptNumber, Duration delay, RetryCategory category, String failureMessage, Instant timestamp) {

    public AttemptRecord {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive, got: " + attemptNumber);
        }
        Objects.requireNonNull(delay, "delay cannot be null");
        Objects.requireNonNull(category, "category cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
