// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import software.amazon.migration.resilience.retry.RetryCategory;

/**
 * Point-in-time copy of {@link RetryStatistics}.
 *
 * @param totalCalls calls that reached a final outcome
 * @param successfulCalls calls that eventually succeeded
 * @param failedCalls calls that were exhausted, not retryable or interrupted
 * @param totalRetries retries scheduled across all calls
 * @param retriesByCategory retries per category, only categories seen so far
 * @param averageDelay mean delay over all recorded retries
 * @param maxDelay longest delay recorded
 * @param attempts every recorded retry, oldest first
 */
public record StatisticsSnapshot(
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        long totalRetries,
        Map<RetryCategory, Long> retriesByCategory,
        Duration averageDelay,
        Duration maxDelay,
        List<AttemptRecord> attempts) {

    public StatisticsSnapshot {
        retriesByCategory = Map.copyOf(retriesByCategory);
        attempts = List.copyOf(attempts);
    }

    /** @return successful calls as a percentage of all calls, or 0 when no call was recorded */
    @JsonProperty("successRate")
    public double successRate() {
        if (totalCalls == 0) {
            return 0.0;
        }
        return (double) successfulCalls / totalCalls * 100;
    }
}
