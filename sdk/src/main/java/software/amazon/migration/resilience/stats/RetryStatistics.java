// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.stats;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import software.amazon.migration.resilience.retry.RetryCategory;

/**
 * Accumulates call outcomes and scheduled retries for reporting.
 *
 * <p>One instance is usually shared by every executor in the process, see {@link #shared()}. Executors can also be
 * given their own instance, e.g. to isolate tests or to report on a single migration wave. All mutators and
 * {@link #snapshot()} synchronize on the instance.
 */
public class RetryStatistics {
    private static final RetryStatistics SHARED = new RetryStatistics();

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private final List<AttemptRecord> attempts = new ArrayList<>();
    private final Map<RetryCategory, Long> retriesByCategory = new EnumMap<>(RetryCategory.class);
    private Duration totalDelay = Duration.ZERO;
    private Duration maxDelay = Duration.ZERO;

    /** @return the process-wide instance used by executors that are not given their own */
    public static RetryStatistics shared() {
        return SHARED;
    }

    /**
     * Records a scheduled retry.
     *
     * @param attempt the retry to record
     */
    public synchronized void recordAttempt(AttemptRecord attempt) {
        Objects.requireNonNull(attempt, "attempt cannot be null");
        attempts.add(attempt);
        retriesByCategory.merge(attempt.category(), 1L, Long::sum);
        totalDelay = totalDelay.plus(attempt.delay());
        if (attempt.delay().compareTo(maxDelay) > 0) {
            maxDelay = attempt.delay();
        }
    }

    /**
     * Records the final outcome of a call.
     *
     * @param success true if the call eventually returned a result
     */
    public synchronized void recordCallResult(boolean success) {
        totalCalls++;
        if (success) {
            successfulCalls++;
        } else {
            failedCalls++;
        }
    }

    /** @return successful calls as a percentage of all calls, or 0 when no call was recorded */
    public synchronized double successRate() {
        if (totalCalls == 0) {
            return 0.0;
        }
        return (double) successfulCalls / totalCalls * 100;
    }

    /** Clears all counters and recorded retries. */
    public synchronized void reset() {
        totalCalls = 0;
        successfulCalls = 0;
        failedCalls = 0;
        attempts.clear();
        retriesByCategory.clear();
        totalDelay = Duration.ZERO;
        maxDelay = Duration.ZERO;
    }

    /** @return a consistent copy of the current statistics */
    public synchronized StatisticsSnapshot snapshot() {
        var averageDelay = attempts.isEmpty() ? Duration.ZERO : totalDelay.dividedBy(attempts.size());
        return new StatisticsSnapshot(
                totalCalls,
                successfulCalls,
                failedCalls,
                attempts.size(),
                retriesByCategory,
                averageDelay,
                maxDelay,
                attempts);
    }
}
