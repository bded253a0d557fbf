// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

import java.time.Duration;

/** Suspends the calling thread between attempts. */
@FunctionalInterface
public interface Sleeper {

    /** Sleeper backed by {@link Thread#sleep(long, int)}. */
    Sleeper THREAD_SLEEP = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            long millis;
            try {
                millis = duration.toMillis();
            } catch (ArithmeticException e) {
                millis = Long.MAX_VALUE;
            }
            Thread.sleep(millis, duration.getNano() % 1_000_000);
        }
    };

    /**
     * Blocks the calling thread only.
     *
     * @param duration how long to wait
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
