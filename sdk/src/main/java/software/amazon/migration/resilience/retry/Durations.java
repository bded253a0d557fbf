// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

import java.time.Duration;
import java.util.Locale;

/** Conversions between {@link Duration} and fractional seconds. Both directions saturate instead of overflowing. */
public final class Durations {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    // largest magnitude representable as a long count of nanoseconds
    private static final double MAX_NANO_SECONDS = Long.MAX_VALUE / NANOS_PER_SECOND;

    private Durations() {}

    public static Duration ofSeconds(double seconds) {
        if (Math.abs(seconds) < MAX_NANO_SECONDS) {
            return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
        }
        return Duration.ofSeconds((long) seconds);
    }

    public static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / NANOS_PER_SECOND;
    }

    /** Formats a duration as seconds with one decimal, e.g. {@code 2.5s}. */
    public static String format(Duration duration) {
        return String.format(Locale.ROOT, "%.1fs", toSeconds(duration));
    }
}
