// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

import java.time.Duration;
import java.util.Optional;

/** Parses server-supplied retry-after values given in (possibly fractional) seconds. */
public final class RetryAfterHint {

    private RetryAfterHint() {}

    /**
     * Parses a retry-after value.
     *
     * <p>Anything that is not a finite, non-negative number is ignored, including HTTP dates.
     *
     * @param rawValue the raw header or field value, may be null
     * @return the hinted delay, or empty if the value is absent or malformed
     */
    public static Optional<Duration> parse(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return Optional.empty();
        }
        double seconds;
        try {
            seconds = Double.parseDouble(rawValue.trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
            return Optional.empty();
        }
        return Optional.of(Durations.ofSeconds(seconds));
    }
}
