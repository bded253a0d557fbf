// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.validation;

import java.time.Duration;

/**
 * Utility class for validating input parameters in the Migration Resilience SDK.
 *
 * <p>Provides common validation methods to ensure consistent error messages and validation logic across the SDK.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a duration is strictly positive.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null, zero or negative
     */
    public static void validatePositiveDuration(Duration duration, String parameterName) {
        if (duration == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is positive (greater than 0).
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or not positive
     */
    public static void validatePositiveInteger(Integer value, String parameterName) {
        if (value == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a multiplier is a finite number of at least 1.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is NaN, infinite or below 1
     */
    public static void validateMultiplier(double value, String parameterName) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 1.0) {
            throw new IllegalArgumentException(parameterName + " must be a finite number >= 1, got: " + value);
        }
    }
}
