// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.validation;

import java.time.Duration;

/**
 * Utility class for validating input parameters in the sync SDK.
 *
 * <p>Provides common validation methods to ensure consistent error messages and validation logic across the SDK.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a duration is present and strictly positive.
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
     * Validates that a duration is present and not negative. Zero is accepted.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public static void validateNonNegativeDuration(Duration duration, String parameterName) {
        if (duration == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " cannot be negative, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is positive (greater than 0).
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is not positive
     */
    public static void validatePositiveInteger(int value, String parameterName) {
        if (value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that an integer value lies within an inclusive range.
     *
     * @param value the value to validate
     * @param min lowest accepted value
     * @param max highest accepted value
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is outside {@code [min, max]}
     */
    public static void validateRange(int value, int min, int max, String parameterName) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    parameterName + " must be between " + min + " and " + max + ", got: " + value);
        }
    }

    /**
     * Validates that a string is neither null nor blank.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or blank
     */
    public static void validateNotBlank(String value, String parameterName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(parameterName + " cannot be null or blank");
        }
    }
}
