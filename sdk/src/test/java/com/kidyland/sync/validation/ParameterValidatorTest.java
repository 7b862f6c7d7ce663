// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.validation;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ParameterValidatorTest {

    @Test
    void validatePositiveDuration_withValidDuration_shouldPass() {
        assertDoesNotThrow(() -> ParameterValidator.validatePositiveDuration(Duration.ofMillis(1), "test"));
    }

    @Test
    void validatePositiveDuration_withNull_shouldThrow() {
        var exception = assertThrows(
                IllegalArgumentException.class, () -> ParameterValidator.validatePositiveDuration(null, "testParam"));

        assertEquals("testParam cannot be null", exception.getMessage());
    }

    @Test
    void validatePositiveDuration_withZero_shouldThrow() {
        var exception = assertThrows(
                IllegalArgumentException.class,
                () -> ParameterValidator.validatePositiveDuration(Duration.ZERO, "testParam"));

        assertEquals("testParam must be positive, got: PT0S", exception.getMessage());
    }

    @Test
    void validateNonNegativeDuration_acceptsZero() {
        assertDoesNotThrow(() -> ParameterValidator.validateNonNegativeDuration(Duration.ZERO, "test"));
    }

    @Test
    void validateNonNegativeDuration_withNegative_shouldThrow() {
        var exception = assertThrows(
                IllegalArgumentException.class,
                () -> ParameterValidator.validateNonNegativeDuration(Duration.ofSeconds(-1), "testParam"));

        assertEquals("testParam cannot be negative, got: PT-1S", exception.getMessage());
    }

    @Test
    void validatePositiveInteger_withZero_shouldThrow() {
        var exception = assertThrows(
                IllegalArgumentException.class, () -> ParameterValidator.validatePositiveInteger(0, "testParam"));

        assertEquals("testParam must be positive, got: 0", exception.getMessage());
    }

    @Test
    void validateRange_isInclusive() {
        assertDoesNotThrow(() -> ParameterValidator.validateRange(1, 1, 60, "test"));
        assertDoesNotThrow(() -> ParameterValidator.validateRange(60, 1, 60, "test"));

        var exception = assertThrows(
                IllegalArgumentException.class, () -> ParameterValidator.validateRange(61, 1, 60, "testParam"));
        assertEquals("testParam must be between 1 and 60, got: 61", exception.getMessage());
    }

    @Test
    void validateNotBlank_withBlank_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> ParameterValidator.validateNotBlank(" ", "testParam"));
        assertThrows(IllegalArgumentException.class, () -> ParameterValidator.validateNotBlank(null, "testParam"));
    }
}
