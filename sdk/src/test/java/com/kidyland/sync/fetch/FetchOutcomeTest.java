// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.fetch;

import static org.junit.jupiter.api.Assertions.*;

import com.kidyland.sync.exception.DecodeException;
import org.junit.jupiter.api.Test;

class FetchOutcomeTest {

    @Test
    void changedCarriesPayloadAndOptionalValidator() {
        var withValidator = FetchOutcome.changed("data", "\"v1\"");
        var withoutValidator = FetchOutcome.changed("data", null);

        assertEquals(FetchOutcome.Type.CHANGED, withValidator.getType());
        assertEquals("data", withValidator.getPayload());
        assertEquals("\"v1\"", withValidator.getValidator().orElseThrow());
        assertTrue(withoutValidator.getValidator().isEmpty());
        assertNull(withValidator.getError());
    }

    @Test
    void failedRequiresError() {
        var error = new DecodeException("bad body");

        var outcome = FetchOutcome.<String>failed(error);

        assertEquals(FetchOutcome.Type.FAILED, outcome.getType());
        assertSame(error, outcome.getError());
        assertNull(outcome.getPayload());
        assertThrows(NullPointerException.class, () -> FetchOutcome.failed(null));
    }

    @Test
    void unchangedHasNoPayload() {
        var outcome = FetchOutcome.<String>unchanged();

        assertEquals(FetchOutcome.Type.UNCHANGED, outcome.getType());
        assertNull(outcome.getPayload());
        assertEquals("FetchOutcome{unchanged}", outcome.toString());
    }
}
