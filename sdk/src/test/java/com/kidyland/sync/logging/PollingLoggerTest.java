// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.logging;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.MDC;

class PollingLoggerTest {

    private Logger mockLogger;
    private PollingLogger logger;

    @BeforeEach
    void setUp() {
        mockLogger = mock(Logger.class);
        logger = new PollingLogger(mockLogger, "active-timers");
    }

    @Test
    void delegatesEachLevel() {
        logger.trace("t");
        logger.debug("d {}", 1);
        logger.info("i");
        logger.warn("w");
        logger.error("e");

        verify(mockLogger).trace(eq("t"), any(Object[].class));
        verify(mockLogger).debug(eq("d {}"), any(Object[].class));
        verify(mockLogger).info(eq("i"), any(Object[].class));
        verify(mockLogger).warn(eq("w"), any(Object[].class));
        verify(mockLogger).error(eq("e"), any(Object[].class));
    }

    @Test
    void setsEngineAndTargetMdcDuringLogCall() {
        logger.setTarget("branch-7");
        doAnswer(invocation -> {
                    assertEquals("active-timers", MDC.get(PollingLogger.MDC_ENGINE));
                    assertEquals("branch-7", MDC.get(PollingLogger.MDC_TARGET));
                    return null;
                })
                .when(mockLogger)
                .info(anyString(), any(Object[].class));

        logger.info("polling");

        verify(mockLogger).info(eq("polling"), any(Object[].class));
        assertNull(MDC.get(PollingLogger.MDC_ENGINE));
        assertNull(MDC.get(PollingLogger.MDC_TARGET));
    }

    @Test
    void omitsTargetWhenNoneIsSet() {
        doAnswer(invocation -> {
                    assertNull(MDC.get(PollingLogger.MDC_TARGET));
                    return null;
                })
                .when(mockLogger)
                .warn(anyString(), any(Object[].class));

        logger.warn("no target");

        verify(mockLogger).warn(eq("no target"), any(Object[].class));
    }

    @Test
    void errorWithThrowablePassesCause() {
        var cause = new IllegalStateException("boom");

        logger.error("failed", cause);

        verify(mockLogger).error("failed", cause);
    }
}
