// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import org.junit.jupiter.api.Test;

class PollingExceptionTest {

    @Test
    void testTransportExceptionWithStatus() {
        var exception = new TransportException(503, "Unexpected response 503");

        assertEquals("Unexpected response 503", exception.getMessage());
        assertEquals(503, exception.getStatusCode().getAsInt());
        assertNull(exception.getCause());
    }

    @Test
    void testTransportExceptionWithoutStatus() {
        var cause = new IOException("connection reset");
        var exception = new TransportException("Request failed", cause);

        assertTrue(exception.getStatusCode().isEmpty());
        assertEquals(cause, exception.getCause());
    }

    @Test
    void testDecodeExceptionConstructors() {
        var cause = new RuntimeException("Original error");

        assertEquals(cause, new DecodeException("Deserialization failed", cause).getCause());
        assertNull(new DecodeException("Empty body").getCause());
    }

    @Test
    void testTimeoutKeepsCause() {
        var cause = new InterruptedIOException("timeout");
        var exception = new PollTimeoutException("Request timed out", cause);

        assertEquals(cause, exception.getCause());
    }

    @Test
    void testHierarchy() {
        assertInstanceOf(PollingException.class, new AuthenticationException("No token"));
        assertInstanceOf(PollingException.class, new TransportException(500, "boom"));
        assertInstanceOf(PollingException.class, new DecodeException("bad"));
        assertInstanceOf(PollingException.class, new PollTimeoutException("slow", null));
        assertInstanceOf(RuntimeException.class, new PollingException("base"));
    }
}
