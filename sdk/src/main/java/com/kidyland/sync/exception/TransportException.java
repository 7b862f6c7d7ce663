// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.exception;

import java.util.OptionalInt;

/** Network or HTTP-level failure. Carries the HTTP status when the server answered with a non-2xx code. */
public class TransportException extends PollingException {
    private final Integer statusCode;

    public TransportException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    /** @return the HTTP status code, or empty if the request never produced a response */
    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
