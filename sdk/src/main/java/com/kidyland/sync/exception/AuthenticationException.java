// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.exception;

/** Thrown when no bearer token is available or the server rejects it with HTTP 401. */
public class AuthenticationException extends PollingException {
    public AuthenticationException(String message) {
        super(message);
    }
}
