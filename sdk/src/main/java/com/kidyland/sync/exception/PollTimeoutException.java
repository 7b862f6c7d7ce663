// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.exception;

/** The request did not complete within the configured request timeout. */
public class PollTimeoutException extends PollingException {
    public PollTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
