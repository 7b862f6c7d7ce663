// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.exception;

/**
 * Base class for every failure the sync SDK reports.
 *
 * <p>Polling failures never propagate out of a {@link com.kidyland.sync.PollingEngine}; they are delivered to the
 * engine's error callback. One-shot calls such as alert acknowledgement complete their future exceptionally with a
 * subclass of this type.
 */
public class PollingException extends RuntimeException {
    public PollingException(String message, Throwable cause) {
        super(message, cause);
    }

    public PollingException(String message) {
        super(message);
    }
}
