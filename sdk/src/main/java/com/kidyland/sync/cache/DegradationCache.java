// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.cache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last successfully decoded payload so a failing engine can keep showing last known good data instead of
 * going silent.
 *
 * @param <T> payload type
 */
public class DegradationCache<T> {
    private final AtomicReference<T> lastPayload = new AtomicReference<>();

    /** Replaces the cached payload. Null payloads are ignored. */
    public void record(T payload) {
        if (payload != null) {
            lastPayload.set(payload);
        }
    }

    public Optional<T> get() {
        return Optional.ofNullable(lastPayload.get());
    }

    public void reset() {
        lastPayload.set(null);
    }
}
