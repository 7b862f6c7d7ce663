// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.fetch;

import com.kidyland.sync.exception.PollingException;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one conditional fetch: the data is unchanged, the data changed, or the fetch failed.
 *
 * @param <T> payload type
 */
public final class FetchOutcome<T> {

    public enum Type {
        /** Server confirmed the cached validator is still current (HTTP 304). */
        UNCHANGED,
        /** Server returned a new payload (HTTP 200). */
        CHANGED,
        /** Authentication, transport, timeout or decode failure. */
        FAILED
    }

    private static final FetchOutcome<?> UNCHANGED = new FetchOutcome<>(Type.UNCHANGED, null, null, null);

    private final Type type;
    private final T payload;
    private final String validator;
    private final PollingException error;

    private FetchOutcome(Type type, T payload, String validator, PollingException error) {
        this.type = type;
        this.payload = payload;
        this.validator = validator;
        this.error = error;
    }

    @SuppressWarnings("unchecked")
    public static <T> FetchOutcome<T> unchanged() {
        return (FetchOutcome<T>) UNCHANGED;
    }

    /**
     * @param payload the decoded response body
     * @param validator the response's ETag, or null if the server sent none
     */
    public static <T> FetchOutcome<T> changed(T payload, String validator) {
        return new FetchOutcome<>(Type.CHANGED, payload, validator, null);
    }

    public static <T> FetchOutcome<T> failed(PollingException error) {
        return new FetchOutcome<>(Type.FAILED, null, null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public Type getType() {
        return type;
    }

    /** @return the payload of a {@link Type#CHANGED} outcome, null otherwise */
    public T getPayload() {
        return payload;
    }

    public Optional<String> getValidator() {
        return Optional.ofNullable(validator);
    }

    /** @return the error of a {@link Type#FAILED} outcome, null otherwise */
    public PollingException getError() {
        return error;
    }

    @Override
    public String toString() {
        return switch (type) {
            case UNCHANGED -> "FetchOutcome{unchanged}";
            case CHANGED -> "FetchOutcome{changed, validator=" + validator + "}";
            case FAILED -> "FetchOutcome{failed: " + error.getMessage() + "}";
        };
    }
}
