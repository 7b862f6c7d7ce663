// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.auth;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Supplies the bearer token attached to every request.
 *
 * <p>Implementations are read-only accessors to a credential obtained elsewhere; they are called from several engines
 * concurrently and must not block on token acquisition. An empty result makes the request fail with
 * {@link com.kidyland.sync.exception.AuthenticationException} without touching the network.
 */
@FunctionalInterface
public interface TokenProvider {

    Optional<String> getToken();

    /** @return a provider that always returns {@code token} */
    static TokenProvider of(String token) {
        Objects.requireNonNull(token, "token cannot be null");
        return () -> Optional.of(token);
    }

    /** @return a provider reading the token from an environment variable on every call */
    static TokenProvider fromEnvironment(String variableName) {
        Objects.requireNonNull(variableName, "variableName cannot be null");
        return () -> Optional.ofNullable(System.getenv(variableName)).filter(value -> !value.isBlank());
    }

    /** @return a provider reading the persisted credential stored in {@code path} on every call */
    static TokenProvider fromFile(Path path) {
        return new FileTokenProvider(path);
    }
}
