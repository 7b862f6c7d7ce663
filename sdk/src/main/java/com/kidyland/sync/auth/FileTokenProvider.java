// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.auth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the token persisted by the login flow. The file is re-read on every call so a token refreshed by another
 * process is picked up by the next poll.
 */
public class FileTokenProvider implements TokenProvider {
    private static final Logger logger = LoggerFactory.getLogger(FileTokenProvider.class);

    private final Path path;

    public FileTokenProvider(Path path) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
    }

    @Override
    public Optional<String> getToken() {
        if (!Files.isRegularFile(path)) {
            logger.debug("No token file at {}", path);
            return Optional.empty();
        }
        try {
            var token = Files.readString(path, StandardCharsets.UTF_8).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        } catch (IOException e) {
            logger.error("Error reading token from {}", path, e);
            return Optional.empty();
        }
    }

    public Path getPath() {
        return path;
    }
}
