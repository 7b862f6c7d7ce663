// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.fetch;

import java.util.concurrent.CompletableFuture;

/**
 * Performs one fetch of a polled resource and classifies the result.
 *
 * <p>Implementations must report every failure as a {@link FetchOutcome.Type#FAILED} outcome rather than by
 * completing the future exceptionally, although the engine tolerates both.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface ConditionalFetcher<T> {

    /**
     * Fetches the resource for {@code targetId}.
     *
     * @param targetId the subscription target, e.g. a branch id; may be null for an unfiltered request
     * @param lastValidator validator from the last changed outcome, or null to fetch unconditionally
     * @return a future completing with the outcome
     */
    CompletableFuture<FetchOutcome<T>> fetch(String targetId, String lastValidator);
}
