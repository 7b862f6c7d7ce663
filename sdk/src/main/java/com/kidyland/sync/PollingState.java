// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a {@link PollingEngine}, for diagnostics.
 *
 * @param running whether a subscription is active
 * @param paused whether the subscription is suspended
 * @param targetId target of the active subscription, or null
 * @param currentInterval nominal delay before the next scheduled poll
 * @param lastValidator ETag of the last changed response, or null
 * @param consecutiveUnchanged unchanged responses since the last change or failure
 * @param errorCount failures since the last success
 * @param consecutiveFailures failures since the last success, drives degradation
 * @param degradedSince start of the current degraded period, or null
 * @param pollScheduled whether a timer for the next poll is pending
 * @param requestInFlight whether a fetch is outstanding
 */
public record PollingState(
        boolean running,
        boolean paused,
        String targetId,
        Duration currentInterval,
        String lastValidator,
        int consecutiveUnchanged,
        int errorCount,
        int consecutiveFailures,
        Instant degradedSince,
        boolean pollScheduled,
        boolean requestInFlight) {

    public boolean isDegraded() {
        return degradedSince != null;
    }

    public Optional<String> getLastValidator() {
        return Optional.ofNullable(lastValidator);
    }
}
