// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.backoff;

import java.time.Duration;

/**
 * What the {@link BackoffController} concluded after recording one failed poll.
 *
 * @param errorCount errors since the last success, including this one
 * @param consecutiveFailures failures since the last success, including this one
 * @param nextInterval interval to wait before the next poll
 * @param degraded whether failures have reached the degradation threshold
 * @param degradationEntered true only for the failure that reached the threshold; the cached payload is replayed then
 * @param degradedFor time spent degraded so far, zero when not degraded
 * @param exhausted whether the error budget is used up and the engine must stop
 */
public record FailureVerdict(
        int errorCount,
        int consecutiveFailures,
        Duration nextInterval,
        boolean degraded,
        boolean degradationEntered,
        Duration degradedFor,
        boolean exhausted) {

    /** @return true for the first failure after a success, which is treated as expected noise */
    public boolean isTransient() {
        return consecutiveFailures == 1;
    }
}
