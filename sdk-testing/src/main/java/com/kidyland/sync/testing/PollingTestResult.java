// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.testing;

import com.kidyland.sync.PollingState;
import com.kidyland.sync.exception.PollingException;
import java.time.Duration;
import java.util.List;

/**
 * What a {@link LocalPollingTestRunner} observed.
 *
 * @param payloads payloads delivered to the data callback, replays included
 * @param errors failures delivered to the error callback
 * @param intervals delays the engine scheduled polls with
 * @param calls fetches the engine made
 * @param state engine state when the result was taken
 */
public record PollingTestResult<T>(
        List<T> payloads,
        List<PollingException> errors,
        List<Duration> intervals,
        List<ScriptedFetcher.FetchCall> calls,
        PollingState state) {

    public List<Long> getIntervalsMillis() {
        return intervals.stream().map(Duration::toMillis).toList();
    }

    public int getPollCount() {
        return calls.size();
    }
}
