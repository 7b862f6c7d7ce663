// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync;

import com.kidyland.sync.alerts.AlertAcknowledger;
import com.kidyland.sync.alerts.AlertDeduplicator;
import com.kidyland.sync.alerts.AlertRecord;
import com.kidyland.sync.http.HttpConditionalFetcher;
import com.kidyland.sync.http.PollingEndpoint;
import com.kidyland.sync.model.TimerSnapshot;
import java.util.List;
import java.util.Objects;

/**
 * Builds the two standard consumers of the API server from a {@link SyncConfig}.
 *
 * <p>Each call returns a new, independent instance; callers own its lifecycle.
 */
public final class SyncClients {

    private SyncClients() {
        // Utility class - prevent instantiation
    }

    /** @return an engine polling the active-timer snapshot with {@link PollingConfig#activeTimerDefaults()} */
    public static PollingEngine<List<TimerSnapshot>> activeTimers(SyncConfig config) {
        return activeTimers(config, PollingConfig.activeTimerDefaults());
    }

    public static PollingEngine<List<TimerSnapshot>> activeTimers(SyncConfig config, PollingConfig pollingConfig) {
        Objects.requireNonNull(config, "SyncConfig cannot be null");
        var fetcher = new HttpConditionalFetcher<>(
                config, PollingEndpoint.ACTIVE_TIMERS, new TypeToken<List<TimerSnapshot>>() {});
        return engineBuilder("active-timers", fetcher, config)
                .withConfig(pollingConfig)
                .build();
    }

    /** @return a deduplicating consumer of pending alerts with {@link PollingConfig#pendingAlertDefaults()} */
    public static AlertDeduplicator pendingAlerts(SyncConfig config) {
        return pendingAlerts(config, PollingConfig.pendingAlertDefaults());
    }

    public static AlertDeduplicator pendingAlerts(SyncConfig config, PollingConfig pollingConfig) {
        Objects.requireNonNull(config, "SyncConfig cannot be null");
        var fetcher = new HttpConditionalFetcher<>(
                config, PollingEndpoint.PENDING_ALERTS, new TypeToken<List<AlertRecord>>() {});
        var engine = engineBuilder("pending-alerts", fetcher, config)
                .withConfig(pollingConfig)
                .build();
        return new AlertDeduplicator(engine, new AlertAcknowledger(config));
    }

    private static <T> PollingEngine.Builder<T> engineBuilder(
            String name, HttpConditionalFetcher<T> fetcher, SyncConfig config) {
        return PollingEngine.builder(name, fetcher)
                .withTaskScheduler(config.getTaskScheduler())
                .withVisibilitySource(config.getVisibilitySource())
                .withClock(config.getClock());
    }
}
