// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.alerts;

import com.kidyland.sync.PollingEngine;
import com.kidyland.sync.PollingState;
import com.kidyland.sync.exception.PollingException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Surfaces each pending alert once per subscription.
 *
 * <p>The pending-alert endpoint always answers with the full candidate list, so the same alert arrives on every poll
 * until it is acknowledged. Every payload is passed to the list callback as is; only records whose
 * {@link AlertRecord#shownAlertKey()} has not been seen before reach the per-alert callback. The set of shown keys
 * grows for the lifetime of a subscription and is cleared by {@link #stop()}. An alert is marked as shown only once the
 * per-alert callback returns normally.
 */
public class AlertDeduplicator {
    private static final Logger logger = LoggerFactory.getLogger(AlertDeduplicator.class);

    private final PollingEngine<List<AlertRecord>> engine;
    private final AlertAcknowledger acknowledger;
    private final Set<String> shownAlerts = ConcurrentHashMap.newKeySet();

    public AlertDeduplicator(PollingEngine<List<AlertRecord>> engine, AlertAcknowledger acknowledger) {
        this.engine = Objects.requireNonNull(engine, "PollingEngine cannot be null");
        this.acknowledger = Objects.requireNonNull(acknowledger, "AlertAcknowledger cannot be null");
    }

    /** Starts without a list callback or error callback. See {@link #start(String, Consumer, Consumer, Consumer)}. */
    public void start(String targetId, Consumer<? super AlertRecord> onNewAlert) {
        start(targetId, onNewAlert, null, null);
    }

    /**
     * Starts polling pending alerts for a target. A running subscription is replaced and the shown set cleared.
     *
     * @param targetId branch whose alerts are polled
     * @param onNewAlert receives each alert the first time it is seen
     * @param onAlerts receives every alert list, including repeats, may be null
     * @param onError receives every polling failure, may be null
     */
    public void start(
            String targetId,
            Consumer<? super AlertRecord> onNewAlert,
            Consumer<? super List<AlertRecord>> onAlerts,
            Consumer<? super PollingException> onError) {
        Objects.requireNonNull(onNewAlert, "onNewAlert cannot be null");
        shownAlerts.clear();
        engine.start(targetId, alerts -> dispatch(alerts, onNewAlert, onAlerts), onError);
    }

    /** Stops polling and forgets which alerts were shown. */
    public void stop() {
        engine.stop();
        shownAlerts.clear();
    }

    public void pause() {
        engine.pause();
    }

    public void resume() {
        engine.resume();
    }

    public void forcePoll() {
        engine.forcePoll();
    }

    public boolean isRunning() {
        return engine.isRunning();
    }

    /** @return number of distinct alerts delivered since the subscription started */
    public int shownAlertCount() {
        return shownAlerts.size();
    }

    public PollingState getState() {
        return engine.getState();
    }

    /** @return the last alert list received */
    public Optional<List<AlertRecord>> getCachedAlerts() {
        return engine.getCachedPayload();
    }

    /**
     * Acknowledges an alert on the server. Independent of polling; a failure completes the returned future
     * exceptionally and leaves the subscription untouched.
     *
     * @param timerId the timer whose alert is acknowledged
     * @param alertMinutes the alert threshold
     * @return a future completing when the server accepted the acknowledgement
     */
    public CompletableFuture<Void> acknowledgeAlert(String timerId, int alertMinutes) {
        return acknowledger.acknowledge(timerId, alertMinutes);
    }

    private void dispatch(
            List<AlertRecord> alerts,
            Consumer<? super AlertRecord> onNewAlert,
            Consumer<? super List<AlertRecord>> onAlerts) {
        if (onAlerts != null) {
            onAlerts.accept(alerts);
        }
        for (var alert : alerts) {
            if (alert == null) {
                continue;
            }
            var key = alert.shownAlertKey();
            if (shownAlerts.contains(key)) {
                continue;
            }
            logger.info("New alert {} for timer {}", key, alert.timerId());
            try {
                onNewAlert.accept(alert);
                shownAlerts.add(key);
            } catch (RuntimeException e) {
                // not marked as shown, so the next poll delivers it again
                logger.error("Alert callback failed for {}", key, e);
            }
        }
    }
}
