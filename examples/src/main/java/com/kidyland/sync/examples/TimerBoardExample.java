// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.examples;

import com.kidyland.sync.PollingEngine;
import com.kidyland.sync.SyncClients;
import com.kidyland.sync.SyncConfig;
import com.kidyland.sync.alerts.AlertDeduplicator;
import com.kidyland.sync.alerts.AlertRecord;
import com.kidyland.sync.exception.PollingException;
import com.kidyland.sync.model.TimerSnapshot;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example of a branch timer board kept fresh by both standard consumers.
 *
 * <p>This example demonstrates:
 *
 * <ul>
 *   <li>Polling the active-timer snapshot with the adaptive interval
 *   <li>Surfacing each pending alert once and acknowledging it
 *   <li>Forcing an immediate timer refresh after a local change to server state
 *   <li>Keeping the last good board on screen while the server is unreachable
 * </ul>
 *
 * <p>Run with the branch id as the only argument. The server address is read from {@code KIDYLAND_API_URL} and the
 * token from {@code ~/.kidyland/auth_token}.
 */
public class TimerBoardExample implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TimerBoardExample.class);

    private final PollingEngine<List<TimerSnapshot>> timers;
    private final AlertDeduplicator alerts;
    private final List<AlertRecord> surfacedAlerts = new CopyOnWriteArrayList<>();
    private volatile List<TimerSnapshot> board = List.of();
    private volatile PollingException lastError;

    public TimerBoardExample(SyncConfig config) {
        this(SyncClients.activeTimers(config), SyncClients.pendingAlerts(config));
    }

    public TimerBoardExample(PollingEngine<List<TimerSnapshot>> timers, AlertDeduplicator alerts) {
        this.timers = timers;
        this.alerts = alerts;
    }

    public static void main(String[] args) throws InterruptedException {
        if (args.length != 1) {
            System.err.println("Usage: TimerBoardExample <branch-id>");
            System.exit(2);
        }
        var done = new CountDownLatch(1);
        var example = new TimerBoardExample(SyncConfig.defaultConfig());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            example.close();
            done.countDown();
        }));
        example.open(args[0]);
        done.await();
    }

    /** Subscribes the board to a branch. */
    public void open(String branchId) {
        logger.info("Opening timer board for branch {}", branchId);
        timers.start(branchId, this::refresh, this::reportError);
        alerts.start(branchId, this::surface, null, this::reportError);
    }

    /**
     * Acknowledges an alert and refreshes the board right away, since the acknowledgement changes the timer list the
     * server reports.
     */
    public CompletableFuture<Void> acknowledge(AlertRecord alert) {
        return alerts.acknowledgeAlert(alert.timerId(), alert.alertThresholdMinutes())
                .thenRun(timers::forcePoll);
    }

    public List<TimerSnapshot> getBoard() {
        return board;
    }

    public List<AlertRecord> getSurfacedAlerts() {
        return List.copyOf(surfacedAlerts);
    }

    public Optional<PollingException> getLastError() {
        return Optional.ofNullable(lastError);
    }

    @Override
    public void close() {
        timers.stop();
        alerts.stop();
        logger.info("Timer board closed");
    }

    private void refresh(List<TimerSnapshot> snapshot) {
        board = List.copyOf(snapshot);
        lastError = null;
        logger.info("Board refreshed: {} active timers", snapshot.size());
    }

    private void surface(AlertRecord alert) {
        surfacedAlerts.add(alert);
        var childName = alert.timerSnapshot() != null ? alert.timerSnapshot().childName() : "unknown";
        logger.info("Timer {} for {}: {} minutes left", alert.timerId(), childName, alert.alertThresholdMinutes());
    }

    private void reportError(PollingException error) {
        lastError = error;
        logger.warn("Board update failed: {}", error.getMessage());
    }
}
