// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.alerts;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.kidyland.sync.PollingConfig;
import com.kidyland.sync.PollingEngine;
import com.kidyland.sync.fetch.ConditionalFetcher;
import com.kidyland.sync.fetch.FetchOutcome;
import com.kidyland.sync.schedule.RecordingTaskScheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertDeduplicatorTest {

    private ConditionalFetcher<List<AlertRecord>> fetcher;
    private RecordingTaskScheduler scheduler;
    private AlertAcknowledger acknowledger;
    private AlertDeduplicator deduplicator;
    private List<AlertRecord> shown;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        fetcher = mock(ConditionalFetcher.class);
        scheduler = new RecordingTaskScheduler();
        acknowledger = mock(AlertAcknowledger.class);
        var engine = PollingEngine.builder("pending-alerts", fetcher)
                .withConfig(PollingConfig.pendingAlertDefaults())
                .withTaskScheduler(scheduler)
                .withJitterSource(() -> 0.5)
                .build();
        deduplicator = new AlertDeduplicator(engine, acknowledger);
        shown = new ArrayList<>();
    }

    private static AlertRecord alert(String timerId, int minutes) {
        return new AlertRecord("a-" + timerId + "-" + minutes, timerId, minutes, "2026-03-01T10:55:00", "pending", null);
    }

    private static CompletableFuture<FetchOutcome<List<AlertRecord>>> alerts(AlertRecord... records) {
        return CompletableFuture.completedFuture(FetchOutcome.changed(List.of(records), null));
    }

    @Test
    void repeatedAlertIsShownOnce() {
        when(fetcher.fetch(any(), any()))
                .thenReturn(alerts(alert("t-1", 5)), alerts(alert("t-1", 5)), alerts(alert("t-1", 5), alert("t-2", 5)));

        deduplicator.start("b-1", shown::add);
        scheduler.runNext();
        scheduler.runNext();

        assertEquals(List.of("t-1:5", "t-2:5"), shown.stream().map(AlertRecord::shownAlertKey).toList());
        assertEquals(2, deduplicator.shownAlertCount());
    }

    @Test
    void alertIsDeliveredAgainWhenCallbackFails() {
        when(fetcher.fetch(any(), any()))
                .thenReturn(alerts(alert("t-1", 5), alert("t-2", 5)), alerts(alert("t-1", 5), alert("t-2", 5)));
        var attempts = new ArrayList<String>();

        deduplicator.start("b-1", alert -> {
            attempts.add(alert.shownAlertKey());
            if (alert.timerId().equals("t-1") && attempts.size() == 1) {
                throw new IllegalStateException("display unavailable");
            }
            shown.add(alert);
        });

        assertEquals(List.of("t-2:5"), shown.stream().map(AlertRecord::shownAlertKey).toList());
        assertEquals(1, deduplicator.shownAlertCount());

        scheduler.runNext();

        assertEquals(List.of("t-1:5", "t-2:5", "t-1:5"), attempts);
        assertEquals(List.of("t-2:5", "t-1:5"), shown.stream().map(AlertRecord::shownAlertKey).toList());
        assertEquals(2, deduplicator.shownAlertCount());
        assertTrue(deduplicator.isRunning());
    }

    @Test
    void sameTimerAtAnotherThresholdIsANewAlert() {
        when(fetcher.fetch(any(), any())).thenReturn(alerts(alert("t-1", 10)), alerts(alert("t-1", 5)));

        deduplicator.start("b-1", shown::add);
        scheduler.runNext();

        assertEquals(2, shown.size());
    }

    @Test
    void everyListIsPassedToListCallback() {
        when(fetcher.fetch(any(), any())).thenReturn(alerts(alert("t-1", 5)));
        List<List<AlertRecord>> lists = new ArrayList<>();

        deduplicator.start("b-1", shown::add, lists::add, null);
        scheduler.runNext();

        assertEquals(2, lists.size());
        assertEquals(1, shown.size());
        assertEquals(1, deduplicator.getCachedAlerts().orElseThrow().size());
    }

    @Test
    void pollsAtFixedInterval() {
        when(fetcher.fetch(any(), any())).thenReturn(alerts());

        deduplicator.start("b-1", shown::add);
        scheduler.runNext();
        scheduler.runNext();

        assertEquals(List.of(10000L, 10000L, 10000L), scheduler.scheduledDelaysMillis());
        verify(fetcher, times(3)).fetch("b-1", null);
    }

    @Test
    void stopClearsShownSet() {
        when(fetcher.fetch(any(), any())).thenReturn(alerts(alert("t-1", 5)));

        deduplicator.start("b-1", shown::add);
        deduplicator.stop();

        assertFalse(deduplicator.isRunning());
        assertEquals(0, deduplicator.shownAlertCount());

        deduplicator.start("b-1", shown::add);
        assertEquals(2, shown.size());
    }

    @Test
    void pauseAndResumeDelegateToEngine() {
        when(fetcher.fetch(any(), any())).thenReturn(alerts());

        deduplicator.start("b-1", shown::add);
        deduplicator.pause();
        assertTrue(deduplicator.getState().paused());
        assertEquals(0, scheduler.pendingCount());

        deduplicator.resume();
        assertFalse(deduplicator.getState().paused());
        deduplicator.forcePoll();

        verify(fetcher, times(3)).fetch(any(), any());
    }

    @Test
    void acknowledgeIsIndependentOfPolling() {
        var failure = CompletableFuture.<Void>failedFuture(new IllegalStateException("offline"));
        when(acknowledger.acknowledge("t-1", 5)).thenReturn(failure);
        when(fetcher.fetch(any(), any())).thenReturn(alerts());
        deduplicator.start("b-1", shown::add);

        var result = deduplicator.acknowledgeAlert("t-1", 5);

        assertTrue(result.isCompletedExceptionally());
        assertTrue(deduplicator.isRunning());
        assertEquals(0, deduplicator.getState().errorCount());
    }
}
