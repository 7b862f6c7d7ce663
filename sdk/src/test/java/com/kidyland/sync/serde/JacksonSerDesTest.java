// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.serde;

import static org.junit.jupiter.api.Assertions.*;

import com.kidyland.sync.TypeToken;
import com.kidyland.sync.alerts.AlertRecord;
import com.kidyland.sync.exception.DecodeException;
import com.kidyland.sync.model.TimerSnapshot;
import java.util.List;
import org.junit.jupiter.api.Test;

class JacksonSerDesTest {

    private final SerDes serDes = new JacksonSerDes();

    @Test
    void decodesActiveTimerList() {
        var json =
                """
                [{"id": "t-1", "sale_id": "s-1", "service_id": "svc-9", "child_name": "Ana", "child_age": 6,
                  "status": "active", "start_at": "2026-03-01T10:00:00", "end_at": "2026-03-01T11:00:00",
                  "time_left": 42, "sucursal_id": "b-1"}]
                """;

        var timers = serDes.deserialize(json, new TypeToken<List<TimerSnapshot>>() {});

        assertEquals(1, timers.size());
        var timer = timers.get(0);
        assertEquals("t-1", timer.id());
        assertEquals("s-1", timer.saleId());
        assertEquals("Ana", timer.childName());
        assertEquals(6, timer.childAge());
        assertEquals("2026-03-01T11:00:00", timer.endAt());
        assertEquals(42, timer.timeLeftMinutes());
    }

    @Test
    void decodesPendingAlertWithNestedTimer() {
        var json =
                """
                [{"id": "a-1", "timer_id": "t-1", "alert_minutes": 5, "triggered_at": "2026-03-01T10:55:00",
                  "status": "pending",
                  "timer": {"id": "t-1", "sale_id": "s-1", "service_id": "svc-9", "child_name": "Ana",
                            "child_age": null, "status": "active", "time_left_minutes": 5}}]
                """;

        var alerts = serDes.deserialize(json, new TypeToken<List<AlertRecord>>() {});

        var alert = alerts.get(0);
        assertEquals("t-1", alert.timerId());
        assertEquals(5, alert.alertThresholdMinutes());
        assertEquals("pending", alert.status());
        assertEquals(5, alert.timerSnapshot().timeLeftMinutes());
        assertNull(alert.timerSnapshot().childAge());
        assertEquals("t-1:5", alert.shownAlertKey());
    }

    @Test
    void nullInputDecodesToNull() {
        assertNull(serDes.deserialize(null, TypeToken.of(String.class)));
    }

    @Test
    void malformedJsonThrowsDecodeException() {
        var exception = assertThrows(
                DecodeException.class, () -> serDes.deserialize("{not json", new TypeToken<List<AlertRecord>>() {}));

        assertTrue(exception.getMessage().startsWith("Deserialization failed for type: "));
        assertNotNull(exception.getCause());
    }
}
