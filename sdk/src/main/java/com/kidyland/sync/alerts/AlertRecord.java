// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.alerts;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kidyland.sync.model.TimerSnapshot;

/**
 * A timer that crossed one of its alert thresholds.
 *
 * @param id alert id
 * @param timerId timer that crossed the threshold
 * @param alertThresholdMinutes minutes left at which the alert fires
 * @param triggeredAt when the server recorded the crossing
 * @param status alert status, e.g. {@code pending}
 * @param timerSnapshot the timer as it was when the alert list was produced
 */
public record AlertRecord(
        String id,
        String timerId,
        @JsonProperty("alert_minutes") int alertThresholdMinutes,
        String triggeredAt,
        String status,
        @JsonProperty("timer") TimerSnapshot timerSnapshot) {

    /** @return key identifying this alert across polls, {@code timerId:minutes} */
    public String shownAlertKey() {
        return timerId + ":" + alertThresholdMinutes;
    }
}
