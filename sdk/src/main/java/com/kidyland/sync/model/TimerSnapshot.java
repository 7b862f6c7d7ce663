// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A running timer as reported by the server. Timestamps are kept as the server sends them; the server emits local
 * times without an offset.
 *
 * @param id timer id
 * @param saleId sale the timer belongs to
 * @param serviceId service being timed
 * @param childName name of the child using the service
 * @param childAge age of the child, if recorded
 * @param status timer status, e.g. {@code active}
 * @param startAt when the timer started
 * @param endAt when the timer runs out
 * @param timeLeftMinutes minutes remaining when the snapshot was taken
 */
public record TimerSnapshot(
        String id,
        String saleId,
        String serviceId,
        String childName,
        Integer childAge,
        String status,
        String startAt,
        String endAt,
        @JsonProperty("time_left") @JsonAlias("time_left_minutes") Integer timeLeftMinutes) {}
