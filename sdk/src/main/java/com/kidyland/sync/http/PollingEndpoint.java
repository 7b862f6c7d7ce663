// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.http;

import com.kidyland.sync.validation.ParameterValidator;
import okhttp3.HttpUrl;

/**
 * A pollable resource on the API server.
 *
 * @param path path below the API base URL, without leading slash
 * @param targetParameter query parameter carrying the target id
 * @param conditional whether the server supports {@code If-None-Match}/{@code ETag} validation for this resource
 */
public record PollingEndpoint(String path, String targetParameter, boolean conditional) {

    /** Full snapshot of running timers; answers 304 while nothing changed. */
    public static final PollingEndpoint ACTIVE_TIMERS = new PollingEndpoint("timers/active", "sucursal_id", true);

    /** Alerts waiting to be surfaced; always answers 200 with the complete candidate set. */
    public static final PollingEndpoint PENDING_ALERTS =
            new PollingEndpoint("timers/alerts/pending", "sucursal_id", false);

    public PollingEndpoint {
        ParameterValidator.validateNotBlank(path, "path");
        ParameterValidator.validateNotBlank(targetParameter, "targetParameter");
    }

    /**
     * Builds the request URL for a target.
     *
     * @param baseUrl API base URL, possibly with a path prefix
     * @param targetId target id, or null to omit the parameter
     * @return the resolved URL
     */
    public HttpUrl resolve(HttpUrl baseUrl, String targetId) {
        var builder = baseUrl.newBuilder().addPathSegments(path);
        if (targetId != null) {
            builder.addQueryParameter(targetParameter, targetId);
        }
        return builder.build();
    }
}
