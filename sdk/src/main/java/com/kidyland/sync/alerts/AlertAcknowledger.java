// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.alerts;

import com.kidyland.sync.SyncConfig;
import com.kidyland.sync.auth.TokenProvider;
import com.kidyland.sync.exception.AuthenticationException;
import com.kidyland.sync.http.ApiRequests;
import com.kidyland.sync.validation.ParameterValidator;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Marks an alert threshold of a timer as handled on the server. */
public class AlertAcknowledger {
    private static final Logger logger = LoggerFactory.getLogger(AlertAcknowledger.class);

    static final int MIN_ALERT_MINUTES = 1;
    static final int MAX_ALERT_MINUTES = 60;

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final TokenProvider tokenProvider;

    public AlertAcknowledger(SyncConfig config) {
        Objects.requireNonNull(config, "SyncConfig cannot be null");
        this.baseUrl = config.getBaseUrl();
        this.httpClient = config.getHttpClient();
        this.tokenProvider = config.getTokenProvider();
    }

    /**
     * Sends {@code POST /timers/{timerId}/alerts/acknowledge?alert_minutes={n}} with an empty body.
     *
     * @param timerId the timer whose alert is acknowledged
     * @param alertMinutes the threshold, between 1 and 60
     * @return a future completing when the server accepted the acknowledgement, or exceptionally with a
     *     {@link com.kidyland.sync.exception.PollingException}
     * @throws IllegalArgumentException if the arguments are invalid; no request is made
     */
    public CompletableFuture<Void> acknowledge(String timerId, int alertMinutes) {
        ParameterValidator.validateNotBlank(timerId, "timerId");
        ParameterValidator.validateRange(alertMinutes, MIN_ALERT_MINUTES, MAX_ALERT_MINUTES, "alertMinutes");

        var future = new CompletableFuture<Void>();
        var url = baseUrl.newBuilder()
                .addPathSegment("timers")
                .addPathSegment(timerId)
                .addPathSegments("alerts/acknowledge")
                .addQueryParameter("alert_minutes", String.valueOf(alertMinutes))
                .build();

        okhttp3.Request request;
        try {
            request = ApiRequests.authorized(url, tokenProvider)
                    .post(RequestBody.create(new byte[0]))
                    .build();
        } catch (AuthenticationException e) {
            future.completeExceptionally(e);
            return future;
        }

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                logger.error("Error acknowledging alert {}:{}", timerId, alertMinutes, e);
                future.completeExceptionally(ApiRequests.failureFor(url, e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        logger.debug("Acknowledged alert {}:{}", timerId, alertMinutes);
                        future.complete(null);
                    } else {
                        var failure = ApiRequests.failureFor(response);
                        logger.error("Error acknowledging alert {}:{}: {}", timerId, alertMinutes, failure.getMessage());
                        future.completeExceptionally(failure);
                    }
                }
            }
        });
        return future;
    }
}
