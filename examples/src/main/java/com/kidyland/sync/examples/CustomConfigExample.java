// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.examples;

import com.kidyland.sync.PollingConfig;
import com.kidyland.sync.PollingEngine;
import com.kidyland.sync.SyncClients;
import com.kidyland.sync.SyncConfig;
import com.kidyland.sync.auth.TokenProvider;
import com.kidyland.sync.model.TimerSnapshot;
import java.time.Duration;
import java.util.List;
import okhttp3.OkHttpClient;

/**
 * Example demonstrating custom configuration: a tuned OkHttp client that tags every request, a token taken from the
 * environment, and a timing profile for a busy front desk that wants faster updates than the defaults.
 *
 * <p>This example demonstrates:
 *
 * <ul>
 *   <li>Custom OkHttp client with an interceptor and connection timeout
 *   <li>Environment variable token provider
 *   <li>Custom adaptive interval bounds and growth factor
 *   <li>Shorter request timeout
 * </ul>
 */
public class CustomConfigExample {
    static final String CLIENT_HEADER = "X-Kidyland-Client";
    static final String CLIENT_NAME = "front-desk";

    private CustomConfigExample() {}

    public static SyncConfig createConfiguration(String baseUrl, TokenProvider tokenProvider) {
        var httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .addInterceptor(chain -> chain.proceed(chain.request()
                        .newBuilder()
                        .header(CLIENT_HEADER, CLIENT_NAME)
                        .build()))
                .build();

        return SyncConfig.builder()
                .withBaseUrl(baseUrl)
                .withHttpClient(httpClient)
                .withTokenProvider(tokenProvider)
                .withRequestTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** Polls every 2s while timers change, backing off by doubling to at most 20s while they don't. */
    public static PollingConfig createPollingConfig() {
        return PollingConfig.builder()
                .withMinInterval(Duration.ofSeconds(2))
                .withMaxInterval(Duration.ofSeconds(20))
                .withBackoffMultiplier(2.0)
                .withJitterRange(Duration.ofMillis(500))
                .withErrorBackoffBase(Duration.ofSeconds(4))
                .withMaxConsecutiveErrors(20)
                .withDegradationThreshold(3)
                .build();
    }

    public static PollingEngine<List<TimerSnapshot>> createTimerEngine(String baseUrl) {
        var config = createConfiguration(baseUrl, TokenProvider.fromEnvironment("KIDYLAND_TOKEN"));
        return SyncClients.activeTimers(config, createPollingConfig());
    }
}
