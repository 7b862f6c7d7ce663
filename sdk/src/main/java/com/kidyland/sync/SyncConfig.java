// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync;

import com.kidyland.sync.auth.TokenProvider;
import com.kidyland.sync.schedule.ExecutorTaskScheduler;
import com.kidyland.sync.schedule.TaskScheduler;
import com.kidyland.sync.serde.JacksonSerDes;
import com.kidyland.sync.serde.SerDes;
import com.kidyland.sync.validation.ParameterValidator;
import com.kidyland.sync.visibility.VisibilitySource;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Environment configuration shared by the consumers built through {@link SyncClients}: where the API server lives, how
 * to reach it, how to authenticate and how to schedule polls.
 *
 * <p>Example usage with default settings, reading the server address from {@code KIDYLAND_API_URL} and the token from
 * {@code ~/.kidyland/auth_token}:
 *
 * <pre>{@code
 * SyncConfig config = SyncConfig.defaultConfig();
 * }</pre>
 *
 * <p>Example usage with explicit settings:
 *
 * <pre>{@code
 * SyncConfig config = SyncConfig.builder()
 *     .withBaseUrl("https://api.kidyland.example")
 *     .withTokenProvider(TokenProvider.fromEnvironment("KIDYLAND_TOKEN"))
 *     .withVisibilitySource(window)
 *     .build();
 * }</pre>
 */
public final class SyncConfig {
    private static final Logger logger = LoggerFactory.getLogger(SyncConfig.class);

    static final String API_URL_ENV = "KIDYLAND_API_URL";
    static final String DEFAULT_BASE_URL = "http://localhost:8000";
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final TokenProvider tokenProvider;
    private final SerDes serDes;
    private final TaskScheduler taskScheduler;
    private final VisibilitySource visibilitySource;
    private final Duration requestTimeout;
    private final Clock clock;

    private SyncConfig(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : defaultBaseUrl();
        this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        var client = builder.httpClient != null ? builder.httpClient : new OkHttpClient();
        this.httpClient = client.newBuilder().callTimeout(requestTimeout).build();
        this.tokenProvider = builder.tokenProvider != null ? builder.tokenProvider : defaultTokenProvider();
        this.serDes = builder.serDes != null ? builder.serDes : new JacksonSerDes();
        this.taskScheduler = builder.taskScheduler != null ? builder.taskScheduler : ExecutorTaskScheduler.shared();
        this.visibilitySource =
                builder.visibilitySource != null ? builder.visibilitySource : VisibilitySource.alwaysVisible();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    /**
     * Creates a SyncConfig with default settings.
     *
     * @return SyncConfig with default configuration
     */
    public static SyncConfig defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return API base URL every endpoint path is resolved against */
    public HttpUrl getBaseUrl() {
        return baseUrl;
    }

    /** @return HTTP client with the request timeout applied as call timeout */
    public OkHttpClient getHttpClient() {
        return httpClient;
    }

    public TokenProvider getTokenProvider() {
        return tokenProvider;
    }

    public SerDes getSerDes() {
        return serDes;
    }

    public TaskScheduler getTaskScheduler() {
        return taskScheduler;
    }

    public VisibilitySource getVisibilitySource() {
        return visibilitySource;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Clock getClock() {
        return clock;
    }

    private static HttpUrl defaultBaseUrl() {
        var url = System.getenv(API_URL_ENV);
        if (url == null || url.isBlank()) {
            logger.debug("{} not set, defaulting to: {}", API_URL_ENV, DEFAULT_BASE_URL);
            url = DEFAULT_BASE_URL;
        }
        return HttpUrl.get(url);
    }

    private static TokenProvider defaultTokenProvider() {
        var path = Path.of(System.getProperty("user.home"), ".kidyland", "auth_token");
        logger.debug("Reading authentication token from {}", path);
        return TokenProvider.fromFile(path);
    }

    /** Builder for SyncConfig. */
    public static final class Builder {
        private HttpUrl baseUrl;
        private OkHttpClient httpClient;
        private TokenProvider tokenProvider;
        private SerDes serDes;
        private TaskScheduler taskScheduler;
        private VisibilitySource visibilitySource;
        private Duration requestTimeout;
        private Clock clock;

        private Builder() {}

        /**
         * Sets the API base URL.
         *
         * @param baseUrl absolute http or https URL, optionally with a path prefix
         * @return This builder
         * @throws IllegalArgumentException if the URL cannot be parsed
         */
        public Builder withBaseUrl(String baseUrl) {
            Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
            return withBaseUrl(HttpUrl.get(baseUrl));
        }

        public Builder withBaseUrl(HttpUrl baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
            return this;
        }

        /**
         * Sets the OkHttp client. Connection pools and interceptors are shared with it; the call timeout is replaced
         * by the request timeout.
         *
         * @param httpClient Custom OkHttpClient instance
         * @return This builder
         */
        public Builder withHttpClient(OkHttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "OkHttpClient cannot be null");
            return this;
        }

        public Builder withTokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = Objects.requireNonNull(tokenProvider, "TokenProvider cannot be null");
            return this;
        }

        public Builder withSerDes(SerDes serDes) {
            this.serDes = Objects.requireNonNull(serDes, "SerDes cannot be null");
            return this;
        }

        /**
         * Sets the scheduler shared by every engine built from this config. If not set, one with its own daemon thread
         * is created.
         *
         * @param taskScheduler scheduler for delayed polls
         * @return This builder
         */
        public Builder withTaskScheduler(TaskScheduler taskScheduler) {
            this.taskScheduler = Objects.requireNonNull(taskScheduler, "TaskScheduler cannot be null");
            return this;
        }

        public Builder withVisibilitySource(VisibilitySource visibilitySource) {
            this.visibilitySource = Objects.requireNonNull(visibilitySource, "VisibilitySource cannot be null");
            return this;
        }

        /**
         * Sets the bound on a whole request, from connect to the last byte of the body. Defaults to 30 seconds.
         *
         * @param requestTimeout positive timeout
         * @return This builder
         */
        public Builder withRequestTimeout(Duration requestTimeout) {
            ParameterValidator.validatePositiveDuration(requestTimeout, "requestTimeout");
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public SyncConfig build() {
            return new SyncConfig(this);
        }
    }
}
