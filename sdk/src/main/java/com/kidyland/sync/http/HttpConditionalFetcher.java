// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.http;

import com.kidyland.sync.SyncConfig;
import com.kidyland.sync.TypeToken;
import com.kidyland.sync.auth.TokenProvider;
import com.kidyland.sync.exception.AuthenticationException;
import com.kidyland.sync.exception.DecodeException;
import com.kidyland.sync.fetch.ConditionalFetcher;
import com.kidyland.sync.fetch.FetchOutcome;
import com.kidyland.sync.serde.SerDes;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConditionalFetcher} issuing authenticated GET requests with OkHttp.
 *
 * <p>On conditional endpoints the last validator is sent as {@code If-None-Match} and a 304 answer is reported as
 * unchanged without reading the body. A 200 answer is decoded with the configured {@link SerDes}; when it carries no
 * {@code ETag} the outcome has no validator and the engine keeps the previous one.
 *
 * @param <T> payload type
 */
public class HttpConditionalFetcher<T> implements ConditionalFetcher<T> {
    private static final Logger logger = LoggerFactory.getLogger(HttpConditionalFetcher.class);

    private final PollingEndpoint endpoint;
    private final TypeToken<T> payloadType;
    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final TokenProvider tokenProvider;
    private final SerDes serDes;

    /**
     * @param config server address, client, token and SerDes
     * @param endpoint resource to poll
     * @param payloadType type the response body is decoded to
     */
    public HttpConditionalFetcher(SyncConfig config, PollingEndpoint endpoint, TypeToken<T> payloadType) {
        Objects.requireNonNull(config, "SyncConfig cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "PollingEndpoint cannot be null");
        this.payloadType = Objects.requireNonNull(payloadType, "TypeToken cannot be null");
        this.baseUrl = config.getBaseUrl();
        this.httpClient = config.getHttpClient();
        this.tokenProvider = config.getTokenProvider();
        this.serDes = config.getSerDes();
    }

    @Override
    public CompletableFuture<FetchOutcome<T>> fetch(String targetId, String lastValidator) {
        var future = new CompletableFuture<FetchOutcome<T>>();
        var url = endpoint.resolve(baseUrl, targetId);

        okhttp3.Request.Builder builder;
        try {
            builder = ApiRequests.authorized(url, tokenProvider);
        } catch (AuthenticationException e) {
            future.complete(FetchOutcome.failed(e));
            return future;
        }
        if (endpoint.conditional() && lastValidator != null) {
            builder.header(ApiRequests.HEADER_IF_NONE_MATCH, lastValidator);
        }

        logger.trace("GET {} (validator={})", url, lastValidator);
        httpClient.newCall(builder.get().build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.complete(FetchOutcome.failed(ApiRequests.failureFor(url, e)));
            }

            @Override
            public void onResponse(Call call, Response response) {
                future.complete(classify(url, response));
            }
        });
        return future;
    }

    public PollingEndpoint getEndpoint() {
        return endpoint;
    }

    private FetchOutcome<T> classify(HttpUrl url, Response response) {
        try (response) {
            if (response.code() == 304) {
                return FetchOutcome.unchanged();
            }
            if (!response.isSuccessful()) {
                return FetchOutcome.failed(ApiRequests.failureFor(response));
            }
            var body = response.body();
            var data = body != null ? body.string() : "";
            if (data.isEmpty()) {
                return FetchOutcome.failed(new DecodeException("Empty response body from " + url));
            }
            T payload = serDes.deserialize(data, payloadType);
            if (payload == null) {
                return FetchOutcome.failed(new DecodeException("Null payload from " + url));
            }
            return FetchOutcome.changed(payload, response.header(ApiRequests.HEADER_ETAG));
        } catch (DecodeException e) {
            return FetchOutcome.failed(e);
        } catch (IOException e) {
            return FetchOutcome.failed(ApiRequests.failureFor(url, e));
        } catch (RuntimeException e) {
            return FetchOutcome.failed(new DecodeException("Failed to decode response from " + url, e));
        }
    }
}
