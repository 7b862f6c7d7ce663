// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.http;

import com.kidyland.sync.auth.TokenProvider;
import com.kidyland.sync.exception.AuthenticationException;
import com.kidyland.sync.exception.PollTimeoutException;
import com.kidyland.sync.exception.PollingException;
import com.kidyland.sync.exception.TransportException;
import java.io.IOException;
import java.io.InterruptedIOException;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.Response;

/** Request construction and failure mapping shared by every call the SDK makes to the API server. */
public final class ApiRequests {
    static final String HEADER_AUTHORIZATION = "Authorization";
    static final String HEADER_ACCEPT = "Accept";
    static final String HEADER_IF_NONE_MATCH = "If-None-Match";
    static final String HEADER_ETAG = "ETag";
    static final String MEDIA_TYPE_JSON = "application/json";

    private ApiRequests() {
        // Utility class - prevent instantiation
    }

    /**
     * Starts a request carrying the bearer token.
     *
     * @param url request URL
     * @param tokenProvider token source
     * @return a request builder with authorization and accept headers set
     * @throws AuthenticationException if no token is available
     */
    public static Request.Builder authorized(HttpUrl url, TokenProvider tokenProvider) {
        var token = tokenProvider.getToken()
                .orElseThrow(() -> new AuthenticationException("No authentication token available"));
        return new Request.Builder()
                .url(url)
                .header(HEADER_AUTHORIZATION, "Bearer " + token)
                .header(HEADER_ACCEPT, MEDIA_TYPE_JSON);
    }

    /**
     * Maps a non-2xx response to the SDK's error taxonomy.
     *
     * @param response the unsuccessful response
     * @return {@link AuthenticationException} for 401, {@link TransportException} otherwise
     */
    public static PollingException failureFor(Response response) {
        if (response.code() == 401) {
            return new AuthenticationException("Authentication failed");
        }
        var message = response.message().isEmpty()
                ? "HTTP " + response.code()
                : "HTTP " + response.code() + ": " + response.message();
        return new TransportException(response.code(), message);
    }

    /**
     * Maps an I/O failure to the SDK's error taxonomy.
     *
     * @param url the request URL, for the message
     * @param e the failure
     * @return {@link PollTimeoutException} for timeouts, {@link TransportException} otherwise
     */
    public static PollingException failureFor(HttpUrl url, IOException e) {
        if (e instanceof InterruptedIOException) {
            return new PollTimeoutException("Request timeout for " + url, e);
        }
        return new TransportException("Request to " + url + " failed: " + e.getMessage(), e);
    }
}
