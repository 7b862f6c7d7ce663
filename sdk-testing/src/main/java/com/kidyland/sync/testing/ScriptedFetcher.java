// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.testing;

import com.kidyland.sync.exception.PollingException;
import com.kidyland.sync.fetch.ConditionalFetcher;
import com.kidyland.sync.fetch.FetchOutcome;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link ConditionalFetcher} answering from a script. Each fetch consumes the next scripted step; once the script is
 * exhausted the last step repeats. Every call is recorded with the target and validator it received.
 *
 * <pre>{@code
 * var fetcher = new ScriptedFetcher<String>()
 *     .thenChanged("A", "\"v1\"")
 *     .thenUnchanged()
 *     .thenFailed(new TransportException(503, "HTTP 503"));
 * }</pre>
 *
 * @param <T> payload type
 */
public class ScriptedFetcher<T> implements ConditionalFetcher<T> {

    /** A fetch the engine made. */
    public record FetchCall(String targetId, String validator) {}

    private final Deque<Supplier<CompletableFuture<FetchOutcome<T>>>> script = new ArrayDeque<>();
    private final List<FetchCall> calls = new ArrayList<>();
    private final List<CompletableFuture<FetchOutcome<T>>> pending = new ArrayList<>();
    private Supplier<CompletableFuture<FetchOutcome<T>>> last;

    public synchronized ScriptedFetcher<T> thenChanged(T payload, String validator) {
        return then(FetchOutcome.changed(payload, validator));
    }

    public synchronized ScriptedFetcher<T> thenUnchanged() {
        return then(FetchOutcome.unchanged());
    }

    public synchronized ScriptedFetcher<T> thenFailed(PollingException error) {
        return then(FetchOutcome.failed(error));
    }

    /** Scripts a fetch that stays in flight until {@link #completePending(FetchOutcome)} is called. */
    public synchronized ScriptedFetcher<T> thenPending() {
        script.add(() -> {
            var future = new CompletableFuture<FetchOutcome<T>>();
            pending.add(future);
            return future;
        });
        return this;
    }

    private ScriptedFetcher<T> then(FetchOutcome<T> outcome) {
        script.add(() -> CompletableFuture.completedFuture(outcome));
        return this;
    }

    @Override
    public CompletableFuture<FetchOutcome<T>> fetch(String targetId, String lastValidator) {
        Supplier<CompletableFuture<FetchOutcome<T>>> step;
        synchronized (this) {
            calls.add(new FetchCall(targetId, lastValidator));
            if (!script.isEmpty()) {
                last = script.poll();
            }
            step = last;
        }
        if (step == null) {
            throw new IllegalStateException("ScriptedFetcher has no scripted outcome");
        }
        return step.get();
    }

    /**
     * Completes the oldest fetch scripted with {@link #thenPending()}.
     *
     * @param outcome the outcome to deliver
     * @throws IllegalStateException if no fetch is pending
     */
    public void completePending(FetchOutcome<T> outcome) {
        CompletableFuture<FetchOutcome<T>> future;
        synchronized (this) {
            if (pending.isEmpty()) {
                throw new IllegalStateException("No pending fetch");
            }
            future = pending.remove(0);
        }
        future.complete(outcome);
    }

    public synchronized List<FetchCall> getCalls() {
        return List.copyOf(calls);
    }

    public synchronized int getCallCount() {
        return calls.size();
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }
}
