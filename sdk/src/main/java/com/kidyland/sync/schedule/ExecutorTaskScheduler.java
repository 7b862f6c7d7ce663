// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.schedule;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link TaskScheduler} backed by a {@link ScheduledExecutorService}. */
public class ExecutorTaskScheduler implements TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final String SHARED_THREAD_NAME = "kidyland-sync-shared";

    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Creates a scheduler with its own single daemon thread, shut down by {@link #close()}. Prefer {@link #shared()}
     * unless the scheduler's lifetime is managed by the caller.
     */
    public ExecutorTaskScheduler() {
        this(createDefaultExecutor("kidyland-sync-" + THREAD_COUNTER.incrementAndGet()), true);
    }

    /**
     * Creates a scheduler on a caller-managed executor. {@link #close()} will not shut the executor down.
     *
     * @param executor the executor to schedule on
     */
    public ExecutorTaskScheduler(ScheduledExecutorService executor) {
        this(executor, false);
    }

    private ExecutorTaskScheduler(ScheduledExecutorService executor, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "ScheduledExecutorService cannot be null");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Returns the process-wide scheduler used by engines and configs built without an explicit one. It runs on a
     * single daemon thread created on first use; {@link #close()} has no effect on it.
     *
     * @return the shared default scheduler
     */
    public static ExecutorTaskScheduler shared() {
        return SharedHolder.INSTANCE;
    }

    @Override
    public ScheduledTask schedule(Runnable action, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                // an exception escaping here would be swallowed by the executor
                logger.error("Scheduled task failed", e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ScheduledExecutorService createDefaultExecutor(String threadName) {
        logger.debug("Creating polling scheduler {}", threadName);
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName(threadName);
            t.setDaemon(true);
            return t;
        });
    }

    private static final class SharedHolder {
        private static final ExecutorTaskScheduler INSTANCE =
                new ExecutorTaskScheduler(createDefaultExecutor(SHARED_THREAD_NAME), false);
    }

    private static final class FutureTask implements ScheduledTask {
        private final ScheduledFuture<?> future;

        private FutureTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
