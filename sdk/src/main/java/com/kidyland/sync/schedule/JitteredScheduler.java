// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.schedule;

import com.kidyland.sync.validation.ParameterValidator;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Schedules single callbacks with a symmetric random offset so that many clients polling the same endpoint at the
 * same adaptive interval do not fire in lockstep.
 *
 * <p>The effective delay is {@code max(0, delay + uniform(-jitterRange/2, +jitterRange/2))}.
 */
public class JitteredScheduler {
    private final TaskScheduler taskScheduler;
    private final Duration jitterRange;
    private final DoubleSupplier random;

    public JitteredScheduler(TaskScheduler taskScheduler, Duration jitterRange) {
        this(taskScheduler, jitterRange, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param taskScheduler scheduler that runs the callbacks
     * @param jitterRange total width of the jitter window
     * @param random source of uniform values in {@code [0, 1)}
     */
    public JitteredScheduler(TaskScheduler taskScheduler, Duration jitterRange, DoubleSupplier random) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "TaskScheduler cannot be null");
        ParameterValidator.validateNonNegativeDuration(jitterRange, "jitterRange");
        this.jitterRange = jitterRange;
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Schedules {@code callback} after {@code delay} plus jitter.
     *
     * @param delay the nominal delay
     * @param callback the action to run
     * @return handle for {@link #cancel(ScheduledTask)}
     */
    public ScheduledTask schedule(Duration delay, Runnable callback) {
        return taskScheduler.schedule(callback, jitter(delay));
    }

    /**
     * Cancels a handle returned by {@link #schedule(Duration, Runnable)}. Null handles are ignored.
     *
     * @param handle the handle to cancel
     */
    public void cancel(ScheduledTask handle) {
        if (handle != null) {
            handle.cancel();
        }
    }

    /**
     * Applies the jitter window to a nominal delay.
     *
     * @param delay the nominal delay
     * @return the jittered delay, never negative
     */
    public Duration jitter(Duration delay) {
        long offsetMillis = Math.round((random.getAsDouble() - 0.5) * jitterRange.toMillis());
        return Duration.ofMillis(Math.max(0, delay.toMillis() + offsetMillis));
    }

    public Duration getJitterRange() {
        return jitterRange;
    }
}
