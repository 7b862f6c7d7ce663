// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.schedule;

import java.io.Closeable;
import java.time.Duration;

/**
 * Abstraction over the timer facility engines use to run delayed work.
 *
 * <p>Production code uses {@link ExecutorTaskScheduler}; tests substitute a virtual-time implementation so that
 * intervals can be asserted without sleeping.
 */
public interface TaskScheduler extends Closeable {
    /**
     * Schedules an action to run once after a delay.
     *
     * @param action the action to execute
     * @param delay minimum time to wait before executing; zero runs as soon as possible
     * @return a handle that can be used to cancel the action
     */
    ScheduledTask schedule(Runnable action, Duration delay);

    /** Releases any threads owned by this scheduler. Scheduled actions that have not run are discarded. */
    @Override
    default void close() {}
}
