// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.schedule;

/** Handle to a callback scheduled through a {@link TaskScheduler}. */
public interface ScheduledTask {
    /**
     * Prevents the callback from running if it has not started yet. Has no effect on a callback that already ran or
     * is running.
     */
    void cancel();

    boolean isCancelled();
}
