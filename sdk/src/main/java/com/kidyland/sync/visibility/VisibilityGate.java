// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.visibility;

import java.util.Objects;

/**
 * Adapts a {@link VisibilitySource} into hidden/visible callbacks for one engine run.
 *
 * <p>The listener is registered on the first {@link #onHidden(Runnable)} or {@link #onVisible(Runnable)} call and
 * removed by {@link #detach()}, which the engine calls from {@code stop()} so no listener outlives its run.
 */
public class VisibilityGate {
    private final VisibilitySource source;
    private final VisibilityListener listener = this::dispatch;

    private volatile Runnable hiddenCallback;
    private volatile Runnable visibleCallback;
    private boolean attached;

    public VisibilityGate(VisibilitySource source) {
        this.source = Objects.requireNonNull(source, "VisibilitySource cannot be null");
    }

    public synchronized VisibilityGate onHidden(Runnable callback) {
        this.hiddenCallback = Objects.requireNonNull(callback, "callback cannot be null");
        attach();
        return this;
    }

    public synchronized VisibilityGate onVisible(Runnable callback) {
        this.visibleCallback = Objects.requireNonNull(callback, "callback cannot be null");
        attach();
        return this;
    }

    /** Removes the listener from the source and drops both callbacks. Idempotent. */
    public synchronized void detach() {
        if (attached) {
            source.removeVisibilityListener(listener);
            attached = false;
        }
        hiddenCallback = null;
        visibleCallback = null;
    }

    public synchronized boolean isAttached() {
        return attached;
    }

    /** @return the current state of the underlying source */
    public boolean isVisible() {
        return source.isVisible();
    }

    private void attach() {
        if (!attached) {
            source.addVisibilityListener(listener);
            attached = true;
        }
    }

    private void dispatch(boolean visible) {
        Runnable callback = visible ? visibleCallback : hiddenCallback;
        if (callback != null) {
            callback.run();
        }
    }
}
