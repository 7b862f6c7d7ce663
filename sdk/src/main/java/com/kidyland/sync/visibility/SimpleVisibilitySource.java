// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.visibility;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link VisibilitySource} whose state the host sets directly, e.g. from window focus or screen-on events. */
public class SimpleVisibilitySource implements VisibilitySource {
    private static final Logger logger = LoggerFactory.getLogger(SimpleVisibilitySource.class);

    private final List<VisibilityListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean visible;

    public SimpleVisibilitySource() {
        this(true);
    }

    public SimpleVisibilitySource(boolean initiallyVisible) {
        this.visible = initiallyVisible;
    }

    @Override
    public boolean isVisible() {
        return visible;
    }

    /**
     * Updates the visibility state. Listeners are notified on the calling thread, and only when the state changes.
     *
     * @param visible the new state
     */
    public void setVisible(boolean visible) {
        synchronized (this) {
            if (this.visible == visible) {
                return;
            }
            this.visible = visible;
        }
        logger.debug("Visibility changed to {}", visible ? "visible" : "hidden");
        for (VisibilityListener listener : listeners) {
            try {
                listener.onVisibilityChanged(visible);
            } catch (RuntimeException e) {
                logger.error("Visibility listener failed", e);
            }
        }
    }

    @Override
    public void addVisibilityListener(VisibilityListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    @Override
    public void removeVisibilityListener(VisibilityListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
