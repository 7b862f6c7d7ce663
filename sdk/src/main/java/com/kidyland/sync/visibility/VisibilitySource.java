// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.visibility;

/**
 * Host-provided signal telling whether the consumer of polled data is currently visible to anyone.
 *
 * <p>Hosts with a window or screen lifecycle bridge it here, typically through {@link SimpleVisibilitySource}.
 * Headless hosts use {@link #alwaysVisible()}.
 */
public interface VisibilitySource {

    /** @return true if the consumer is visible */
    boolean isVisible();

    /**
     * Registers a listener to be called when {@link #isVisible()} changes.
     *
     * @param listener a listener
     */
    void addVisibilityListener(VisibilityListener listener);

    /**
     * Undoes the effect of {@link #addVisibilityListener(VisibilityListener)}. Has no effect if no such listener is
     * registered.
     *
     * @param listener a listener
     */
    void removeVisibilityListener(VisibilityListener listener);

    /** @return a source that is always visible and never notifies */
    static VisibilitySource alwaysVisible() {
        return AlwaysVisible.INSTANCE;
    }

    final class AlwaysVisible implements VisibilitySource {
        private static final AlwaysVisible INSTANCE = new AlwaysVisible();

        private AlwaysVisible() {}

        @Override
        public boolean isVisible() {
            return true;
        }

        @Override
        public void addVisibilityListener(VisibilityListener listener) {}

        @Override
        public void removeVisibilityListener(VisibilityListener listener) {}
    }
}
