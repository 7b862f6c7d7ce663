// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/** Logger wrapper that adds the engine name and current target to log entries via MDC. */
public class PollingLogger {
    static final String MDC_ENGINE = "pollingEngine";
    static final String MDC_TARGET = "pollingTarget";

    private final Logger delegate;
    private final String engineName;
    private volatile String targetId;

    public PollingLogger(Logger delegate, String engineName) {
        this.delegate = delegate;
        this.engineName = engineName;
    }

    /** @param targetId target of the current run, or null between runs */
    public void setTarget(String targetId) {
        this.targetId = targetId;
    }

    public void trace(String format, Object... args) {
        log(() -> delegate.trace(format, args));
    }

    public void debug(String format, Object... args) {
        log(() -> delegate.debug(format, args));
    }

    public void info(String format, Object... args) {
        log(() -> delegate.info(format, args));
    }

    public void warn(String format, Object... args) {
        log(() -> delegate.warn(format, args));
    }

    public void error(String format, Object... args) {
        log(() -> delegate.error(format, args));
    }

    public void error(String message, Throwable t) {
        log(() -> delegate.error(message, t));
    }

    private void log(Runnable logAction) {
        try {
            MDC.put(MDC_ENGINE, engineName);
            var target = targetId;
            if (target != null) {
                MDC.put(MDC_TARGET, target);
            }
            logAction.run();
        } finally {
            MDC.remove(MDC_ENGINE);
            MDC.remove(MDC_TARGET);
        }
    }
}
