// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.backoff;

import com.kidyland.sync.PollingConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Adaptive interval state machine of a polling engine.
 *
 * <p>Two regimes drive the interval and never compound:
 *
 * <ul>
 *   <li>Stable data: after two consecutive unchanged responses the interval grows by the configured multiplier up to
 *       the maximum; any change snaps it back to the minimum.
 *   <li>Failures: the interval is recomputed from the error backoff base as {@code base * 2^(errorCount - 1)}, capped
 *       at the maximum, independent of where the stable-data regime left it.
 * </ul>
 *
 * <p>The interval always stays within {@code [minInterval, maxInterval]}. The unchanged counter and the failure
 * counters are never nonzero at the same time.
 *
 * <p>Not thread-safe. The owning engine serializes access.
 */
public class BackoffController {
    /** Unchanged responses required before the interval starts growing. */
    static final int UNCHANGED_BEFORE_GROWTH = 2;

    private final PollingConfig config;
    private final Clock clock;

    private Duration currentInterval;
    private int consecutiveUnchanged;
    private int errorCount;
    private int consecutiveFailures;
    private Instant degradedSince;

    public BackoffController(PollingConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "PollingConfig cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        reset();
    }

    /** Returns every counter to its initial value and the interval to the configured initial interval. */
    public void reset() {
        currentInterval = config.getInitialInterval();
        consecutiveUnchanged = 0;
        errorCount = 0;
        consecutiveFailures = 0;
        degradedSince = null;
    }

    /**
     * Records an unchanged (304) response.
     *
     * @return how long the engine had been degraded, if this success ended a degraded period
     */
    public Optional<Duration> onUnchanged() {
        var recovery = clearFailures();
        consecutiveUnchanged++;
        if (consecutiveUnchanged >= UNCHANGED_BEFORE_GROWTH) {
            currentInterval = clamp(multiply(currentInterval, config.getBackoffMultiplier()));
        }
        return recovery;
    }

    /**
     * Records a changed (200) response.
     *
     * @return how long the engine had been degraded, if this success ended a degraded period
     */
    public Optional<Duration> onChanged() {
        var recovery = clearFailures();
        currentInterval = config.getMinInterval();
        consecutiveUnchanged = 0;
        return recovery;
    }

    /**
     * Records a failed poll of any kind.
     *
     * @return the resulting backoff, degradation and termination decision
     */
    public FailureVerdict onFailure() {
        consecutiveUnchanged = 0;
        errorCount++;
        consecutiveFailures++;

        double exponent = Math.pow(2, errorCount - 1);
        currentInterval = clamp(multiply(config.getErrorBackoffBase(), exponent));

        boolean degraded = consecutiveFailures >= config.getDegradationThreshold();
        Duration degradedFor = Duration.ZERO;
        if (degraded) {
            if (degradedSince == null) {
                degradedSince = clock.instant();
            }
            degradedFor = Duration.between(degradedSince, clock.instant());
        }

        return new FailureVerdict(
                errorCount,
                consecutiveFailures,
                currentInterval,
                degraded,
                consecutiveFailures == config.getDegradationThreshold(),
                degradedFor,
                errorCount >= config.getMaxConsecutiveErrors());
    }

    /** Biases the next polls toward responsiveness after a local change known to affect server state. */
    public void forceResponsive() {
        currentInterval = config.getMinInterval();
        consecutiveUnchanged = 0;
    }

    public Duration getCurrentInterval() {
        return currentInterval;
    }

    public int getConsecutiveUnchanged() {
        return consecutiveUnchanged;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /** @return when the current degraded period began, or empty if not degraded */
    public Optional<Instant> getDegradedSince() {
        return Optional.ofNullable(degradedSince);
    }

    private Optional<Duration> clearFailures() {
        errorCount = 0;
        consecutiveFailures = 0;
        if (degradedSince == null) {
            return Optional.empty();
        }
        var degradedFor = Duration.between(degradedSince, clock.instant());
        degradedSince = null;
        return Optional.of(degradedFor);
    }

    private Duration clamp(Duration interval) {
        if (interval.compareTo(config.getMinInterval()) < 0) {
            return config.getMinInterval();
        }
        if (interval.compareTo(config.getMaxInterval()) > 0) {
            return config.getMaxInterval();
        }
        return interval;
    }

    private static Duration multiply(Duration interval, double factor) {
        double millis = interval.toMillis() * factor;
        // large error counts push the product past the range of a long
        if (millis >= Long.MAX_VALUE) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(Math.round(millis));
    }
}
