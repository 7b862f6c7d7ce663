// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync;

import com.kidyland.sync.validation.ParameterValidator;
import java.time.Duration;

/**
 * Immutable timing configuration for a {@link PollingEngine}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * PollingConfig config = PollingConfig.builder()
 *     .withMinInterval(Duration.ofSeconds(5))
 *     .withMaxInterval(Duration.ofSeconds(30))
 *     .withBackoffMultiplier(1.5)
 *     .build();
 * }</pre>
 *
 * <p>Unset values fall back to the active-timer defaults. The error backoff base defaults to the initial interval.
 */
public final class PollingConfig {
    static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(5);
    static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(30);
    static final double DEFAULT_BACKOFF_MULTIPLIER = 1.5;
    static final Duration DEFAULT_JITTER_RANGE = Duration.ofSeconds(1);
    static final int DEFAULT_MAX_CONSECUTIVE_ERRORS = 10;
    static final int DEFAULT_DEGRADATION_THRESHOLD = 2;
    static final Duration ALERT_INTERVAL = Duration.ofSeconds(10);

    private final Duration minInterval;
    private final Duration maxInterval;
    private final Duration initialInterval;
    private final double backoffMultiplier;
    private final Duration jitterRange;
    private final Duration errorBackoffBase;
    private final int maxConsecutiveErrors;
    private final int degradationThreshold;

    private PollingConfig(Builder builder) {
        this.minInterval = builder.minInterval;
        this.maxInterval = builder.maxInterval;
        this.initialInterval = builder.initialInterval != null ? builder.initialInterval : builder.minInterval;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.jitterRange = builder.jitterRange;
        this.errorBackoffBase = builder.errorBackoffBase != null ? builder.errorBackoffBase : this.initialInterval;
        this.maxConsecutiveErrors = builder.maxConsecutiveErrors;
        this.degradationThreshold = builder.degradationThreshold;
    }

    /**
     * Defaults for the active-timer snapshot: 5s to 30s adaptive interval starting at 5s, 1.5x growth on stable data,
     * 1s jitter window, stop after 10 consecutive errors, replay cached data after 2 consecutive failures.
     */
    public static PollingConfig activeTimerDefaults() {
        return builder().build();
    }

    /**
     * Defaults for the pending-alert stream: a fixed 10s interval (min, initial and max coincide, so neither the
     * unchanged nor the error backoff moves it), 1s jitter window, same error limits as the timer defaults.
     */
    public static PollingConfig pendingAlertDefaults() {
        return builder()
                .withMinInterval(ALERT_INTERVAL)
                .withInitialInterval(ALERT_INTERVAL)
                .withMaxInterval(ALERT_INTERVAL)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    public Duration getInitialInterval() {
        return initialInterval;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getJitterRange() {
        return jitterRange;
    }

    public Duration getErrorBackoffBase() {
        return errorBackoffBase;
    }

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public int getDegradationThreshold() {
        return degradationThreshold;
    }

    /** @return a builder pre-filled with this configuration */
    public Builder toBuilder() {
        return new Builder()
                .withMinInterval(minInterval)
                .withMaxInterval(maxInterval)
                .withInitialInterval(initialInterval)
                .withBackoffMultiplier(backoffMultiplier)
                .withJitterRange(jitterRange)
                .withErrorBackoffBase(errorBackoffBase)
                .withMaxConsecutiveErrors(maxConsecutiveErrors)
                .withDegradationThreshold(degradationThreshold);
    }

    @Override
    public String toString() {
        return "PollingConfig{min=" + minInterval + ", max=" + maxInterval + ", initial=" + initialInterval
                + ", multiplier=" + backoffMultiplier + ", jitter=" + jitterRange + ", errorBase=" + errorBackoffBase
                + ", maxErrors=" + maxConsecutiveErrors + ", degradationThreshold=" + degradationThreshold + "}";
    }

    /** Builder for PollingConfig. */
    public static final class Builder {
        private Duration minInterval = DEFAULT_MIN_INTERVAL;
        private Duration maxInterval = DEFAULT_MAX_INTERVAL;
        private Duration initialInterval;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private Duration jitterRange = DEFAULT_JITTER_RANGE;
        private Duration errorBackoffBase;
        private int maxConsecutiveErrors = DEFAULT_MAX_CONSECUTIVE_ERRORS;
        private int degradationThreshold = DEFAULT_DEGRADATION_THRESHOLD;

        private Builder() {}

        /** Lower bound of the adaptive interval; the interval snaps back here whenever data changes. */
        public Builder withMinInterval(Duration minInterval) {
            this.minInterval = minInterval;
            return this;
        }

        /** Upper bound of the adaptive interval for both the unchanged and the error backoff. */
        public Builder withMaxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
            return this;
        }

        /** Interval used right after {@code start()}. Defaults to the minimum interval. */
        public Builder withInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
            return this;
        }

        /** Growth factor applied on sustained unchanged responses. Must be greater than 1.0. */
        public Builder withBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        /** Total width of the symmetric jitter window. Zero disables jitter. */
        public Builder withJitterRange(Duration jitterRange) {
            this.jitterRange = jitterRange;
            return this;
        }

        /** Base of the exponential error backoff. Defaults to the initial interval. */
        public Builder withErrorBackoffBase(Duration errorBackoffBase) {
            this.errorBackoffBase = errorBackoffBase;
            return this;
        }

        /** Number of consecutive errors after which the engine stops itself. */
        public Builder withMaxConsecutiveErrors(int maxConsecutiveErrors) {
            this.maxConsecutiveErrors = maxConsecutiveErrors;
            return this;
        }

        /** Number of consecutive failures after which cached data is replayed to the consumer. */
        public Builder withDegradationThreshold(int degradationThreshold) {
            this.degradationThreshold = degradationThreshold;
            return this;
        }

        /**
         * Builds the PollingConfig instance.
         *
         * @return Immutable PollingConfig instance
         * @throws IllegalArgumentException if any value is missing or inconsistent
         */
        public PollingConfig build() {
            ParameterValidator.validatePositiveDuration(minInterval, "minInterval");
            ParameterValidator.validatePositiveDuration(maxInterval, "maxInterval");
            Duration initial = initialInterval != null ? initialInterval : minInterval;
            ParameterValidator.validatePositiveDuration(initial, "initialInterval");
            if (minInterval.compareTo(maxInterval) > 0) {
                throw new IllegalArgumentException(
                        "minInterval must not exceed maxInterval, got: " + minInterval + " > " + maxInterval);
            }
            if (initial.compareTo(minInterval) < 0 || initial.compareTo(maxInterval) > 0) {
                throw new IllegalArgumentException("initialInterval must be between minInterval and maxInterval, got: "
                        + initial);
            }
            if (!(backoffMultiplier > 1.0) || Double.isInfinite(backoffMultiplier)) {
                throw new IllegalArgumentException("backoffMultiplier must be greater than 1.0, got: " + backoffMultiplier);
            }
            ParameterValidator.validateNonNegativeDuration(jitterRange, "jitterRange");
            if (errorBackoffBase != null) {
                ParameterValidator.validatePositiveDuration(errorBackoffBase, "errorBackoffBase");
            }
            ParameterValidator.validatePositiveInteger(maxConsecutiveErrors, "maxConsecutiveErrors");
            ParameterValidator.validatePositiveInteger(degradationThreshold, "degradationThreshold");
            return new PollingConfig(this);
        }
    }
}
