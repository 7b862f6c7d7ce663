// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync;

import com.kidyland.sync.backoff.BackoffController;
import com.kidyland.sync.backoff.FailureVerdict;
import com.kidyland.sync.cache.DegradationCache;
import com.kidyland.sync.exception.PollingException;
import com.kidyland.sync.fetch.ConditionalFetcher;
import com.kidyland.sync.fetch.FetchOutcome;
import com.kidyland.sync.logging.PollingLogger;
import com.kidyland.sync.schedule.ExecutorTaskScheduler;
import com.kidyland.sync.schedule.JitteredScheduler;
import com.kidyland.sync.schedule.ScheduledTask;
import com.kidyland.sync.schedule.TaskScheduler;
import com.kidyland.sync.validation.ParameterValidator;
import com.kidyland.sync.visibility.VisibilityGate;
import com.kidyland.sync.visibility.VisibilitySource;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;
import org.slf4j.LoggerFactory;

/**
 * Keeps a consumer's view of one server resource fresh by polling it at an adaptive interval.
 *
 * <p>Each {@link #start} begins a run that polls immediately, then reschedules itself after every outcome:
 *
 * <ul>
 *   <li>changed data snaps the interval to the minimum and is delivered to {@code onData};
 *   <li>two or more unchanged responses in a row grow the interval toward the maximum;
 *   <li>failures back off exponentially from the error base, are delivered to {@code onError}, replay the last good
 *       payload once when the degradation threshold is crossed, and stop the run after too many errors.
 * </ul>
 *
 * <p>At most one fetch is outstanding per engine. The next poll is scheduled only after the outcome has been handled,
 * so payloads reach {@code onData} in request-completion order. Polling is suspended while the host reports itself
 * hidden and resumes with an immediate poll when it becomes visible again.
 *
 * <p>All state is guarded by the engine's monitor. Callbacks run while it is held and may call any method of the
 * engine, including {@link #stop()}. Results of fetches issued by an earlier run are discarded.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * PollingEngine<List<TimerSnapshot>> engine = PollingEngine.builder("timers", fetcher)
 *     .withConfig(PollingConfig.activeTimerDefaults())
 *     .build();
 * engine.start(branchId, timers -> board.update(timers), error -> banner.show(error.getMessage()));
 * }</pre>
 *
 * @param <T> payload type
 */
public class PollingEngine<T> {

    private final String name;
    private final PollingConfig config;
    private final ConditionalFetcher<T> fetcher;
    private final JitteredScheduler scheduler;
    private final VisibilitySource visibilitySource;
    private final BackoffController backoff;
    private final DegradationCache<T> cache = new DegradationCache<>();
    private final PollingLogger log;

    // ===== Run state =====
    private boolean running;
    private boolean paused;
    private String targetId;
    private String lastValidator;
    private Consumer<? super T> onData;
    private Consumer<? super PollingException> onError;
    private VisibilityGate visibilityGate;

    // ===== Scheduling =====
    private long generation;
    private long timerSequence;
    private ScheduledTask pendingTask;
    private boolean inFlight;
    private boolean pollRequested;

    private PollingEngine(Builder<T> builder) {
        this.name = builder.name;
        this.config = builder.config != null ? builder.config : PollingConfig.activeTimerDefaults();
        this.fetcher = builder.fetcher;
        var taskScheduler = builder.taskScheduler != null ? builder.taskScheduler : ExecutorTaskScheduler.shared();
        var jitterSource = builder.jitterSource != null
                ? builder.jitterSource
                : (DoubleSupplier) () -> ThreadLocalRandom.current().nextDouble();
        this.scheduler = new JitteredScheduler(taskScheduler, config.getJitterRange(), jitterSource);
        this.visibilitySource =
                builder.visibilitySource != null ? builder.visibilitySource : VisibilitySource.alwaysVisible();
        this.backoff = new BackoffController(config, builder.clock != null ? builder.clock : Clock.systemUTC());
        this.log = new PollingLogger(LoggerFactory.getLogger(PollingEngine.class), name);
    }

    /**
     * Creates a builder for an engine.
     *
     * @param name name used in log entries
     * @param fetcher fetcher for the polled resource
     * @return Builder instance
     */
    public static <T> Builder<T> builder(String name, ConditionalFetcher<T> fetcher) {
        return new Builder<>(name, fetcher);
    }

    /** Starts polling without an error callback. See {@link #start(String, Consumer, Consumer)}. */
    public void start(String targetId, Consumer<? super T> onData) {
        start(targetId, onData, null);
    }

    /**
     * Starts a new run. A run that is already active is stopped first. All counters, the validator and the cached
     * payload are reset, the visibility listener is installed and the first poll is issued immediately.
     *
     * @param targetId target passed to the fetcher on every poll, may be null
     * @param onData receives every changed payload and the degradation replay
     * @param onError receives every failure, may be null
     */
    public synchronized void start(
            String targetId, Consumer<? super T> onData, Consumer<? super PollingException> onError) {
        Objects.requireNonNull(onData, "onData cannot be null");
        if (running) {
            log.warn("Already polling {}, stopping previous run", this.targetId);
            stop();
        }

        generation++;
        this.targetId = targetId;
        this.onData = onData;
        this.onError = onError;
        lastValidator = null;
        backoff.reset();
        cache.reset();
        running = true;
        paused = false;
        inFlight = false;
        pollRequested = false;
        log.setTarget(targetId);
        log.info("Starting adaptive polling with initial interval {}ms", backoff.getCurrentInterval().toMillis());

        visibilityGate = new VisibilityGate(visibilitySource).onHidden(this::pause).onVisible(this::resume);
        poll();
    }

    /**
     * Ends the current run. Cancels the pending poll, detaches the visibility listener and drops the callbacks; a
     * fetch still in flight completes without effect. Idempotent and safe to call from inside a callback.
     */
    public synchronized void stop() {
        generation++;
        if (visibilityGate != null) {
            visibilityGate.detach();
            visibilityGate = null;
        }
        cancelPendingPoll();
        boolean wasRunning = running;
        running = false;
        paused = false;
        inFlight = false;
        pollRequested = false;
        onData = null;
        onError = null;
        if (wasRunning) {
            log.info("Stopped polling");
        }
    }

    /**
     * Suspends polling. The pending poll is cancelled; a fetch already in flight still updates the engine state but
     * schedules nothing. No effect when not running.
     */
    public synchronized void pause() {
        if (!running) {
            return;
        }
        cancelPendingPoll();
        if (!paused) {
            paused = true;
            log.info("Paused polling");
        }
    }

    /** Resumes a paused run with an immediate poll. No effect when not running or not paused. */
    public synchronized void resume() {
        if (!running || !paused) {
            return;
        }
        paused = false;
        log.info("Resumed polling");
        poll();
    }

    /**
     * Polls immediately and returns the interval to its minimum. Intended for use after a local mutation that is
     * known to change the server's data. No effect when not running; a paused run stays paused.
     */
    public synchronized void forcePoll() {
        if (!running) {
            return;
        }
        cancelPendingPoll();
        backoff.forceResponsive();
        log.debug("Forced poll");
        poll();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    /** @return a snapshot of the engine's state */
    public synchronized PollingState getState() {
        return new PollingState(
                running,
                paused,
                targetId,
                backoff.getCurrentInterval(),
                lastValidator,
                backoff.getConsecutiveUnchanged(),
                backoff.getErrorCount(),
                backoff.getConsecutiveFailures(),
                backoff.getDegradedSince().orElse(null),
                pendingTask != null,
                inFlight);
    }

    /** @return the last successfully decoded payload of the current run */
    public Optional<T> getCachedPayload() {
        return cache.get();
    }

    public String getName() {
        return name;
    }

    public PollingConfig getConfig() {
        return config;
    }

    private void poll() {
        if (!running || paused) {
            return;
        }
        if (inFlight) {
            pollRequested = true;
            return;
        }
        inFlight = true;
        long pollGeneration = generation;

        CompletableFuture<FetchOutcome<T>> result;
        try {
            result = fetcher.fetch(targetId, lastValidator);
        } catch (RuntimeException e) {
            result = CompletableFuture.completedFuture(FetchOutcome.failed(asPollingException(e)));
        }
        if (result == null) {
            result = CompletableFuture.completedFuture(
                    FetchOutcome.failed(new PollingException("Fetcher returned no result")));
        }
        result.whenComplete((outcome, error) -> onFetchComplete(pollGeneration, outcome, error));
    }

    private synchronized void onFetchComplete(long pollGeneration, FetchOutcome<T> outcome, Throwable error) {
        if (pollGeneration != generation) {
            log.debug("Discarding result of a poll from a previous run");
            return;
        }
        if (error != null) {
            outcome = FetchOutcome.failed(asPollingException(error));
        } else if (outcome == null) {
            outcome = FetchOutcome.failed(new PollingException("Fetcher completed without an outcome"));
        }

        switch (outcome.getType()) {
            case UNCHANGED -> handleUnchanged();
            case CHANGED -> handleChanged(outcome);
            case FAILED -> handleFailure(outcome.getError(), pollGeneration);
        }

        // a callback stopped or restarted the engine
        if (pollGeneration != generation) {
            return;
        }
        inFlight = false;
        if (!running || paused) {
            pollRequested = false;
            return;
        }
        if (pollRequested) {
            pollRequested = false;
            poll();
        } else {
            scheduleNextPoll();
        }
    }

    private void handleUnchanged() {
        backoff.onUnchanged().ifPresent(this::logRecovery);
        log.debug(
                "Data unchanged (consecutiveUnchanged={}), next poll in {}ms",
                backoff.getConsecutiveUnchanged(),
                backoff.getCurrentInterval().toMillis());
    }

    private void handleChanged(FetchOutcome<T> outcome) {
        outcome.getValidator().ifPresent(validator -> lastValidator = validator);
        var recovery = backoff.onChanged();
        cache.record(outcome.getPayload());
        recovery.ifPresent(this::logRecovery);
        log.debug("Data changed, next poll in {}ms", backoff.getCurrentInterval().toMillis());
        deliverData(outcome.getPayload());
    }

    private void handleFailure(PollingException error, long pollGeneration) {
        FailureVerdict verdict = backoff.onFailure();
        if (verdict.degraded()) {
            log.warn(
                    "Persistent failure, degraded for {}s (consecutiveFailures={}, errorCount={}): {}",
                    verdict.degradedFor().toSeconds(),
                    verdict.consecutiveFailures(),
                    verdict.errorCount(),
                    error.getMessage());
            if (verdict.degradationEntered()) {
                cache.get().ifPresent(payload -> {
                    log.info("Using fallback data from the last successful response");
                    deliverData(payload);
                });
            }
        } else if (verdict.isTransient()) {
            log.debug("Transient failure (errorCount={}): {}", verdict.errorCount(), error.getMessage());
        } else {
            log.debug(
                    "Failure (consecutiveFailures={}, errorCount={}): {}",
                    verdict.consecutiveFailures(),
                    verdict.errorCount(),
                    error.getMessage());
        }

        if (pollGeneration != generation) {
            return;
        }
        deliverError(error);

        if (pollGeneration == generation && verdict.exhausted()) {
            log.error("Too many errors ({}), stopping polling", verdict.errorCount());
            stop();
        }
    }

    private void scheduleNextPoll() {
        cancelPendingPoll();
        long sequence = timerSequence;
        Duration interval = backoff.getCurrentInterval();
        pendingTask = scheduler.schedule(interval, () -> onTimer(sequence));
        log.trace("Next poll scheduled in {}ms", interval.toMillis());
    }

    private synchronized void onTimer(long sequence) {
        if (sequence != timerSequence || pendingTask == null) {
            return;
        }
        pendingTask = null;
        poll();
    }

    private void cancelPendingPoll() {
        scheduler.cancel(pendingTask);
        pendingTask = null;
        timerSequence++;
    }

    private void logRecovery(Duration degradedFor) {
        log.info("System recovered after {}s", degradedFor.toSeconds());
    }

    private void deliverData(T payload) {
        var callback = onData;
        if (callback == null) {
            return;
        }
        try {
            callback.accept(payload);
        } catch (RuntimeException e) {
            log.error("Data callback failed", e);
        }
    }

    private void deliverError(PollingException error) {
        var callback = onError;
        if (callback == null) {
            return;
        }
        try {
            callback.accept(error);
        } catch (RuntimeException e) {
            log.error("Error callback failed", e);
        }
    }

    private static PollingException asPollingException(Throwable error) {
        var cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof PollingException pollingException) {
            return pollingException;
        }
        return new PollingException("Poll failed: " + cause.getMessage(), cause);
    }

    /** Builder for PollingEngine. */
    public static final class Builder<T> {
        private final String name;
        private final ConditionalFetcher<T> fetcher;
        private PollingConfig config;
        private TaskScheduler taskScheduler;
        private VisibilitySource visibilitySource;
        private Clock clock;
        private DoubleSupplier jitterSource;

        private Builder(String name, ConditionalFetcher<T> fetcher) {
            ParameterValidator.validateNotBlank(name, "name");
            this.name = name;
            this.fetcher = Objects.requireNonNull(fetcher, "ConditionalFetcher cannot be null");
        }

        /**
         * Sets the timing configuration. If not set, {@link PollingConfig#activeTimerDefaults()} is used.
         *
         * @param config timing configuration
         * @return This builder
         */
        public Builder<T> withConfig(PollingConfig config) {
            this.config = Objects.requireNonNull(config, "PollingConfig cannot be null");
            return this;
        }

        /**
         * Sets the scheduler that fires delayed polls. If not set, a scheduler with its own daemon thread is created.
         *
         * @param taskScheduler scheduler for delayed polls
         * @return This builder
         */
        public Builder<T> withTaskScheduler(TaskScheduler taskScheduler) {
            this.taskScheduler = Objects.requireNonNull(taskScheduler, "TaskScheduler cannot be null");
            return this;
        }

        /**
         * Sets the host visibility signal. If not set, the host is treated as always visible.
         *
         * @param visibilitySource host visibility signal
         * @return This builder
         */
        public Builder<T> withVisibilitySource(VisibilitySource visibilitySource) {
            this.visibilitySource = Objects.requireNonNull(visibilitySource, "VisibilitySource cannot be null");
            return this;
        }

        public Builder<T> withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        /**
         * Sets the source of uniform values in {@code [0, 1)} used for jitter. Tests pass a constant 0.5 to remove the
         * jitter.
         *
         * @param jitterSource uniform random source
         * @return This builder
         */
        public Builder<T> withJitterSource(DoubleSupplier jitterSource) {
            this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource cannot be null");
            return this;
        }

        public PollingEngine<T> build() {
            return new PollingEngine<>(this);
        }
    }
}
