package com.phillippitts.apiguard.service.ratelimit;

import com.phillippitts.apiguard.exception.RateLimitExceededException;
import com.phillippitts.apiguard.exception.RateLimitExceededException.LimitType;
import com.phillippitts.apiguard.service.alert.Alert;
import com.phillippitts.apiguard.service.alert.AlertLevel;
import com.phillippitts.apiguard.service.alert.AlertSink;
import com.phillippitts.apiguard.service.metrics.GovernanceMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window request limiter for one provider, with an optional UTC-daily cap.
 *
 * <p>The minute window holds admission timestamps in arrival order; entries 60 seconds old or older
 * are pruned before every decision. The daily counter rolls over when the UTC date of "now" moves
 * past the stored reset date, so an idle process still resets correctly.
 *
 * <p>{@link #acquire()} and {@link #acquireAsync()} share one admission step. While the minute window
 * is full they pause in increments of at most {@link #MAX_PAUSE} and re-check, giving up once the
 * projected wait would exceed {@code maxWaitDuration}. A reached daily cap fails immediately since
 * waiting cannot help within the same day.
 *
 * <p><b>Thread Safety:</b> all state is guarded by one {@link ReentrantLock}; nothing blocks while
 * holding it.
 */
public class RateLimiter {

    private static final Logger LOG = LogManager.getLogger(RateLimiter.class);

    static final Duration WINDOW = Duration.ofSeconds(60);
    static final Duration MAX_PAUSE = Duration.ofSeconds(1);

    private final String provider;
    private final RateLimiterConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ScheduledExecutorService scheduler;
    private final AlertSink alertSink;
    private final GovernanceMetricsPublisher metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> minuteWindow = new ArrayDeque<>();
    private int dailyCount;
    private LocalDate dailyResetDate;
    private LocalDate exhaustedAlertDate;

    private long totalRequests;
    private long waitsCount;
    private Duration totalWaitTime = Duration.ZERO;
    private Instant lastRequestAt;
    private Instant dailyResetAt;

    public RateLimiter(String provider, RateLimiterConfig config) {
        this(provider, config, Clock.systemUTC(), Sleeper.SYSTEM, DefaultScheduler.INSTANCE,
                AlertSink.NOOP, GovernanceMetricsPublisher.NOOP);
    }

    public RateLimiter(String provider,
                       RateLimiterConfig config,
                       Clock clock,
                       Sleeper sleeper,
                       ScheduledExecutorService scheduler,
                       AlertSink alertSink,
                       GovernanceMetricsPublisher metrics) {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        this.provider = provider;
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public String getProvider() {
        return provider;
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    /**
     * Non-blocking predicate: true when both the minute window and the daily cap have room.
     * Records nothing.
     */
    public boolean check() {
        lock.lock();
        try {
            Instant now = clock.instant();
            rollDailyIfNeeded(now);
            pruneWindow(now);
            return !dailyCapReached() && minuteWindow.size() < config.requestsPerMinute();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the request is admitted or waiting is pointless.
     *
     * @return true if admitted, false if the daily cap is reached, the wait would exceed
     *         {@code maxWaitDuration}, or the thread was interrupted
     * @throws RateLimitExceededException when {@code allowWait} is false and a cap is reached
     */
    public boolean acquire() {
        Instant start = clock.instant();
        while (true) {
            Step step = step(start);
            if (step.finished()) {
                return step.admitted();
            }
            try {
                sleeper.sleep(step.pause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for rate limit: provider={}", provider);
                return false;
            }
        }
    }

    /**
     * Asynchronous {@link #acquire()}: re-checks are scheduled instead of blocking a thread.
     * A {@link RateLimitExceededException} completes the future exceptionally.
     */
    public CompletableFuture<Boolean> acquireAsync() {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        attemptAsync(clock.instant(), result);
        return result;
    }

    /**
     * Requests left today, or empty when no daily limit is configured.
     */
    public OptionalInt getRemainingDaily() {
        if (!config.hasDailyLimit()) {
            return OptionalInt.empty();
        }
        lock.lock();
        try {
            rollDailyIfNeeded(clock.instant());
            return OptionalInt.of(remainingDailyLocked());
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStats getStats() {
        lock.lock();
        try {
            return statsLocked(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public RateLimiterSnapshot snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            rollDailyIfNeeded(now);
            RateLimitStats stats = statsLocked(now);
            Integer remaining = config.hasDailyLimit() ? remainingDailyLocked() : null;
            return new RateLimiterSnapshot(provider, config, stats, remaining);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> toMap() {
        return snapshot().toMap();
    }

    /**
     * Clears the minute window, the daily count and all stats.
     */
    public void reset() {
        lock.lock();
        try {
            minuteWindow.clear();
            dailyCount = 0;
            dailyResetDate = null;
            exhaustedAlertDate = null;
            totalRequests = 0;
            waitsCount = 0;
            totalWaitTime = Duration.ZERO;
            lastRequestAt = null;
            dailyResetAt = null;
        } finally {
            lock.unlock();
        }
        LOG.info("Rate limiter '{}' reset", provider);
    }

    // ---- admission ----

    private void attemptAsync(Instant start, CompletableFuture<Boolean> result) {
        if (result.isDone()) {
            return;
        }
        Step step;
        try {
            step = step(start);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        if (step.finished()) {
            result.complete(step.admitted());
            return;
        }
        try {
            scheduler.schedule(() -> attemptAsync(start, result),
                    step.pause().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.warn("Rate limit scheduler rejected re-check for provider={}", provider);
            result.completeExceptionally(e);
        }
    }

    /**
     * One admission attempt shared by the blocking and asynchronous paths.
     */
    private Step step(Instant start) {
        Decision decision;
        int windowCount;
        int dailyUsed;
        Duration wait = Duration.ZERO;
        Duration elapsed;
        boolean alertExhausted = false;

        lock.lock();
        try {
            Instant now = clock.instant();
            rollDailyIfNeeded(now);
            pruneWindow(now);
            windowCount = minuteWindow.size();
            dailyUsed = dailyCount;
            elapsed = now.isBefore(start) ? Duration.ZERO : Duration.between(start, now);

            if (dailyCapReached()) {
                decision = Decision.DAILY_CAP;
                LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
                if (!today.equals(exhaustedAlertDate)) {
                    exhaustedAlertDate = today;
                    alertExhausted = true;
                }
            } else if (windowCount < config.requestsPerMinute()) {
                decision = Decision.ADMIT;
                admit(now);
            } else {
                decision = Decision.WINDOW_FULL;
                wait = Duration.between(now, minuteWindow.peekFirst().plus(WINDOW));
                if (wait.isNegative()) {
                    wait = Duration.ZERO;
                }
            }
        } finally {
            lock.unlock();
        }

        switch (decision) {
            case ADMIT:
                return Step.done(true);
            case DAILY_CAP:
                if (alertExhausted) {
                    raiseExhaustedAlert();
                }
                metrics.denied(provider, "daily");
                if (!config.allowWait()) {
                    throw new RateLimitExceededException(provider, LimitType.DAILY, dailyUsed,
                            config.dailyLimit());
                }
                LOG.warn("Daily limit reached for '{}' ({}/{})", provider, dailyUsed, config.dailyLimit());
                return Step.done(false);
            default:
                break;
        }

        if (!config.allowWait()) {
            metrics.denied(provider, "per_minute");
            throw new RateLimitExceededException(provider, LimitType.PER_MINUTE, windowCount,
                    config.requestsPerMinute());
        }
        if (elapsed.plus(wait).compareTo(config.maxWaitDuration()) > 0) {
            metrics.denied(provider, "per_minute");
            LOG.warn("Rate limit wait for '{}' would exceed {}s; giving up",
                    provider, config.maxWaitDuration().toSeconds());
            return Step.done(false);
        }

        Duration pause = wait.compareTo(MAX_PAUSE) < 0 ? wait : MAX_PAUSE;
        lock.lock();
        try {
            waitsCount++;
            totalWaitTime = totalWaitTime.plus(pause);
        } finally {
            lock.unlock();
        }
        metrics.waited(provider, pause);
        LOG.debug("Rate limited '{}': pausing {}ms ({}ms until a slot frees)",
                provider, pause.toMillis(), wait.toMillis());
        return Step.waitFor(pause);
    }

    // ---- lock-held helpers ----

    private void admit(Instant now) {
        minuteWindow.addLast(now);
        dailyCount++;
        totalRequests++;
        lastRequestAt = now;
    }

    private void pruneWindow(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!minuteWindow.isEmpty() && !minuteWindow.peekFirst().isAfter(cutoff)) {
            minuteWindow.pollFirst();
        }
    }

    private void rollDailyIfNeeded(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (dailyResetDate == null || dailyResetDate.isBefore(today)) {
            if (dailyResetDate != null && dailyCount > 0) {
                LOG.info("Daily counter for '{}' rolled over at {} ({} requests on {})",
                        provider, today, dailyCount, dailyResetDate);
            }
            dailyCount = 0;
            dailyResetDate = today;
            dailyResetAt = now;
        }
    }

    private boolean dailyCapReached() {
        return config.hasDailyLimit() && dailyCount >= config.dailyLimit();
    }

    private int remainingDailyLocked() {
        return Math.max(0, config.dailyLimit() - dailyCount);
    }

    private RateLimitStats statsLocked(Instant now) {
        pruneWindow(now);
        return new RateLimitStats(totalRequests, dailyCount, minuteWindow.size(), waitsCount,
                totalWaitTime, lastRequestAt, dailyResetAt);
    }

    private void raiseExhaustedAlert() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", provider);
        metadata.put("limit_type", "daily");
        metadata.put("limit", config.dailyLimit());
        alertSink.deliver(new Alert(AlertLevel.ERROR, Alert.SOURCE_RATE_LIMITER,
                "Rate limit exhausted: '" + provider + "' daily limit reached", metadata, clock.instant()));
    }

    private enum Decision { ADMIT, DAILY_CAP, WINDOW_FULL }

    private record Step(boolean finished, boolean admitted, Duration pause) {

        static Step done(boolean admitted) {
            return new Step(true, admitted, Duration.ZERO);
        }

        static Step waitFor(Duration pause) {
            return new Step(false, false, pause);
        }
    }

    /** Daemon scheduler for limiters built without one. */
    private static final class DefaultScheduler {
        static final ScheduledExecutorService INSTANCE = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ratelimit-scheduler");
            t.setDaemon(true);
            return t;
        });
    }
}
