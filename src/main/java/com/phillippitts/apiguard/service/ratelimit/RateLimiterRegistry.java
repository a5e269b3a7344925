package com.phillippitts.apiguard.service.ratelimit;

import com.phillippitts.apiguard.service.alert.AlertSink;
import com.phillippitts.apiguard.service.metrics.GovernanceMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;

/**
 * Provider name → {@link RateLimiter}. One limiter per provider, created atomically on first use.
 */
public class RateLimiterRegistry {

    private static final Logger LOG = LogManager.getLogger(RateLimiterRegistry.class);

    private final ConcurrentMap<String, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final Function<String, RateLimiterConfig> configResolver;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ScheduledExecutorService scheduler;
    private final AlertSink alertSink;
    private final GovernanceMetricsPublisher metrics;

    /**
     * Registry that owns its scheduler and uses the provider defaults from {@link ProviderRateLimits}.
     */
    public RateLimiterRegistry(ScheduledExecutorService scheduler) {
        this(ProviderRateLimits::forProvider, Clock.systemUTC(), Sleeper.SYSTEM, scheduler,
                AlertSink.NOOP, GovernanceMetricsPublisher.NOOP);
    }

    public RateLimiterRegistry(Function<String, RateLimiterConfig> configResolver,
                               Clock clock,
                               Sleeper sleeper,
                               ScheduledExecutorService scheduler,
                               AlertSink alertSink,
                               GovernanceMetricsPublisher metrics) {
        this.configResolver = Objects.requireNonNull(configResolver, "configResolver");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public RateLimiter getOrCreate(String provider) {
        return limiters.computeIfAbsent(provider, p -> create(p, configResolver.apply(p)));
    }

    /**
     * Returns the limiter for {@code provider}, creating it with {@code config} if absent. An existing
     * limiter keeps its original configuration.
     */
    public RateLimiter getOrCreate(String provider, RateLimiterConfig config) {
        Objects.requireNonNull(config, "config");
        return limiters.computeIfAbsent(provider, p -> create(p, config));
    }

    public Optional<RateLimiter> get(String provider) {
        return Optional.ofNullable(limiters.get(provider));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(limiters.keySet()));
    }

    /**
     * Snapshot of every limiter, ordered by provider.
     */
    public Map<String, RateLimiterSnapshot> getAllStats() {
        Map<String, RateLimiterSnapshot> all = new TreeMap<>();
        limiters.forEach((provider, limiter) -> all.put(provider, limiter.snapshot()));
        return all;
    }

    public void resetAll() {
        limiters.values().forEach(RateLimiter::reset);
        LOG.info("Reset {} rate limiters", limiters.size());
    }

    private RateLimiter create(String provider, RateLimiterConfig config) {
        LOG.info("Created rate limiter '{}' ({} rpm, daily={})",
                provider, config.requestsPerMinute(), config.dailyLimit());
        return new RateLimiter(provider, config, clock, sleeper, scheduler, alertSink, metrics);
    }
}
