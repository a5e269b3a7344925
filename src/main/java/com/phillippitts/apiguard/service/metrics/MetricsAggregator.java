package com.phillippitts.apiguard.service.metrics;

import com.phillippitts.apiguard.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.apiguard.service.breaker.CircuitBreakerSnapshot;
import com.phillippitts.apiguard.service.breaker.CircuitState;
import com.phillippitts.apiguard.service.budget.CostBucket;
import com.phillippitts.apiguard.service.budget.CostPeriod;
import com.phillippitts.apiguard.service.budget.CostTracker;
import com.phillippitts.apiguard.service.budget.CostTrackerRegistry;
import com.phillippitts.apiguard.service.budget.CostTrackerSnapshot;
import com.phillippitts.apiguard.service.budget.UsageBreakdown;
import com.phillippitts.apiguard.service.budget.UsageSummary;
import com.phillippitts.apiguard.service.ratelimit.RateLimiterRegistry;
import com.phillippitts.apiguard.service.ratelimit.RateLimiterSnapshot;
import com.phillippitts.apiguard.util.LogSanitizer;
import com.phillippitts.apiguard.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Folds the three registries into a {@link MetricsSnapshot} and derives {@link SystemHealth}.
 *
 * <p>Health rules:
 * <ul>
 *   <li>any breaker OPEN, any provider with its daily cap used up, any budget exceeded, or a
 *       registry read fault → unhealthy, one issue each</li>
 *   <li>otherwise any breaker HALF_OPEN, any daily cap at 90% or more, or any budget at 90% or
 *       more → degraded, one warning each</li>
 *   <li>otherwise healthy</li>
 * </ul>
 *
 * <p>A fault while reading one registry is logged and turned into a {@code "Health check error: ..."}
 * issue; it never fails the snapshot.
 */
public class MetricsAggregator {

    private static final Logger LOG = LogManager.getLogger(MetricsAggregator.class);

    static final double RATE_LIMIT_WARNING_PERCENT = 90.0;

    private final CircuitBreakerRegistry breakers;
    private final RateLimiterRegistry limiters;
    private final CostTrackerRegistry trackers;
    private final Clock clock;
    private volatile Instant startedAt;

    public MetricsAggregator(CircuitBreakerRegistry breakers,
                             RateLimiterRegistry limiters,
                             CostTrackerRegistry trackers,
                             Clock clock) {
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.limiters = Objects.requireNonNull(limiters, "limiters");
        this.trackers = Objects.requireNonNull(trackers, "trackers");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    /**
     * Reads every registry once and builds a fresh snapshot.
     */
    public MetricsSnapshot getSnapshot() {
        List<String> errors = new ArrayList<>();

        Optional<Map<String, CircuitBreakerSnapshot>> breakerStats =
                read("circuit breaker", breakers::getAllStats, errors);
        Optional<Map<String, RateLimiterSnapshot>> limiterStats =
                read("rate limiter", limiters::getAllStats, errors);
        Optional<Map<String, CostTrackerSnapshot>> trackerStats =
                read("cost tracker", trackers::getAllStats, errors);

        CircuitBreakerMetrics breakerMetrics = breakerStats.map(MetricsAggregator::foldBreakers)
                .orElse(CircuitBreakerMetrics.EMPTY);
        RateLimitMetrics rateMetrics = limiterStats.map(MetricsAggregator::foldLimiters)
                .orElse(RateLimitMetrics.EMPTY);
        TokenMetrics tokenMetrics = trackerStats.map(MetricsAggregator::foldTokens)
                .orElse(TokenMetrics.EMPTY);
        BudgetMetrics budgetMetrics = trackerStats.map(MetricsAggregator::foldBudgets)
                .orElse(BudgetMetrics.EMPTY);

        SystemHealth health = deriveHealth(breakerMetrics, rateMetrics, budgetMetrics, errors);
        Instant now = clock.instant();
        return new MetricsSnapshot(now, TimeUtils.secondsBetween(startedAt, now), health,
                tokenMetrics, rateMetrics, breakerMetrics, budgetMetrics);
    }

    /**
     * Health alone, derived from a fresh read of every registry.
     */
    public SystemHealth getSystemHealth() {
        return getSnapshot().systemHealth();
    }

    /**
     * Dense cost series summed across every tracker, oldest bucket first.
     *
     * @param count number of buckets, current one included
     */
    public List<CostBucket> getCostHistory(CostPeriod period, int count) {
        Objects.requireNonNull(period, "period");
        Instant now = clock.instant();
        List<CostBucket> series = new ArrayList<>(period.emptySeries(now, count));
        Map<Instant, Integer> positions = new HashMap<>();
        for (int i = 0; i < series.size(); i++) {
            positions.put(series.get(i).start(), i);
        }
        for (String name : trackers.names()) {
            Optional<CostTracker> tracker = trackers.get(name);
            if (tracker.isEmpty()) {
                continue;
            }
            for (CostBucket bucket : tracker.get().getCostHistory(period, count)) {
                Integer index = positions.get(bucket.start());
                if (index != null) {
                    series.set(index, series.get(index).plus(bucket));
                }
            }
        }
        return series;
    }

    /** Restarts the uptime clock. */
    public void resetUptime() {
        startedAt = clock.instant();
    }

    private <T> Optional<T> read(String component, Supplier<T> reader, List<String> errors) {
        try {
            return Optional.of(reader.get());
        } catch (RuntimeException e) {
            LOG.error("Failed to collect {} metrics", component, e);
            errors.add("Health check error: " + LogSanitizer.describe(e));
            return Optional.empty();
        }
    }

    static CircuitBreakerMetrics foldBreakers(Map<String, CircuitBreakerSnapshot> all) {
        int open = 0;
        int halfOpen = 0;
        int closed = 0;
        long calls = 0;
        long failures = 0;
        long rejections = 0;
        for (CircuitBreakerSnapshot snapshot : all.values()) {
            switch (snapshot.state()) {
                case OPEN -> open++;
                case HALF_OPEN -> halfOpen++;
                default -> closed++;
            }
            calls += snapshot.stats().totalCalls();
            failures += snapshot.stats().failedCalls();
            rejections += snapshot.stats().rejectedCalls();
        }
        return new CircuitBreakerMetrics(all.size(), open, halfOpen, closed, calls, failures, rejections, all);
    }

    static RateLimitMetrics foldLimiters(Map<String, RateLimiterSnapshot> all) {
        long requests = 0;
        long waits = 0;
        Duration waitTime = Duration.ZERO;
        for (RateLimiterSnapshot snapshot : all.values()) {
            requests += snapshot.stats().totalRequests();
            waits += snapshot.stats().waitsCount();
            waitTime = waitTime.plus(snapshot.stats().totalWaitTime());
        }
        return new RateLimitMetrics(requests, waits, waitTime, all);
    }

    static TokenMetrics foldTokens(Map<String, CostTrackerSnapshot> all) {
        long input = 0;
        long output = 0;
        double cost = 0.0;
        int calls = 0;
        Map<String, UsageBreakdown> byTracker = new HashMap<>();
        Map<String, UsageBreakdown> byProvider = new HashMap<>();
        Map<String, UsageBreakdown> byLayer = new HashMap<>();
        for (CostTrackerSnapshot snapshot : all.values()) {
            UsageSummary summary = snapshot.summary();
            input += summary.totalInputUnits();
            output += summary.totalOutputUnits();
            cost += summary.totalCostUsd();
            calls += summary.callsCount();
            byTracker.put(snapshot.name(), new UsageBreakdown(summary.totalInputUnits(),
                    summary.totalOutputUnits(), summary.totalCostUsd(), summary.callsCount()));
            summary.byProvider().forEach((provider, b) -> byProvider.merge(provider, b, UsageBreakdown::plus));
            summary.byLayer().forEach((layer, b) -> byLayer.merge(layer, b, UsageBreakdown::plus));
        }
        return new TokenMetrics(input, output, cost, calls, byTracker, byProvider, byLayer);
    }

    static BudgetMetrics foldBudgets(Map<String, CostTrackerSnapshot> all) {
        boolean anyUnlimited = false;
        double totalBudget = 0.0;
        double totalUsed = 0.0;
        double totalRemaining = 0.0;
        int exceeded = 0;
        int warning = 0;
        int critical = 0;
        Map<String, BudgetStatus> byTracker = new HashMap<>();

        for (CostTrackerSnapshot snapshot : all.values()) {
            Double ceiling = snapshot.config().budgetCeiling();
            double used = snapshot.summary().totalCostUsd();
            BudgetLevel level = BudgetLevel.of(ceiling != null, snapshot.budgetExceeded(), snapshot.usedPercent());
            switch (level) {
                case EXCEEDED -> exceeded++;
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                default -> { }
            }
            byTracker.put(snapshot.name(), new BudgetStatus(snapshot.name(), ceiling, used,
                    snapshot.remainingBudget(), snapshot.usedPercent(), snapshot.budgetExceeded(), level));

            totalUsed += used;
            if (ceiling == null) {
                anyUnlimited = true;
            } else {
                totalBudget += ceiling;
                totalRemaining += snapshot.remainingBudget();
            }
        }

        if (anyUnlimited || totalBudget <= 0.0) {
            return new BudgetMetrics(null, totalUsed, null, 0.0, exceeded, warning, critical, byTracker);
        }
        return new BudgetMetrics(totalBudget, totalUsed, totalRemaining, totalUsed / totalBudget * 100.0,
                exceeded, warning, critical, byTracker);
    }

    static SystemHealth deriveHealth(CircuitBreakerMetrics breakerMetrics,
                                     RateLimitMetrics rateMetrics,
                                     BudgetMetrics budgetMetrics,
                                     List<String> errors) {
        List<String> issues = new ArrayList<>(errors);
        List<String> warnings = new ArrayList<>();

        breakerMetrics.byService().forEach((service, snapshot) -> {
            if (snapshot.state() == CircuitState.OPEN) {
                String reason = snapshot.stats().lastFailureReason();
                issues.add("Circuit breaker '" + service + "' is OPEN: " + (reason == null ? "unknown" : reason));
            } else if (snapshot.state() == CircuitState.HALF_OPEN) {
                warnings.add("Circuit breaker '" + service + "' is recovering (HALF_OPEN)");
            }
        });

        rateMetrics.byProvider().forEach((provider, snapshot) -> {
            Integer limit = snapshot.config().dailyLimit();
            Integer remaining = snapshot.remainingDaily();
            if (limit == null || remaining == null) {
                return;
            }
            double usedPercent = (limit - remaining) * 100.0 / limit;
            if (remaining == 0) {
                issues.add("Rate limit for '" + provider + "' EXHAUSTED (0 remaining)");
            } else if (usedPercent >= RATE_LIMIT_WARNING_PERCENT) {
                warnings.add(String.format(Locale.ROOT, "Rate limit for '%s' at %.0f%% (%d remaining)",
                        provider, usedPercent, remaining));
            }
        });

        budgetMetrics.byTracker().forEach((name, status) -> {
            if (status.level() == BudgetLevel.EXCEEDED) {
                issues.add(String.format(Locale.ROOT, "Budget for '%s' EXCEEDED: $%.2f of $%.2f",
                        name, status.usedUsd(), status.budgetUsd()));
            } else if (status.level() == BudgetLevel.CRITICAL) {
                warnings.add(String.format(Locale.ROOT, "Budget for '%s' at %.1f%%", name, status.usedPercent()));
            }
        });

        HealthStatus status = HealthStatus.HEALTHY;
        if (!warnings.isEmpty()) {
            status = status.worst(HealthStatus.DEGRADED);
        }
        if (!issues.isEmpty()) {
            status = status.worst(HealthStatus.UNHEALTHY);
        }
        return new SystemHealth(status, issues, warnings);
    }
}
