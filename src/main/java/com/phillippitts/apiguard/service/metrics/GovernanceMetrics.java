package com.phillippitts.apiguard.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer instrumentation for the governance core.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Circuit breaker call outcomes, rejections and state transitions per service</li>
 *   <li>Rate limiter waits and denials per provider</li>
 *   <li>Tracked spend per cost scope and provider</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class GovernanceMetrics {

    private static final String METRIC_PREFIX = "apiguard";

    private final MeterRegistry registry;

    public GovernanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the call outcome counter for a breaker.
     *
     * @param service breaker name
     * @param outcome success, failure or excluded
     */
    public void incrementCallOutcome(String service, String outcome) {
        Counter.builder(METRIC_PREFIX + ".breaker.calls")
                .description("Calls recorded by circuit breakers")
                .tag("service", service)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Increments the rejection counter for a breaker.
     *
     * @param service breaker name
     */
    public void incrementRejection(String service) {
        Counter.builder(METRIC_PREFIX + ".breaker.rejections")
                .description("Calls rejected by an open circuit")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    /**
     * Records a breaker state change.
     *
     * @param service breaker name
     * @param to new state name
     */
    public void incrementTransition(String service, String to) {
        Counter.builder(METRIC_PREFIX + ".breaker.transitions")
                .description("Circuit breaker state transitions")
                .tag("service", service)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    /**
     * Records one bounded wait slice spent by a rate limiter.
     *
     * @param provider provider name
     * @param waited time slept
     */
    public void recordWait(String provider, Duration waited) {
        Timer.builder(METRIC_PREFIX + ".ratelimit.wait")
                .description("Time spent waiting for rate limit admission")
                .tag("provider", provider)
                .register(registry)
                .record(waited);
    }

    /**
     * Increments the denial counter for a rate limiter.
     *
     * @param provider provider name
     * @param limitType per_minute or daily
     */
    public void incrementDenied(String provider, String limitType) {
        Counter.builder(METRIC_PREFIX + ".ratelimit.denied")
                .description("Requests refused by a rate limiter")
                .tag("provider", provider)
                .tag("limit", limitType)
                .register(registry)
                .increment();
    }

    /**
     * Adds tracked spend in USD.
     *
     * @param scope cost tracker name
     * @param provider provider the spend was incurred with
     * @param costUsd estimated cost
     */
    public void addCost(String scope, String provider, double costUsd) {
        Counter.builder(METRIC_PREFIX + ".budget.cost")
                .description("Estimated spend in USD")
                .baseUnit("usd")
                .tag("scope", scope)
                .tag("provider", provider)
                .register(registry)
                .increment(costUsd);
    }
}
