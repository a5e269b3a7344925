package com.phillippitts.apiguard.service.breaker;

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
import java.util.function.Function;

/**
 * Name → {@link CircuitBreaker} map shared by every caller of a service.
 *
 * <p>Breakers are created on first use. Creation is atomic per name: concurrent first callers for
 * the same name all receive the same instance.
 */
public class CircuitBreakerRegistry {

    private static final Logger LOG = LogManager.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Function<String, CircuitBreakerConfig> configResolver;
    private final Clock clock;
    private final FailureClassifier classifier;
    private final AlertSink alertSink;
    private final GovernanceMetricsPublisher metrics;

    /**
     * Registry that gives every breaker the default configuration and reports nowhere.
     */
    public CircuitBreakerRegistry() {
        this(name -> CircuitBreakerConfig.defaults(), Clock.systemUTC(), FailureClassifier.DEFAULT,
                AlertSink.NOOP, GovernanceMetricsPublisher.NOOP);
    }

    /**
     * @param configResolver configuration for a breaker created without an explicit one
     * @param clock          time source handed to every breaker
     * @param classifier     maps throwables to failure kinds
     * @param alertSink      receives state change alerts
     * @param metrics        receives call outcomes and transitions
     */
    public CircuitBreakerRegistry(Function<String, CircuitBreakerConfig> configResolver,
                                  Clock clock,
                                  FailureClassifier classifier,
                                  AlertSink alertSink,
                                  GovernanceMetricsPublisher metrics) {
        this.configResolver = Objects.requireNonNull(configResolver, "configResolver");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Returns the breaker for {@code name}, creating it with the resolved configuration if absent.
     */
    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, n -> create(n, configResolver.apply(n)));
    }

    /**
     * Returns the breaker for {@code name}, creating it with {@code config} if absent. An existing
     * breaker keeps its original configuration.
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(config, "config");
        return breakers.computeIfAbsent(name, n -> create(n, config));
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(breakers.keySet()));
    }

    /**
     * Snapshot of every breaker, ordered by name.
     */
    public Map<String, CircuitBreakerSnapshot> getAllStats() {
        Map<String, CircuitBreakerSnapshot> all = new TreeMap<>();
        breakers.forEach((name, breaker) -> all.put(name, breaker.snapshot()));
        return all;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        LOG.info("Reset {} circuit breakers", breakers.size());
    }

    private CircuitBreaker create(String name, CircuitBreakerConfig config) {
        LOG.info("Created circuit breaker '{}' (threshold={}, recovery={}s, excluded={})",
                name, config.failureThreshold(), config.recoveryTimeout().toSeconds(),
                config.excludedFailureKinds());
        return new CircuitBreaker(name, config, clock, classifier, alertSink, metrics);
    }
}
