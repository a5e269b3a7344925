package com.phillippitts.apiguard.service.budget;

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
 * Scope name → {@link CostTracker}, e.g. {@code global} plus one tracker per job.
 */
public class CostTrackerRegistry {

    private static final Logger LOG = LogManager.getLogger(CostTrackerRegistry.class);

    /** Conventional name of the process-wide tracker. */
    public static final String GLOBAL = "global";

    private final ConcurrentMap<String, CostTracker> trackers = new ConcurrentHashMap<>();
    private final Function<String, CostTrackerConfig> configResolver;
    private final ModelPricing pricing;
    private final Clock clock;
    private final AlertSink alertSink;
    private final GovernanceMetricsPublisher metrics;

    /**
     * Registry whose trackers have no ceiling and report nowhere.
     */
    public CostTrackerRegistry() {
        this(name -> CostTrackerConfig.unlimited(), ModelPricing.defaults(), Clock.systemUTC(),
                AlertSink.NOOP, GovernanceMetricsPublisher.NOOP);
    }

    public CostTrackerRegistry(Function<String, CostTrackerConfig> configResolver,
                               ModelPricing pricing,
                               Clock clock,
                               AlertSink alertSink,
                               GovernanceMetricsPublisher metrics) {
        this.configResolver = Objects.requireNonNull(configResolver, "configResolver");
        this.pricing = Objects.requireNonNull(pricing, "pricing");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public CostTracker getOrCreate(String name) {
        return trackers.computeIfAbsent(name, n -> create(n, configResolver.apply(n)));
    }

    /**
     * Returns the tracker for {@code name}, creating it with {@code config} if absent. An existing
     * tracker keeps its original configuration.
     */
    public CostTracker getOrCreate(String name, CostTrackerConfig config) {
        Objects.requireNonNull(config, "config");
        return trackers.computeIfAbsent(name, n -> create(n, config));
    }

    public Optional<CostTracker> get(String name) {
        return Optional.ofNullable(trackers.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(trackers.keySet()));
    }

    public Map<String, CostTrackerSnapshot> getAllStats() {
        Map<String, CostTrackerSnapshot> all = new TreeMap<>();
        trackers.forEach((name, tracker) -> all.put(name, tracker.snapshot()));
        return all;
    }

    public void resetAll() {
        trackers.values().forEach(CostTracker::reset);
        LOG.info("Reset {} cost trackers", trackers.size());
    }

    private CostTracker create(String name, CostTrackerConfig config) {
        LOG.info("Created cost tracker '{}' (budget={}, enforce={})",
                name, config.budgetCeiling(), config.enforceBudget());
        return new CostTracker(name, config, pricing, clock, alertSink, metrics);
    }
}
