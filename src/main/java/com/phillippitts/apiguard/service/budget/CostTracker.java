package com.phillippitts.apiguard.service.budget;

import com.phillippitts.apiguard.exception.BudgetExceededException;
import com.phillippitts.apiguard.service.alert.Alert;
import com.phillippitts.apiguard.service.alert.AlertLevel;
import com.phillippitts.apiguard.service.alert.AlertSink;
import com.phillippitts.apiguard.service.metrics.GovernanceMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Append-only ledger of metered calls for one budget scope, with optional budget enforcement.
 *
 * <p>{@link #trackUsage} appends the record before checking the budget, so spend that crosses the
 * ceiling is never lost even though the call then throws {@link BudgetExceededException}.
 *
 * <p>Costs are summed unrounded; rounding happens only in exported maps.
 *
 * <p><b>Thread Safety:</b> records and alert flags are guarded by one {@link ReentrantLock}.
 * Alerts are delivered after it is released.
 */
public class CostTracker {

    private static final Logger LOG = LogManager.getLogger(CostTracker.class);

    private final String name;
    private final CostTrackerConfig config;
    private final ModelPricing pricing;
    private final Clock clock;
    private final AlertSink alertSink;
    private final GovernanceMetricsPublisher metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<UsageRecord> records = new ArrayList<>();
    private double totalCostUsd;
    private boolean warningRaised;

    public CostTracker(String name, CostTrackerConfig config) {
        this(name, config, ModelPricing.defaults(), Clock.systemUTC(), AlertSink.NOOP,
                GovernanceMetricsPublisher.NOOP);
    }

    public CostTracker(String name,
                       CostTrackerConfig config,
                       ModelPricing pricing,
                       Clock clock,
                       AlertSink alertSink,
                       GovernanceMetricsPublisher metrics) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        this.config = Objects.requireNonNull(config, "config");
        this.pricing = Objects.requireNonNull(pricing, "pricing");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public String getName() {
        return name;
    }

    public CostTrackerConfig getConfig() {
        return config;
    }

    /**
     * Cost of a call at the configured prices. Pure.
     */
    public double estimateCost(String model, long inputUnits, long outputUnits) {
        return pricing.estimateCost(model, inputUnits, outputUnits);
    }

    public UsageRecord trackUsage(String provider, String model, long inputUnits, long outputUnits) {
        return trackUsage(provider, model, inputUnits, outputUnits, null, null, null);
    }

    /**
     * Prices and appends one call, then checks the budget.
     *
     * @param scopeTag defaults to the tracker's {@code scopeId} when null
     * @return the stored record
     * @throws BudgetExceededException when the budget is enforced and the new total is strictly above
     *                                 the ceiling; the record is stored regardless
     */
    public UsageRecord trackUsage(String provider,
                                  String model,
                                  long inputUnits,
                                  long outputUnits,
                                  String layerTag,
                                  String runTag,
                                  String scopeTag) {
        double cost = estimateCost(model, inputUnits, outputUnits);
        UsageRecord record = new UsageRecord(provider, model, inputUnits, outputUnits, cost, layerTag,
                runTag, scopeTag == null ? config.scopeId() : scopeTag, clock.instant());

        boolean exceeded;
        boolean raiseWarning = false;
        double total;
        UsageSummary summary = null;
        lock.lock();
        try {
            records.add(record);
            totalCostUsd += cost;
            total = totalCostUsd;
            exceeded = isOverCeiling(total);
            if (!exceeded && !warningRaised && config.hasBudget()
                    && usedPercent(total) >= config.warningPercent()) {
                warningRaised = true;
                raiseWarning = true;
            }
            if (exceeded) {
                summary = UsageSummary.of(records);
            }
        } finally {
            lock.unlock();
        }

        LOG.debug("Tracked usage: tracker={}, provider={}, model={}, in={}, out={}, cost={}",
                name, provider, model, inputUnits, outputUnits, cost);
        metrics.costTracked(name, provider, cost);

        if (raiseWarning) {
            raiseWarningAlert(total);
        }
        if (exceeded) {
            raiseExceededAlert(total);
            if (config.enforceBudget()) {
                LOG.warn("Budget exceeded for tracker '{}': ${} > ${}", name,
                        String.format(Locale.ROOT, "%.4f", total),
                        String.format(Locale.ROOT, "%.2f", config.budgetCeiling()));
                throw new BudgetExceededException(summary, config.budgetCeiling());
            }
        }
        return record;
    }

    public UsageSummary getSummary() {
        return getSummary(UsageFilter.ALL);
    }

    /**
     * Totals and breakdowns over the records matching {@code filter}.
     */
    public UsageSummary getSummary(UsageFilter filter) {
        Objects.requireNonNull(filter, "filter");
        lock.lock();
        try {
            if (filter.equals(UsageFilter.ALL)) {
                return UsageSummary.of(records);
            }
            return UsageSummary.of(records.stream().filter(filter::matches).collect(Collectors.toList()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@code max(0, ceiling - used)}, or empty without a ceiling.
     */
    public OptionalDouble getRemainingBudget() {
        if (!config.hasBudget()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(0.0, config.budgetCeiling() - currentTotal()));
    }

    public boolean isBudgetExceeded() {
        return isOverCeiling(currentTotal());
    }

    /**
     * Share of the ceiling spent, in percent; 0 without a ceiling.
     */
    public double getBudgetUsedPercent() {
        return usedPercent(currentTotal());
    }

    /** Copy of every stored record, oldest first. */
    public List<UsageRecord> getUsages() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cost per clock hour for the last {@code windowHours} hours, oldest first, current hour last.
     * Hours with no usage are present with zero cost.
     */
    public List<CostBucket> getHourlyCosts(int windowHours) {
        return getCostHistory(CostPeriod.HOURLY, windowHours);
    }

    /**
     * Cost per UTC day for the last {@code windowDays} days, oldest first, today last.
     * Days with no usage are present with zero cost.
     */
    public List<CostBucket> getDailyCosts(int windowDays) {
        return getCostHistory(CostPeriod.DAILY, windowDays);
    }

    /**
     * Dense cost series of {@code count} buckets ending with the current one.
     */
    public List<CostBucket> getCostHistory(CostPeriod period, int count) {
        Objects.requireNonNull(period, "period");
        Instant now = clock.instant();
        List<CostBucket> buckets = new ArrayList<>(period.emptySeries(now, count));
        for (UsageRecord record : getUsages()) {
            int index = period.indexOf(now, count, record.timestamp());
            if (index >= 0) {
                buckets.set(index, buckets.get(index).add(record.estimatedCost()));
            }
        }
        return buckets;
    }

    /**
     * Clears every record. Administrative and test use only.
     */
    public void reset() {
        lock.lock();
        try {
            records.clear();
            totalCostUsd = 0.0;
            warningRaised = false;
        } finally {
            lock.unlock();
        }
        LOG.info("Cost tracker '{}' reset", name);
    }

    public CostTrackerSnapshot snapshot() {
        lock.lock();
        try {
            double total = totalCostUsd;
            Double remaining = config.hasBudget() ? Math.max(0.0, config.budgetCeiling() - total) : null;
            return new CostTrackerSnapshot(name, config, UsageSummary.of(records), remaining,
                    usedPercent(total), isOverCeiling(total));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Export view including every stored record.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(snapshot().toMap());
        map.put("usages", getUsages().stream().map(UsageRecord::toMap).collect(Collectors.toList()));
        return map;
    }

    private double currentTotal() {
        lock.lock();
        try {
            return totalCostUsd;
        } finally {
            lock.unlock();
        }
    }

    private boolean isOverCeiling(double total) {
        return config.hasBudget() && total > config.budgetCeiling();
    }

    private double usedPercent(double total) {
        if (!config.hasBudget()) {
            return 0.0;
        }
        if (config.budgetCeiling() == 0.0) {
            return total > 0.0 ? 100.0 : 0.0;
        }
        return total / config.budgetCeiling() * 100.0;
    }

    private void raiseWarningAlert(double total) {
        double percent = usedPercent(total);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tracker", name);
        metadata.put("used_percent", percent);
        metadata.put("used_usd", total);
        metadata.put("budget_usd", config.budgetCeiling());
        alertSink.deliver(new Alert(AlertLevel.WARNING, Alert.SOURCE_BUDGET_TRACKER,
                String.format(Locale.ROOT, "Budget warning: '%s' at %.1f%% ($%.2f/$%.2f)",
                        name, percent, total, config.budgetCeiling()),
                metadata, clock.instant()));
    }

    private void raiseExceededAlert(double total) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tracker", name);
        metadata.put("used_usd", total);
        metadata.put("budget_usd", config.budgetCeiling());
        metadata.put("overage_usd", total - config.budgetCeiling());
        alertSink.deliver(new Alert(AlertLevel.CRITICAL, Alert.SOURCE_BUDGET_TRACKER,
                String.format(Locale.ROOT, "BUDGET EXCEEDED: '%s' at $%.2f (limit: $%.2f)",
                        name, total, config.budgetCeiling()),
                metadata, clock.instant()));
    }
}
