package com.phillippitts.apiguard.service.metrics;

import com.phillippitts.apiguard.util.TimeUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Budget positions of every cost tracker.
 *
 * @param totalBudgetUsd    sum of ceilings, or null when any tracker is unlimited
 * @param totalRemainingUsd sum of remaining budgets, or null when any tracker is unlimited
 */
public record BudgetMetrics(
        Double totalBudgetUsd,
        double totalUsedUsd,
        Double totalRemainingUsd,
        double overallUsedPercent,
        int trackersExceeded,
        int trackersWarning,
        int trackersCritical,
        Map<String, BudgetStatus> byTracker
) {

    public static final BudgetMetrics EMPTY = new BudgetMetrics(null, 0.0, null, 0.0, 0, 0, 0, Map.of());

    public BudgetMetrics {
        byTracker = byTracker == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byTracker));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> trackers = new LinkedHashMap<>();
        byTracker.forEach((name, status) -> trackers.put(name, status.toMap()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_budget_usd", totalBudgetUsd == null ? null : TimeUtils.round(totalBudgetUsd, 2));
        map.put("total_used_usd", TimeUtils.round(totalUsedUsd, 4));
        map.put("total_remaining_usd", totalRemainingUsd == null ? null : TimeUtils.round(totalRemainingUsd, 4));
        map.put("overall_used_percent", TimeUtils.round(overallUsedPercent, 1));
        map.put("trackers_exceeded", trackersExceeded);
        map.put("trackers_warning", trackersWarning);
        map.put("trackers_critical", trackersCritical);
        map.put("by_tracker", trackers);
        return map;
    }
}
