package com.phillippitts.apiguard.service.budget;

import com.phillippitts.apiguard.util.TimeUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consistent export view of one tracker.
 *
 * @param remainingBudget USD left before the ceiling, or null without a ceiling
 * @param usedPercent     share of the ceiling spent, 0 without a ceiling
 */
public record CostTrackerSnapshot(
        String name,
        CostTrackerConfig config,
        UsageSummary summary,
        Double remainingBudget,
        double usedPercent,
        boolean budgetExceeded
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("job_id", config.scopeId());
        map.put("budget_usd", config.budgetCeiling());
        map.put("enforce_budget", config.enforceBudget());
        map.putAll(summary.toMap());
        map.put("budget_remaining_usd", remainingBudget == null ? null : TimeUtils.round(remainingBudget, 4));
        map.put("budget_used_percent", TimeUtils.round(usedPercent, 1));
        map.put("budget_exceeded", budgetExceeded);
        return map;
    }
}
