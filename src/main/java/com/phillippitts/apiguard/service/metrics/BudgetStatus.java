package com.phillippitts.apiguard.service.metrics;

import com.phillippitts.apiguard.util.TimeUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Budget position of one cost tracker.
 *
 * @param budgetUsd    ceiling, or null when unlimited
 * @param remainingUsd USD left, or null when unlimited
 */
public record BudgetStatus(
        String name,
        Double budgetUsd,
        double usedUsd,
        Double remainingUsd,
        double usedPercent,
        boolean exceeded,
        BudgetLevel level
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("budget_usd", budgetUsd);
        map.put("used_usd", TimeUtils.round(usedUsd, 4));
        map.put("remaining_usd", remainingUsd == null ? null : TimeUtils.round(remainingUsd, 4));
        map.put("used_percent", TimeUtils.round(usedPercent, 1));
        map.put("is_exceeded", exceeded);
        map.put("status", level.value());
        return map;
    }
}
