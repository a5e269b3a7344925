package com.phillippitts.apiguard.service.metrics;

import com.phillippitts.apiguard.service.budget.UsageBreakdown;
import com.phillippitts.apiguard.util.TimeUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Usage and cost summed over every cost tracker.
 *
 * @param byTracker  totals per tracker
 * @param byProvider totals per provider across trackers
 * @param byLayer    totals per layer tag across trackers
 */
public record TokenMetrics(
        long totalInputUnits,
        long totalOutputUnits,
        double totalCostUsd,
        int callsCount,
        Map<String, UsageBreakdown> byTracker,
        Map<String, UsageBreakdown> byProvider,
        Map<String, UsageBreakdown> byLayer
) {

    public static final TokenMetrics EMPTY =
            new TokenMetrics(0, 0, 0.0, 0, Map.of(), Map.of(), Map.of());

    public TokenMetrics {
        byTracker = byTracker == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byTracker));
        byProvider = byProvider == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byProvider));
        byLayer = byLayer == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byLayer));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_input_tokens", totalInputUnits);
        map.put("total_output_tokens", totalOutputUnits);
        map.put("total_cost_usd", TimeUtils.round(totalCostUsd, 4));
        map.put("calls_count", callsCount);
        map.put("by_tracker", toMaps(byTracker));
        map.put("by_provider", toMaps(byProvider));
        map.put("by_layer", toMaps(byLayer));
        return map;
    }

    private static Map<String, Object> toMaps(Map<String, UsageBreakdown> breakdowns) {
        Map<String, Object> map = new LinkedHashMap<>();
        breakdowns.forEach((key, value) -> map.put(key, value.toMap()));
        return map;
    }
}
