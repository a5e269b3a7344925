package com.phillippitts.apiguard.service.budget;

import com.phillippitts.apiguard.util.TimeUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate over a set of usage records, computed on read.
 *
 * @param byProvider totals keyed by provider
 * @param byLayer    totals keyed by layer tag; untagged records count under {@value #UNKNOWN_LAYER}
 */
public record UsageSummary(
        long totalInputUnits,
        long totalOutputUnits,
        double totalCostUsd,
        int callsCount,
        Map<String, UsageBreakdown> byProvider,
        Map<String, UsageBreakdown> byLayer
) {

    public static final String UNKNOWN_LAYER = "unknown";

    public static final UsageSummary EMPTY = new UsageSummary(0, 0, 0.0, 0, Map.of(), Map.of());

    public UsageSummary {
        byProvider = byProvider == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byProvider));
        byLayer = byLayer == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byLayer));
    }

    /**
     * Folds records into a summary, in iteration order.
     */
    public static UsageSummary of(Iterable<UsageRecord> records) {
        long input = 0;
        long output = 0;
        double cost = 0.0;
        int calls = 0;
        Map<String, UsageBreakdown> providers = new TreeMap<>();
        Map<String, UsageBreakdown> layers = new TreeMap<>();
        for (UsageRecord record : records) {
            input += record.inputUnits();
            output += record.outputUnits();
            cost += record.estimatedCost();
            calls++;
            providers.merge(record.provider(), UsageBreakdown.EMPTY.add(record), (a, b) -> a.add(record));
            String layer = record.layerTag() == null ? UNKNOWN_LAYER : record.layerTag();
            layers.merge(layer, UsageBreakdown.EMPTY.add(record), (a, b) -> a.add(record));
        }
        return new UsageSummary(input, output, cost, calls, providers, layers);
    }

    public long totalUnits() {
        return totalInputUnits + totalOutputUnits;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_input_tokens", totalInputUnits);
        map.put("total_output_tokens", totalOutputUnits);
        map.put("total_tokens", totalUnits());
        map.put("total_cost_usd", TimeUtils.round(totalCostUsd, 4));
        map.put("calls_count", callsCount);
        map.put("by_provider", breakdownMap(byProvider));
        map.put("by_layer", breakdownMap(byLayer));
        return map;
    }

    private static Map<String, Object> breakdownMap(Map<String, UsageBreakdown> breakdowns) {
        Map<String, Object> map = new LinkedHashMap<>();
        breakdowns.forEach((key, value) -> map.put(key, value.toMap()));
        return map;
    }
}
