package com.phillippitts.apiguard.service.budget;

import com.phillippitts.apiguard.util.TimeUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Totals for one provider or layer within a {@link UsageSummary}.
 */
public record UsageBreakdown(long inputUnits, long outputUnits, double costUsd, int calls) {

    public static final UsageBreakdown EMPTY = new UsageBreakdown(0, 0, 0.0, 0);

    UsageBreakdown add(UsageRecord record) {
        return new UsageBreakdown(inputUnits + record.inputUnits(), outputUnits + record.outputUnits(),
                costUsd + record.estimatedCost(), calls + 1);
    }

    /** Sums two breakdowns. */
    public UsageBreakdown plus(UsageBreakdown other) {
        return new UsageBreakdown(inputUnits + other.inputUnits, outputUnits + other.outputUnits,
                costUsd + other.costUsd, calls + other.calls);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("input_tokens", inputUnits);
        map.put("output_tokens", outputUnits);
        map.put("cost_usd", TimeUtils.round(costUsd, 4));
        map.put("calls", calls);
        return map;
    }
}
