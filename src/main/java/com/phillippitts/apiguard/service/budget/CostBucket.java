package com.phillippitts.apiguard.service.budget;

import com.phillippitts.apiguard.util.TimeUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cost accumulated in one hour or one UTC day.
 *
 * @param start inclusive start of the bucket
 */
public record CostBucket(Instant start, double costUsd, int calls) {

    CostBucket add(double cost) {
        return new CostBucket(start, costUsd + cost, calls + 1);
    }

    /** Sums two buckets covering the same period. */
    public CostBucket plus(CostBucket other) {
        return new CostBucket(start, costUsd + other.costUsd, calls + other.calls);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("period_start", TimeUtils.isoOrNull(start));
        map.put("cost_usd", TimeUtils.round(costUsd, 4));
        map.put("calls", calls);
        return map;
    }
}
