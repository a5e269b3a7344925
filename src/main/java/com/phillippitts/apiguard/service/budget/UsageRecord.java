package com.phillippitts.apiguard.service.budget;

import com.phillippitts.apiguard.util.TimeUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One metered call, appended to a {@link CostTracker} and never changed afterwards.
 *
 * @param layerTag pipeline stage that made the call (nullable)
 * @param runTag   run the call belongs to (nullable)
 * @param scopeTag job or other budget scope (nullable)
 */
public record UsageRecord(
        String provider,
        String model,
        long inputUnits,
        long outputUnits,
        double estimatedCost,
        String layerTag,
        String runTag,
        String scopeTag,
        Instant timestamp
) {

    public UsageRecord {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(timestamp, "timestamp");
        if (inputUnits < 0 || outputUnits < 0) {
            throw new IllegalArgumentException("Units must not be negative, got: "
                    + inputUnits + "/" + outputUnits);
        }
        if (estimatedCost < 0 || Double.isNaN(estimatedCost)) {
            throw new IllegalArgumentException("estimatedCost must be >= 0, got: " + estimatedCost);
        }
    }

    public long totalUnits() {
        return inputUnits + outputUnits;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("provider", provider);
        map.put("model", model);
        map.put("input_tokens", inputUnits);
        map.put("output_tokens", outputUnits);
        map.put("cost_usd", TimeUtils.round(estimatedCost, 6));
        map.put("layer", layerTag);
        map.put("run_id", runTag);
        map.put("scope", scopeTag);
        map.put("timestamp", TimeUtils.isoOrNull(timestamp));
        return map;
    }
}
