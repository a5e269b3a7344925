package com.phillippitts.apiguard.service.metrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derived health: issues make it unhealthy, warnings make it degraded.
 */
public record SystemHealth(HealthStatus status, List<String> issues, List<String> warnings) {

    public SystemHealth {
        Objects.requireNonNull(status, "status");
        issues = issues == null ? List.of() : List.copyOf(issues);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.value());
        map.put("issues", issues);
        map.put("warnings", warnings);
        return map;
    }
}
