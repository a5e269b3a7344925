package com.phillippitts.apiguard.service.metrics;

import com.phillippitts.apiguard.util.TimeUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the dashboards show, recomputed on every request.
 *
 * <p>Each part is read from its registry separately; there is no cross-component atomicity, so a
 * snapshot taken during a governed call may reflect an intermediate point of that call.
 */
public record MetricsSnapshot(
        Instant timestamp,
        double uptimeSeconds,
        SystemHealth systemHealth,
        TokenMetrics tokens,
        RateLimitMetrics rateLimits,
        CircuitBreakerMetrics circuitBreakers,
        BudgetMetrics budget
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", TimeUtils.isoOrNull(timestamp));
        map.put("uptime_seconds", TimeUtils.round(uptimeSeconds, 1));
        map.put("system_health", systemHealth.toMap());
        map.put("tokens", tokens.toMap());
        map.put("rate_limits", rateLimits.toMap());
        map.put("circuit_breakers", circuitBreakers.toMap());
        map.put("budget", budget.toMap());
        return map;
    }
}
