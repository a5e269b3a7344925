package com.phillippitts.apiguard.service.metrics;

import com.phillippitts.apiguard.service.breaker.CircuitBreakerSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * State counts and call totals over every circuit breaker.
 */
public record CircuitBreakerMetrics(
        int totalBreakers,
        int openBreakers,
        int halfOpenBreakers,
        int closedBreakers,
        long totalCalls,
        long totalFailures,
        long totalRejections,
        Map<String, CircuitBreakerSnapshot> byService
) {

    public static final CircuitBreakerMetrics EMPTY =
            new CircuitBreakerMetrics(0, 0, 0, 0, 0, 0, 0, Map.of());

    public CircuitBreakerMetrics {
        byService = byService == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byService));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> services = new LinkedHashMap<>();
        byService.forEach((service, breaker) -> services.put(service, breaker.toMap()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_breakers", totalBreakers);
        map.put("open_breakers", openBreakers);
        map.put("half_open_breakers", halfOpenBreakers);
        map.put("closed_breakers", closedBreakers);
        map.put("total_calls", totalCalls);
        map.put("total_failures", totalFailures);
        map.put("total_rejections", totalRejections);
        map.put("by_service", services);
        return map;
    }
}
