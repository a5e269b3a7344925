package com.phillippitts.apiguard.service.breaker;

import com.phillippitts.apiguard.util.TimeUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Consistent export view of one breaker: config, counters and time remaining read under a single
 * lock acquisition.
 */
public record CircuitBreakerSnapshot(
        String name,
        CircuitBreakerConfig config,
        CircuitBreakerStats stats,
        Duration timeRemaining
) {

    public CircuitState state() {
        return stats.state();
    }

    /**
     * Serializable form for dashboards and the metrics endpoint.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> configMap = new LinkedHashMap<>();
        configMap.put("failure_threshold", config.failureThreshold());
        configMap.put("success_threshold", config.successThreshold());
        configMap.put("recovery_timeout", TimeUtils.toSeconds(config.recoveryTimeout()));
        configMap.put("half_open_max_calls", config.halfOpenMaxConcurrent());
        configMap.put("failure_rate_threshold", config.failureRateThreshold());
        configMap.put("min_calls_for_rate", config.minCallsForRate());
        configMap.put("excluded_failure_kinds", config.excludedFailureKinds().stream()
                .map(Enum::name)
                .sorted()
                .collect(Collectors.toList()));

        Map<String, Object> statsMap = new LinkedHashMap<>();
        statsMap.put("total_calls", stats.totalCalls());
        statsMap.put("successful_calls", stats.successfulCalls());
        statsMap.put("failed_calls", stats.failedCalls());
        statsMap.put("rejected_calls", stats.rejectedCalls());
        statsMap.put("consecutive_failures", stats.consecutiveFailures());
        statsMap.put("consecutive_successes", stats.consecutiveSuccesses());
        statsMap.put("half_open_in_flight", stats.halfOpenInFlight());
        statsMap.put("last_failure_at", TimeUtils.isoOrNull(stats.lastFailureAt()));
        statsMap.put("last_failure_reason", stats.lastFailureReason());
        statsMap.put("last_success_at", TimeUtils.isoOrNull(stats.lastSuccessAt()));
        statsMap.put("last_state_change_at", TimeUtils.isoOrNull(stats.lastStateChangeAt()));
        statsMap.put("time_in_current_state_seconds",
                TimeUtils.round(TimeUtils.toSeconds(stats.timeInCurrentState()), 1));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("state", stats.state().value());
        map.put("config", configMap);
        map.put("stats", statsMap);
        map.put("time_remaining_seconds", TimeUtils.round(TimeUtils.toSeconds(timeRemaining), 1));
        return map;
    }
}
