package com.phillippitts.apiguard.service.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of a breaker's counters. Timestamps are null until the event first happens.
 */
public record CircuitBreakerStats(
        CircuitState state,
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        long rejectedCalls,
        int consecutiveFailures,
        int consecutiveSuccesses,
        int halfOpenInFlight,
        Instant lastFailureAt,
        String lastFailureReason,
        Instant lastSuccessAt,
        Instant lastStateChangeAt,
        Duration timeInCurrentState
) {
}
