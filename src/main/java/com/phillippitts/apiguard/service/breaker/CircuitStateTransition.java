package com.phillippitts.apiguard.service.breaker;

import java.time.Instant;

/**
 * A state change of one breaker, handed to {@link CircuitStateListener}s after the breaker
 * has released its lock.
 *
 * @param breakerName         breaker that changed state
 * @param from                previous state
 * @param to                  new state
 * @param at                  when the change happened
 * @param consecutiveFailures consecutive failure count at the time of the change
 * @param lastFailureReason   last recorded failure reason (nullable)
 */
public record CircuitStateTransition(
        String breakerName,
        CircuitState from,
        CircuitState to,
        Instant at,
        int consecutiveFailures,
        String lastFailureReason
) {
}
