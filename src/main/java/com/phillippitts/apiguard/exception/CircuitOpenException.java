package com.phillippitts.apiguard.exception;

import java.time.Duration;
import java.util.Locale;

/**
 * Thrown when a call is rejected because its circuit breaker is OPEN, or HALF_OPEN
 * with every trial slot taken. Always recoverable: retry later or fall back.
 */
public class CircuitOpenException extends ApiGuardException {

    private final String breakerName;
    private final Duration timeRemaining;
    private final String lastFailureReason;

    public CircuitOpenException(String breakerName, Duration timeRemaining, String lastFailureReason) {
        super(String.format(Locale.ROOT, "Circuit '%s' is OPEN. Retry in %.1fs. Last failure: %s",
                breakerName,
                timeRemaining.toMillis() / 1000.0,
                lastFailureReason == null ? "unknown" : lastFailureReason));
        this.breakerName = breakerName;
        this.timeRemaining = timeRemaining;
        this.lastFailureReason = lastFailureReason;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Duration getTimeRemaining() {
        return timeRemaining;
    }

    /** Nullable when the breaker was forced open or has never failed. */
    public String getLastFailureReason() {
        return lastFailureReason;
    }
}
