package com.phillippitts.apiguard.service.breaker;

import java.util.Locale;

/**
 * Circuit breaker states.
 *
 * <ul>
 *   <li>CLOSED: normal operation, calls pass through</li>
 *   <li>OPEN: service considered unhealthy, calls rejected immediately</li>
 *   <li>HALF_OPEN: recovery trial, a bounded number of concurrent calls allowed</li>
 * </ul>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /** Lower-case export value ({@code closed}, {@code open}, {@code half_open}). */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
