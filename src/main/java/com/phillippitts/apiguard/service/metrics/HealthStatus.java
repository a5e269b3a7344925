package com.phillippitts.apiguard.service.metrics;

import java.util.Locale;

/**
 * Overall governance health, from best to worst.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** The worse of the two. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
