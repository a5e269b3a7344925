package com.phillippitts.apiguard.service.health;

import com.phillippitts.apiguard.service.metrics.MetricsAggregator;
import com.phillippitts.apiguard.service.metrics.SystemHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the governance layer (breakers, rate limits, budgets).
 *
 * <p>Maps {@link SystemHealth}:
 * <ul>
 *   <li>UP: healthy</li>
 *   <li>DEGRADED: a breaker recovering, a daily cap or budget close to its limit</li>
 *   <li>DOWN: a breaker open, a daily cap used up, a budget exceeded, or a read fault</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class GovernanceHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final MetricsAggregator aggregator;

    public GovernanceHealthIndicator(MetricsAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public Health health() {
        SystemHealth health = aggregator.getSystemHealth();

        Health.Builder builder = switch (health.status()) {
            case HEALTHY -> Health.up();
            case DEGRADED -> Health.status(DEGRADED);
            case UNHEALTHY -> Health.down();
        };
        return builder
                .withDetail("status", health.status().value())
                .withDetail("issues", health.issues())
                .withDetail("warnings", health.warnings())
                .build();
    }
}
