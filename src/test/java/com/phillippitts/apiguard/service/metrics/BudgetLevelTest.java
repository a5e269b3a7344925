package com.phillippitts.apiguard.service.metrics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetLevelTest {

    @Test
    void bandsFollowThresholds() {
        assertThat(BudgetLevel.of(true, false, 79.9)).isEqualTo(BudgetLevel.OK);
        assertThat(BudgetLevel.of(true, false, 80.0)).isEqualTo(BudgetLevel.WARNING);
        assertThat(BudgetLevel.of(true, false, 90.0)).isEqualTo(BudgetLevel.CRITICAL);
        assertThat(BudgetLevel.of(true, false, 100.0)).isEqualTo(BudgetLevel.CRITICAL);
        assertThat(BudgetLevel.of(true, true, 120.0)).isEqualTo(BudgetLevel.EXCEEDED);
    }

    @Test
    void unlimitedIsAlwaysOk() {
        assertThat(BudgetLevel.of(false, false, 500.0)).isEqualTo(BudgetLevel.OK);
        assertThat(BudgetLevel.EXCEEDED.value()).isEqualTo("exceeded");
    }

    @Test
    void worstHealthWins() {
        assertThat(HealthStatus.HEALTHY.worst(HealthStatus.DEGRADED)).isEqualTo(HealthStatus.DEGRADED);
        assertThat(HealthStatus.UNHEALTHY.worst(HealthStatus.DEGRADED)).isEqualTo(HealthStatus.UNHEALTHY);
    }
}
