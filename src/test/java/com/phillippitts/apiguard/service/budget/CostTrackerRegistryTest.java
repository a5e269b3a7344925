package com.phillippitts.apiguard.service.budget;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CostTrackerRegistryTest {

    @Test
    void returnsSameTrackerPerName() {
        CostTrackerRegistry registry = new CostTrackerRegistry();

        CostTracker global = registry.getOrCreate(CostTrackerRegistry.GLOBAL);

        assertThat(registry.getOrCreate("global")).isSameAs(global);
        assertThat(global.getConfig().hasBudget()).isFalse();
    }

    @Test
    void explicitConfigAppliesOnlyOnCreation() {
        CostTrackerRegistry registry = new CostTrackerRegistry();
        CostTracker job = registry.getOrCreate("job-1", CostTrackerConfig.withBudget(2.0));

        CostTracker again = registry.getOrCreate("job-1", CostTrackerConfig.withBudget(50.0));

        assertThat(again).isSameAs(job);
        assertThat(again.getConfig().budgetCeiling()).isEqualTo(2.0);
    }

    @Test
    void getAllStatsAndResetAll() {
        CostTrackerRegistry registry = new CostTrackerRegistry();
        registry.getOrCreate("job-b").trackUsage("openai", "gpt-4o", 1000, 0);
        registry.getOrCreate("job-a");

        Map<String, CostTrackerSnapshot> all = registry.getAllStats();
        assertThat(all.keySet()).containsExactly("job-a", "job-b");
        assertThat(all.get("job-b").summary().callsCount()).isEqualTo(1);

        registry.resetAll();

        assertThat(registry.get("job-b")).hasValueSatisfying(
                tracker -> assertThat(tracker.getUsages()).isEmpty());
        assertThat(registry.names()).containsExactly("job-a", "job-b");
    }
}
