package com.phillippitts.apiguard;

import com.phillippitts.apiguard.service.budget.CostTrackerRegistry;
import com.phillippitts.apiguard.service.guard.GovernedCallExecutor;
import com.phillippitts.apiguard.service.metrics.MetricsAggregator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ApiGuardApplicationTest {

    @Autowired
    private GovernedCallExecutor executor;

    @Autowired
    private CostTrackerRegistry trackers;

    @Autowired
    private MetricsAggregator aggregator;

    @Test
    void contextLoads() {
        assertThat(executor).isNotNull();
        assertThat(trackers.names()).contains(CostTrackerRegistry.GLOBAL);
        assertThat(aggregator.getSystemHealth().status()).isNotNull();
    }
}
