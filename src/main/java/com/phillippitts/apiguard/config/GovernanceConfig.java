package com.phillippitts.apiguard.config;

import com.phillippitts.apiguard.config.properties.BudgetProperties;
import com.phillippitts.apiguard.config.properties.CircuitBreakerProperties;
import com.phillippitts.apiguard.config.properties.RateLimitProperties;
import com.phillippitts.apiguard.service.alert.AlertSink;
import com.phillippitts.apiguard.service.alert.ApplicationEventAlertSink;
import com.phillippitts.apiguard.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.apiguard.service.breaker.FailureClassifier;
import com.phillippitts.apiguard.service.budget.CostTrackerRegistry;
import com.phillippitts.apiguard.service.guard.GovernedCallExecutor;
import com.phillippitts.apiguard.service.metrics.GovernanceMetrics;
import com.phillippitts.apiguard.service.metrics.GovernanceMetricsPublisher;
import com.phillippitts.apiguard.service.metrics.MetricsAggregator;
import com.phillippitts.apiguard.service.ratelimit.RateLimiterRegistry;
import com.phillippitts.apiguard.service.ratelimit.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Wires the governance registries once per application context.
 *
 * <p>Every component that needs a breaker, limiter or tracker by name injects the matching registry
 * bean; tests build fresh registries instead.
 */
@Configuration
public class GovernanceConfig {

    private static final Logger LOG = LogManager.getLogger(GovernanceConfig.class);

    @Bean
    public Clock governanceClock() {
        return Clock.systemUTC();
    }

    /**
     * Scheduler behind {@code RateLimiter.acquireAsync}; re-checks are short and never block.
     */
    @Bean
    public ThreadPoolTaskScheduler rateLimitScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("ratelimit-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public GovernanceMetricsPublisher governanceMetricsPublisher(GovernanceMetrics metrics) {
        return new GovernanceMetricsPublisher(metrics);
    }

    @Bean
    public AlertSink alertSink(ApplicationEventPublisher publisher) {
        return new ApplicationEventAlertSink(publisher);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerProperties properties,
                                                         Clock governanceClock,
                                                         AlertSink alertSink,
                                                         GovernanceMetricsPublisher metrics) {
        LOG.info("Circuit breaker overrides configured for: {}", properties.getServices().keySet());
        return new CircuitBreakerRegistry(properties::resolve, governanceClock, FailureClassifier.DEFAULT,
                alertSink, metrics);
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry(RateLimitProperties properties,
                                                   Clock governanceClock,
                                                   ThreadPoolTaskScheduler rateLimitScheduler,
                                                   AlertSink alertSink,
                                                   GovernanceMetricsPublisher metrics) {
        LOG.info("Rate limit overrides configured for: {} (allowWait={}, maxWait={}s)",
                properties.getProviders().keySet(), properties.isAllowWait(), properties.getMaxWait().toSeconds());
        return new RateLimiterRegistry(properties::resolve, governanceClock, Sleeper.SYSTEM,
                rateLimitScheduler.getScheduledExecutor(), alertSink, metrics);
    }

    @Bean
    public CostTrackerRegistry costTrackerRegistry(BudgetProperties properties,
                                                   Clock governanceClock,
                                                   AlertSink alertSink,
                                                   GovernanceMetricsPublisher metrics) {
        CostTrackerRegistry registry = new CostTrackerRegistry(properties::resolve, properties.toModelPricing(),
                governanceClock, alertSink, metrics);
        // Present on dashboards from startup
        registry.getOrCreate(CostTrackerRegistry.GLOBAL);
        return registry;
    }

    @Bean
    public MetricsAggregator metricsAggregator(CircuitBreakerRegistry circuitBreakerRegistry,
                                               RateLimiterRegistry rateLimiterRegistry,
                                               CostTrackerRegistry costTrackerRegistry,
                                               Clock governanceClock) {
        return new MetricsAggregator(circuitBreakerRegistry, rateLimiterRegistry, costTrackerRegistry,
                governanceClock);
    }

    @Bean
    public GovernedCallExecutor governedCallExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                                                     RateLimiterRegistry rateLimiterRegistry,
                                                     CostTrackerRegistry costTrackerRegistry) {
        return new GovernedCallExecutor(circuitBreakerRegistry, rateLimiterRegistry, costTrackerRegistry);
    }
}
