package com.phillippitts.apiguard.presentation.controller;

import com.phillippitts.apiguard.service.breaker.CircuitBreaker;
import com.phillippitts.apiguard.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.apiguard.service.budget.CostBucket;
import com.phillippitts.apiguard.service.budget.CostPeriod;
import com.phillippitts.apiguard.service.metrics.MetricsAggregator;
import com.phillippitts.apiguard.service.ratelimit.RateLimiterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Read-only dashboard export of the governance state, plus the two operational breaker overrides.
 */
@RestController
@RequestMapping("/api")
class MetricsController {

    private static final Logger LOG = LogManager.getLogger(MetricsController.class);

    static final int MAX_BUCKETS = 720;

    private final MetricsAggregator aggregator;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiterRegistry limiters;

    MetricsController(MetricsAggregator aggregator,
                      CircuitBreakerRegistry breakers,
                      RateLimiterRegistry limiters) {
        this.aggregator = aggregator;
        this.breakers = breakers;
        this.limiters = limiters;
    }

    @GetMapping("/metrics")
    Map<String, Object> metrics() {
        return aggregator.getSnapshot().toMap();
    }

    @GetMapping("/metrics/cost-history")
    Map<String, Object> costHistory(@RequestParam(defaultValue = "hourly") String period,
                                    @RequestParam(defaultValue = "24") int count) {
        if (count < 1 || count > MAX_BUCKETS) {
            throw new IllegalArgumentException("count must be between 1 and " + MAX_BUCKETS + ", got: " + count);
        }
        CostPeriod costPeriod = CostPeriod.fromString(period);
        List<CostBucket> buckets = aggregator.getCostHistory(costPeriod, count);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("period", costPeriod.name().toLowerCase(Locale.ROOT));
        body.put("count", count);
        body.put("buckets", buckets.stream().map(CostBucket::toMap).collect(Collectors.toList()));
        return body;
    }

    @GetMapping("/circuit-breakers")
    Map<String, Object> circuitBreakers() {
        Map<String, Object> body = new LinkedHashMap<>();
        breakers.getAllStats().forEach((name, snapshot) -> body.put(name, snapshot.toMap()));
        return body;
    }

    @PostMapping("/circuit-breakers/{name}/reset")
    ResponseEntity<Map<String, Object>> resetBreaker(@PathVariable String name) {
        return override(name, "reset", CircuitBreaker::reset);
    }

    @PostMapping("/circuit-breakers/{name}/force-open")
    ResponseEntity<Map<String, Object>> forceOpenBreaker(@PathVariable String name) {
        return override(name, "force-open", CircuitBreaker::forceOpen);
    }

    @GetMapping("/rate-limits")
    Map<String, Object> rateLimits() {
        Map<String, Object> body = new LinkedHashMap<>();
        limiters.getAllStats().forEach((provider, snapshot) -> body.put(provider, snapshot.toMap()));
        return body;
    }

    @GetMapping("/budgets")
    Map<String, Object> budgets() {
        return aggregator.getSnapshot().budget().toMap();
    }

    private ResponseEntity<Map<String, Object>> override(String name, String action, Consumer<CircuitBreaker> op) {
        Optional<CircuitBreaker> breaker = breakers.get(name);
        if (breaker.isEmpty()) {
            LOG.warn("Breaker override '{}' requested for unknown breaker '{}'", action, name);
            return ResponseEntity.notFound().build();
        }
        LOG.info("Breaker override '{}' applied to '{}'", action, name);
        op.accept(breaker.get());
        return ResponseEntity.ok(breaker.get().toMap());
    }
}
