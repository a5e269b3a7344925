package com.phillippitts.apiguard.service.metrics;

import com.phillippitts.apiguard.service.ratelimit.RateLimiterSnapshot;
import com.phillippitts.apiguard.util.TimeUtils;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Request and wait totals over every rate limiter.
 */
public record RateLimitMetrics(
        long totalRequests,
        long totalWaits,
        Duration totalWaitTime,
        Map<String, RateLimiterSnapshot> byProvider
) {

    public static final RateLimitMetrics EMPTY = new RateLimitMetrics(0, 0, Duration.ZERO, Map.of());

    public RateLimitMetrics {
        totalWaitTime = totalWaitTime == null ? Duration.ZERO : totalWaitTime;
        byProvider = byProvider == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(byProvider));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> providers = new LinkedHashMap<>();
        byProvider.forEach((provider, limiter) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("total_requests", limiter.stats().totalRequests());
            entry.put("requests_today", limiter.stats().requestsToday());
            entry.put("requests_this_minute", limiter.stats().requestsThisMinute());
            entry.put("waits_count", limiter.stats().waitsCount());
            entry.put("wait_time_seconds", TimeUtils.round(TimeUtils.toSeconds(limiter.stats().totalWaitTime()), 2));
            entry.put("remaining_daily", limiter.remainingDaily());
            entry.put("daily_limit", limiter.config().dailyLimit());
            entry.put("requests_per_minute", limiter.config().requestsPerMinute());
            providers.put(provider, entry);
        });

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_requests", totalRequests);
        map.put("total_waits", totalWaits);
        map.put("total_wait_time_seconds", TimeUtils.round(TimeUtils.toSeconds(totalWaitTime), 2));
        map.put("by_provider", providers);
        return map;
    }
}
