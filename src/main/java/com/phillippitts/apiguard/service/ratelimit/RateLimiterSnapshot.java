package com.phillippitts.apiguard.service.ratelimit;

import com.phillippitts.apiguard.util.TimeUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consistent export view of one limiter.
 *
 * @param remainingDaily requests left today, or null when there is no daily cap
 */
public record RateLimiterSnapshot(
        String provider,
        RateLimiterConfig config,
        RateLimitStats stats,
        Integer remainingDaily
) {

    /**
     * Fraction of the daily cap already used (0..1), or null when there is no daily cap.
     */
    public Double dailyUsage() {
        if (config.dailyLimit() == null) {
            return null;
        }
        return (double) stats.requestsToday() / config.dailyLimit();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> statsMap = new LinkedHashMap<>();
        statsMap.put("total_requests", stats.totalRequests());
        statsMap.put("requests_today", stats.requestsToday());
        statsMap.put("requests_this_minute", stats.requestsThisMinute());
        statsMap.put("waits_count", stats.waitsCount());
        statsMap.put("total_wait_time_seconds", TimeUtils.round(TimeUtils.toSeconds(stats.totalWaitTime()), 2));
        statsMap.put("last_request_at", TimeUtils.isoOrNull(stats.lastRequestAt()));
        statsMap.put("daily_reset_at", TimeUtils.isoOrNull(stats.dailyResetAt()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("provider", provider);
        map.put("requests_per_minute", config.requestsPerMinute());
        map.put("daily_limit", config.dailyLimit());
        map.put("allow_wait", config.allowWait());
        map.put("max_wait_seconds", TimeUtils.toSeconds(config.maxWaitDuration()));
        map.put("stats", statsMap);
        map.put("remaining_daily", remainingDaily);
        return map;
    }
}
