package com.phillippitts.apiguard.service.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of a limiter's counters.
 */
public record RateLimitStats(
        long totalRequests,
        int requestsToday,
        int requestsThisMinute,
        long waitsCount,
        Duration totalWaitTime,
        Instant lastRequestAt,
        Instant dailyResetAt
) {
}
