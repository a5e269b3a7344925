package com.phillippitts.apiguard.service.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable rate limiter configuration.
 *
 * @param requestsPerMinute requests admitted in any trailing 60 seconds
 * @param dailyLimit        requests admitted per UTC day, or null for no daily cap
 * @param allowWait         wait for the minute window to drain instead of failing fast
 * @param maxWaitDuration   longest total time {@code acquire} may spend waiting
 */
public record RateLimiterConfig(
        int requestsPerMinute,
        Integer dailyLimit,
        boolean allowWait,
        Duration maxWaitDuration
) {

    public static final int DEFAULT_REQUESTS_PER_MINUTE = 60;
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(60);

    public RateLimiterConfig {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be >= 1, got: " + requestsPerMinute);
        }
        if (dailyLimit != null && dailyLimit < 1) {
            throw new IllegalArgumentException("dailyLimit must be >= 1 when set, got: " + dailyLimit);
        }
        Objects.requireNonNull(maxWaitDuration, "maxWaitDuration must not be null");
        if (maxWaitDuration.isNegative()) {
            throw new IllegalArgumentException("maxWaitDuration must not be negative, got: " + maxWaitDuration);
        }
    }

    /** Per-minute limit only, waiting up to the default maximum. */
    public static RateLimiterConfig perMinute(int requestsPerMinute) {
        return new RateLimiterConfig(requestsPerMinute, null, true, DEFAULT_MAX_WAIT);
    }

    /** Per-minute and daily limits, waiting up to the default maximum. */
    public static RateLimiterConfig of(int requestsPerMinute, Integer dailyLimit) {
        return new RateLimiterConfig(requestsPerMinute, dailyLimit, true, DEFAULT_MAX_WAIT);
    }

    public RateLimiterConfig withAllowWait(boolean allowWait) {
        return new RateLimiterConfig(requestsPerMinute, dailyLimit, allowWait, maxWaitDuration);
    }

    public RateLimiterConfig withMaxWaitDuration(Duration maxWaitDuration) {
        return new RateLimiterConfig(requestsPerMinute, dailyLimit, allowWait, maxWaitDuration);
    }

    public boolean hasDailyLimit() {
        return dailyLimit != null;
    }
}
