package com.phillippitts.apiguard.exception;

import java.util.Locale;

/**
 * Thrown when a rate limiter is configured not to wait and either its per-minute or
 * daily cap is reached.
 */
public class RateLimitExceededException extends ApiGuardException {

    public enum LimitType { PER_MINUTE, DAILY }

    private final String provider;
    private final LimitType limitType;
    private final int current;
    private final int limit;

    public RateLimitExceededException(String provider, LimitType limitType, int current, int limit) {
        super("Rate limit exceeded for " + provider + ": " + current + "/" + limit
                + " (" + limitType.name().toLowerCase(Locale.ROOT) + ")");
        this.provider = provider;
        this.limitType = limitType;
        this.current = current;
        this.limit = limit;
    }

    public String getProvider() {
        return provider;
    }

    public LimitType getLimitType() {
        return limitType;
    }

    public int getCurrent() {
        return current;
    }

    public int getLimit() {
        return limit;
    }
}
