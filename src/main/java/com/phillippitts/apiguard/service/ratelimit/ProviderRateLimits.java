package com.phillippitts.apiguard.service.ratelimit;

import java.util.Locale;
import java.util.Map;

/**
 * Published request limits of the providers this application calls.
 */
public final class ProviderRateLimits {

    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String OPENROUTER = "openrouter";
    public static final String FIRECRAWL = "firecrawl";

    private static final Map<String, RateLimiterConfig> DEFAULTS = Map.of(
            OPENAI, RateLimiterConfig.perMinute(500),
            ANTHROPIC, RateLimiterConfig.perMinute(100),
            OPENROUTER, RateLimiterConfig.perMinute(60),
            FIRECRAWL, RateLimiterConfig.of(10, 600)
    );

    private ProviderRateLimits() {
        // Utility class - prevent instantiation
    }

    /**
     * Default configuration for a provider; unknown providers get
     * {@value RateLimiterConfig#DEFAULT_REQUESTS_PER_MINUTE} requests per minute and no daily cap.
     */
    public static RateLimiterConfig forProvider(String provider) {
        if (provider == null) {
            return RateLimiterConfig.perMinute(RateLimiterConfig.DEFAULT_REQUESTS_PER_MINUTE);
        }
        return DEFAULTS.getOrDefault(provider.toLowerCase(Locale.ROOT),
                RateLimiterConfig.perMinute(RateLimiterConfig.DEFAULT_REQUESTS_PER_MINUTE));
    }

    public static Map<String, RateLimiterConfig> defaults() {
        return DEFAULTS;
    }
}
