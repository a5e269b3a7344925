package com.phillippitts.apiguard.config.properties;

import com.phillippitts.apiguard.service.ratelimit.ProviderRateLimits;
import com.phillippitts.apiguard.service.ratelimit.RateLimiterConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rate limiter settings ({@code apiguard.rate-limit.*}).
 *
 * <p>Known providers start from {@link ProviderRateLimits}; any other provider gets
 * {@code default-requests-per-minute} and no daily cap. {@code providers.<name>} overrides
 * individual fields.
 */
@ConfigurationProperties(prefix = "apiguard.rate-limit")
@Validated
public class RateLimitProperties {

    /** Requests per minute for providers without built-in or configured limits. */
    @Positive(message = "Default requests per minute must be positive")
    private int defaultRequestsPerMinute = RateLimiterConfig.DEFAULT_REQUESTS_PER_MINUTE;

    /** Wait for the minute window instead of failing fast. */
    private boolean allowWait = true;

    /** Longest total wait inside one acquire. */
    @NotNull
    private Duration maxWait = RateLimiterConfig.DEFAULT_MAX_WAIT;

    @Valid
    private Map<String, ProviderLimit> providers = new LinkedHashMap<>();

    public int getDefaultRequestsPerMinute() {
        return defaultRequestsPerMinute;
    }

    public void setDefaultRequestsPerMinute(int defaultRequestsPerMinute) {
        this.defaultRequestsPerMinute = defaultRequestsPerMinute;
    }

    public boolean isAllowWait() {
        return allowWait;
    }

    public void setAllowWait(boolean allowWait) {
        this.allowWait = allowWait;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
        this.maxWait = maxWait;
    }

    public Map<String, ProviderLimit> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderLimit> providers) {
        this.providers = providers;
    }

    /**
     * Configuration for the limiter of {@code provider}.
     */
    public RateLimiterConfig resolve(String provider) {
        RateLimiterConfig base = ProviderRateLimits.defaults().containsKey(provider.toLowerCase(Locale.ROOT))
                ? ProviderRateLimits.forProvider(provider)
                : RateLimiterConfig.perMinute(defaultRequestsPerMinute);

        int requestsPerMinute = base.requestsPerMinute();
        Integer dailyLimit = base.dailyLimit();
        boolean wait = allowWait;
        Duration maxWaitDuration = maxWait;

        ProviderLimit override = providers.get(provider);
        if (override != null) {
            if (override.getRequestsPerMinute() != null) {
                requestsPerMinute = override.getRequestsPerMinute();
            }
            if (override.getDailyLimit() != null) {
                dailyLimit = override.getDailyLimit() == 0 ? null : override.getDailyLimit();
            }
            if (override.getAllowWait() != null) {
                wait = override.getAllowWait();
            }
            if (override.getMaxWait() != null) {
                maxWaitDuration = override.getMaxWait();
            }
        }
        return new RateLimiterConfig(requestsPerMinute, dailyLimit, wait, maxWaitDuration);
    }

    /**
     * Partial limits for one provider; null fields are left unchanged.
     */
    public static class ProviderLimit {

        @Positive(message = "Requests per minute must be positive")
        private Integer requestsPerMinute;

        /** Requests per UTC day; 0 removes a built-in daily cap. */
        private Integer dailyLimit;

        private Boolean allowWait;

        private Duration maxWait;

        public Integer getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(Integer requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public Integer getDailyLimit() {
            return dailyLimit;
        }

        public void setDailyLimit(Integer dailyLimit) {
            this.dailyLimit = dailyLimit;
        }

        public Boolean getAllowWait() {
            return allowWait;
        }

        public void setAllowWait(Boolean allowWait) {
            this.allowWait = allowWait;
        }

        public Duration getMaxWait() {
            return maxWait;
        }

        public void setMaxWait(Duration maxWait) {
            this.maxWait = maxWait;
        }
    }
}
