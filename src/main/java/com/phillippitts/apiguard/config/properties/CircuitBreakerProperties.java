package com.phillippitts.apiguard.config.properties;

import com.phillippitts.apiguard.service.breaker.CircuitBreakerConfig;
import com.phillippitts.apiguard.service.breaker.FailureKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Circuit breaker settings ({@code apiguard.circuit-breaker.*}).
 *
 * <p>{@code defaults} applies to every breaker; {@code services.<name>} overrides individual fields
 * for one breaker. Unset fields fall back to {@link CircuitBreakerConfig#defaults()}.
 */
@ConfigurationProperties(prefix = "apiguard.circuit-breaker")
@Validated
public class CircuitBreakerProperties {

    @Valid
    private Settings defaults = new Settings();

    @Valid
    private Map<String, Settings> services = new LinkedHashMap<>();

    public Settings getDefaults() {
        return defaults;
    }

    public void setDefaults(Settings defaults) {
        this.defaults = defaults;
    }

    public Map<String, Settings> getServices() {
        return services;
    }

    public void setServices(Map<String, Settings> services) {
        this.services = services;
    }

    /**
     * Configuration for the breaker named {@code service}.
     */
    public CircuitBreakerConfig resolve(String service) {
        CircuitBreakerConfig.Builder builder = CircuitBreakerConfig.defaults().toBuilder();
        defaults.applyTo(builder);
        Settings override = services.get(service);
        if (override != null) {
            override.applyTo(builder);
        }
        return builder.build();
    }

    /**
     * Partial breaker settings; null fields are left unchanged.
     */
    public static class Settings {

        @Positive(message = "Failure threshold must be positive")
        private Integer failureThreshold;

        @Positive(message = "Success threshold must be positive")
        private Integer successThreshold;

        private Duration recoveryTimeout;

        @Positive(message = "Half-open max concurrent must be positive")
        private Integer halfOpenMaxConcurrent;

        @DecimalMin(value = "0.0", message = "Failure rate threshold must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Failure rate threshold must be between 0 and 1")
        private Double failureRateThreshold;

        @Positive(message = "Min calls for rate must be positive")
        private Integer minCallsForRate;

        private Set<FailureKind> excludedFailureKinds;

        void applyTo(CircuitBreakerConfig.Builder builder) {
            if (failureThreshold != null) {
                builder.failureThreshold(failureThreshold);
            }
            if (successThreshold != null) {
                builder.successThreshold(successThreshold);
            }
            if (recoveryTimeout != null) {
                builder.recoveryTimeout(recoveryTimeout);
            }
            if (halfOpenMaxConcurrent != null) {
                builder.halfOpenMaxConcurrent(halfOpenMaxConcurrent);
            }
            if (failureRateThreshold != null) {
                builder.failureRateThreshold(failureRateThreshold);
            }
            if (minCallsForRate != null) {
                builder.minCallsForRate(minCallsForRate);
            }
            if (excludedFailureKinds != null) {
                builder.excludedFailureKinds(excludedFailureKinds);
            }
        }

        public Integer getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(Integer failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Integer getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(Integer successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public Integer getHalfOpenMaxConcurrent() {
            return halfOpenMaxConcurrent;
        }

        public void setHalfOpenMaxConcurrent(Integer halfOpenMaxConcurrent) {
            this.halfOpenMaxConcurrent = halfOpenMaxConcurrent;
        }

        public Double getFailureRateThreshold() {
            return failureRateThreshold;
        }

        public void setFailureRateThreshold(Double failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
        }

        public Integer getMinCallsForRate() {
            return minCallsForRate;
        }

        public void setMinCallsForRate(Integer minCallsForRate) {
            this.minCallsForRate = minCallsForRate;
        }

        public Set<FailureKind> getExcludedFailureKinds() {
            return excludedFailureKinds;
        }

        public void setExcludedFailureKinds(Set<FailureKind> excludedFailureKinds) {
            this.excludedFailureKinds = excludedFailureKinds;
        }
    }
}
