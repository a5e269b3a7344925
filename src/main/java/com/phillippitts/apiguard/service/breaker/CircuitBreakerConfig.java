package com.phillippitts.apiguard.service.breaker;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable circuit breaker configuration.
 *
 * @param failureThreshold      consecutive failures (in CLOSED) that open the circuit
 * @param successThreshold      consecutive successes (in HALF_OPEN) that close it again
 * @param recoveryTimeout       time after the last failure before an OPEN circuit admits trial calls
 * @param halfOpenMaxConcurrent trial calls allowed in flight while HALF_OPEN
 * @param failureRateThreshold  lifetime failure fraction (0..1) that opens the circuit
 * @param minCallsForRate       recorded calls required before the failure rate is considered
 * @param excludedFailureKinds  failure kinds that are never counted
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        int successThreshold,
        Duration recoveryTimeout,
        int halfOpenMaxConcurrent,
        double failureRateThreshold,
        int minCallsForRate,
        Set<FailureKind> excludedFailureKinds
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 3;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_HALF_OPEN_MAX_CONCURRENT = 3;
    public static final double DEFAULT_FAILURE_RATE_THRESHOLD = 0.5;
    public static final int DEFAULT_MIN_CALLS_FOR_RATE = 10;

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, got: " + successThreshold);
        }
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
        if (recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative, got: " + recoveryTimeout);
        }
        if (halfOpenMaxConcurrent < 1) {
            throw new IllegalArgumentException(
                    "halfOpenMaxConcurrent must be >= 1, got: " + halfOpenMaxConcurrent);
        }
        if (failureRateThreshold < 0.0 || failureRateThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "failureRateThreshold must be between 0.0 and 1.0, got: " + failureRateThreshold);
        }
        if (minCallsForRate < 1) {
            throw new IllegalArgumentException("minCallsForRate must be >= 1, got: " + minCallsForRate);
        }
        excludedFailureKinds = excludedFailureKinds == null || excludedFailureKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(excludedFailureKinds));
    }

    /** Configuration with every default. */
    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .recoveryTimeout(recoveryTimeout)
                .halfOpenMaxConcurrent(halfOpenMaxConcurrent)
                .failureRateThreshold(failureRateThreshold)
                .minCallsForRate(minCallsForRate)
                .excludedFailureKinds(excludedFailureKinds);
    }

    /**
     * Fluent builder; unset values fall back to the defaults above.
     */
    public static final class Builder {
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;
        private Duration recoveryTimeout = DEFAULT_RECOVERY_TIMEOUT;
        private int halfOpenMaxConcurrent = DEFAULT_HALF_OPEN_MAX_CONCURRENT;
        private double failureRateThreshold = DEFAULT_FAILURE_RATE_THRESHOLD;
        private int minCallsForRate = DEFAULT_MIN_CALLS_FOR_RATE;
        private Set<FailureKind> excludedFailureKinds = Set.of();

        private Builder() {
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder successThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
            return this;
        }

        public Builder recoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
            return this;
        }

        public Builder halfOpenMaxConcurrent(int halfOpenMaxConcurrent) {
            this.halfOpenMaxConcurrent = halfOpenMaxConcurrent;
            return this;
        }

        public Builder failureRateThreshold(double failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
            return this;
        }

        public Builder minCallsForRate(int minCallsForRate) {
            this.minCallsForRate = minCallsForRate;
            return this;
        }

        public Builder excludedFailureKinds(Set<FailureKind> excludedFailureKinds) {
            this.excludedFailureKinds = excludedFailureKinds;
            return this;
        }

        public Builder exclude(FailureKind kind) {
            EnumSet<FailureKind> kinds = excludedFailureKinds.isEmpty()
                    ? EnumSet.noneOf(FailureKind.class)
                    : EnumSet.copyOf(excludedFailureKinds);
            kinds.add(kind);
            this.excludedFailureKinds = kinds;
            return this;
        }

        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(failureThreshold, successThreshold, recoveryTimeout,
                    halfOpenMaxConcurrent, failureRateThreshold, minCallsForRate, excludedFailureKinds);
        }
    }
}
