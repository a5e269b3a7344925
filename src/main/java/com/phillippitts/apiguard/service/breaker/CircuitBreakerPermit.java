package com.phillippitts.apiguard.service.breaker;

import java.util.Objects;

/**
 * Scoped admission granted by {@link CircuitBreaker#acquirePermit()}.
 *
 * <p>Exactly one outcome is recorded per permit. A permit closed without {@link #success()} or
 * {@link #failure(Throwable)} counts as a fatal failure, so an admitted HALF_OPEN trial call always
 * gives its slot back.
 *
 * <pre>{@code
 * try (CircuitBreakerPermit permit = breaker.acquirePermit()) {
 *     Result r = client.call();
 *     permit.success();
 *     return r;
 * }
 * }</pre>
 */
public final class CircuitBreakerPermit implements AutoCloseable {

    static final String ABANDONED_REASON = "Call abandoned without reporting an outcome";

    private final CircuitBreaker breaker;
    private boolean completed;

    CircuitBreakerPermit(CircuitBreaker breaker) {
        this.breaker = Objects.requireNonNull(breaker, "breaker");
    }

    public void success() {
        if (!completed) {
            completed = true;
            breaker.recordSuccess();
        }
    }

    public void failure(Throwable failure) {
        if (!completed) {
            completed = true;
            breaker.recordFailure(failure);
        }
    }

    public void failure(FailureKind kind, String reason) {
        if (!completed) {
            completed = true;
            breaker.recordFailure(kind, reason);
        }
    }

    public boolean isCompleted() {
        return completed;
    }

    @Override
    public void close() {
        if (!completed) {
            completed = true;
            breaker.recordFailure(FailureKind.FATAL, ABANDONED_REASON);
        }
    }
}
