package com.phillippitts.apiguard.service.alert;

/**
 * Outbound port for notable governance events (breaker state changes, budget thresholds,
 * rate-limit exhaustion).
 *
 * <p>Implementations must be fast and must not throw: they are called on the caller's thread
 * right after a component releases its lock. Delivery, retry and deduplication belong to the
 * implementation.
 */
@FunctionalInterface
public interface AlertSink {

    /** Sink that drops every alert. Default for components built outside Spring. */
    AlertSink NOOP = alert -> { };

    /**
     * Delivers one alert.
     *
     * @param alert alert to deliver (never null)
     */
    void deliver(Alert alert);
}
