package com.phillippitts.apiguard.service.alert;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured notable event emitted by the governance core.
 *
 * @param level     severity
 * @param source    emitting component ({@code circuit_breaker}, {@code rate_limiter}, {@code budget_tracker})
 * @param message   human-readable summary
 * @param metadata  technical context (service name, counts, amounts); values may be null
 * @param timestamp when the alert was raised
 */
public record Alert(
        AlertLevel level,
        String source,
        String message,
        Map<String, Object> metadata,
        Instant timestamp
) {
    public static final String SOURCE_CIRCUIT_BREAKER = "circuit_breaker";
    public static final String SOURCE_RATE_LIMITER = "rate_limiter";
    public static final String SOURCE_BUDGET_TRACKER = "budget_tracker";

    public Alert {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(message, "message");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
