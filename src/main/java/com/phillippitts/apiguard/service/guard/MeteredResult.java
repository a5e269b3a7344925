package com.phillippitts.apiguard.service.guard;

import java.util.Objects;

/**
 * Value returned by a metered call together with what it consumed.
 *
 * @param usage units consumed, or null when the provider reported none
 */
public record MeteredResult<T>(T value, UsageReport usage) {

    public static <T> MeteredResult<T> of(T value, UsageReport usage) {
        return new MeteredResult<>(value, Objects.requireNonNull(usage, "usage"));
    }

    public static <T> MeteredResult<T> unmetered(T value) {
        return new MeteredResult<>(value, null);
    }
}
