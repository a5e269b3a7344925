package com.phillippitts.apiguard.service.budget;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Bucket width of a cost time series. Buckets are aligned to UTC hour or day boundaries.
 */
public enum CostPeriod {
    HOURLY(ChronoUnit.HOURS),
    DAILY(ChronoUnit.DAYS);

    private final ChronoUnit unit;

    CostPeriod(ChronoUnit unit) {
        this.unit = unit;
    }

    public Duration width() {
        return unit.getDuration();
    }

    /**
     * {@code count} zero buckets ending with the one containing {@code now}, oldest first.
     */
    public List<CostBucket> emptySeries(Instant now, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got: " + count);
        }
        Instant first = firstStart(now, count);
        List<CostBucket> buckets = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            buckets.add(new CostBucket(first.plus(width().multipliedBy(i)), 0.0, 0));
        }
        return buckets;
    }

    /**
     * Position of {@code at} in the series built by {@link #emptySeries}, or -1 if outside it.
     */
    public int indexOf(Instant now, int count, Instant at) {
        Instant first = firstStart(now, count);
        Instant end = now.truncatedTo(unit).plus(width());
        if (at.isBefore(first) || !at.isBefore(end)) {
            return -1;
        }
        return (int) (Duration.between(first, at).toMillis() / width().toMillis());
    }

    /**
     * Parses {@code hourly}/{@code daily}, case-insensitively.
     */
    public static CostPeriod fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("period must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown period '" + value + "', expected hourly or daily", e);
        }
    }

    private Instant firstStart(Instant now, int count) {
        return now.truncatedTo(unit).minus(width().multipliedBy(count - 1L));
    }
}
