package com.phillippitts.apiguard.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions used by stats exports.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts a duration to fractional seconds (millisecond precision).
     *
     * @param duration duration, null treated as zero
     * @return seconds as a double
     */
    public static double toSeconds(Duration duration) {
        if (duration == null) {
            return 0.0;
        }
        return duration.toMillis() / 1000.0;
    }

    /**
     * Seconds elapsed between two instants, never negative.
     */
    public static double secondsBetween(Instant from, Instant to) {
        if (from == null || to == null || to.isBefore(from)) {
            return 0.0;
        }
        return toSeconds(Duration.between(from, to));
    }

    /**
     * ISO-8601 rendering of an instant, or null.
     */
    public static String isoOrNull(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    /**
     * Rounds half-up to the given number of decimal places. Only used when exporting values;
     * internal accumulation always keeps full precision.
     */
    public static double round(double value, int places) {
        return BigDecimal.valueOf(value)
                .setScale(places, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
