package org.Aayush.forecast.core.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Shared deterministic time helpers for frame scaling, seasonality and holiday lookup.
 *
 * <p>All methods operate in UTC and are safe for pre-epoch timestamps.</p>
 */
public final class TimeUtils {

    public static final double SECONDS_PER_DAY = 86_400.0d;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts an instant to fractional days since the Unix epoch.
     *
     * @param instant timestamp (UTC).
     * @return days since 1970-01-01T00:00Z, negative before the epoch.
     */
    public static double toEpochDays(Instant instant) {
        double seconds = instant.getEpochSecond() + instant.getNano() / (double) NANOS_PER_SECOND;
        return seconds / SECONDS_PER_DAY;
    }

    /**
     * Converts fractional epoch days back to an instant, rounded to the nearest millisecond.
     */
    public static Instant fromEpochDays(double epochDays) {
        return Instant.ofEpochMilli(Math.round(epochDays * SECONDS_PER_DAY * 1_000.0d));
    }

    /**
     * Returns the UTC calendar date containing {@code instant}.
     */
    public static LocalDate toUtcDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    /**
     * Returns the instant at UTC midnight starting {@code date}.
     */
    public static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Returns the smallest positive gap, in days, between consecutive sorted epoch-day values.
     *
     * @param sortedEpochDays strictly increasing epoch-day values.
     * @return minimum spacing, or {@code +INF} when fewer than two values exist.
     */
    public static double minimumSpacingDays(double[] sortedEpochDays) {
        double min = Double.POSITIVE_INFINITY;
        for (int i = 1; i < sortedEpochDays.length; i++) {
            double gap = sortedEpochDays[i] - sortedEpochDays[i - 1];
            if (gap > 0.0d && gap < min) {
                min = gap;
            }
        }
        return min;
    }
}
