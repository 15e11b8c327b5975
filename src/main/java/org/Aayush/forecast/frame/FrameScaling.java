package org.Aayush.forecast.frame;

import org.Aayush.forecast.core.time.TimeUtils;

import java.time.Instant;

/**
 * Immutable coordinate system shared by trend, seasonality and prediction.
 *
 * <p>Time is mapped to {@code [0, 1]} over the training range; values are transformed,
 * shifted by the per-row floor and divided by {@code yScale}.</p>
 *
 * @param startEpochDays first training timestamp in epoch days.
 * @param spanDays training range length in days (strictly positive).
 * @param yScale value scale (strictly positive).
 * @param transform value transform applied before scaling.
 */
public record FrameScaling(double startEpochDays, double spanDays, double yScale, ValueTransform transform) {

    /**
     * Maps an instant to scaled model time.
     */
    public double toScaled(Instant timestamp) {
        return toScaledTime(TimeUtils.toEpochDays(timestamp));
    }

    /**
     * Maps epoch days to scaled model time.
     */
    public double toScaledTime(double epochDays) {
        return (epochDays - startEpochDays) / spanDays;
    }

    /**
     * Maps an observed value into scaled model space.
     */
    public double scaleValue(double observed, double floor) {
        return (transform.apply(observed) - floor) / yScale;
    }

    /**
     * Maps a scaled value back to observed units (zero floor).
     */
    public double fromScaled(double scaled) {
        return fromScaled(scaled, 0.0d);
    }

    /**
     * Maps a scaled value back to observed units.
     */
    public double fromScaled(double scaled, double floor) {
        return transform.inverse(scaled * yScale + floor);
    }
}
