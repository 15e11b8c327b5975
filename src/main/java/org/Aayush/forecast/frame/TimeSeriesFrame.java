package org.Aayush.forecast.frame;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.core.time.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Normalized, immutable training history.
 *
 * <p>Construction drops (or rejects) non-finite values, deduplicates timestamps keeping
 * the last observation, sorts by time and derives the {@link FrameScaling} that every
 * downstream component uses. Timestamps are strictly increasing afterwards and the first
 * and last are distinguishable in epoch-day precision, so the scaled span is positive.</p>
 */
@Slf4j
public final class TimeSeriesFrame {
    private final List<Instant> timestamps;
    private final double[] epochDays;
    private final double[] values;
    private final double[] floors;
    private final double[] caps;
    private final Map<String, double[]> regressorColumns;
    private final FrameScaling scaling;
    private final double[] scaledTimes;
    private final double[] scaledValues;

    private TimeSeriesFrame(List<Observation> rows, ValueTransform transform) {
        int n = rows.size();
        List<Instant> stamps = new ArrayList<>(n);
        this.epochDays = new double[n];
        this.values = new double[n];
        this.floors = new double[n];
        this.caps = new double[n];
        Set<String> regressorNames = new LinkedHashSet<>();
        for (int i = 0; i < n; i++) {
            Observation row = rows.get(i);
            stamps.add(row.getTimestamp());
            epochDays[i] = TimeUtils.toEpochDays(row.getTimestamp());
            values[i] = transform.apply(row.getValue());
            floors[i] = row.getFloor() == null ? 0.0d : row.getFloor();
            caps[i] = row.getCap() == null ? Double.NaN : row.getCap();
            regressorNames.addAll(row.getRegressors().keySet());
        }
        this.timestamps = Collections.unmodifiableList(stamps);

        LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
        for (String name : regressorNames) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                Double raw = rows.get(i).getRegressors().get(name);
                column[i] = raw == null ? Double.NaN : raw;
            }
            columns.put(name, column);
        }
        this.regressorColumns = Collections.unmodifiableMap(columns);

        double maxAbs = 0.0d;
        for (int i = 0; i < n; i++) {
            maxAbs = Math.max(maxAbs, Math.abs(values[i] - floors[i]));
        }
        double yScale = maxAbs == 0.0d ? 1.0d : maxAbs;
        this.scaling = new FrameScaling(epochDays[0], epochDays[n - 1] - epochDays[0], yScale, transform);

        this.scaledTimes = new double[n];
        this.scaledValues = new double[n];
        for (int i = 0; i < n; i++) {
            scaledTimes[i] = scaling.toScaledTime(epochDays[i]);
            scaledValues[i] = (values[i] - floors[i]) / yScale;
        }
    }

    /**
     * Builds a frame with identity transform and the {@link NonFinitePolicy#DROP} policy.
     */
    public static TimeSeriesFrame of(List<Observation> observations) {
        return of(observations, ValueTransform.IDENTITY, NonFinitePolicy.DROP);
    }

    /**
     * Builds a validated frame.
     *
     * @param observations raw observations in any order.
     * @param transform value transform to apply.
     * @param nonFinitePolicy handling of NaN / infinite values.
     * @return normalized frame.
     * @throws InvalidInputException when no value is finite or the distinct timestamps do not span
     *         a positive epoch-day interval.
     */
    public static TimeSeriesFrame of(
            List<Observation> observations,
            ValueTransform transform,
            NonFinitePolicy nonFinitePolicy
    ) {
        Objects.requireNonNull(observations, "observations");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(nonFinitePolicy, "nonFinitePolicy");

        TreeMap<Instant, Observation> byTimestamp = new TreeMap<>();
        int nonFinite = 0;
        int duplicates = 0;
        for (Observation observation : observations) {
            Observation row = Objects.requireNonNull(observation, "observation");
            Objects.requireNonNull(row.getTimestamp(), "observation.timestamp");
            if (!Double.isFinite(row.getValue())) {
                if (nonFinitePolicy == NonFinitePolicy.REJECT) {
                    throw new InvalidInputException(
                            InvalidInputException.REASON_NON_FINITE_VALUE,
                            "non-finite value " + row.getValue() + " at " + row.getTimestamp()
                    );
                }
                nonFinite++;
                continue;
            }
            if (byTimestamp.put(row.getTimestamp(), row) != null) {
                duplicates++;
            }
        }

        if (byTimestamp.isEmpty() && nonFinite > 0) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_ALL_VALUES_NON_FINITE,
                    "all " + nonFinite + " observed values are non-finite"
            );
        }
        if (byTimestamp.size() < 2) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_HISTORY_TOO_SHORT,
                    "history needs at least 2 distinct timestamps, got " + byTimestamp.size()
            );
        }
        Instant first = byTimestamp.firstKey();
        Instant last = byTimestamp.lastKey();
        if (!(TimeUtils.toEpochDays(last) > TimeUtils.toEpochDays(first))) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_HISTORY_TOO_SHORT,
                    "history span " + Duration.between(first, last) + " is below the supported time resolution"
            );
        }
        if (nonFinite > 0 || duplicates > 0) {
            log.debug("Normalized history: dropped {} non-finite and {} duplicate observations", nonFinite, duplicates);
        }
        return new TimeSeriesFrame(new ArrayList<>(byTimestamp.values()), transform);
    }

    public int size() {
        return timestamps.size();
    }

    public Instant start() {
        return timestamps.get(0);
    }

    public Instant end() {
        return timestamps.get(timestamps.size() - 1);
    }

    /**
     * Returns sorted, distinct timestamps.
     */
    public List<Instant> timestamps() {
        return timestamps;
    }

    public FrameScaling scaling() {
        return scaling;
    }

    /**
     * Maps an instant into the frame's scaled time coordinate.
     */
    public double toScaled(Instant timestamp) {
        return scaling.toScaled(timestamp);
    }

    /**
     * Maps a scaled value back to observed units assuming a zero floor.
     */
    public double fromScaled(double scaled) {
        return scaling.fromScaled(scaled);
    }

    public double spanDays() {
        return scaling.spanDays();
    }

    public double[] epochDays() {
        return epochDays.clone();
    }

    public double[] scaledTimes() {
        return scaledTimes.clone();
    }

    public double[] scaledValues() {
        return scaledValues.clone();
    }

    /**
     * Returns transformed (unscaled) values.
     */
    public double[] values() {
        return values.clone();
    }

    public double[] floors() {
        return floors.clone();
    }

    /**
     * Returns raw caps; {@code NaN} marks rows without a cap.
     */
    public double[] caps() {
        return caps.clone();
    }

    /**
     * Returns caps in scaled value space; {@code NaN} marks rows without a cap.
     */
    public double[] scaledCaps() {
        double[] scaled = new double[caps.length];
        for (int i = 0; i < caps.length; i++) {
            scaled[i] = (caps[i] - floors[i]) / scaling.yScale();
        }
        return scaled;
    }

    /**
     * Returns whether every row carries a cap.
     */
    public boolean hasCapEverywhere() {
        for (double cap : caps) {
            if (Double.isNaN(cap)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether all observed values are identical.
     */
    public boolean isConstant() {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the smallest spacing between consecutive timestamps, in days.
     */
    public double minimumSpacingDays() {
        return TimeUtils.minimumSpacingDays(epochDays);
    }

    public Set<String> regressorNames() {
        return regressorColumns.keySet();
    }

    /**
     * Returns a regressor column; {@code NaN} marks missing values, absent names yield an all-NaN column.
     */
    public double[] regressorColumn(String name) {
        double[] column = regressorColumns.get(name);
        if (column == null) {
            double[] missing = new double[size()];
            Arrays.fill(missing, Double.NaN);
            return missing;
        }
        return column.clone();
    }

    /**
     * Returns the values of a regressor column that are present.
     */
    public double[] presentRegressorValues(String name) {
        DoubleArrayList present = new DoubleArrayList();
        for (double value : regressorColumn(name)) {
            if (!Double.isNaN(value)) {
                present.add(value);
            }
        }
        return present.toDoubleArray();
    }
}
