package org.Aayush.forecast.design;

import org.Aayush.forecast.core.time.TimeUtils;
import org.Aayush.forecast.frame.FuturePoint;
import org.Aayush.forecast.frame.TimeSeriesFrame;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Row-aligned raw inputs from which feature sources compute their columns.
 *
 * @param epochDays timestamps as fractional epoch days.
 * @param dates UTC calendar date of each row.
 * @param regressors raw regressor values by name; {@code NaN} marks missing values.
 */
public record FeatureInput(double[] epochDays, LocalDate[] dates, Map<String, double[]> regressors) {

    public int size() {
        return epochDays.length;
    }

    /**
     * Returns the raw column for {@code name}; absent names yield an all-{@code NaN} column.
     */
    public double[] regressor(String name) {
        double[] column = regressors.get(name);
        if (column == null) {
            column = new double[size()];
            Arrays.fill(column, Double.NaN);
        }
        return column;
    }

    /**
     * Collects training rows.
     */
    public static FeatureInput ofFrame(TimeSeriesFrame frame) {
        List<Instant> timestamps = frame.timestamps();
        LocalDate[] dates = new LocalDate[timestamps.size()];
        for (int i = 0; i < dates.length; i++) {
            dates[i] = TimeUtils.toUtcDate(timestamps.get(i));
        }
        Map<String, double[]> regressors = new HashMap<>();
        for (String name : frame.regressorNames()) {
            regressors.put(name, frame.regressorColumn(name));
        }
        return new FeatureInput(frame.epochDays(), dates, regressors);
    }

    /**
     * Collects prediction rows.
     */
    public static FeatureInput ofPoints(List<FuturePoint> points) {
        int n = points.size();
        double[] epochDays = new double[n];
        LocalDate[] dates = new LocalDate[n];
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < n; i++) {
            FuturePoint point = points.get(i);
            epochDays[i] = TimeUtils.toEpochDays(point.getTimestamp());
            dates[i] = TimeUtils.toUtcDate(point.getTimestamp());
            names.addAll(point.getRegressors().keySet());
        }
        Map<String, double[]> regressors = new HashMap<>();
        for (String name : names) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                Double raw = points.get(i).getRegressors().get(name);
                column[i] = raw == null ? Double.NaN : raw;
            }
            regressors.put(name, column);
        }
        return new FeatureInput(epochDays, dates, regressors);
    }
}
