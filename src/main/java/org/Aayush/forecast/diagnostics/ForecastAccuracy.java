package org.Aayush.forecast.diagnostics;

import org.Aayush.forecast.engine.ForecastRow;
import org.apache.commons.math3.stat.descriptive.moment.Mean;

import java.util.List;
import java.util.Objects;

/**
 * Backtest metrics for forecast rows.
 */
public final class ForecastAccuracy {

    private ForecastAccuracy() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Compares rows with realized values.
     *
     * @param actuals realized values aligned with {@code rows}.
     * @param rows forecast rows.
     * @return accuracy summary.
     * @throws IllegalArgumentException when lengths differ, inputs are empty or an actual is non-finite.
     */
    public static AccuracyReport evaluate(double[] actuals, List<ForecastRow> rows) {
        Objects.requireNonNull(actuals, "actuals");
        Objects.requireNonNull(rows, "rows");
        if (actuals.length != rows.size()) {
            throw new IllegalArgumentException("actuals length " + actuals.length + " != rows " + rows.size());
        }
        if (actuals.length == 0) {
            throw new IllegalArgumentException("nothing to evaluate");
        }

        int n = actuals.length;
        double[] squared = new double[n];
        double[] absolute = new double[n];
        double[] covered = new double[n];
        double percentageSum = 0.0d;
        int percentageCount = 0;
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(actuals[i])) {
                throw new IllegalArgumentException("actual at row " + i + " is not finite");
            }
            ForecastRow row = Objects.requireNonNull(rows.get(i), "row");
            double error = actuals[i] - row.getYhat();
            squared[i] = error * error;
            absolute[i] = Math.abs(error);
            covered[i] = actuals[i] >= row.getYhatLower() && actuals[i] <= row.getYhatUpper() ? 1.0d : 0.0d;
            if (actuals[i] != 0.0d) {
                percentageSum += Math.abs(error / actuals[i]);
                percentageCount++;
            }
        }

        Mean mean = new Mean();
        double mse = mean.evaluate(squared);
        return new AccuracyReport(
                n,
                mse,
                Math.sqrt(mse),
                mean.evaluate(absolute),
                percentageCount == 0 ? Double.NaN : percentageSum / percentageCount,
                mean.evaluate(covered)
        );
    }
}
