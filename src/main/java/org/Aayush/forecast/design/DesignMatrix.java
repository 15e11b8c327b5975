package org.Aayush.forecast.design;

import java.util.List;

/**
 * Row-wise feature matrix for one set of timestamps plus the trend inputs for the same rows.
 */
public final class DesignMatrix {
    private final double[][] features;
    private final boolean[] multiplicative;
    private final List<FeatureColumn> columns;
    private final double[] scaledTimes;
    private final double[] scaledCaps;

    DesignMatrix(double[][] features, List<FeatureColumn> columns, double[] scaledTimes, double[] scaledCaps) {
        this.features = features;
        this.columns = columns;
        this.scaledTimes = scaledTimes;
        this.scaledCaps = scaledCaps;
        this.multiplicative = new boolean[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            multiplicative[c] = columns.get(c).multiplicative();
        }
    }

    public int rows() {
        return scaledTimes.length;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<FeatureColumn> columns() {
        return columns;
    }

    /**
     * Returns one feature value without copying.
     */
    public double feature(int row, int column) {
        return features[row][column];
    }

    public boolean isMultiplicative(int column) {
        return multiplicative[column];
    }

    public double[] scaledTimes() {
        return scaledTimes.clone();
    }

    /**
     * Returns scaled capacities; all {@code NaN} unless the trend needs them.
     */
    public double[] scaledCaps() {
        return scaledCaps.clone();
    }

    /**
     * Computes per-row additive and multiplicative sums for a coefficient vector.
     *
     * @param beta coefficients aligned with {@link #columns()}.
     * @param additiveOut output per-row additive sum.
     * @param multiplicativeOut output per-row multiplicative sum.
     */
    public void combine(double[] beta, double[] additiveOut, double[] multiplicativeOut) {
        for (int i = 0; i < features.length; i++) {
            double additive = 0.0d;
            double mult = 0.0d;
            double[] row = features[i];
            for (int c = 0; c < row.length; c++) {
                double term = row[c] * beta[c];
                if (multiplicative[c]) {
                    mult += term;
                } else {
                    additive += term;
                }
            }
            additiveOut[i] = additive;
            multiplicativeOut[i] = mult;
        }
    }

    /**
     * Sums the contribution of the columns that belong to {@code component} for each row.
     */
    public double[] componentContribution(String component, double[] beta) {
        double[] out = new double[features.length];
        for (int c = 0; c < columns.size(); c++) {
            if (!columns.get(c).component().equals(component)) {
                continue;
            }
            for (int i = 0; i < features.length; i++) {
                out[i] += features[i][c] * beta[c];
            }
        }
        return out;
    }
}
