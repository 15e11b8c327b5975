package org.Aayush.forecast.trend;

import java.util.Arrays;

/**
 * Constant trend; rate and changepoints are unused.
 */
public final class FlatTrend implements TrendModel {

    @Override
    public GrowthMode growth() {
        return GrowthMode.FLAT;
    }

    @Override
    public double[] evaluate(double[] t, double[] cap, double[] changepoints, TrendParameters parameters) {
        double[] trend = new double[t.length];
        Arrays.fill(trend, parameters.offset());
        return trend;
    }

    @Override
    public double[][] gradient(double[] t, double[] cap, double[] changepoints, TrendParameters parameters) {
        double[][] gradient = new double[t.length][2 + changepoints.length];
        for (double[] row : gradient) {
            row[1] = 1.0d;
        }
        return gradient;
    }

    @Override
    public TrendParameters initialParameters(double[] t, double[] y, double[] cap, int changepointCount) {
        double sum = 0.0d;
        for (double value : y) {
            sum += value;
        }
        return new TrendParameters(0.0d, sum / y.length, new double[changepointCount]);
    }

    /**
     * Flat growth never places changepoints.
     */
    @Override
    public int[] defaultChangepoints(int historySize, int requested, double range) {
        return new int[0];
    }
}
