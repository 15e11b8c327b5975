package org.Aayush.forecast.trend;

/**
 * Piecewise-linear growth.
 *
 * <p>{@code trend(t) = m + k t + sum_{s_j <= t} delta_j (t - s_j)}.</p>
 */
public final class LinearTrend implements TrendModel {

    @Override
    public GrowthMode growth() {
        return GrowthMode.LINEAR;
    }

    @Override
    public double[] evaluate(double[] t, double[] cap, double[] changepoints, TrendParameters parameters) {
        double[] trend = new double[t.length];
        double k = parameters.rate();
        double m = parameters.offset();
        for (int i = 0; i < t.length; i++) {
            double value = m + k * t[i];
            for (int j = 0; j < changepoints.length; j++) {
                if (t[i] >= changepoints[j]) {
                    value += parameters.delta(j) * (t[i] - changepoints[j]);
                }
            }
            trend[i] = value;
        }
        return trend;
    }

    @Override
    public double[][] gradient(double[] t, double[] cap, double[] changepoints, TrendParameters parameters) {
        double[][] gradient = new double[t.length][2 + changepoints.length];
        for (int i = 0; i < t.length; i++) {
            gradient[i][0] = t[i];
            gradient[i][1] = 1.0d;
            for (int j = 0; j < changepoints.length; j++) {
                if (t[i] >= changepoints[j]) {
                    gradient[i][2 + j] = t[i] - changepoints[j];
                }
            }
        }
        return gradient;
    }

    /**
     * Starts from the line through the first and last observation.
     */
    @Override
    public TrendParameters initialParameters(double[] t, double[] y, double[] cap, int changepointCount) {
        int last = t.length - 1;
        double k = (y[last] - y[0]) / (t[last] - t[0]);
        double m = y[0] - k * t[0];
        return new TrendParameters(k, m, new double[changepointCount]);
    }
}
