package org.Aayush.forecast.trend;

/**
 * Piecewise-logistic growth saturating at a per-timestamp capacity.
 *
 * <p>{@code trend(t) = cap(t) / (1 + exp(-(k + a(t).delta) (t - (m + a(t).gamma))))}, where the
 * offset adjustments {@code gamma} keep the curve continuous at every changepoint.</p>
 */
public final class LogisticTrend implements TrendModel {
    private static final double RELATIVE_STEP = 1e-6d;
    private static final double MIN_RATE = 1e-12d;

    @Override
    public GrowthMode growth() {
        return GrowthMode.LOGISTIC;
    }

    @Override
    public boolean requiresCapacity() {
        return true;
    }

    @Override
    public double[] evaluate(double[] t, double[] cap, double[] changepoints, TrendParameters parameters) {
        double k = parameters.rate();
        double m = parameters.offset();
        double[] deltas = parameters.deltas();
        double[] gammas = offsetAdjustments(k, m, deltas, changepoints);

        double[] trend = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            double rate = k;
            double offset = m;
            for (int j = 0; j < changepoints.length; j++) {
                if (t[i] >= changepoints[j]) {
                    rate += deltas[j];
                    offset += gammas[j];
                }
            }
            trend[i] = cap[i] * sigmoid(rate * (t[i] - offset));
        }
        return trend;
    }

    /**
     * Differentiates numerically; the offset adjustments depend on every earlier delta.
     */
    @Override
    public double[][] gradient(double[] t, double[] cap, double[] changepoints, TrendParameters parameters) {
        int width = 2 + changepoints.length;
        double[] theta = new double[width];
        theta[0] = parameters.rate();
        theta[1] = parameters.offset();
        System.arraycopy(parameters.deltas(), 0, theta, 2, changepoints.length);

        double[][] gradient = new double[t.length][width];
        for (int p = 0; p < width; p++) {
            double h = RELATIVE_STEP * Math.max(1.0d, Math.abs(theta[p]));
            double original = theta[p];
            theta[p] = original + h;
            double[] upper = evaluate(t, cap, changepoints, fromVector(theta));
            theta[p] = original - h;
            double[] lower = evaluate(t, cap, changepoints, fromVector(theta));
            theta[p] = original;
            for (int i = 0; i < t.length; i++) {
                gradient[i][p] = (upper[i] - lower[i]) / (2.0d * h);
            }
        }
        return gradient;
    }

    /**
     * Solves the logistic curve through the first and last observation.
     */
    @Override
    public TrendParameters initialParameters(double[] t, double[] y, double[] cap, int changepointCount) {
        int last = t.length - 1;
        double span = t[last] - t[0];
        double c0 = cap[0];
        double c1 = cap[last];
        double y0 = Math.max(0.01d * c0, Math.min(0.99d * c0, y[0]));
        double y1 = Math.max(0.01d * c1, Math.min(0.99d * c1, y[last]));
        double r0 = c0 / y0;
        double r1 = c1 / y1;
        if (Math.abs(r0 - r1) <= 0.01d) {
            r0 = 1.05d * r0;
        }
        double l0 = Math.log(r0 - 1.0d);
        double l1 = Math.log(r1 - 1.0d);
        double m = l0 * span / (l0 - l1);
        double k = (l0 - l1) / span;
        return new TrendParameters(k, m, new double[changepointCount]);
    }

    static double[] offsetAdjustments(double k, double m, double[] deltas, double[] changepoints) {
        double[] gammas = new double[changepoints.length];
        double rateBefore = k;
        double offset = m;
        for (int j = 0; j < changepoints.length; j++) {
            double rateAfter = rateBefore + deltas[j];
            if (Math.abs(rateAfter) < MIN_RATE) {
                gammas[j] = 0.0d;
            } else {
                gammas[j] = (changepoints[j] - offset) * (1.0d - rateBefore / rateAfter);
            }
            offset += gammas[j];
            rateBefore = rateAfter;
        }
        return gammas;
    }

    private static double sigmoid(double z) {
        if (z >= 0.0d) {
            return 1.0d / (1.0d + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0d + e);
    }

    private static TrendParameters fromVector(double[] theta) {
        double[] deltas = new double[theta.length - 2];
        System.arraycopy(theta, 2, deltas, 0, deltas.length);
        return new TrendParameters(theta[0], theta[1], deltas);
    }
}
