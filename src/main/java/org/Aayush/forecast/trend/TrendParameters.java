package org.Aayush.forecast.trend;

import java.util.Arrays;

/**
 * Trend parameters in scaled model space.
 *
 * @param rate base growth rate {@code k}.
 * @param offset base offset {@code m}.
 * @param deltas rate adjustment per changepoint.
 */
public record TrendParameters(double rate, double offset, double[] deltas) {

    public TrendParameters {
        deltas = deltas == null ? new double[0] : deltas.clone();
    }

    /**
     * Returns a copy of the rate adjustments.
     */
    @Override
    public double[] deltas() {
        return deltas.clone();
    }

    public int changepointCount() {
        return deltas.length;
    }

    /**
     * Returns one rate adjustment without copying.
     */
    public double delta(int index) {
        return deltas[index];
    }

    /**
     * Returns mean absolute rate adjustment, the scale used for simulated future changepoints.
     */
    public double meanAbsoluteDelta() {
        if (deltas.length == 0) {
            return 0.0d;
        }
        double sum = 0.0d;
        for (double delta : deltas) {
            sum += Math.abs(delta);
        }
        return sum / deltas.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TrendParameters that)) {
            return false;
        }
        return Double.compare(rate, that.rate) == 0
                && Double.compare(offset, that.offset) == 0
                && Arrays.equals(deltas, that.deltas);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Double.hashCode(rate) + Double.hashCode(offset)) + Arrays.hashCode(deltas);
    }

    @Override
    public String toString() {
        return "TrendParameters[rate=" + rate + ", offset=" + offset + ", deltas=" + Arrays.toString(deltas) + "]";
    }
}
