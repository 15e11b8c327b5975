package org.Aayush.forecast.trend;

/**
 * Capability contract for trend growth variants.
 *
 * <p>All inputs and outputs are in the scaled coordinate system of the training frame:
 * time in {@code [0, 1]} over history, values divided by the frame's value scale.
 * Implementations are stateless and thread-safe.</p>
 */
public interface TrendModel {

    /**
     * Returns the growth mode implemented by this model.
     */
    GrowthMode growth();

    /**
     * Returns whether the capacity array is required.
     */
    default boolean requiresCapacity() {
        return false;
    }

    /**
     * Evaluates the trend at each scaled time.
     *
     * @param t scaled times.
     * @param cap scaled capacities per time (ignored unless {@link #requiresCapacity()}).
     * @param changepoints sorted scaled changepoint times.
     * @param parameters trend parameters.
     * @return trend values per time.
     */
    double[] evaluate(double[] t, double[] cap, double[] changepoints, TrendParameters parameters);

    /**
     * Computes partial derivatives of the trend with respect to {@code (rate, offset, deltas...)}.
     *
     * @return matrix of shape {@code t.length x (2 + changepoints.length)}.
     */
    double[][] gradient(double[] t, double[] cap, double[] changepoints, TrendParameters parameters);

    /**
     * Derives deterministic starting parameters from scaled history.
     *
     * @param t scaled history times (sorted).
     * @param y scaled history values.
     * @param cap scaled capacities (may contain {@code NaN} when unused).
     * @param changepointCount number of changepoint rate adjustments.
     */
    TrendParameters initialParameters(double[] t, double[] y, double[] cap, int changepointCount);

    /**
     * Places changepoints at evenly spaced history rows inside the leading {@code range} fraction.
     *
     * <p>With {@code h = floor(historySize * range)} rows available, the requested count is
     * reduced to {@code h - 1} when too large; rows are the rounded points of
     * {@code linspace(0, h - 1, count + 1)} without the first one.</p>
     *
     * @param historySize number of training rows.
     * @param requested requested changepoint count.
     * @param range leading fraction of history eligible for changepoints.
     * @return sorted history row indexes.
     */
    default int[] defaultChangepoints(int historySize, int requested, double range) {
        int eligible = (int) Math.floor(historySize * range);
        int count = requested;
        if (count + 1 > eligible) {
            count = eligible - 1;
        }
        if (count <= 0) {
            return new int[0];
        }
        int[] indexes = new int[count];
        double step = (eligible - 1) / (double) count;
        for (int i = 1; i <= count; i++) {
            indexes[i - 1] = (int) Math.rint(i * step);
        }
        return indexes;
    }
}
