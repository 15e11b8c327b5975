package org.Aayush.forecast.regressor;

/**
 * Training-window statistics reused to transform regressor values at prediction time.
 *
 * @param mean training mean (0 when not standardized).
 * @param std training sample standard deviation (1 when not standardized or degenerate).
 * @param standardized whether the column is standardized.
 */
public record RegressorStatistics(double mean, double std, boolean standardized) {
    static final RegressorStatistics IDENTITY = new RegressorStatistics(0.0d, 1.0d, false);

    /**
     * Applies the stored transform.
     */
    public double apply(double raw) {
        return (raw - mean) / std;
    }
}
