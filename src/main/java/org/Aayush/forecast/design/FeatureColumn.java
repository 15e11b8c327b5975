package org.Aayush.forecast.design;

/**
 * One column of the design matrix.
 *
 * @param name unique column name.
 * @param component component the column contributes to (seasonality, holiday or regressor name).
 * @param mode additive or multiplicative combination.
 * @param priorScale standard deviation of the zero-centered Gaussian prior on its coefficient.
 */
public record FeatureColumn(String name, String component, ComponentMode mode, double priorScale) {

    public boolean multiplicative() {
        return mode == ComponentMode.MULTIPLICATIVE;
    }
}
