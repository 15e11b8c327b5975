package org.Aayush.forecast.optimizer;

/**
 * Parameter estimation strategies selectable by configuration.
 *
 * <p>{@code MAP} returns a single maximum-a-posteriori point; intervals then reflect
 * trend-extrapolation and observation noise only. {@code LAPLACE} also draws parameter
 * samples from a Gaussian approximation of the posterior around that point, so intervals
 * include parameter uncertainty.</p>
 */
public enum EstimationMode {
    MAP,
    LAPLACE;

    /**
     * Returns the registry id of the strategy implementing this mode.
     */
    public String strategyId() {
        return name();
    }
}
