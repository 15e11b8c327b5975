package org.Aayush.forecast.optimizer;

/**
 * Strategy contract for turning an objective into fitted parameters.
 */
public interface EstimationStrategy {

    /**
     * Returns stable strategy identifier.
     */
    String id();

    /**
     * Estimates parameters.
     *
     * @param request objective, start point, optimizer and sampling options.
     * @return MAP point plus optional posterior samples.
     * @throws org.Aayush.forecast.core.error.ConvergenceException when estimation fails to converge.
     */
    Estimate estimate(EstimationRequest request);
}
