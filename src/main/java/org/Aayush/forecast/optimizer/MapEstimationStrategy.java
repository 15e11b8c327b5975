package org.Aayush.forecast.optimizer;

import java.util.List;

/**
 * Single maximum-a-posteriori point estimate.
 */
public final class MapEstimationStrategy implements EstimationStrategy {

    @Override
    public String id() {
        return EstimationMode.MAP.strategyId();
    }

    @Override
    public Estimate estimate(EstimationRequest request) {
        OptimizationResult optimum = request.getOptimizer().minimize(
                request.getObjective(),
                request.getStart(),
                request.getCancellation()
        );
        return new Estimate(optimum, List.of());
    }
}
