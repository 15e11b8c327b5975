package org.Aayush.forecast.optimizer;

import lombok.Builder;
import lombok.Value;
import org.Aayush.forecast.core.concurrent.CancellationToken;

/**
 * Inputs shared by all estimation strategies.
 */
@Value
@Builder
public class EstimationRequest {
    /** Objective bound to training data. */
    ForecastObjective objective;
    /** Starting parameter vector. */
    double[] start;
    /** Minimizer used for the MAP search. */
    Optimizer optimizer;
    /** Number of posterior draws, for sampling strategies. */
    int posteriorSamples;
    /** Seed for posterior draws. */
    long randomSeed;
    /** Cooperative cancellation token. */
    @Builder.Default
    CancellationToken cancellation = CancellationToken.none();
}
