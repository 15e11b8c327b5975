package org.Aayush.forecast.optimizer;

import org.Aayush.forecast.core.concurrent.CancellationToken;

/**
 * Capability contract for numerical minimizers.
 *
 * <p>Implementations must be deterministic for a given start point and must check the
 * cancellation token between iterations.</p>
 */
public interface Optimizer {

    /**
     * Minimizes {@code function} from {@code start}.
     *
     * @param function objective.
     * @param start starting point (not modified).
     * @param cancellation cooperative cancellation token.
     * @return converged result.
     * @throws org.Aayush.forecast.core.error.ConvergenceException when the budget is exhausted
     *         or the objective is non-finite at the start.
     * @throws org.Aayush.forecast.core.error.ForecastCancelledException when cancelled.
     */
    OptimizationResult minimize(DifferentiableFunction function, double[] start, CancellationToken cancellation);
}
