package org.Aayush.forecast.optimizer;

/**
 * Smooth scalar objective with analytic or numeric gradient.
 */
public interface DifferentiableFunction {

    /**
     * Returns the number of parameters.
     */
    int dimension();

    /**
     * Evaluates the objective and writes its gradient.
     *
     * @param point parameter vector (not modified).
     * @param gradient output array of length {@link #dimension()}.
     * @return objective value, possibly non-finite when {@code point} is infeasible.
     */
    double valueAndGradient(double[] point, double[] gradient);
}
