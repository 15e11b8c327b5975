package org.Aayush.forecast.optimizer;

/**
 * Terminal state of one minimization.
 *
 * @param point best parameter vector.
 * @param value objective at {@code point}.
 * @param iterations iterations performed.
 * @param termination why the search stopped.
 */
public record OptimizationResult(double[] point, double value, int iterations, Termination termination) {

    public OptimizationResult {
        point = point.clone();
    }

    @Override
    public double[] point() {
        return point.clone();
    }

    /**
     * Reasons a search stopped.
     */
    public enum Termination {
        RELATIVE_OBJECTIVE,
        GRADIENT_NORM,
        LINE_SEARCH_STALLED,
        CLOSED_FORM,
        /** Estimation did not complete; only seen on candidate models attached to a convergence failure. */
        INCOMPLETE
    }
}
