package org.Aayush.forecast.core.error;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when parameter estimation does not reach tolerance within its budget.
 *
 * <p>The best iterate is always attached so the caller can decide to accept it, retry,
 * or simplify the configuration.</p>
 */
@Getter
@Accessors(fluent = true)
public class ConvergenceException extends ForecastException {
    public static final String REASON_BUDGET_EXHAUSTED = "F_OPTIMIZER_BUDGET_EXHAUSTED";
    public static final String REASON_LINE_SEARCH_STALLED = "F_LINE_SEARCH_STALLED";
    public static final String REASON_NON_FINITE_OBJECTIVE = "F_NON_FINITE_OBJECTIVE";
    public static final String REASON_LAPLACE_HESSIAN_INVALID = "F_LAPLACE_HESSIAN_INVALID";

    private final int iterations;
    private final double objectiveValue;
    private final double[] bestPoint;

    /**
     * Creates a convergence failure.
     */
    public ConvergenceException(String reasonCode, String message, int iterations, double objectiveValue, double[] bestPoint) {
        this(reasonCode, message, iterations, objectiveValue, bestPoint, null);
    }

    /**
     * Creates a convergence failure with a cause.
     */
    public ConvergenceException(String reasonCode, String message, double[] bestPoint, Throwable cause) {
        this(reasonCode, message, 0, Double.NaN, bestPoint, cause);
    }

    /**
     * Re-raises {@code failure} with the same reason, message, iterate and cause.
     */
    protected ConvergenceException(ConvergenceException failure) {
        this(
                failure.reasonCode(),
                stripPrefix(failure.getMessage()),
                failure.iterations,
                failure.objectiveValue,
                failure.bestPoint,
                failure.getCause()
        );
    }

    private ConvergenceException(
            String reasonCode,
            String message,
            int iterations,
            double objectiveValue,
            double[] bestPoint,
            Throwable cause
    ) {
        super(reasonCode, message, cause);
        this.iterations = iterations;
        this.objectiveValue = objectiveValue;
        this.bestPoint = bestPoint == null ? new double[0] : bestPoint.clone();
    }

    /**
     * Returns a copy of the best parameter vector reached before the failure.
     */
    public double[] bestPoint() {
        return bestPoint.clone();
    }

    private static String stripPrefix(String message) {
        int close = message.indexOf("] ");
        return close >= 0 ? message.substring(close + 2) : message;
    }
}
