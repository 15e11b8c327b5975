package org.Aayush.forecast.optimizer;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Iteration budget and convergence tolerances for one fit.
 */
@Getter
@Accessors(fluent = true)
public final class OptimizerBudget {
    public static final int DEFAULT_MAX_ITERATIONS = 10_000;
    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-11d;
    public static final double DEFAULT_GRADIENT_TOLERANCE = 1e-8d;

    static final String PROP_MAX_ITERATIONS = "forecast.optimizer.maxIterations";
    static final String PROP_RELATIVE_TOLERANCE = "forecast.optimizer.relativeTolerance";
    static final String PROP_GRADIENT_TOLERANCE = "forecast.optimizer.gradientTolerance";

    private final int maxIterations;
    private final double relativeTolerance;
    private final double gradientTolerance;

    private OptimizerBudget(int maxIterations, double relativeTolerance, double gradientTolerance) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0");
        }
        if (!(relativeTolerance >= 0.0d) || !(gradientTolerance >= 0.0d)) {
            throw new IllegalArgumentException("tolerances must be >= 0");
        }
        this.maxIterations = maxIterations;
        this.relativeTolerance = relativeTolerance;
        this.gradientTolerance = gradientTolerance;
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static OptimizerBudget of(int maxIterations, double relativeTolerance, double gradientTolerance) {
        return new OptimizerBudget(maxIterations, relativeTolerance, gradientTolerance);
    }

    /**
     * Loads budget values from system properties, falling back to built-in defaults.
     */
    public static OptimizerBudget defaults() {
        return OptimizerBudget.of(
                readInt(PROP_MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS),
                readDouble(PROP_RELATIVE_TOLERANCE, DEFAULT_RELATIVE_TOLERANCE),
                readDouble(PROP_GRADIENT_TOLERANCE, DEFAULT_GRADIENT_TOLERANCE)
        );
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return value >= 0.0d && Double.isFinite(value) ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    @Override
    public String toString() {
        return "OptimizerBudget[maxIterations=" + maxIterations
                + ", relativeTolerance=" + relativeTolerance
                + ", gradientTolerance=" + gradientTolerance + "]";
    }
}
