package org.Aayush.forecast.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.concurrent.CancellationToken;
import org.Aayush.forecast.core.error.ConvergenceException;

import java.util.Objects;

/**
 * Limited-memory BFGS quasi-Newton minimizer.
 *
 * <p>Search directions come from the standard two-loop recursion over the last
 * {@code memory} curvature pairs; step lengths from a bracketing weak-Wolfe line search.
 * The search stops when the relative objective change or the gradient infinity norm falls
 * under the budget tolerances. When no descent step exists even along the steepest-descent
 * direction the current point is returned only if its gradient is negligible relative to the
 * objective scale; otherwise the search fails with {@link ConvergenceException#REASON_LINE_SEARCH_STALLED}.</p>
 */
@Slf4j
public final class LbfgsOptimizer implements Optimizer {
    public static final int DEFAULT_MEMORY = 10;

    private static final double ARMIJO = 1e-4d;
    private static final double CURVATURE = 0.9d;
    private static final int MAX_LINE_SEARCH_STEPS = 60;
    private static final double MIN_STEP = 1e-20d;
    private static final double CURVATURE_EPSILON = 1e-12d;
    private static final double STALL_GRADIENT_FLOOR = 1e-6d;

    private final OptimizerBudget budget;
    private final int memory;

    /**
     * Creates an optimizer with default history size.
     */
    public LbfgsOptimizer(OptimizerBudget budget) {
        this(budget, DEFAULT_MEMORY);
    }

    /**
     * Creates an optimizer.
     *
     * @param budget iteration budget and tolerances.
     * @param memory number of stored curvature pairs.
     */
    public LbfgsOptimizer(OptimizerBudget budget, int memory) {
        this.budget = Objects.requireNonNull(budget, "budget");
        if (memory <= 0) {
            throw new IllegalArgumentException("memory must be > 0");
        }
        this.memory = memory;
    }

    public OptimizerBudget budget() {
        return budget;
    }

    @Override
    public OptimizationResult minimize(DifferentiableFunction function, double[] start, CancellationToken cancellation) {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(start, "start");
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        int n = function.dimension();
        if (start.length != n) {
            throw new IllegalArgumentException("start length " + start.length + " != dimension " + n);
        }

        double[] x = start.clone();
        double[] g = new double[n];
        double fx = function.valueAndGradient(x, g);
        if (!Double.isFinite(fx) || !allFinite(g)) {
            throw new ConvergenceException(
                    ConvergenceException.REASON_NON_FINITE_OBJECTIVE,
                    "objective or gradient is non-finite at the starting point",
                    0,
                    fx,
                    x
            );
        }
        if (normInf(g) <= budget.gradientTolerance()) {
            return new OptimizationResult(x, fx, 0, OptimizationResult.Termination.GRADIENT_NORM);
        }

        double[][] sHistory = new double[memory][];
        double[][] yHistory = new double[memory][];
        double[] rho = new double[memory];
        int stored = 0;
        int newest = -1;
        boolean restarted = false;

        for (int iteration = 1; iteration <= budget.maxIterations(); iteration++) {
            token.throwIfCancelled("optimization");

            double[] direction = direction(g, sHistory, yHistory, rho, stored, newest);
            double slope = dot(direction, g);
            if (!(slope < 0.0d)) {
                direction = negate(g);
                slope = -dot(g, g);
                stored = 0;
            }
            double initialStep = stored == 0 ? Math.min(1.0d, 1.0d / normInf(g)) : 1.0d;

            LineSearchPoint next = lineSearch(function, x, fx, direction, slope, initialStep);
            if (next == null) {
                if (!restarted && stored > 0) {
                    stored = 0;
                    restarted = true;
                    continue;
                }
                double gradientNorm = normInf(g);
                if (gradientNorm > stallTolerance(fx)) {
                    throw new ConvergenceException(
                            ConvergenceException.REASON_LINE_SEARCH_STALLED,
                            "line search found no decrease at iteration " + iteration
                                    + " with gradient norm " + gradientNorm,
                            iteration,
                            fx,
                            x
                    );
                }
                log.debug("Line search stalled after {} iterations at objective {}", iteration, fx);
                return new OptimizationResult(x, fx, iteration, OptimizationResult.Termination.LINE_SEARCH_STALLED);
            }
            restarted = false;

            double[] s = new double[n];
            double[] y = new double[n];
            for (int i = 0; i < n; i++) {
                s[i] = next.x[i] - x[i];
                y[i] = next.g[i] - g[i];
            }
            double sy = dot(s, y);
            if (sy > CURVATURE_EPSILON * dot(y, y)) {
                newest = (newest + 1) % memory;
                sHistory[newest] = s;
                yHistory[newest] = y;
                rho[newest] = 1.0d / sy;
                stored = Math.min(stored + 1, memory);
            }

            double previous = fx;
            x = next.x;
            fx = next.f;
            g = next.g;

            double scale = Math.max(1.0d, Math.max(Math.abs(previous), Math.abs(fx)));
            if (Math.abs(previous - fx) <= budget.relativeTolerance() * scale) {
                return new OptimizationResult(x, fx, iteration, OptimizationResult.Termination.RELATIVE_OBJECTIVE);
            }
            if (normInf(g) <= budget.gradientTolerance()) {
                return new OptimizationResult(x, fx, iteration, OptimizationResult.Termination.GRADIENT_NORM);
            }
        }

        throw new ConvergenceException(
                ConvergenceException.REASON_BUDGET_EXHAUSTED,
                "optimizer did not converge within " + budget.maxIterations() + " iterations",
                budget.maxIterations(),
                fx,
                x
        );
    }

    /**
     * Largest gradient norm at which a stalled line search still counts as stationary.
     */
    private double stallTolerance(double fx) {
        return Math.max(budget.gradientTolerance(), STALL_GRADIENT_FLOOR * Math.max(1.0d, Math.abs(fx)));
    }

    /**
     * Two-loop recursion computing {@code -H g}.
     */
    private static double[] direction(
            double[] g,
            double[][] sHistory,
            double[][] yHistory,
            double[] rho,
            int stored,
            int newest
    ) {
        double[] q = g.clone();
        if (stored == 0) {
            return negate(q);
        }
        int memory = sHistory.length;
        double[] alpha = new double[memory];
        for (int j = 0; j < stored; j++) {
            int idx = Math.floorMod(newest - j, memory);
            alpha[idx] = rho[idx] * dot(sHistory[idx], q);
            axpy(-alpha[idx], yHistory[idx], q);
        }
        double gamma = dot(sHistory[newest], yHistory[newest]) / dot(yHistory[newest], yHistory[newest]);
        for (int i = 0; i < q.length; i++) {
            q[i] *= gamma;
        }
        for (int j = stored - 1; j >= 0; j--) {
            int idx = Math.floorMod(newest - j, memory);
            double beta = rho[idx] * dot(yHistory[idx], q);
            axpy(alpha[idx] - beta, sHistory[idx], q);
        }
        return negate(q);
    }

    /**
     * Bracketing weak-Wolfe search; returns {@code null} when no decrease was found.
     */
    private static LineSearchPoint lineSearch(
            DifferentiableFunction function,
            double[] x,
            double fx,
            double[] direction,
            double slope,
            double initialStep
    ) {
        int n = x.length;
        double lo = 0.0d;
        double hi = Double.POSITIVE_INFINITY;
        double step = initialStep;
        LineSearchPoint bestSufficient = null;

        for (int attempt = 0; attempt < MAX_LINE_SEARCH_STEPS && step > MIN_STEP; attempt++) {
            double[] candidate = new double[n];
            for (int i = 0; i < n; i++) {
                candidate[i] = x[i] + step * direction[i];
            }
            double[] gradient = new double[n];
            double value = function.valueAndGradient(candidate, gradient);

            if (!Double.isFinite(value) || !allFinite(gradient) || value > fx + ARMIJO * step * slope) {
                hi = step;
                step = 0.5d * (lo + hi);
                continue;
            }
            LineSearchPoint point = new LineSearchPoint(candidate, value, gradient);
            if (bestSufficient == null || value < bestSufficient.f) {
                bestSufficient = point;
            }
            if (dot(gradient, direction) < CURVATURE * slope) {
                lo = step;
                step = Double.isInfinite(hi) ? 2.0d * step : 0.5d * (lo + hi);
                continue;
            }
            return point;
        }
        if (bestSufficient != null && bestSufficient.f < fx) {
            return bestSufficient;
        }
        return null;
    }

    private static boolean allFinite(double[] values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static void axpy(double alpha, double[] x, double[] y) {
        for (int i = 0; i < y.length; i++) {
            y[i] += alpha * x[i];
        }
    }

    private static double normInf(double[] values) {
        double max = 0.0d;
        for (double value : values) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }

    private static double[] negate(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = -values[i];
        }
        return out;
    }

    private record LineSearchPoint(double[] x, double f, double[] g) {
    }
}
