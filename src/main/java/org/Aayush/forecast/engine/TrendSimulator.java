package org.Aayush.forecast.engine;

import org.Aayush.forecast.trend.TrendModel;
import org.Aayush.forecast.trend.TrendParameters;
import org.apache.commons.math3.distribution.LaplaceDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Arrays;
import java.util.Objects;

/**
 * Draws future trend continuations for one prediction grid.
 *
 * <p>History covers scaled time {@code [0, 1]} and holds {@code S} changepoints, so future
 * changepoints arrive at rate {@code S} per unit of scaled time. Each trial draws
 * {@code Poisson(S (T - 1))} new changepoints uniformly on {@code (1, T]}, where {@code T} is
 * the latest requested time, with rate adjustments from {@code Laplace(0, mean|delta| + 1e-8)}.
 * Rows inside history are unaffected.</p>
 */
public final class TrendSimulator {
    static final double SCALE_EPSILON = 1e-8d;

    private final TrendModel trend;
    private final double[] changepoints;
    private final double[] times;
    private final double[] caps;
    private final double horizon;

    /**
     * Binds the simulator to a prediction grid.
     *
     * @param trend fitted trend variant.
     * @param changepoints historical scaled changepoints (sorted).
     * @param times scaled prediction times.
     * @param caps scaled capacities per prediction time.
     */
    public TrendSimulator(TrendModel trend, double[] changepoints, double[] times, double[] caps) {
        this.trend = Objects.requireNonNull(trend, "trend");
        this.changepoints = Objects.requireNonNull(changepoints, "changepoints").clone();
        this.times = Objects.requireNonNull(times, "times").clone();
        this.caps = Objects.requireNonNull(caps, "caps").clone();
        double max = Double.NEGATIVE_INFINITY;
        for (double t : this.times) {
            max = Math.max(max, t);
        }
        this.horizon = max;
    }

    /**
     * Expected number of new changepoints per trial.
     */
    public double expectedNewChangepoints() {
        if (horizon <= 1.0d || changepoints.length == 0) {
            return 0.0d;
        }
        return changepoints.length * (horizon - 1.0d);
    }

    /**
     * Simulates one scaled trend trajectory.
     *
     * @param fitted fitted trend parameters (historical deltas included).
     * @param random generator shared across trials of one prediction.
     * @return scaled trend per prediction time.
     */
    public double[] sample(TrendParameters fitted, RandomGenerator random) {
        double expected = expectedNewChangepoints();
        int added = 0;
        if (expected > 0.0d) {
            added = new PoissonDistribution(
                    random,
                    expected,
                    PoissonDistribution.DEFAULT_EPSILON,
                    PoissonDistribution.DEFAULT_MAX_ITERATIONS
            ).sample();
        }
        if (added == 0) {
            return trend.evaluate(times, caps, changepoints, fitted);
        }

        double[] future = new double[added];
        for (int j = 0; j < added; j++) {
            future[j] = 1.0d + random.nextDouble() * (horizon - 1.0d);
        }
        Arrays.sort(future);
        LaplaceDistribution laplace = new LaplaceDistribution(random, 0.0d, fitted.meanAbsoluteDelta() + SCALE_EPSILON);

        int historical = changepoints.length;
        double[] allChangepoints = Arrays.copyOf(changepoints, historical + added);
        double[] allDeltas = Arrays.copyOf(fitted.deltas(), historical + added);
        for (int j = 0; j < added; j++) {
            allChangepoints[historical + j] = future[j];
            allDeltas[historical + j] = laplace.sample();
        }
        return trend.evaluate(times, caps, allChangepoints, new TrendParameters(fitted.rate(), fitted.offset(), allDeltas));
    }
}
