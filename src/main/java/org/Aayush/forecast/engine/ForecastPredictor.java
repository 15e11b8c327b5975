package org.Aayush.forecast.engine;

import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.concurrent.CancellationToken;
import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.DesignLayout;
import org.Aayush.forecast.design.DesignMatrix;
import org.Aayush.forecast.design.FeatureColumn;
import org.Aayush.forecast.design.FeatureInput;
import org.Aayush.forecast.frame.FrameScaling;
import org.Aayush.forecast.frame.FuturePoint;
import org.Aayush.forecast.trend.TrendParameters;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Stateless evaluation of a {@link FittedModel} on a prediction grid.
 *
 * <p>Point forecasts evaluate every component with the MAP parameters. Intervals come from
 * simulated trajectories: each trial continues the trend with {@link TrendSimulator}, uses a
 * posterior draw for the remaining parameters when the model carries any, and adds one Gaussian
 * observation-noise draw shared by every row of the trajectory. Beyond the history the distances
 * from {@code yhat} to each bound are carried forward as running maxima in time order, so the
 * interval never narrows as the horizon grows. The generator is seeded from the configuration on
 * every call, so repeated predictions on the same grid are bit-identical.</p>
 */
@Slf4j
public final class ForecastPredictor {

    private ForecastPredictor() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Predicts without cancellation support.
     */
    public static List<ForecastRow> predict(FittedModel model, List<FuturePoint> points, boolean includeComponents) {
        return predict(model, points, includeComponents, CancellationToken.none());
    }

    /**
     * Predicts one row per future point, in input order.
     *
     * @param model fitted model.
     * @param points prediction grid; may overlap history.
     * @param includeComponents whether rows carry per-component contributions.
     * @param cancellation checked between simulation trials.
     * @return forecast rows aligned with {@code points}.
     * @throws InvalidInputException when the grid is empty or lacks required caps / regressors.
     */
    public static List<ForecastRow> predict(
            FittedModel model,
            List<FuturePoint> points,
            boolean includeComponents,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(points, "points");
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        if (points.isEmpty()) {
            throw new InvalidInputException(InvalidInputException.REASON_EMPTY_FUTURE, "prediction grid is empty");
        }

        DesignLayout layout = model.layout();
        FrameScaling scaling = layout.scaling();
        int n = points.size();
        double[] times = new double[n];
        double[] floors = new double[n];
        double[] caps = new double[n];
        for (int i = 0; i < n; i++) {
            FuturePoint point = Objects.requireNonNull(points.get(i), "point");
            Objects.requireNonNull(point.getTimestamp(), "point.timestamp");
            times[i] = scaling.toScaled(point.getTimestamp());
            floors[i] = point.getFloor() == null ? 0.0d : point.getFloor();
            caps[i] = scaledCap(point, floors[i], scaling, layout.trend().requiresCapacity());
        }

        DesignMatrix matrix = layout.matrix(FeatureInput.ofPoints(points), times, caps);
        double[] changepoints = layout.scaledChangepoints();
        TrendParameters trendParameters = model.trendParameters();
        double[] beta = model.coefficients();
        double[] trend = layout.trend().evaluate(times, caps, changepoints, trendParameters);
        double[] additive = new double[n];
        double[] multiplicative = new double[n];
        matrix.combine(beta, additive, multiplicative);

        double yScale = scaling.yScale();
        double[] yhat = new double[n];
        for (int i = 0; i < n; i++) {
            yhat[i] = scaling.transform().inverse(combine(trend[i], additive[i], multiplicative[i], floors[i], yScale));
        }

        double[] lower = yhat;
        double[] upper = yhat;
        ForecastConfig config = model.config();
        if (config.getUncertaintySamples() > 0) {
            double[][] bounds = intervals(model, matrix, times, caps, floors, yhat, token);
            lower = bounds[0];
            upper = bounds[1];
        }

        Map<String, double[]> contributions = includeComponents ? contributions(layout, matrix, beta) : Map.of();
        List<ForecastRow> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ForecastRow.ForecastRowBuilder row = ForecastRow.builder()
                    .timestamp(points.get(i).getTimestamp())
                    .yhat(yhat[i])
                    .yhatLower(lower[i])
                    .yhatUpper(upper[i])
                    .trend(trend[i] * yScale + floors[i])
                    .additiveTerms(additive[i] * yScale)
                    .multiplicativeTerms(multiplicative[i]);
            for (Map.Entry<String, double[]> component : contributions.entrySet()) {
                row.component(component.getKey(), component.getValue()[i]);
            }
            rows.add(row.build());
        }
        log.debug("Predicted {} rows with {} simulated trajectories", n, config.getUncertaintySamples());
        return rows;
    }

    private static double[][] intervals(
            FittedModel model,
            DesignMatrix matrix,
            double[] times,
            double[] caps,
            double[] floors,
            double[] yhat,
            CancellationToken token
    ) {
        DesignLayout layout = model.layout();
        FrameScaling scaling = layout.scaling();
        ForecastConfig config = model.config();
        int n = times.length;
        int trials = config.getUncertaintySamples();
        boolean noise = config.isIncludeObservationNoise();
        RandomGenerator random = new Well19937c(config.getRandomSeed());
        TrendSimulator simulator = new TrendSimulator(layout.trend(), layout.scaledChangepoints(), times, caps);

        double[] additive = new double[n];
        double[] multiplicative = new double[n];
        matrix.combine(model.coefficients(), additive, multiplicative);
        TrendParameters trendParameters = model.trendParameters();
        double sigma = model.sigma();

        double[][] simulated = new double[n][trials];
        for (int trial = 0; trial < trials; trial++) {
            token.throwIfCancelled("uncertainty simulation");
            if (model.sampleCount() > 0) {
                double[] draw = model.sampleView(trial % model.sampleCount());
                trendParameters = layout.trendParameters(draw);
                matrix.combine(layout.coefficients(draw), additive, multiplicative);
                sigma = layout.sigma(draw);
            }
            double[] path = simulator.sample(trendParameters, random);
            double error = noise ? random.nextGaussian() * sigma : 0.0d;
            for (int i = 0; i < n; i++) {
                double value = combine(path[i], additive[i] + error, multiplicative[i], floors[i], scaling.yScale());
                simulated[i][trial] = scaling.transform().inverse(value);
            }
        }

        double width = config.getIntervalWidth();
        double lowerQuantile = 100.0d * (1.0d - width) / 2.0d;
        double upperQuantile = 100.0d * (1.0d + width) / 2.0d;
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double[][] bounds = new double[2][n];
        for (int i = 0; i < n; i++) {
            percentile.setData(simulated[i]);
            bounds[0][i] = percentile.evaluate(lowerQuantile);
            bounds[1][i] = percentile.evaluate(upperQuantile);
        }
        widenForward(times, yhat, bounds);
        return bounds;
    }

    /**
     * Makes future bounds non-narrowing in time order; rows sharing a timestamp get the same band.
     */
    private static void widenForward(double[] times, double[] yhat, double[][] bounds) {
        int[] future = IntStream.range(0, times.length).filter(i -> times[i] > 1.0d).toArray();
        IntArrays.mergeSort(future, (a, b) -> Double.compare(times[a], times[b]));
        double below = 0.0d;
        double above = 0.0d;
        int start = 0;
        while (start < future.length) {
            int end = start;
            while (end < future.length && times[future[end]] == times[future[start]]) {
                below = Math.max(below, yhat[future[end]] - bounds[0][future[end]]);
                above = Math.max(above, bounds[1][future[end]] - yhat[future[end]]);
                end++;
            }
            for (int k = start; k < end; k++) {
                int i = future[k];
                bounds[0][i] = yhat[i] - below;
                bounds[1][i] = yhat[i] + above;
            }
            start = end;
        }
    }

    /**
     * Adds per-component contributions; multiplicative ones stay fractions of the trend.
     */
    private static Map<String, double[]> contributions(DesignLayout layout, DesignMatrix matrix, double[] beta) {
        Map<String, Boolean> multiplicative = new LinkedHashMap<>();
        for (FeatureColumn column : layout.columns()) {
            multiplicative.putIfAbsent(column.component(), column.multiplicative());
        }
        double yScale = layout.scaling().yScale();
        Map<String, double[]> out = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> component : multiplicative.entrySet()) {
            double[] values = matrix.componentContribution(component.getKey(), beta);
            if (!component.getValue()) {
                for (int i = 0; i < values.length; i++) {
                    values[i] *= yScale;
                }
            }
            out.put(component.getKey(), values);
        }
        return out;
    }

    private static double combine(double scaledTrend, double scaledAdditive, double multiplicative, double floor, double yScale) {
        return (scaledTrend * yScale + floor) * (1.0d + multiplicative) + scaledAdditive * yScale;
    }

    private static double scaledCap(FuturePoint point, double floor, FrameScaling scaling, boolean required) {
        if (!required) {
            return Double.NaN;
        }
        if (point.getCap() == null) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CAP_REQUIRED,
                    "logistic growth requires a cap at " + point.getTimestamp()
            );
        }
        double cap = point.getCap();
        if (!(cap > floor)) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CAP_BELOW_FLOOR,
                    "cap must exceed floor at " + point.getTimestamp()
            );
        }
        return (cap - floor) / scaling.yScale();
    }
}
