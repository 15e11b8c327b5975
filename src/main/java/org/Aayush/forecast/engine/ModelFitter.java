package org.Aayush.forecast.engine;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.concurrent.CancellationToken;
import org.Aayush.forecast.core.error.ConvergenceException;
import org.Aayush.forecast.design.DesignLayout;
import org.Aayush.forecast.design.DesignMatrix;
import org.Aayush.forecast.design.DesignMatrixBuilder;
import org.Aayush.forecast.frame.TimeSeriesFrame;
import org.Aayush.forecast.optimizer.Estimate;
import org.Aayush.forecast.optimizer.EstimationRequest;
import org.Aayush.forecast.optimizer.EstimationStrategy;
import org.Aayush.forecast.optimizer.EstimationStrategyRegistry;
import org.Aayush.forecast.optimizer.ForecastObjective;
import org.Aayush.forecast.optimizer.LbfgsOptimizer;
import org.Aayush.forecast.optimizer.OptimizationResult;
import org.Aayush.forecast.trend.GrowthMode;
import org.Aayush.forecast.trend.TrendParameters;

import java.util.List;

/**
 * One fit pass: plan the layout, build the training matrix, estimate parameters.
 */
@Slf4j
final class ModelFitter {
    private static final double INITIAL_SIGMA = 1.0d;

    private ModelFitter() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static FittedModel fit(
            TimeSeriesFrame history,
            ForecastConfig config,
            EstimationStrategyRegistry strategies,
            CancellationToken cancellation
    ) {
        DesignLayout layout = DesignMatrixBuilder.plan(history, config);
        cancellation.throwIfCancelled("design planning");
        DesignMatrix matrix = DesignMatrixBuilder.trainingMatrix(layout, history);
        double[] y = history.scaledValues();
        ForecastObjective objective = new ForecastObjective(layout, matrix, y);

        Estimate estimate;
        if (history.isConstant() && layout.trend().growth() != GrowthMode.LOGISTIC) {
            estimate = constantEstimate(layout, objective, y[0]);
            log.info("History is constant at {}; using closed-form zero-slope model", history.values()[0]);
        } else {
            double[] start = startingPoint(layout, history);
            EstimationStrategy strategy = strategies.strategy(config.getEstimationMode());
            EstimationRequest request = EstimationRequest.builder()
                    .objective(objective)
                    .start(start)
                    .optimizer(new LbfgsOptimizer(config.getOptimizerBudget()))
                    .posteriorSamples(config.getPosteriorSamples())
                    .randomSeed(config.getRandomSeed())
                    .cancellation(cancellation)
                    .build();
            try {
                estimate = strategy.estimate(request);
            } catch (ConvergenceException ex) {
                throw attachCandidate(ex, config, layout, history);
            }
        }

        OptimizationResult optimum = estimate.optimum();
        log.info(
                "Fit finished: termination={}, iterations={}, objective={}, posteriorSamples={}",
                optimum.termination(),
                optimum.iterations(),
                optimum.value(),
                estimate.samples().size()
        );
        return FittedModel.assemble(config, layout, history.start(), history.end(), history.size(), estimate);
    }

    private static Estimate constantEstimate(DesignLayout layout, ForecastObjective objective, double level) {
        TrendParameters trend = new TrendParameters(0.0d, level, new double[layout.changepointCount()]);
        double[] point = layout.pack(trend, new double[layout.columns().size()], DesignLayout.SIGMA_FLOOR);
        OptimizationResult closedForm = new OptimizationResult(
                point,
                objective.value(point),
                0,
                OptimizationResult.Termination.CLOSED_FORM
        );
        return new Estimate(closedForm, List.of());
    }

    private static double[] startingPoint(DesignLayout layout, TimeSeriesFrame history) {
        TrendParameters trend = layout.trend().initialParameters(
                history.scaledTimes(),
                history.scaledValues(),
                history.scaledCaps(),
                layout.changepointCount()
        );
        return layout.pack(trend, new double[layout.columns().size()], INITIAL_SIGMA);
    }

    private static ConvergenceException attachCandidate(
            ConvergenceException failure,
            ForecastConfig config,
            DesignLayout layout,
            TimeSeriesFrame history
    ) {
        double[] best = failure.bestPoint();
        if (best.length != layout.dimension() || !allFinite(best)) {
            return failure;
        }
        OptimizationResult partial = new OptimizationResult(
                best,
                failure.objectiveValue(),
                failure.iterations(),
                OptimizationResult.Termination.INCOMPLETE
        );
        FittedModel candidate = FittedModel.assemble(
                config,
                layout,
                history.start(),
                history.end(),
                history.size(),
                new Estimate(partial, List.of())
        );
        log.warn("Estimation failed ({}); attaching best iterate as candidate model", failure.reasonCode());
        return new FitConvergenceException(failure, candidate);
    }

    private static boolean allFinite(double[] values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
