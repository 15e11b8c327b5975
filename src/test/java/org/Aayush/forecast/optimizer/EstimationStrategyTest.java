package org.Aayush.forecast.optimizer;

import org.Aayush.forecast.core.concurrent.CancellationToken;
import org.Aayush.forecast.core.error.ForecastCancelledException;
import org.Aayush.forecast.design.DesignLayout;
import org.Aayush.forecast.design.DesignMatrixBuilder;
import org.Aayush.forecast.engine.ForecastConfig;
import org.Aayush.forecast.frame.TimeSeriesFrame;
import org.Aayush.forecast.seasonality.SeasonalitySetting;
import org.Aayush.forecast.testutil.SyntheticSeries;
import org.Aayush.forecast.trend.TrendParameters;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Estimation Strategy Tests")
class EstimationStrategyTest {

    @Test
    @DisplayName("Default registry exposes MAP and LAPLACE strategies")
    void testDefaultRegistryBuiltIns() {
        EstimationStrategyRegistry registry = EstimationStrategyRegistry.defaultRegistry();
        assertEquals(EstimationMode.MAP.strategyId(), registry.strategy(EstimationMode.MAP).id());
        assertEquals(EstimationMode.LAPLACE.strategyId(), registry.strategy(EstimationMode.LAPLACE).id());
        assertNotNull(registry.strategy("MAP"));
        assertNull(registry.strategy("UNKNOWN"));
        assertNull(registry.strategy((String) null));
        assertTrue(registry.strategyIds().containsAll(List.of("MAP", "LAPLACE")));
    }

    @Test
    @DisplayName("Custom strategy overrides built-in id deterministically")
    void testCustomStrategyOverride() {
        EstimationStrategy custom = new EstimationStrategy() {
            @Override
            public String id() {
                return EstimationMode.MAP.strategyId();
            }

            @Override
            public Estimate estimate(EstimationRequest request) {
                return new Estimate(
                        new OptimizationResult(request.getStart(), 0.0d, 0, OptimizationResult.Termination.CLOSED_FORM),
                        List.of()
                );
            }
        };

        EstimationStrategyRegistry registry = new EstimationStrategyRegistry(List.of(custom));
        assertSame(custom, registry.strategy(EstimationMode.MAP));
        assertEquals(2, registry.strategyIds().size());
    }

    @Test
    @DisplayName("Blank strategy ids are rejected")
    void testBlankIdRejected() {
        EstimationStrategy blank = new EstimationStrategy() {
            @Override
            public String id() {
                return "  ";
            }

            @Override
            public Estimate estimate(EstimationRequest request) {
                throw new UnsupportedOperationException();
            }
        };
        assertThrows(IllegalArgumentException.class, () -> new EstimationStrategyRegistry(List.of(blank)));
    }

    @Test
    @DisplayName("MAP strategy returns the optimum without samples")
    void testMapStrategy() {
        EstimationRequest request = request(0, 1L, CancellationToken.none());
        Estimate estimate = new MapEstimationStrategy().estimate(request);

        assertTrue(estimate.samples().isEmpty());
        assertTrue(estimate.optimum().value() < request.getObjective().value(request.getStart()));
    }

    @Test
    @DisplayName("Laplace strategy draws reproducible samples around the MAP point")
    void testLaplaceSamples() {
        LaplaceEstimationStrategy strategy = new LaplaceEstimationStrategy();
        Estimate first = strategy.estimate(request(64, 9L, CancellationToken.none()));
        Estimate second = strategy.estimate(request(64, 9L, CancellationToken.none()));

        assertEquals(64, first.samples().size());
        assertArrayEquals(first.point(), second.point());
        for (int s = 0; s < first.samples().size(); s++) {
            assertArrayEquals(first.samples().get(s), second.samples().get(s));
        }

        double[] mode = first.point();
        double[] mean = new double[mode.length];
        for (double[] sample : first.samples()) {
            assertEquals(mode.length, sample.length);
            for (int i = 0; i < sample.length; i++) {
                assertTrue(Double.isFinite(sample[i]));
                mean[i] += sample[i] / first.samples().size();
            }
        }
        assertEquals(mode[1], mean[1], 0.1d);
    }

    @Test
    @DisplayName("Finite-difference Hessian recovers a diagonal quadratic")
    void testHessian() {
        RealMatrix hessian = LaplaceEstimationStrategy.hessian(
                LbfgsOptimizerTest.quadratic(new double[]{1.0d, 4.0d}, new double[]{0.0d, 0.0d}),
                new double[]{0.5d, -0.5d},
                CancellationToken.none()
        );
        assertEquals(2.0d, hessian.getEntry(0, 0), 1e-6);
        assertEquals(8.0d, hessian.getEntry(1, 1), 1e-6);
        assertEquals(0.0d, hessian.getEntry(0, 1), 1e-6);
    }

    @Test
    @DisplayName("Cancelled request stops the estimation")
    void testCancellation() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        assertThrows(ForecastCancelledException.class, () -> new LaplaceEstimationStrategy().estimate(request(8, 1L, token)));
    }

    private static EstimationRequest request(int samples, long seed, CancellationToken token) {
        TimeSeriesFrame history = TimeSeriesFrame.of(SyntheticSeries.daily(60, d -> 3.0d + 0.05d * d, 0.3d, 2L));
        ForecastConfig config = ForecastConfig.builder()
                .changepointCount(3)
                .weeklySeasonality(SeasonalitySetting.disabled())
                .build();
        DesignLayout layout = DesignMatrixBuilder.plan(history, config);
        ForecastObjective objective = new ForecastObjective(
                layout,
                DesignMatrixBuilder.trainingMatrix(layout, history),
                history.scaledValues()
        );
        TrendParameters trend = layout.trend().initialParameters(
                history.scaledTimes(), history.scaledValues(), history.scaledCaps(), layout.changepointCount()
        );
        return EstimationRequest.builder()
                .objective(objective)
                .start(layout.pack(trend, new double[layout.columns().size()], 1.0d))
                .optimizer(new LbfgsOptimizer(OptimizerBudget.of(5000, 1e-12d, 1e-9d)))
                .posteriorSamples(samples)
                .randomSeed(seed)
                .cancellation(token)
                .build();
    }
}
