package org.Aayush.forecast.engine;

import org.Aayush.forecast.trend.GrowthMode;
import org.Aayush.forecast.trend.TrendModel;
import org.Aayush.forecast.trend.TrendModels;
import org.Aayush.forecast.trend.TrendParameters;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Trend Simulator Tests")
class TrendSimulatorTest {
    private static final TrendModel LINEAR = TrendModels.forGrowth(GrowthMode.LINEAR);
    private static final double[] CHANGEPOINTS = {0.2d, 0.4d, 0.6d, 0.8d};
    private static final double[] NO_CAPS = {Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN};
    private static final double[] TIMES = {0.1d, 0.5d, 1.0d, 1.5d, 2.0d};

    @Test
    @DisplayName("Expected new changepoints scale with horizon past history")
    void testExpectedNewChangepoints() {
        assertEquals(4.0d, new TrendSimulator(LINEAR, CHANGEPOINTS, TIMES, NO_CAPS).expectedNewChangepoints(), 1e-12);
        assertEquals(
                0.0d,
                new TrendSimulator(LINEAR, CHANGEPOINTS, new double[]{0.3d, 0.9d}, new double[2]).expectedNewChangepoints(),
                0.0d
        );
        assertEquals(0.0d, new TrendSimulator(LINEAR, new double[0], TIMES, NO_CAPS).expectedNewChangepoints(), 0.0d);
    }

    @Test
    @DisplayName("Rows inside history keep the fitted trend")
    void testHistoryRowsUnchanged() {
        TrendParameters fitted = new TrendParameters(1.0d, 0.5d, new double[]{0.3d, -0.2d, 0.4d, -0.1d});
        double[] expected = LINEAR.evaluate(TIMES, NO_CAPS, CHANGEPOINTS, fitted);
        TrendSimulator simulator = new TrendSimulator(LINEAR, CHANGEPOINTS, TIMES, NO_CAPS);
        Well19937c random = new Well19937c(3L);

        for (int trial = 0; trial < 20; trial++) {
            double[] path = simulator.sample(fitted, random);
            assertEquals(expected[0], path[0], 0.0d);
            assertEquals(expected[1], path[1], 0.0d);
            assertEquals(expected[2], path[2], 0.0d);
        }
    }

    @Test
    @DisplayName("Zero historical deltas continue the line almost exactly")
    void testZeroDeltasContinueLine() {
        TrendParameters fitted = new TrendParameters(2.0d, 1.0d, new double[4]);
        double[] path = new TrendSimulator(LINEAR, CHANGEPOINTS, TIMES, NO_CAPS).sample(fitted, new Well19937c(5L));
        for (int i = 0; i < TIMES.length; i++) {
            assertEquals(1.0d + 2.0d * TIMES[i], path[i], 1e-6);
        }
    }

    @Test
    @DisplayName("Same seed yields the same trajectory")
    void testSeededReproducibility() {
        TrendParameters fitted = new TrendParameters(1.0d, 0.0d, new double[]{0.5d, -0.5d, 0.5d, -0.5d});
        TrendSimulator simulator = new TrendSimulator(LINEAR, CHANGEPOINTS, TIMES, NO_CAPS);
        assertArrayEquals(simulator.sample(fitted, new Well19937c(9L)), simulator.sample(fitted, new Well19937c(9L)));
    }
}
