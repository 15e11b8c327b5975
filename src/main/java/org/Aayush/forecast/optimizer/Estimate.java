package org.Aayush.forecast.optimizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one estimation strategy.
 *
 * @param optimum MAP optimization result.
 * @param samples posterior parameter draws (empty for point estimation).
 */
public record Estimate(OptimizationResult optimum, List<double[]> samples) {

    public Estimate {
        List<double[]> copies = new ArrayList<>(samples.size());
        for (double[] sample : samples) {
            copies.add(sample.clone());
        }
        samples = List.copyOf(copies);
    }

    /**
     * Returns the MAP parameter vector.
     */
    public double[] point() {
        return optimum.point();
    }
}
