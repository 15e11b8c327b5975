package org.Aayush.forecast.trend;

import java.util.Objects;

/**
 * Factory for the built-in trend variants.
 */
public final class TrendModels {
    private static final TrendModel LINEAR = new LinearTrend();
    private static final TrendModel LOGISTIC = new LogisticTrend();
    private static final TrendModel FLAT = new FlatTrend();

    private TrendModels() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the shared stateless model for {@code growth}.
     */
    public static TrendModel forGrowth(GrowthMode growth) {
        return switch (Objects.requireNonNull(growth, "growth")) {
            case LINEAR -> LINEAR;
            case LOGISTIC -> LOGISTIC;
            case FLAT -> FLAT;
        };
    }
}
