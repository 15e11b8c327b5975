package org.Aayush.forecast.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One predicted timestamp.
 *
 * <p>{@code yhat}, {@code yhatLower} and {@code yhatUpper} are in observed units. {@code trend}
 * and {@code additiveTerms} are in model units (observed units unless a value transform is
 * configured); {@code multiplicativeTerms} is a fraction of the trend.</p>
 */
@Value
@Builder
public class ForecastRow {
    Instant timestamp;
    double yhat;
    double yhatLower;
    double yhatUpper;
    double trend;
    double additiveTerms;
    double multiplicativeTerms;
    /** Per-component contributions in column order; empty unless requested. */
    @Singular
    Map<String, Double> components;

    /**
     * Returns {@code yhatUpper - yhatLower}.
     */
    public double intervalWidth() {
        return yhatUpper - yhatLower;
    }
}
