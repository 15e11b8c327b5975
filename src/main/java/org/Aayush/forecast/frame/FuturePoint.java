package org.Aayush.forecast.frame;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One timestamp of the prediction grid plus the exogenous values the model needs there.
 */
@Value
@Builder
public class FuturePoint {
    Instant timestamp;
    /** Carrying capacity, required for logistic growth. */
    Double cap;
    /** Saturating minimum, {@code null} means zero. */
    Double floor;
    /** Regressor values keyed by name, required for every fitted regressor. */
    @Singular
    Map<String, Double> regressors;

    public static FuturePoint of(Instant timestamp) {
        return FuturePoint.builder().timestamp(timestamp).build();
    }
}
