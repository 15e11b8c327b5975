package org.Aayush.forecast.frame;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One historical observation supplied by the caller.
 */
@Value
@Builder
public class Observation {
    /** Observation timestamp (UTC). */
    Instant timestamp;
    /** Observed value; non-finite values are handled by {@link NonFinitePolicy}. */
    double value;
    /** Carrying capacity for logistic growth, {@code null} when not used. */
    Double cap;
    /** Saturating minimum for logistic growth, {@code null} means zero. */
    Double floor;
    /** Extra regressor values keyed by regressor name. */
    @Singular
    Map<String, Double> regressors;

    /**
     * Creates a plain (timestamp, value) observation.
     */
    public static Observation of(Instant timestamp, double value) {
        return Observation.builder().timestamp(timestamp).value(value).build();
    }
}
