package org.Aayush.forecast.regressor;

import lombok.Builder;
import lombok.Value;
import org.Aayush.forecast.design.ComponentMode;

/**
 * Declared extra regressor.
 */
@Value
@Builder
public class RegressorSpec {
    /** Regressor name, matched against observation and future-point regressor keys. */
    String name;
    /** Gaussian prior scale; {@code null} inherits the engine holiday prior scale. */
    Double priorScale;
    /** Standardization policy. */
    @Builder.Default
    Standardization standardization = Standardization.AUTO;
    /** Combination mode; {@code null} inherits the engine seasonality mode. */
    ComponentMode mode;

    public static RegressorSpec of(String name) {
        return RegressorSpec.builder().name(name).build();
    }
}
