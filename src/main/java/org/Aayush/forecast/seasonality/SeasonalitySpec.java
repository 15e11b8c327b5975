package org.Aayush.forecast.seasonality;

import lombok.Builder;
import lombok.Value;
import org.Aayush.forecast.design.ComponentMode;

/**
 * Declared periodic component.
 */
@Value
@Builder(toBuilder = true)
public class SeasonalitySpec {
    /** Component name, unique across seasonalities. */
    String name;
    /** Period length in days. */
    double period;
    /** Number of sine/cosine harmonic pairs. */
    int fourierOrder;
    /** Gaussian prior scale; {@code null} inherits the engine default. */
    Double priorScale;
    /** Combination mode; {@code null} inherits the engine default. */
    ComponentMode mode;
}
