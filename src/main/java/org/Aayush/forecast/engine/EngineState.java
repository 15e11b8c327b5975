package org.Aayush.forecast.engine;

/**
 * Lifecycle of one {@link ForecastEngine}.
 *
 * <p>{@code UNFITTED -> FITTING -> FITTED}; a failed or cancelled fit returns to {@code UNFITTED}.</p>
 */
public enum EngineState {
    UNFITTED,
    FITTING,
    FITTED
}
