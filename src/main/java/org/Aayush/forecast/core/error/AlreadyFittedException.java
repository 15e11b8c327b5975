package org.Aayush.forecast.core.error;

/**
 * Raised when {@code fit} is invoked on an engine that is fitted or currently fitting.
 *
 * <p>Engines are one-shot builders; a new engine instance is required to re-fit.</p>
 */
public final class AlreadyFittedException extends ForecastException {
    public static final String REASON_ALREADY_FITTED = "F_ALREADY_FITTED";
    public static final String REASON_FIT_IN_PROGRESS = "F_FIT_IN_PROGRESS";

    public AlreadyFittedException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
