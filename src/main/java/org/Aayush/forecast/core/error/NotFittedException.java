package org.Aayush.forecast.core.error;

/**
 * Raised when prediction is requested before a successful fit.
 */
public final class NotFittedException extends ForecastException {
    public static final String REASON_NOT_FITTED = "F_NOT_FITTED";

    public NotFittedException(String message) {
        super(REASON_NOT_FITTED, message);
    }
}
