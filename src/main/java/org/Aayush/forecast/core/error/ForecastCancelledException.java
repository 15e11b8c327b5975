package org.Aayush.forecast.core.error;

/**
 * Raised when a cooperative cancellation request is honored during fit or simulation.
 */
public final class ForecastCancelledException extends ForecastException {
    public static final String REASON_CANCELLED = "F_CANCELLED";

    public ForecastCancelledException(String message) {
        super(REASON_CANCELLED, message);
    }
}
