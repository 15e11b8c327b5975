package org.Aayush.forecast.core.error;

/**
 * Malformed or insufficient history, future grid or configuration.
 */
public final class InvalidInputException extends ForecastException {
    public static final String REASON_HISTORY_TOO_SHORT = "F_HISTORY_TOO_SHORT";
    public static final String REASON_ALL_VALUES_NON_FINITE = "F_ALL_VALUES_NON_FINITE";
    public static final String REASON_NON_FINITE_VALUE = "F_NON_FINITE_VALUE";
    public static final String REASON_NON_POSITIVE_VALUE = "F_NON_POSITIVE_VALUE";
    public static final String REASON_CAP_REQUIRED = "F_CAP_REQUIRED";
    public static final String REASON_CAP_BELOW_FLOOR = "F_CAP_BELOW_FLOOR";
    public static final String REASON_REGRESSOR_MISSING = "F_REGRESSOR_MISSING";
    public static final String REASON_CHANGEPOINT_OUT_OF_RANGE = "F_CHANGEPOINT_OUT_OF_RANGE";
    public static final String REASON_CONFIG_INVALID = "F_CONFIG_INVALID";
    public static final String REASON_EMPTY_FUTURE = "F_EMPTY_FUTURE";

    public InvalidInputException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
