package org.Aayush.forecast.diagnostics;

/**
 * Point and interval accuracy of forecasts against realized values.
 *
 * @param count number of compared rows.
 * @param mse mean squared error.
 * @param rmse root mean squared error.
 * @param mae mean absolute error.
 * @param mape mean absolute percentage error over rows with a non-zero actual; {@code NaN} when there are none.
 * @param coverage fraction of actuals inside {@code [yhatLower, yhatUpper]}.
 */
public record AccuracyReport(int count, double mse, double rmse, double mae, double mape, double coverage) {
}
