package org.Aayush.forecast.diagnostics;

import org.Aayush.forecast.engine.ForecastRow;
import org.Aayush.forecast.testutil.SyntheticSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Forecast Accuracy Tests")
class ForecastAccuracyTest {

    @Test
    @DisplayName("Point and interval metrics over a small backtest")
    void testMetrics() {
        List<ForecastRow> rows = List.of(
                row(0, 10.0d, 9.0d, 11.0d),
                row(1, 20.0d, 19.0d, 21.0d),
                row(2, 5.0d, 4.0d, 6.0d),
                row(3, 8.0d, 7.0d, 9.0d)
        );
        AccuracyReport report = ForecastAccuracy.evaluate(new double[]{12.0d, 20.0d, 4.0d, 8.0d}, rows);

        assertEquals(4, report.count());
        assertEquals((4.0d + 0.0d + 1.0d + 0.0d) / 4.0d, report.mse(), 1e-12);
        assertEquals(Math.sqrt(1.25d), report.rmse(), 1e-12);
        assertEquals(0.75d, report.mae(), 1e-12);
        assertEquals((2.0d / 12.0d + 0.0d + 0.25d + 0.0d) / 4.0d, report.mape(), 1e-12);
        assertEquals(0.75d, report.coverage(), 1e-12);
    }

    @Test
    @DisplayName("Zero actuals are skipped by MAPE")
    void testZeroActuals() {
        List<ForecastRow> rows = List.of(row(0, 1.0d, 0.0d, 2.0d), row(1, 2.0d, 1.0d, 3.0d));

        AccuracyReport mixed = ForecastAccuracy.evaluate(new double[]{0.0d, 4.0d}, rows);
        assertEquals(0.5d, mixed.mape(), 1e-12);

        AccuracyReport zeros = ForecastAccuracy.evaluate(new double[]{0.0d, 0.0d}, rows);
        assertTrue(Double.isNaN(zeros.mape()));
    }

    @Test
    @DisplayName("Mismatched, empty and non-finite inputs are rejected")
    void testValidation() {
        List<ForecastRow> rows = List.of(row(0, 1.0d, 0.0d, 2.0d));
        assertThrows(IllegalArgumentException.class, () -> ForecastAccuracy.evaluate(new double[2], rows));
        assertThrows(IllegalArgumentException.class, () -> ForecastAccuracy.evaluate(new double[0], List.of()));
        assertThrows(IllegalArgumentException.class, () -> ForecastAccuracy.evaluate(new double[]{Double.NaN}, rows));
    }

    private static ForecastRow row(int day, double yhat, double lower, double upper) {
        return ForecastRow.builder()
                .timestamp(SyntheticSeries.day(day))
                .yhat(yhat)
                .yhatLower(lower)
                .yhatUpper(upper)
                .trend(yhat)
                .build();
    }
}
