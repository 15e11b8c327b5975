package org.Aayush.forecast.regressor;

import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.ComponentMode;
import org.Aayush.forecast.design.FeatureInput;
import org.Aayush.forecast.frame.FuturePoint;
import org.Aayush.forecast.frame.Observation;
import org.Aayush.forecast.frame.TimeSeriesFrame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.Aayush.forecast.testutil.SyntheticSeries.day;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Regressor Model Tests")
class RegressorModelTest {

    @Test
    @DisplayName("Continuous regressors are standardized with training statistics")
    void testStandardization() {
        TimeSeriesFrame history = history("temp", 1.0d, 2.0d, 3.0d, 4.0d, 5.0d);
        RegressorModel model = new RegressorModel(List.of(RegressorSpec.of("temp")), history, 10.0d, ComponentMode.ADDITIVE);

        RegressorStatistics stats = model.statistics().get("temp");
        assertTrue(stats.standardized());
        assertEquals(3.0d, stats.mean(), 1e-12);
        assertEquals(Math.sqrt(2.5d), stats.std(), 1e-12);

        double[][] future = model.evaluate(FeatureInput.ofPoints(List.of(
                FuturePoint.builder().timestamp(day(10)).regressor("temp", 3.0d).build(),
                FuturePoint.builder().timestamp(day(11)).regressor("temp", 100.0d).build()
        )));
        assertEquals(0.0d, future[0][0], 1e-12);
        assertEquals(97.0d / Math.sqrt(2.5d), future[1][0], 1e-9);
    }

    @Test
    @DisplayName("Binary regressors stay raw under AUTO; NEVER and ALWAYS are honored")
    void testStandardizationPolicies() {
        TimeSeriesFrame binary = history("promo", 0.0d, 1.0d, 0.0d, 1.0d);
        RegressorModel auto = new RegressorModel(List.of(RegressorSpec.of("promo")), binary, 10.0d, ComponentMode.ADDITIVE);
        assertFalse(auto.statistics().get("promo").standardized());

        RegressorSpec always = RegressorSpec.builder().name("promo").standardization(Standardization.ALWAYS).build();
        assertTrue(new RegressorModel(List.of(always), binary, 10.0d, ComponentMode.ADDITIVE)
                .statistics().get("promo").standardized());

        TimeSeriesFrame continuous = history("price", 1.5d, 2.5d, 9.0d);
        RegressorSpec never = RegressorSpec.builder().name("price").standardization(Standardization.NEVER).build();
        RegressorStatistics raw = new RegressorModel(List.of(never), continuous, 10.0d, ComponentMode.ADDITIVE)
                .statistics().get("price");
        assertFalse(raw.standardized());
        assertEquals(9.0d, raw.apply(9.0d));
    }

    @Test
    @DisplayName("Constant regressor keeps unit scale instead of dividing by zero")
    void testConstantRegressor() {
        TimeSeriesFrame history = history("flag", 4.0d, 4.0d, 4.0d);
        RegressorStatistics stats = new RegressorModel(List.of(RegressorSpec.of("flag")), history, 10.0d, ComponentMode.ADDITIVE)
                .statistics().get("flag");
        assertEquals(1.0d, stats.std());
        assertEquals(0.0d, stats.apply(4.0d));
    }

    @Test
    @DisplayName("Regressor absent from all history is dropped, partially missing one is rejected")
    void testMissingRegressor() {
        TimeSeriesFrame history = history("temp", 1.0d, 2.0d, 3.0d);
        RegressorModel model = new RegressorModel(
                List.of(RegressorSpec.of("temp"), RegressorSpec.of("ghost")),
                history,
                10.0d,
                ComponentMode.ADDITIVE
        );
        assertEquals(1, model.columns().size());
        assertTrue(model.droppedRegressors().contains("ghost"));

        List<Observation> rows = new ArrayList<>();
        rows.add(Observation.builder().timestamp(day(0)).value(1.0d).regressor("temp", 1.0d).build());
        rows.add(Observation.of(day(1), 2.0d));
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> new RegressorModel(
                List.of(RegressorSpec.of("temp")), TimeSeriesFrame.of(rows), 10.0d, ComponentMode.ADDITIVE
        ));
        assertEquals(InvalidInputException.REASON_REGRESSOR_MISSING, ex.reasonCode());
    }

    @Test
    @DisplayName("Future rows without a fitted regressor value are rejected")
    void testFutureMissingValue() {
        RegressorModel model = new RegressorModel(
                List.of(RegressorSpec.of("temp")),
                history("temp", 1.0d, 2.0d, 3.0d),
                10.0d,
                ComponentMode.ADDITIVE
        );
        InvalidInputException ex = assertThrows(
                InvalidInputException.class,
                () -> model.evaluate(FeatureInput.ofPoints(List.of(FuturePoint.of(day(5)))))
        );
        assertEquals(InvalidInputException.REASON_REGRESSOR_MISSING, ex.reasonCode());
    }

    @Test
    @DisplayName("Duplicate regressor declarations are rejected")
    void testDuplicateDeclaration() {
        TimeSeriesFrame history = history("temp", 1.0d, 2.0d, 3.0d);
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> new RegressorModel(
                List.of(RegressorSpec.of("temp"), RegressorSpec.of("temp")), history, 10.0d, ComponentMode.ADDITIVE
        ));
        assertEquals(InvalidInputException.REASON_CONFIG_INVALID, ex.reasonCode());
    }

    private static TimeSeriesFrame history(String regressor, double... values) {
        List<Observation> rows = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            rows.add(Observation.builder().timestamp(day(i)).value(i).regressor(regressor, values[i]).build());
        }
        return TimeSeriesFrame.of(rows);
    }
}
