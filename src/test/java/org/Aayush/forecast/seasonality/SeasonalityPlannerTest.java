package org.Aayush.forecast.seasonality;

import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.ComponentMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Seasonality Planner Tests")
class SeasonalityPlannerTest {

    @Test
    @DisplayName("Yearly auto-enables at exactly two years of span")
    void testYearlyThreshold() {
        assertEquals(List.of("yearly", "weekly"), names(resolveAuto(730.0d, 1.0d)));
        assertEquals(List.of("weekly"), names(resolveAuto(729.9d, 1.0d)));
    }

    @Test
    @DisplayName("Weekly needs two weeks of span and sub-weekly spacing")
    void testWeeklyThreshold() {
        assertEquals(List.of("weekly"), names(resolveAuto(14.0d, 1.0d)));
        assertEquals(List.of(), names(resolveAuto(13.0d, 1.0d)));
        assertEquals(List.of(), names(resolveAuto(700.0d, 7.0d)));
    }

    @Test
    @DisplayName("Daily needs two days of span and sub-daily spacing")
    void testDailyThreshold() {
        assertEquals(List.of("daily"), names(resolveAuto(2.0d, 1.0d / 24.0d)));
        assertEquals(List.of(), names(resolveAuto(1.5d, 1.0d / 24.0d)));
    }

    @Test
    @DisplayName("Explicit settings override the auto policy and set the order")
    void testExplicitSettings() {
        List<SeasonalitySpec> specs = SeasonalityPlanner.resolve(
                10.0d,
                30.0d,
                SeasonalitySetting.order(4),
                SeasonalitySetting.disabled(),
                SeasonalitySetting.auto(),
                List.of(),
                10.0d,
                ComponentMode.ADDITIVE
        );
        assertEquals(1, specs.size());
        SeasonalitySpec yearly = specs.get(0);
        assertEquals(SeasonalityPlanner.YEARLY, yearly.getName());
        assertEquals(4, yearly.getFourierOrder());
        assertEquals(365.25d, yearly.getPeriod());
        assertEquals(10.0d, yearly.getPriorScale());
        assertEquals(ComponentMode.ADDITIVE, yearly.getMode());
    }

    @Test
    @DisplayName("Custom seasonality replaces a built-in of the same name and keeps its own prior and mode")
    void testCustomSeasonality() {
        SeasonalitySpec customWeekly = SeasonalitySpec.builder()
                .name("weekly")
                .period(7.0d)
                .fourierOrder(5)
                .priorScale(0.5d)
                .mode(ComponentMode.MULTIPLICATIVE)
                .build();
        SeasonalitySpec monthly = SeasonalitySpec.builder().name("monthly").period(30.5d).fourierOrder(5).build();

        List<SeasonalitySpec> specs = SeasonalityPlanner.resolve(
                100.0d,
                1.0d,
                SeasonalitySetting.auto(),
                SeasonalitySetting.auto(),
                SeasonalitySetting.auto(),
                List.of(customWeekly, monthly),
                10.0d,
                ComponentMode.ADDITIVE
        );

        assertEquals(List.of("weekly", "monthly"), names(specs));
        assertEquals(5, specs.get(0).getFourierOrder());
        assertEquals(0.5d, specs.get(0).getPriorScale());
        assertEquals(ComponentMode.MULTIPLICATIVE, specs.get(0).getMode());
        assertEquals(ComponentMode.ADDITIVE, specs.get(1).getMode());
    }

    @Test
    @DisplayName("Malformed custom seasonality is rejected")
    void testInvalidCustom() {
        SeasonalitySpec bad = SeasonalitySpec.builder().name("bad").period(7.0d).fourierOrder(0).build();
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> SeasonalityPlanner.resolve(
                100.0d, 1.0d, null, null, null, List.of(bad), 10.0d, ComponentMode.ADDITIVE
        ));
        assertEquals(InvalidInputException.REASON_CONFIG_INVALID, ex.reasonCode());
        assertThrows(IllegalArgumentException.class, () -> SeasonalitySetting.order(-1));
        assertEquals(SeasonalitySetting.Toggle.DISABLED, SeasonalitySetting.order(0).toggle());
    }

    @Test
    @DisplayName("Fourier columns are ordered sin1, cos1, sin2, cos2 on epoch-day time")
    void testFourierFeatures() {
        double[][] features = FourierSeries.features(new double[]{0.0d, 1.75d}, 7.0d, 2);
        assertEquals(0.0d, features[0][0], 1e-12);
        assertEquals(1.0d, features[0][1], 1e-12);
        assertEquals(1.0d, features[1][0], 1e-12);
        assertEquals(0.0d, features[1][1], 1e-12);
        assertEquals(0.0d, features[1][2], 1e-12);
        assertEquals(-1.0d, features[1][3], 1e-12);
    }

    @Test
    @DisplayName("Fitted component evaluates its harmonics and reports amplitude")
    void testSeasonalComponent() {
        SeasonalComponent component = new SeasonalComponent(
                "weekly", 7.0d, 1, ComponentMode.ADDITIVE, new double[]{3.0d, 4.0d}
        );
        assertEquals(5.0d, component.amplitude(1), 1e-12);
        assertEquals(4.0d, component.evaluate(new double[]{0.0d})[0], 1e-12);
        assertThrows(IllegalArgumentException.class, () -> component.amplitude(2));
    }

    private static List<SeasonalitySpec> resolveAuto(double span, double spacing) {
        return SeasonalityPlanner.resolve(
                span,
                spacing,
                SeasonalitySetting.auto(),
                SeasonalitySetting.auto(),
                SeasonalitySetting.auto(),
                List.of(),
                10.0d,
                ComponentMode.ADDITIVE
        );
    }

    private static List<String> names(List<SeasonalitySpec> specs) {
        return specs.stream().map(SeasonalitySpec::getName).collect(Collectors.toList());
    }
}
