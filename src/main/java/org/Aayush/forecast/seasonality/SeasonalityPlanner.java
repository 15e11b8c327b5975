package org.Aayush.forecast.seasonality;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.ComponentMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves which seasonalities a fit uses.
 *
 * <p>Built-in defaults and auto-enable thresholds:</p>
 * <ul>
 * <li>{@code yearly}: period 365.25 days, order 10, needs a span of at least 730 days.</li>
 * <li>{@code weekly}: period 7 days, order 3, needs a span of at least 14 days and a
 * minimum observation spacing below 7 days.</li>
 * <li>{@code daily}: period 1 day, order 4, needs a span of at least 2 days and a
 * minimum observation spacing below 1 day.</li>
 * </ul>
 * <p>Custom seasonalities are always enabled and replace a built-in of the same name.</p>
 */
@Slf4j
public final class SeasonalityPlanner {
    public static final String YEARLY = "yearly";
    public static final String WEEKLY = "weekly";
    public static final String DAILY = "daily";

    public static final double YEARLY_PERIOD = 365.25d;
    public static final double WEEKLY_PERIOD = 7.0d;
    public static final double DAILY_PERIOD = 1.0d;

    public static final int YEARLY_ORDER = 10;
    public static final int WEEKLY_ORDER = 3;
    public static final int DAILY_ORDER = 4;

    private static final double YEARLY_MIN_SPAN_DAYS = 730.0d;
    private static final double WEEKLY_MIN_SPAN_DAYS = 14.0d;
    private static final double DAILY_MIN_SPAN_DAYS = 2.0d;

    private SeasonalityPlanner() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Resolves enabled seasonalities with prior scale and mode filled in.
     *
     * @param spanDays training span in days.
     * @param minSpacingDays minimum spacing between consecutive training timestamps, in days.
     * @param yearly yearly setting.
     * @param weekly weekly setting.
     * @param daily daily setting.
     * @param custom custom seasonalities.
     * @param defaultPriorScale prior scale for components that do not declare one.
     * @param defaultMode mode for components that do not declare one.
     * @return enabled seasonalities in deterministic order (built-ins first).
     */
    public static List<SeasonalitySpec> resolve(
            double spanDays,
            double minSpacingDays,
            SeasonalitySetting yearly,
            SeasonalitySetting weekly,
            SeasonalitySetting daily,
            List<SeasonalitySpec> custom,
            double defaultPriorScale,
            ComponentMode defaultMode
    ) {
        Objects.requireNonNull(defaultMode, "defaultMode");
        LinkedHashMap<String, SeasonalitySpec> resolved = new LinkedHashMap<>();

        boolean yearlyAuto = spanDays >= YEARLY_MIN_SPAN_DAYS;
        boolean weeklyAuto = spanDays >= WEEKLY_MIN_SPAN_DAYS && minSpacingDays < WEEKLY_PERIOD;
        boolean dailyAuto = spanDays >= DAILY_MIN_SPAN_DAYS && minSpacingDays < DAILY_PERIOD;

        addBuiltIn(resolved, YEARLY, YEARLY_PERIOD, YEARLY_ORDER, yearly, yearlyAuto);
        addBuiltIn(resolved, WEEKLY, WEEKLY_PERIOD, WEEKLY_ORDER, weekly, weeklyAuto);
        addBuiltIn(resolved, DAILY, DAILY_PERIOD, DAILY_ORDER, daily, dailyAuto);

        if (custom != null) {
            for (SeasonalitySpec spec : custom) {
                SeasonalitySpec valid = validate(Objects.requireNonNull(spec, "seasonality"));
                resolved.remove(valid.getName());
                resolved.put(valid.getName(), valid);
            }
        }

        List<SeasonalitySpec> out = new ArrayList<>(resolved.size());
        for (Map.Entry<String, SeasonalitySpec> entry : resolved.entrySet()) {
            SeasonalitySpec spec = entry.getValue();
            out.add(spec.toBuilder()
                    .priorScale(spec.getPriorScale() == null ? defaultPriorScale : spec.getPriorScale())
                    .mode(spec.getMode() == null ? defaultMode : spec.getMode())
                    .build());
        }
        return List.copyOf(out);
    }

    private static void addBuiltIn(
            Map<String, SeasonalitySpec> resolved,
            String name,
            double period,
            int defaultOrder,
            SeasonalitySetting setting,
            boolean autoEnabled
    ) {
        SeasonalitySetting effective = setting == null ? SeasonalitySetting.auto() : setting;
        boolean enabled = switch (effective.toggle()) {
            case AUTO -> autoEnabled;
            case ENABLED -> true;
            case DISABLED -> false;
        };
        if (effective.toggle() == SeasonalitySetting.Toggle.AUTO && !autoEnabled) {
            log.info("Disabling {} seasonality; enable it explicitly to override", name);
        }
        if (!enabled) {
            return;
        }
        resolved.put(name, SeasonalitySpec.builder()
                .name(name)
                .period(period)
                .fourierOrder(effective.orderOr(defaultOrder))
                .build());
    }

    private static SeasonalitySpec validate(SeasonalitySpec spec) {
        if (spec.getName() == null || spec.getName().isBlank()) {
            throw new InvalidInputException(InvalidInputException.REASON_CONFIG_INVALID, "seasonality name must be non-blank");
        }
        if (!(spec.getPeriod() > 0.0d) || !Double.isFinite(spec.getPeriod())) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "seasonality '" + spec.getName() + "' period must be positive and finite"
            );
        }
        if (spec.getFourierOrder() < 1) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "seasonality '" + spec.getName() + "' fourierOrder must be >= 1"
            );
        }
        if (spec.getPriorScale() != null && !(spec.getPriorScale() > 0.0d)) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "seasonality '" + spec.getName() + "' priorScale must be positive"
            );
        }
        return spec;
    }
}
