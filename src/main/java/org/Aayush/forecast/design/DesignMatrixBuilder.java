package org.Aayush.forecast.design;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.core.time.TimeUtils;
import org.Aayush.forecast.engine.ForecastConfig;
import org.Aayush.forecast.frame.TimeSeriesFrame;
import org.Aayush.forecast.frame.ValueTransform;
import org.Aayush.forecast.holiday.HolidayModel;
import org.Aayush.forecast.regressor.RegressorModel;
import org.Aayush.forecast.seasonality.SeasonalityModel;
import org.Aayush.forecast.seasonality.SeasonalityPlanner;
import org.Aayush.forecast.seasonality.SeasonalitySpec;
import org.Aayush.forecast.trend.TrendModel;
import org.Aayush.forecast.trend.TrendModels;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Plans the additive model for one training frame.
 *
 * <p>Validates growth-specific inputs, fixes the changepoints, resolves seasonalities,
 * holiday and regressor columns, and freezes everything into a {@link DesignLayout}.</p>
 */
@Slf4j
public final class DesignMatrixBuilder {
    static final Set<String> RESERVED_NAMES = Set.of(
            "trend", "additive_terms", "multiplicative_terms", "yhat", "yhat_lower", "yhat_upper"
    );

    private DesignMatrixBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Builds the model layout for {@code history} under {@code config}.
     *
     * @throws InvalidInputException when the history does not satisfy the configuration.
     */
    public static DesignLayout plan(TimeSeriesFrame history, ForecastConfig config) {
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(config, "config");
        config.validate();

        TrendModel trend = TrendModels.forGrowth(config.getGrowth());
        if (trend.requiresCapacity()) {
            validateCapacity(history);
        }

        List<Instant> changepoints = resolveChangepoints(history, config, trend);

        List<SeasonalitySpec> seasonalities = SeasonalityPlanner.resolve(
                history.spanDays(),
                history.minimumSpacingDays(),
                config.getYearlySeasonality(),
                config.getWeeklySeasonality(),
                config.getDailySeasonality(),
                config.getSeasonalities(),
                config.getSeasonalityPriorScale(),
                config.getSeasonalityMode()
        );
        SeasonalityModel seasonality = new SeasonalityModel(seasonalities);
        HolidayModel holidays = new HolidayModel(
                config.getHolidays(),
                TimeUtils.toUtcDate(history.start()),
                TimeUtils.toUtcDate(history.end()),
                config.getHolidaysPriorScale(),
                config.effectiveHolidaysMode()
        );
        RegressorModel regressors = new RegressorModel(
                config.getRegressors(),
                history,
                config.getHolidaysPriorScale(),
                config.getSeasonalityMode()
        );

        DesignLayout layout = new DesignLayout(
                trend,
                changepoints,
                config.getChangepointPriorScale(),
                history.scaling(),
                seasonality,
                holidays,
                regressors
        );
        validateNames(layout);
        log.debug(
                "Planned {} model: {} changepoints, {} feature columns, components {}",
                trend.growth(),
                layout.changepointCount(),
                layout.columns().size(),
                layout.components()
        );
        return layout;
    }

    /**
     * Builds the training design matrix.
     */
    public static DesignMatrix trainingMatrix(DesignLayout layout, TimeSeriesFrame history) {
        return layout.matrix(FeatureInput.ofFrame(history), history.scaledTimes(), history.scaledCaps());
    }

    private static List<Instant> resolveChangepoints(TimeSeriesFrame history, ForecastConfig config, TrendModel trend) {
        if (config.getChangepoints() != null) {
            TreeSet<Instant> explicit = new TreeSet<>();
            for (Instant changepoint : config.getChangepoints()) {
                Instant value = Objects.requireNonNull(changepoint, "changepoint");
                if (value.isBefore(history.start()) || value.isAfter(history.end())) {
                    throw new InvalidInputException(
                            InvalidInputException.REASON_CHANGEPOINT_OUT_OF_RANGE,
                            "changepoint " + value + " is outside training range ["
                                    + history.start() + ", " + history.end() + "]"
                    );
                }
                explicit.add(value);
            }
            return new ArrayList<>(explicit);
        }
        int[] indexes = trend.defaultChangepoints(history.size(), config.getChangepointCount(), config.getChangepointRange());
        List<Instant> timestamps = history.timestamps();
        List<Instant> changepoints = new ArrayList<>(indexes.length);
        for (int index : indexes) {
            changepoints.add(timestamps.get(index));
        }
        return changepoints;
    }

    private static void validateCapacity(TimeSeriesFrame history) {
        if (history.scaling().transform() != ValueTransform.IDENTITY) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "logistic growth requires the identity value transform"
            );
        }
        if (!history.hasCapEverywhere()) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CAP_REQUIRED,
                    "logistic growth requires a cap on every history observation"
            );
        }
        double[] caps = history.caps();
        double[] floors = history.floors();
        for (int i = 0; i < caps.length; i++) {
            if (!(caps[i] > floors[i])) {
                throw new InvalidInputException(
                        InvalidInputException.REASON_CAP_BELOW_FLOOR,
                        "cap must exceed floor at " + history.timestamps().get(i)
                );
            }
        }
    }

    private static void validateNames(DesignLayout layout) {
        Set<String> components = new HashSet<>();
        for (SeasonalitySpec spec : layout.seasonality().seasonalities()) {
            components.add(spec.getName());
        }
        List<String> others = new ArrayList<>(layout.holidays().holidayNames());
        others.addAll(layout.regressors().statistics().keySet());
        for (String name : others) {
            if (!components.add(name)) {
                throw new InvalidInputException(
                        InvalidInputException.REASON_CONFIG_INVALID,
                        "component name '" + name + "' is used by more than one component"
                );
            }
        }

        Set<String> seen = new HashSet<>();
        for (FeatureColumn column : layout.columns()) {
            if (!seen.add(column.name())) {
                throw new InvalidInputException(
                        InvalidInputException.REASON_CONFIG_INVALID,
                        "duplicate design column '" + column.name() + "'"
                );
            }
            if (RESERVED_NAMES.contains(column.component())) {
                throw new InvalidInputException(
                        InvalidInputException.REASON_CONFIG_INVALID,
                        "component name '" + column.component() + "' is reserved"
                );
            }
        }
    }
}
