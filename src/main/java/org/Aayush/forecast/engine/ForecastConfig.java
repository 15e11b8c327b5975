package org.Aayush.forecast.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.ComponentMode;
import org.Aayush.forecast.holiday.HolidayEntry;
import org.Aayush.forecast.optimizer.EstimationMode;
import org.Aayush.forecast.optimizer.OptimizerBudget;
import org.Aayush.forecast.regressor.RegressorSpec;
import org.Aayush.forecast.seasonality.SeasonalitySetting;
import org.Aayush.forecast.seasonality.SeasonalitySpec;
import org.Aayush.forecast.trend.GrowthMode;

import java.time.Instant;
import java.util.List;

/**
 * Every recognized option of one forecasting model.
 *
 * <p>Defaults follow the usual additive-model conventions: linear growth, 25 changepoints in
 * the first 80% of history, automatic yearly/weekly/daily seasonality, 80% intervals from
 * 1000 simulated trajectories.</p>
 */
@Value
@Builder(toBuilder = true)
public class ForecastConfig {

    /** Trend growth mode. */
    @Builder.Default
    GrowthMode growth = GrowthMode.LINEAR;

    /** Explicit changepoints; {@code null} places {@link #changepointCount} automatically. */
    List<Instant> changepoints;

    /** Number of automatically placed changepoints. */
    @Builder.Default
    int changepointCount = 25;

    /** Leading fraction of history eligible for automatic changepoints. */
    @Builder.Default
    double changepointRange = 0.8d;

    /** Laplace prior scale on changepoint rate adjustments. */
    @Builder.Default
    double changepointPriorScale = 0.05d;

    @Builder.Default
    SeasonalitySetting yearlySeasonality = SeasonalitySetting.auto();

    @Builder.Default
    SeasonalitySetting weeklySeasonality = SeasonalitySetting.auto();

    @Builder.Default
    SeasonalitySetting dailySeasonality = SeasonalitySetting.auto();

    /** Default mode for seasonalities and regressors that do not declare one. */
    @Builder.Default
    ComponentMode seasonalityMode = ComponentMode.ADDITIVE;

    /** Default Gaussian prior scale for seasonal coefficients. */
    @Builder.Default
    double seasonalityPriorScale = 10.0d;

    /** Custom seasonalities in addition to (or replacing) the built-ins. */
    @Singular
    List<SeasonalitySpec> seasonalities;

    @Singular
    List<HolidayEntry> holidays;

    /** Default Gaussian prior scale for holiday and regressor coefficients. */
    @Builder.Default
    double holidaysPriorScale = 10.0d;

    /** Default holiday mode; {@code null} inherits {@link #seasonalityMode}. */
    ComponentMode holidaysMode;

    @Singular
    List<RegressorSpec> regressors;

    /** Width of the uncertainty interval, in {@code (0, 1)}. */
    @Builder.Default
    double intervalWidth = 0.8d;

    /** Number of simulated trajectories; {@code 0} disables intervals. */
    @Builder.Default
    int uncertaintySamples = 1000;

    /** Whether simulated trajectories include Gaussian observation noise. */
    @Builder.Default
    boolean includeObservationNoise = true;

    /** Seed for trajectory simulation and posterior sampling. */
    @Builder.Default
    long randomSeed = 0L;

    /** Parameter estimation strategy. */
    @Builder.Default
    EstimationMode estimationMode = EstimationMode.MAP;

    /** Number of approximate posterior draws for {@link EstimationMode#LAPLACE}. */
    @Builder.Default
    int posteriorSamples = 200;

    /** Iteration budget and tolerances for the optimizer. */
    @Builder.Default
    OptimizerBudget optimizerBudget = OptimizerBudget.defaults();

    /**
     * Returns the default configuration.
     */
    public static ForecastConfig defaults() {
        return ForecastConfig.builder().build();
    }

    /**
     * Returns the default configuration with logistic growth.
     */
    public static ForecastConfig logistic() {
        return ForecastConfig.builder().growth(GrowthMode.LOGISTIC).build();
    }

    /**
     * Returns the effective holiday mode.
     */
    public ComponentMode effectiveHolidaysMode() {
        return holidaysMode == null ? seasonalityMode : holidaysMode;
    }

    /**
     * Validates option ranges.
     *
     * @throws InvalidInputException with {@code F_CONFIG_INVALID} on the first violation.
     */
    public void validate() {
        require(growth != null, "growth is required");
        require(seasonalityMode != null, "seasonalityMode is required");
        require(estimationMode != null, "estimationMode is required");
        require(optimizerBudget != null, "optimizerBudget is required");
        require(changepointCount >= 0, "changepointCount must be >= 0");
        require(changepointRange > 0.0d && changepointRange <= 1.0d, "changepointRange must be in (0, 1]");
        require(changepointPriorScale > 0.0d, "changepointPriorScale must be positive");
        require(seasonalityPriorScale > 0.0d, "seasonalityPriorScale must be positive");
        require(holidaysPriorScale > 0.0d, "holidaysPriorScale must be positive");
        require(intervalWidth > 0.0d && intervalWidth < 1.0d, "intervalWidth must be in (0, 1)");
        require(uncertaintySamples >= 0, "uncertaintySamples must be >= 0");
        require(estimationMode != EstimationMode.LAPLACE || posteriorSamples >= 1,
                "posteriorSamples must be >= 1 for LAPLACE estimation");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidInputException(InvalidInputException.REASON_CONFIG_INVALID, message);
        }
    }
}
