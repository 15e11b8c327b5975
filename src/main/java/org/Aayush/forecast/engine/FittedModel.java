package org.Aayush.forecast.engine;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.forecast.design.DesignLayout;
import org.Aayush.forecast.design.FeatureColumn;
import org.Aayush.forecast.frame.FrameScaling;
import org.Aayush.forecast.optimizer.Estimate;
import org.Aayush.forecast.optimizer.OptimizationResult;
import org.Aayush.forecast.regressor.RegressorStatistics;
import org.Aayush.forecast.seasonality.SeasonalComponent;
import org.Aayush.forecast.seasonality.SeasonalitySpec;
import org.Aayush.forecast.trend.GrowthMode;
import org.Aayush.forecast.trend.TrendParameters;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a fitted model.
 *
 * <p>Holds the frozen design layout (changepoints, feature columns, scaling and regressor
 * statistics), the MAP parameter vector and any posterior draws. Parameters live in scaled
 * value space. Nothing here changes after construction, so one instance can serve concurrent
 * predictions.</p>
 */
@Getter
@Accessors(fluent = true)
public final class FittedModel {
    private final ForecastConfig config;
    private final DesignLayout layout;
    private final Instant trainingStart;
    private final Instant trainingEnd;
    private final int trainingSize;
    private final TrendParameters trendParameters;
    /** Observation noise scale in scaled value units. */
    private final double sigma;
    private final List<SeasonalComponent> seasonalComponents;
    /** Holiday coefficients by design column name, scaled units. */
    private final Map<String, Double> holidayCoefficients;
    /** Regressor coefficients by regressor name, scaled units per standardized unit. */
    private final Map<String, Double> regressorCoefficients;
    private final int iterations;
    private final OptimizationResult.Termination termination;
    private final double objectiveValue;
    @Getter(AccessLevel.NONE)
    private final double[] parameters;
    @Getter(AccessLevel.NONE)
    private final double[] coefficients;
    @Getter(AccessLevel.NONE)
    private final List<double[]> samples;

    private FittedModel(
            ForecastConfig config,
            DesignLayout layout,
            Instant trainingStart,
            Instant trainingEnd,
            int trainingSize,
            Estimate estimate
    ) {
        this.config = config;
        this.layout = layout;
        this.trainingStart = trainingStart;
        this.trainingEnd = trainingEnd;
        this.trainingSize = trainingSize;
        this.parameters = estimate.point();
        this.samples = estimate.samples();
        this.trendParameters = layout.trendParameters(parameters);
        this.coefficients = layout.coefficients(parameters);
        this.sigma = layout.sigma(parameters);
        this.iterations = estimate.optimum().iterations();
        this.termination = estimate.optimum().termination();
        this.objectiveValue = estimate.optimum().value();

        List<FeatureColumn> columns = layout.columns();
        List<SeasonalComponent> seasonal = new ArrayList<>();
        for (SeasonalitySpec spec : layout.seasonality().seasonalities()) {
            double[] fourier = new double[2 * spec.getFourierOrder()];
            int next = 0;
            for (int c = 0; c < columns.size() && next < fourier.length; c++) {
                if (columns.get(c).component().equals(spec.getName())) {
                    fourier[next++] = coefficients[c];
                }
            }
            seasonal.add(new SeasonalComponent(
                    spec.getName(),
                    spec.getPeriod(),
                    spec.getFourierOrder(),
                    spec.getMode(),
                    fourier
            ));
        }
        this.seasonalComponents = List.copyOf(seasonal);

        LinkedHashMap<String, Double> holidays = new LinkedHashMap<>();
        LinkedHashMap<String, Double> regressors = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            FeatureColumn column = columns.get(c);
            if (layout.holidays().holidayNames().contains(column.component())) {
                holidays.put(column.name(), coefficients[c]);
            } else if (layout.regressors().statistics().containsKey(column.component())) {
                regressors.put(column.name(), coefficients[c]);
            }
        }
        this.holidayCoefficients = Collections.unmodifiableMap(holidays);
        this.regressorCoefficients = Collections.unmodifiableMap(regressors);
    }

    /**
     * Assembles a model from an estimate over {@code layout}.
     *
     * @param config configuration the model was fitted with.
     * @param layout frozen design layout.
     * @param trainingStart first training timestamp.
     * @param trainingEnd last training timestamp.
     * @param trainingSize number of training rows.
     * @param estimate MAP optimum plus optional posterior draws.
     * @return immutable model.
     */
    public static FittedModel assemble(
            ForecastConfig config,
            DesignLayout layout,
            Instant trainingStart,
            Instant trainingEnd,
            int trainingSize,
            Estimate estimate
    ) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(trainingStart, "trainingStart");
        Objects.requireNonNull(trainingEnd, "trainingEnd");
        Objects.requireNonNull(estimate, "estimate");
        if (estimate.optimum().point().length != layout.dimension()) {
            throw new IllegalArgumentException(
                    "estimate dimension " + estimate.optimum().point().length + " != layout dimension " + layout.dimension()
            );
        }
        return new FittedModel(config, layout, trainingStart, trainingEnd, trainingSize, estimate);
    }

    public GrowthMode growth() {
        return layout.trend().growth();
    }

    public FrameScaling scaling() {
        return layout.scaling();
    }

    /**
     * Returns the changepoints the trend was fitted with.
     */
    public List<Instant> changepoints() {
        return layout.changepoints();
    }

    /**
     * Returns frozen regressor standardization statistics by name.
     */
    public Map<String, RegressorStatistics> regressorStatistics() {
        return layout.regressors().statistics();
    }

    /**
     * Returns the MAP parameter vector {@code [k, m, delta..., beta..., u]}.
     */
    public double[] parameters() {
        return parameters.clone();
    }

    /**
     * Returns feature coefficients aligned with {@code layout().columns()}.
     */
    public double[] coefficients() {
        return coefficients.clone();
    }

    /**
     * Returns copies of the posterior draws; empty for point estimation.
     */
    public List<double[]> samples() {
        List<double[]> copies = new ArrayList<>(samples.size());
        for (double[] sample : samples) {
            copies.add(sample.clone());
        }
        return copies;
    }

    public int sampleCount() {
        return samples.size();
    }

    /**
     * Returns one posterior draw without copying; callers must not modify it.
     */
    double[] sampleView(int index) {
        return samples.get(index);
    }

    /**
     * Returns the observation noise scale in model units.
     */
    public double observationNoise() {
        return sigma * layout.scaling().yScale();
    }
}
