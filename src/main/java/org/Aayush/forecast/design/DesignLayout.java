package org.Aayush.forecast.design;

import org.Aayush.forecast.frame.FrameScaling;
import org.Aayush.forecast.holiday.HolidayModel;
import org.Aayush.forecast.regressor.RegressorModel;
import org.Aayush.forecast.seasonality.SeasonalityModel;
import org.Aayush.forecast.trend.TrendModel;
import org.Aayush.forecast.trend.TrendParameters;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Frozen structure of one additive model: trend variant, changepoints, feature columns and
 * the packing of the parameter vector.
 *
 * <p>Parameter vector layout: {@code [k, m, delta_1..delta_S, beta_1..beta_P, u]} where
 * {@code sigma = SIGMA_FLOOR + exp(u)}. The layout is immutable and is reused unchanged to
 * evaluate prediction rows.</p>
 */
public final class DesignLayout {
    public static final double SIGMA_FLOOR = 1e-9d;
    public static final double TREND_PRIOR_SCALE = 5.0d;
    public static final double SIGMA_PRIOR_SCALE = 0.5d;

    private final TrendModel trend;
    private final List<Instant> changepoints;
    private final double[] scaledChangepoints;
    private final double changepointPriorScale;
    private final FrameScaling scaling;
    private final SeasonalityModel seasonality;
    private final HolidayModel holidays;
    private final RegressorModel regressors;
    private final List<FeatureColumn> columns;

    DesignLayout(
            TrendModel trend,
            List<Instant> changepoints,
            double changepointPriorScale,
            FrameScaling scaling,
            SeasonalityModel seasonality,
            HolidayModel holidays,
            RegressorModel regressors
    ) {
        this.trend = trend;
        this.changepoints = List.copyOf(changepoints);
        this.changepointPriorScale = changepointPriorScale;
        this.scaling = scaling;
        this.seasonality = seasonality;
        this.holidays = holidays;
        this.regressors = regressors;
        this.scaledChangepoints = new double[changepoints.size()];
        for (int j = 0; j < scaledChangepoints.length; j++) {
            scaledChangepoints[j] = scaling.toScaled(changepoints.get(j));
        }
        List<FeatureColumn> cols = new ArrayList<>();
        for (FeatureSource source : sources()) {
            cols.addAll(source.columns());
        }
        this.columns = List.copyOf(cols);
    }

    public TrendModel trend() {
        return trend;
    }

    public List<Instant> changepoints() {
        return changepoints;
    }

    public double[] scaledChangepoints() {
        return scaledChangepoints.clone();
    }

    public double changepointPriorScale() {
        return changepointPriorScale;
    }

    public FrameScaling scaling() {
        return scaling;
    }

    public SeasonalityModel seasonality() {
        return seasonality;
    }

    public HolidayModel holidays() {
        return holidays;
    }

    public RegressorModel regressors() {
        return regressors;
    }

    public List<FeatureColumn> columns() {
        return columns;
    }

    /**
     * Returns component names in column order, without duplicates.
     */
    public Set<String> components() {
        Set<String> names = new LinkedHashSet<>();
        for (FeatureColumn column : columns) {
            names.add(column.component());
        }
        return names;
    }

    public int changepointCount() {
        return scaledChangepoints.length;
    }

    public int deltaOffset() {
        return 2;
    }

    public int betaOffset() {
        return 2 + scaledChangepoints.length;
    }

    public int sigmaIndex() {
        return betaOffset() + columns.size();
    }

    public int dimension() {
        return sigmaIndex() + 1;
    }

    /**
     * Evaluates all feature sources on the given rows.
     *
     * @param input raw row inputs.
     * @param scaledTimes scaled time per row.
     * @param scaledCaps scaled capacity per row ({@code NaN} when unused).
     */
    public DesignMatrix matrix(FeatureInput input, double[] scaledTimes, double[] scaledCaps) {
        double[][] features = new double[input.size()][columns.size()];
        int offset = 0;
        for (FeatureSource source : sources()) {
            int width = source.columns().size();
            if (width == 0) {
                continue;
            }
            double[][] block = source.evaluate(input);
            for (int i = 0; i < features.length; i++) {
                System.arraycopy(block[i], 0, features[i], offset, width);
            }
            offset += width;
        }
        return new DesignMatrix(features, columns, scaledTimes.clone(), scaledCaps.clone());
    }

    /**
     * Lists (parameter, prior, scale) tuples aligned with the parameter vector.
     */
    public List<ParameterPrior> parameterPriors() {
        List<ParameterPrior> priors = new ArrayList<>(dimension());
        priors.add(new ParameterPrior("k", PriorKind.GAUSSIAN, TREND_PRIOR_SCALE));
        priors.add(new ParameterPrior("m", PriorKind.GAUSSIAN, TREND_PRIOR_SCALE));
        for (int j = 0; j < scaledChangepoints.length; j++) {
            priors.add(new ParameterPrior("delta_" + j, PriorKind.LAPLACE, changepointPriorScale));
        }
        for (FeatureColumn column : columns) {
            priors.add(new ParameterPrior(column.name(), PriorKind.GAUSSIAN, column.priorScale()));
        }
        priors.add(new ParameterPrior("sigma_obs", PriorKind.HALF_GAUSSIAN, SIGMA_PRIOR_SCALE));
        return priors;
    }

    /**
     * Packs model parameters into a vector.
     */
    public double[] pack(TrendParameters trendParameters, double[] beta, double sigma) {
        double[] point = new double[dimension()];
        point[0] = trendParameters.rate();
        point[1] = trendParameters.offset();
        System.arraycopy(trendParameters.deltas(), 0, point, deltaOffset(), changepointCount());
        System.arraycopy(beta, 0, point, betaOffset(), columns.size());
        point[sigmaIndex()] = Math.log(Math.max(sigma - SIGMA_FLOOR, SIGMA_FLOOR));
        return point;
    }

    public TrendParameters trendParameters(double[] point) {
        double[] deltas = new double[changepointCount()];
        System.arraycopy(point, deltaOffset(), deltas, 0, deltas.length);
        return new TrendParameters(point[0], point[1], deltas);
    }

    public double[] coefficients(double[] point) {
        double[] beta = new double[columns.size()];
        System.arraycopy(point, betaOffset(), beta, 0, beta.length);
        return beta;
    }

    public double sigma(double[] point) {
        return SIGMA_FLOOR + Math.exp(point[sigmaIndex()]);
    }

    private List<FeatureSource> sources() {
        return List.of(seasonality, holidays, regressors);
    }
}
