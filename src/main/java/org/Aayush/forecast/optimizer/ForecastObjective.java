package org.Aayush.forecast.optimizer;

import org.Aayush.forecast.design.DesignLayout;
import org.Aayush.forecast.design.DesignMatrix;
import org.Aayush.forecast.design.FeatureColumn;
import org.Aayush.forecast.trend.TrendModel;
import org.Aayush.forecast.trend.TrendParameters;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Negative log posterior of the additive model in scaled space.
 *
 * <pre>
 * yhat  = trend(t) * (1 + X_mult beta) + X_add beta
 * f     = n log(sigma) + sum (y - yhat)^2 / (2 sigma^2)
 *       + (k^2 + m^2) / (2 * 5^2)
 *       + sum |delta_j| / tau
 *       + sum beta_c^2 / (2 s_c^2)
 *       + sigma^2 / (2 * 0.5^2)
 * </pre>
 *
 * <p>{@code |delta|} is smoothed as {@code sqrt(delta^2 + eps^2) - eps} so the objective stays
 * differentiable at zero. Instances are immutable and safe to share.</p>
 */
public final class ForecastObjective implements DifferentiableFunction {
    static final double LAPLACE_SMOOTHING = 1e-4d;

    private final DesignLayout layout;
    private final DesignMatrix matrix;
    private final double[] y;
    private final double[] t;
    private final double[] cap;
    private final double[] changepoints;
    private final double[] inversePriorVariance;

    /**
     * Binds the objective to training data.
     *
     * @param layout model layout.
     * @param matrix training design matrix.
     * @param scaledValues scaled observed values aligned with the matrix rows.
     */
    public ForecastObjective(DesignLayout layout, DesignMatrix matrix, double[] scaledValues) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.matrix = Objects.requireNonNull(matrix, "matrix");
        this.y = Objects.requireNonNull(scaledValues, "scaledValues").clone();
        if (y.length != matrix.rows()) {
            throw new IllegalArgumentException("values length " + y.length + " != matrix rows " + matrix.rows());
        }
        this.t = matrix.scaledTimes();
        this.cap = matrix.scaledCaps();
        this.changepoints = layout.scaledChangepoints();
        List<FeatureColumn> columns = layout.columns();
        this.inversePriorVariance = new double[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            double scale = columns.get(c).priorScale();
            inversePriorVariance[c] = 1.0d / (scale * scale);
        }
    }

    public DesignLayout layout() {
        return layout;
    }

    public DesignMatrix matrix() {
        return matrix;
    }

    @Override
    public int dimension() {
        return layout.dimension();
    }

    @Override
    public double valueAndGradient(double[] point, double[] gradient) {
        int n = y.length;
        int changepointCount = changepoints.length;
        int betaOffset = layout.betaOffset();
        int sigmaIndex = layout.sigmaIndex();
        TrendModel trendModel = layout.trend();

        TrendParameters trendParameters = layout.trendParameters(point);
        double[] beta = layout.coefficients(point);
        double expU = Math.exp(point[sigmaIndex]);
        double sigma = DesignLayout.SIGMA_FLOOR + expU;

        double[] trend = trendModel.evaluate(t, cap, changepoints, trendParameters);
        double[] additive = new double[n];
        double[] multiplicative = new double[n];
        matrix.combine(beta, additive, multiplicative);

        double[] weights = new double[n];
        double sumSquares = 0.0d;
        double inverseVariance = 1.0d / (sigma * sigma);
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (trend[i] * (1.0d + multiplicative[i]) + additive[i]);
            sumSquares += residual * residual;
            weights[i] = -residual * inverseVariance;
        }

        double trendPriorVariance = DesignLayout.TREND_PRIOR_SCALE * DesignLayout.TREND_PRIOR_SCALE;
        double k = trendParameters.rate();
        double m = trendParameters.offset();
        double value = n * Math.log(sigma) + 0.5d * sumSquares * inverseVariance;
        value += (k * k + m * m) / (2.0d * trendPriorVariance);
        double tau = layout.changepointPriorScale();
        for (int j = 0; j < changepointCount; j++) {
            double delta = trendParameters.delta(j);
            value += (Math.sqrt(delta * delta + LAPLACE_SMOOTHING * LAPLACE_SMOOTHING) - LAPLACE_SMOOTHING) / tau;
        }
        for (int c = 0; c < beta.length; c++) {
            value += 0.5d * beta[c] * beta[c] * inversePriorVariance[c];
        }
        double sigmaPriorVariance = DesignLayout.SIGMA_PRIOR_SCALE * DesignLayout.SIGMA_PRIOR_SCALE;
        value += sigma * sigma / (2.0d * sigmaPriorVariance);

        if (gradient == null) {
            return value;
        }
        Arrays.fill(gradient, 0.0d);

        double[][] trendGradient = trendModel.gradient(t, cap, changepoints, trendParameters);
        int trendWidth = 2 + changepointCount;
        for (int i = 0; i < n; i++) {
            double scale = weights[i] * (1.0d + multiplicative[i]);
            double[] row = trendGradient[i];
            for (int p = 0; p < trendWidth; p++) {
                gradient[p] += scale * row[p];
            }
            for (int c = 0; c < beta.length; c++) {
                double feature = matrix.feature(i, c);
                if (feature == 0.0d) {
                    continue;
                }
                gradient[betaOffset + c] += weights[i] * (matrix.isMultiplicative(c) ? trend[i] * feature : feature);
            }
        }

        gradient[0] += k / trendPriorVariance;
        gradient[1] += m / trendPriorVariance;
        for (int j = 0; j < changepointCount; j++) {
            double delta = trendParameters.delta(j);
            gradient[2 + j] += delta / (tau * Math.sqrt(delta * delta + LAPLACE_SMOOTHING * LAPLACE_SMOOTHING));
        }
        for (int c = 0; c < beta.length; c++) {
            gradient[betaOffset + c] += beta[c] * inversePriorVariance[c];
        }
        double dSigma = n / sigma - sumSquares / (sigma * sigma * sigma) + sigma / sigmaPriorVariance;
        gradient[sigmaIndex] = dSigma * expU;
        return value;
    }

    /**
     * Evaluates the objective without a gradient.
     */
    public double value(double[] point) {
        return valueAndGradient(point, null);
    }
}
