package org.Aayush.forecast.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.concurrent.CancellationToken;
import org.Aayush.forecast.core.error.ConvergenceException;
import org.apache.commons.math3.distribution.MultivariateNormalDistribution;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * MAP estimate plus draws from the Laplace approximation {@code N(theta_map, H^-1)}.
 *
 * <p>The Hessian {@code H} of the negative log posterior is obtained by central differences
 * of the analytic gradient and symmetrized before inversion.</p>
 */
@Slf4j
public final class LaplaceEstimationStrategy implements EstimationStrategy {
    private static final double RELATIVE_STEP = 1e-5d;

    @Override
    public String id() {
        return EstimationMode.LAPLACE.strategyId();
    }

    @Override
    public Estimate estimate(EstimationRequest request) {
        ForecastObjective objective = request.getObjective();
        CancellationToken cancellation = request.getCancellation();
        OptimizationResult optimum = request.getOptimizer().minimize(objective, request.getStart(), cancellation);
        double[] mode = optimum.point();

        double[][] covariance;
        try {
            RealMatrix hessian = hessian(objective, mode, cancellation);
            RealMatrix inverse = new CholeskyDecomposition(hessian).getSolver().getInverse();
            covariance = symmetrize(inverse.getData());
        } catch (MathIllegalArgumentException | MathArithmeticException ex) {
            throw new ConvergenceException(
                    ConvergenceException.REASON_LAPLACE_HESSIAN_INVALID,
                    "posterior Hessian at the MAP point is not positive definite: " + ex.getMessage(),
                    mode,
                    ex
            );
        }

        MultivariateNormalDistribution posterior;
        try {
            posterior = new MultivariateNormalDistribution(new Well19937c(request.getRandomSeed()), mode, covariance);
        } catch (MathIllegalArgumentException ex) {
            throw new ConvergenceException(
                    ConvergenceException.REASON_LAPLACE_HESSIAN_INVALID,
                    "posterior covariance is not a valid covariance matrix: " + ex.getMessage(),
                    mode,
                    ex
            );
        }
        List<double[]> samples = new ArrayList<>(request.getPosteriorSamples());
        for (int s = 0; s < request.getPosteriorSamples(); s++) {
            cancellation.throwIfCancelled("posterior sampling");
            samples.add(posterior.sample());
        }
        log.debug("Drew {} Laplace posterior samples in {} dimensions", samples.size(), mode.length);
        return new Estimate(optimum, samples);
    }

    static RealMatrix hessian(DifferentiableFunction function, double[] point, CancellationToken cancellation) {
        int n = point.length;
        double[][] hessian = new double[n][n];
        double[] probe = point.clone();
        double[] upper = new double[n];
        double[] lower = new double[n];
        for (int i = 0; i < n; i++) {
            cancellation.throwIfCancelled("hessian evaluation");
            double h = RELATIVE_STEP * Math.max(1.0d, Math.abs(point[i]));
            probe[i] = point[i] + h;
            function.valueAndGradient(probe, upper);
            probe[i] = point[i] - h;
            function.valueAndGradient(probe, lower);
            probe[i] = point[i];
            for (int j = 0; j < n; j++) {
                hessian[i][j] = (upper[j] - lower[j]) / (2.0d * h);
            }
        }
        return new Array2DRowRealMatrix(symmetrize(hessian), false);
    }

    private static double[][] symmetrize(double[][] matrix) {
        int n = matrix.length;
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out[i][j] = 0.5d * (matrix[i][j] + matrix[j][i]);
            }
        }
        return out;
    }
}
