package org.Aayush.forecast.engine;

import org.Aayush.forecast.core.error.ConvergenceException;

import java.util.Objects;

/**
 * Convergence failure of a fit that still produced a usable, sub-optimal model.
 *
 * <p>The candidate is assembled from the best iterate and reports termination
 * {@code INCOMPLETE}. The engine stays unfitted; accepting the candidate is up to the caller.</p>
 */
public final class FitConvergenceException extends ConvergenceException {
    private final transient FittedModel candidateModel;

    /**
     * Wraps {@code failure} with a candidate model built from its best iterate.
     */
    public FitConvergenceException(ConvergenceException failure, FittedModel candidateModel) {
        super(Objects.requireNonNull(failure, "failure"));
        this.candidateModel = Objects.requireNonNull(candidateModel, "candidateModel");
    }

    public FittedModel candidateModel() {
        return candidateModel;
    }
}
