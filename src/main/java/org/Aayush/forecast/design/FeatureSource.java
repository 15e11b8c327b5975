package org.Aayush.forecast.design;

import java.util.List;

/**
 * A component that contributes linear columns to the design matrix.
 *
 * <p>Sources are planned once from training data and then re-evaluated unchanged on
 * prediction rows, so they must be immutable after construction.</p>
 */
public interface FeatureSource {

    /**
     * Returns the columns this source contributes, in evaluation order.
     */
    List<FeatureColumn> columns();

    /**
     * Computes this source's columns for every input row.
     *
     * @param input row-aligned raw inputs.
     * @return matrix of shape {@code input.size() x columns().size()}.
     */
    double[][] evaluate(FeatureInput input);
}
