package org.Aayush.forecast.design;

/**
 * Prior families used by the negative log posterior.
 */
public enum PriorKind {
    GAUSSIAN,
    LAPLACE,
    HALF_GAUSSIAN
}
