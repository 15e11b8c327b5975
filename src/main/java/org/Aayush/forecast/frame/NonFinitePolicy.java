package org.Aayush.forecast.frame;

/**
 * Handling of NaN or infinite observed values when building a frame.
 */
public enum NonFinitePolicy {
    /** Silently removes the offending observations (logged at DEBUG). */
    DROP,
    /** Rejects the whole history with {@code F_NON_FINITE_VALUE}. */
    REJECT
}
