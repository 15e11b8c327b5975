package org.Aayush.forecast.trend;

/**
 * Supported trend growth modes.
 *
 * <p>{@code LINEAR} is piecewise linear, {@code LOGISTIC} saturates at a per-timestamp
 * capacity, {@code FLAT} holds a constant offset.</p>
 */
public enum GrowthMode {
    LINEAR,
    LOGISTIC,
    FLAT
}
