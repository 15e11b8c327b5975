package org.Aayush.forecast.design;

/**
 * How a seasonal, holiday or regressor component combines with the trend.
 *
 * <p>{@code ADDITIVE} terms add to the trend; {@code MULTIPLICATIVE} terms scale it:
 * {@code total = trend * (1 + sum multiplicative) + sum additive}.</p>
 */
public enum ComponentMode {
    ADDITIVE,
    MULTIPLICATIVE
}
