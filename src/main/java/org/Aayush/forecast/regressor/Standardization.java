package org.Aayush.forecast.regressor;

/**
 * Regressor standardization policy.
 *
 * <p>{@code AUTO} standardizes unless the training column only holds the values 0 and 1.</p>
 */
public enum Standardization {
    AUTO,
    ALWAYS,
    NEVER
}
