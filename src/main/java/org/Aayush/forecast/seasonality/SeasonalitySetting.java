package org.Aayush.forecast.seasonality;

/**
 * Enablement of one built-in seasonality.
 *
 * @param toggle whether the seasonality is decided from history, forced on or forced off.
 * @param fourierOrder explicit order, or {@code 0} for the built-in default.
 */
public record SeasonalitySetting(Toggle toggle, int fourierOrder) {

    /**
     * Enablement choices.
     */
    public enum Toggle {
        AUTO,
        ENABLED,
        DISABLED
    }

    private static final SeasonalitySetting AUTO = new SeasonalitySetting(Toggle.AUTO, 0);
    private static final SeasonalitySetting ENABLED = new SeasonalitySetting(Toggle.ENABLED, 0);
    private static final SeasonalitySetting DISABLED = new SeasonalitySetting(Toggle.DISABLED, 0);

    public static SeasonalitySetting auto() {
        return AUTO;
    }

    public static SeasonalitySetting enabled() {
        return ENABLED;
    }

    public static SeasonalitySetting disabled() {
        return DISABLED;
    }

    /**
     * Forces the seasonality on with an explicit Fourier order; {@code 0} disables it.
     */
    public static SeasonalitySetting order(int fourierOrder) {
        if (fourierOrder < 0) {
            throw new IllegalArgumentException("fourierOrder must be >= 0");
        }
        return fourierOrder == 0 ? DISABLED : new SeasonalitySetting(Toggle.ENABLED, fourierOrder);
    }

    /**
     * Returns the explicit order, or {@code defaultOrder} when none was given.
     */
    public int orderOr(int defaultOrder) {
        return fourierOrder > 0 ? fourierOrder : defaultOrder;
    }
}
