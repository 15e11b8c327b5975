package org.Aayush.forecast.seasonality;

import org.Aayush.forecast.design.ComponentMode;

/**
 * Fitted periodic component.
 *
 * <p>Coefficients live in scaled value space, ordered like {@link FourierSeries} columns.
 * Additive contributions must be multiplied by the frame value scale to get observed units;
 * multiplicative contributions are relative to the trend.</p>
 *
 * @param name component name.
 * @param period period in days.
 * @param fourierOrder harmonic count.
 * @param mode combination mode.
 * @param coefficients {@code 2 * fourierOrder} Fourier coefficients.
 */
public record SeasonalComponent(String name, double period, int fourierOrder, ComponentMode mode, double[] coefficients) {

    public SeasonalComponent {
        coefficients = coefficients.clone();
    }

    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    /**
     * Returns the amplitude {@code sqrt(a_k^2 + b_k^2)} of harmonic {@code k} (1-based), in scaled units.
     */
    public double amplitude(int harmonic) {
        if (harmonic < 1 || harmonic > fourierOrder) {
            throw new IllegalArgumentException("harmonic out of range: " + harmonic);
        }
        return Math.hypot(coefficients[2 * (harmonic - 1)], coefficients[2 * (harmonic - 1) + 1]);
    }

    /**
     * Evaluates the component in scaled units at each epoch-day time.
     */
    public double[] evaluate(double[] epochDays) {
        double[][] features = FourierSeries.features(epochDays, period, fourierOrder);
        double[] values = new double[epochDays.length];
        for (int i = 0; i < values.length; i++) {
            double sum = 0.0d;
            for (int c = 0; c < coefficients.length; c++) {
                sum += features[i][c] * coefficients[c];
            }
            values[i] = sum;
        }
        return values;
    }
}
