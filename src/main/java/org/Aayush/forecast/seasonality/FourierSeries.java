package org.Aayush.forecast.seasonality;

/**
 * Fourier feature generation on absolute epoch-day time.
 */
public final class FourierSeries {

    private FourierSeries() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Builds {@code sin(2 pi k t / P), cos(2 pi k t / P)} pairs for {@code k = 1..order}.
     *
     * @param epochDays row times in epoch days.
     * @param period period in days.
     * @param order number of harmonics.
     * @return matrix of shape {@code epochDays.length x 2*order}, columns ordered sin1, cos1, sin2, ...
     */
    public static double[][] features(double[] epochDays, double period, int order) {
        double[][] features = new double[epochDays.length][2 * order];
        for (int i = 0; i < epochDays.length; i++) {
            double base = 2.0d * Math.PI * epochDays[i] / period;
            for (int k = 1; k <= order; k++) {
                features[i][2 * (k - 1)] = Math.sin(k * base);
                features[i][2 * (k - 1) + 1] = Math.cos(k * base);
            }
        }
        return features;
    }
}
