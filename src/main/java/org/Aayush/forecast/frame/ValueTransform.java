package org.Aayush.forecast.frame;

import org.Aayush.forecast.core.error.InvalidInputException;

/**
 * Monotone value transform applied before scaling and undone on the way out.
 */
public enum ValueTransform {
    IDENTITY {
        @Override
        public double apply(double value) {
            return value;
        }

        @Override
        public double inverse(double transformed) {
            return transformed;
        }
    },
    LOG {
        @Override
        public double apply(double value) {
            if (!(value > 0.0d)) {
                throw new InvalidInputException(
                        InvalidInputException.REASON_NON_POSITIVE_VALUE,
                        "log transform requires strictly positive values, got " + value
                );
            }
            return Math.log(value);
        }

        @Override
        public double inverse(double transformed) {
            return Math.exp(transformed);
        }
    };

    /**
     * Maps an observed value into model space.
     */
    public abstract double apply(double value);

    /**
     * Maps a model-space value back to observed units.
     */
    public abstract double inverse(double transformed);
}
