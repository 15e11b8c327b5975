package org.Aayush.forecast.seasonality;

import org.Aayush.forecast.design.FeatureColumn;
import org.Aayush.forecast.design.FeatureInput;
import org.Aayush.forecast.design.FeatureSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fourier-series columns for every resolved seasonality.
 */
public final class SeasonalityModel implements FeatureSource {
    private final List<SeasonalitySpec> seasonalities;
    private final List<FeatureColumn> columns;

    /**
     * Creates a source from resolved seasonalities (prior scale and mode must be set).
     */
    public SeasonalityModel(List<SeasonalitySpec> seasonalities) {
        this.seasonalities = List.copyOf(Objects.requireNonNull(seasonalities, "seasonalities"));
        List<FeatureColumn> cols = new ArrayList<>();
        for (SeasonalitySpec spec : this.seasonalities) {
            double priorScale = Objects.requireNonNull(spec.getPriorScale(), "seasonality.priorScale");
            Objects.requireNonNull(spec.getMode(), "seasonality.mode");
            for (int k = 1; k <= spec.getFourierOrder(); k++) {
                cols.add(new FeatureColumn(spec.getName() + "_sin_" + k, spec.getName(), spec.getMode(), priorScale));
                cols.add(new FeatureColumn(spec.getName() + "_cos_" + k, spec.getName(), spec.getMode(), priorScale));
            }
        }
        this.columns = List.copyOf(cols);
    }

    public List<SeasonalitySpec> seasonalities() {
        return seasonalities;
    }

    @Override
    public List<FeatureColumn> columns() {
        return columns;
    }

    @Override
    public double[][] evaluate(FeatureInput input) {
        double[][] out = new double[input.size()][columns.size()];
        int offset = 0;
        for (SeasonalitySpec spec : seasonalities) {
            double[][] block = FourierSeries.features(input.epochDays(), spec.getPeriod(), spec.getFourierOrder());
            int width = 2 * spec.getFourierOrder();
            for (int i = 0; i < out.length; i++) {
                System.arraycopy(block[i], 0, out[i], offset, width);
            }
            offset += width;
        }
        return out;
    }
}
