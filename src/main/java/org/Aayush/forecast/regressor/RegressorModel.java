package org.Aayush.forecast.regressor;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.ComponentMode;
import org.Aayush.forecast.design.FeatureColumn;
import org.Aayush.forecast.design.FeatureInput;
import org.Aayush.forecast.design.FeatureSource;
import org.Aayush.forecast.frame.TimeSeriesFrame;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One linear column per caller-supplied regressor.
 *
 * <p>Standardization statistics come from the training window only and are frozen here;
 * prediction reapplies them to future values without recomputing anything.</p>
 */
@Slf4j
public final class RegressorModel implements FeatureSource {
    private final List<FeatureColumn> columns;
    private final Map<String, RegressorStatistics> statistics;
    private final Set<String> dropped;

    /**
     * Plans regressor columns from training history.
     *
     * @param specs declared regressors.
     * @param history training frame holding the regressor columns.
     * @param defaultPriorScale prior scale for specs that do not declare one.
     * @param defaultMode mode for specs that do not declare one.
     * @throws InvalidInputException when a declared regressor is partially missing or a declaration is malformed.
     */
    public RegressorModel(
            List<RegressorSpec> specs,
            TimeSeriesFrame history,
            double defaultPriorScale,
            ComponentMode defaultMode
    ) {
        Objects.requireNonNull(specs, "specs");
        Objects.requireNonNull(history, "history");

        List<FeatureColumn> cols = new ArrayList<>();
        LinkedHashMap<String, RegressorStatistics> stats = new LinkedHashMap<>();
        Set<String> droppedNames = new HashSet<>();
        for (RegressorSpec spec : specs) {
            RegressorSpec valid = validate(Objects.requireNonNull(spec, "regressor"));
            if (stats.containsKey(valid.getName()) || droppedNames.contains(valid.getName())) {
                throw new InvalidInputException(
                        InvalidInputException.REASON_CONFIG_INVALID,
                        "regressor '" + valid.getName() + "' declared twice"
                );
            }
            double[] present = history.presentRegressorValues(valid.getName());
            if (present.length == 0) {
                log.warn("Regressor '{}' has no values in history; it is dropped from the model", valid.getName());
                droppedNames.add(valid.getName());
                continue;
            }
            if (present.length < history.size()) {
                throw new InvalidInputException(
                        InvalidInputException.REASON_REGRESSOR_MISSING,
                        "regressor '" + valid.getName() + "' is missing for "
                                + (history.size() - present.length) + " history rows"
                );
            }
            stats.put(valid.getName(), statisticsFor(valid, present));
            cols.add(new FeatureColumn(
                    valid.getName(),
                    valid.getName(),
                    valid.getMode() == null ? defaultMode : valid.getMode(),
                    valid.getPriorScale() == null ? defaultPriorScale : valid.getPriorScale()
            ));
        }
        this.columns = List.copyOf(cols);
        this.statistics = Collections.unmodifiableMap(stats);
        this.dropped = Collections.unmodifiableSet(droppedNames);
    }

    /**
     * Returns frozen training statistics by regressor name.
     */
    public Map<String, RegressorStatistics> statistics() {
        return statistics;
    }

    /**
     * Returns names of regressors dropped because history held no values for them.
     */
    public Set<String> droppedRegressors() {
        return dropped;
    }

    @Override
    public List<FeatureColumn> columns() {
        return columns;
    }

    /**
     * Transforms raw regressor values with the stored training statistics.
     *
     * @throws InvalidInputException when any row lacks a value for a fitted regressor.
     */
    @Override
    public double[][] evaluate(FeatureInput input) {
        double[][] out = new double[input.size()][columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            String name = columns.get(c).name();
            RegressorStatistics stat = statistics.get(name);
            double[] raw = input.regressor(name);
            for (int i = 0; i < raw.length; i++) {
                if (!Double.isFinite(raw[i])) {
                    throw new InvalidInputException(
                            InvalidInputException.REASON_REGRESSOR_MISSING,
                            "regressor '" + name + "' has no finite value at row " + i
                    );
                }
                out[i][c] = stat.apply(raw[i]);
            }
        }
        return out;
    }

    private static RegressorStatistics statisticsFor(RegressorSpec spec, double[] values) {
        boolean standardize = switch (spec.getStandardization()) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> !isBinary(values);
        };
        if (!standardize) {
            return RegressorStatistics.IDENTITY;
        }
        double mean = new Mean().evaluate(values);
        double std = values.length > 1 ? new StandardDeviation().evaluate(values) : 0.0d;
        if (!(std > 0.0d)) {
            std = 1.0d;
        }
        return new RegressorStatistics(mean, std, true);
    }

    private static boolean isBinary(double[] values) {
        boolean sawZero = false;
        boolean sawOne = false;
        for (double value : values) {
            if (value == 0.0d) {
                sawZero = true;
            } else if (value == 1.0d) {
                sawOne = true;
            } else {
                return false;
            }
        }
        return sawZero && sawOne;
    }

    private static RegressorSpec validate(RegressorSpec spec) {
        if (spec.getName() == null || spec.getName().isBlank()) {
            throw new InvalidInputException(InvalidInputException.REASON_CONFIG_INVALID, "regressor name must be non-blank");
        }
        if (spec.getPriorScale() != null && !(spec.getPriorScale() > 0.0d)) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "regressor '" + spec.getName() + "' priorScale must be positive"
            );
        }
        if (spec.getStandardization() == null) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "regressor '" + spec.getName() + "' standardization is required"
            );
        }
        return spec;
    }
}
