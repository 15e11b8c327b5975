package org.Aayush.forecast.engine;

import org.Aayush.forecast.core.error.NotFittedException;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caller-owned mapping from series identifier to fitted model.
 *
 * <p>Thread-safe. Models are immutable, so a registered model can be read and predicted from
 * any thread while other series are being replaced.</p>
 */
public final class FittedModelRegistry {
    private final ConcurrentHashMap<String, FittedModel> modelsBySeries = new ConcurrentHashMap<>();

    /**
     * Registers or replaces the model for {@code seriesId}.
     *
     * @return previously registered model, if any.
     */
    public Optional<FittedModel> register(String seriesId, FittedModel model) {
        return Optional.ofNullable(modelsBySeries.put(normalizeSeriesId(seriesId), Objects.requireNonNull(model, "model")));
    }

    public Optional<FittedModel> find(String seriesId) {
        return Optional.ofNullable(modelsBySeries.get(normalizeSeriesId(seriesId)));
    }

    /**
     * Returns the model for {@code seriesId}.
     *
     * @throws NotFittedException when nothing is registered for the series.
     */
    public FittedModel require(String seriesId) {
        String id = normalizeSeriesId(seriesId);
        FittedModel model = modelsBySeries.get(id);
        if (model == null) {
            throw new NotFittedException("no fitted model registered for series '" + id + "'");
        }
        return model;
    }

    public Optional<FittedModel> remove(String seriesId) {
        return Optional.ofNullable(modelsBySeries.remove(normalizeSeriesId(seriesId)));
    }

    public Set<String> seriesIds() {
        return Collections.unmodifiableSet(modelsBySeries.keySet());
    }

    public int size() {
        return modelsBySeries.size();
    }

    private static String normalizeSeriesId(String seriesId) {
        String normalized = Objects.requireNonNull(seriesId, "seriesId").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("seriesId must be non-blank");
        }
        return normalized;
    }
}
