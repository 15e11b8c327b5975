package org.Aayush.forecast.optimizer;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry for estimation strategies.
 */
public final class EstimationStrategyRegistry {
    private static final EstimationStrategy MAP_STRATEGY = new MapEstimationStrategy();
    private static final EstimationStrategy LAPLACE_STRATEGY = new LaplaceEstimationStrategy();

    private final Map<String, EstimationStrategy> strategiesById;

    /**
     * Creates a registry with built-in strategies only.
     */
    public EstimationStrategyRegistry() {
        this.strategiesById = Map.copyOf(materialize(defaultStrategies()));
    }

    /**
     * Creates a registry by merging built-ins with custom strategies.
     *
     * <p>Custom strategy ids override built-ins when ids collide.</p>
     */
    public EstimationStrategyRegistry(Collection<? extends EstimationStrategy> customStrategies) {
        LinkedHashMap<String, EstimationStrategy> merged = materialize(defaultStrategies());
        if (customStrategies != null) {
            merged.putAll(materialize(customStrategies));
        }
        this.strategiesById = Map.copyOf(merged);
    }

    /**
     * Returns strategy by id, or {@code null} when not registered.
     */
    public EstimationStrategy strategy(String strategyId) {
        if (strategyId == null) {
            return null;
        }
        return strategiesById.get(strategyId);
    }

    /**
     * Returns the strategy implementing {@code mode}.
     *
     * @throws IllegalStateException when no strategy is registered for the mode.
     */
    public EstimationStrategy strategy(EstimationMode mode) {
        EstimationStrategy strategy = strategy(Objects.requireNonNull(mode, "mode").strategyId());
        if (strategy == null) {
            throw new IllegalStateException("no estimation strategy registered for " + mode);
        }
        return strategy;
    }

    /**
     * Returns immutable set of registered strategy ids.
     */
    public Set<String> strategyIds() {
        return strategiesById.keySet();
    }

    /**
     * Returns a new default registry instance.
     */
    public static EstimationStrategyRegistry defaultRegistry() {
        return new EstimationStrategyRegistry();
    }

    private static Collection<? extends EstimationStrategy> defaultStrategies() {
        return List.of(MAP_STRATEGY, LAPLACE_STRATEGY);
    }

    private static LinkedHashMap<String, EstimationStrategy> materialize(
            Collection<? extends EstimationStrategy> strategies
    ) {
        LinkedHashMap<String, EstimationStrategy> map = new LinkedHashMap<>();
        for (EstimationStrategy strategy : strategies) {
            EstimationStrategy nonNullStrategy = Objects.requireNonNull(strategy, "strategy");
            map.put(normalizeRequiredId(nonNullStrategy.id(), "strategy.id"), nonNullStrategy);
        }
        return map;
    }

    private static String normalizeRequiredId(String id, String fieldName) {
        String normalized = Objects.requireNonNull(id, fieldName).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return normalized;
    }
}
