package org.Aayush.forecast.engine;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.concurrent.CancellationToken;
import org.Aayush.forecast.core.error.AlreadyFittedException;
import org.Aayush.forecast.core.error.NotFittedException;
import org.Aayush.forecast.frame.FuturePoint;
import org.Aayush.forecast.frame.TimeSeriesFrame;
import org.Aayush.forecast.optimizer.EstimationStrategyRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point: fits one model and serves predictions from it.
 *
 * <p>An engine is a one-shot builder. {@code fit} moves it {@code UNFITTED -> FITTING -> FITTED};
 * any failure (validation, convergence, cancellation) returns it to {@code UNFITTED} so the
 * caller may retry. Calling {@code fit} on a fitting or fitted engine throws
 * {@link AlreadyFittedException}; create a new engine to re-fit. Predictions read the immutable
 * {@link FittedModel} and may run concurrently.</p>
 */
@Slf4j
public final class ForecastEngine {
    private final ForecastConfig config;
    private final EstimationStrategyRegistry strategies;
    private final AtomicReference<EngineState> state = new AtomicReference<>(EngineState.UNFITTED);
    private volatile FittedModel fittedModel;

    /**
     * Creates an engine with built-in estimation strategies.
     */
    public ForecastEngine(ForecastConfig config) {
        this(config, EstimationStrategyRegistry.defaultRegistry());
    }

    /**
     * Creates an engine.
     *
     * @param config validated model configuration.
     * @param strategies estimation strategy registry.
     */
    public ForecastEngine(ForecastConfig config, EstimationStrategyRegistry strategies) {
        this.config = Objects.requireNonNull(config, "config");
        this.strategies = Objects.requireNonNull(strategies, "strategies");
        config.validate();
        strategies.strategy(config.getEstimationMode());
    }

    public ForecastConfig config() {
        return config;
    }

    public EngineState state() {
        return state.get();
    }

    /**
     * Fits the model without cancellation support.
     */
    public FittedModel fit(TimeSeriesFrame history) {
        return fit(history, CancellationToken.none());
    }

    /**
     * Fits the model on the calling thread.
     *
     * @param history normalized training frame.
     * @param cancellation checked between optimizer iterations.
     * @return fitted model, also retained by this engine.
     * @throws AlreadyFittedException when this engine is fitting or fitted.
     */
    public FittedModel fit(TimeSeriesFrame history, CancellationToken cancellation) {
        Objects.requireNonNull(history, "history");
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        beginFit();
        return runFit(history, token);
    }

    /**
     * Fits the model on {@code executor}.
     */
    public CompletableFuture<FittedModel> fitAsync(TimeSeriesFrame history, Executor executor) {
        return fitAsync(history, CancellationToken.none(), executor);
    }

    /**
     * Fits the model on {@code executor}.
     *
     * <p>The state check happens on the calling thread, so a second submission fails
     * immediately with {@link AlreadyFittedException}.</p>
     *
     * @param history normalized training frame.
     * @param cancellation checked between optimizer iterations.
     * @param executor worker that runs the CPU-bound fit.
     * @return future completed with the fitted model, or exceptionally with the fit failure.
     */
    public CompletableFuture<FittedModel> fitAsync(
            TimeSeriesFrame history,
            CancellationToken cancellation,
            Executor executor
    ) {
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(executor, "executor");
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        beginFit();
        try {
            return CompletableFuture.supplyAsync(() -> runFit(history, token), executor);
        } catch (RejectedExecutionException ex) {
            state.set(EngineState.UNFITTED);
            throw ex;
        }
    }

    /**
     * Predicts without per-component contributions.
     */
    public List<ForecastRow> predict(List<FuturePoint> points) {
        return predict(points, false);
    }

    /**
     * Predicts one row per future point.
     *
     * @throws NotFittedException before a successful fit.
     */
    public List<ForecastRow> predict(List<FuturePoint> points, boolean includeComponents) {
        return ForecastPredictor.predict(fittedModel(), points, includeComponents);
    }

    /**
     * Returns the fitted model.
     *
     * @throws NotFittedException before a successful fit.
     */
    public FittedModel fittedModel() {
        FittedModel model = fittedModel;
        if (model == null || state.get() != EngineState.FITTED) {
            throw new NotFittedException("engine has no fitted model (state " + state.get() + ")");
        }
        return model;
    }

    private void beginFit() {
        if (state.compareAndSet(EngineState.UNFITTED, EngineState.FITTING)) {
            return;
        }
        EngineState current = state.get();
        if (current == EngineState.FITTING) {
            throw new AlreadyFittedException(AlreadyFittedException.REASON_FIT_IN_PROGRESS, "a fit is already running");
        }
        throw new AlreadyFittedException(
                AlreadyFittedException.REASON_ALREADY_FITTED,
                "engine is already fitted; create a new engine to re-fit"
        );
    }

    private FittedModel runFit(TimeSeriesFrame history, CancellationToken token) {
        log.info(
                "Fitting {} model on {} observations [{} .. {}] with {} estimation",
                config.getGrowth(),
                history.size(),
                history.start(),
                history.end(),
                config.getEstimationMode()
        );
        try {
            FittedModel model = ModelFitter.fit(history, config, strategies, token);
            fittedModel = model;
            state.set(EngineState.FITTED);
            return model;
        } catch (RuntimeException ex) {
            state.set(EngineState.UNFITTED);
            log.debug("Fit failed, engine returned to UNFITTED: {}", ex.getMessage());
            throw ex;
        }
    }
}
