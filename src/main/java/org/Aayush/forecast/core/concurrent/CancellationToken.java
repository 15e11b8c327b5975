package org.Aayush.forecast.core.concurrent;

import org.Aayush.forecast.core.error.ForecastCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked between optimizer iterations and simulation trials.
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a token that can be cancelled.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Returns the shared token that never reports cancellation.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation. Ignored by {@link #none()}.
     */
    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws {@link ForecastCancelledException} when cancellation was requested.
     *
     * @param stage short description of the interrupted work.
     */
    public void throwIfCancelled(String stage) {
        if (cancelled.get()) {
            throw new ForecastCancelledException("cancelled during " + stage);
        }
    }
}
