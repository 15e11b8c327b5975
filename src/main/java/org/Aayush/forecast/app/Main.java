package org.Aayush.forecast.app;

import org.Aayush.forecast.engine.ForecastConfig;
import org.Aayush.forecast.engine.ForecastEngine;
import org.Aayush.forecast.engine.ForecastRow;
import org.Aayush.forecast.frame.FuturePoint;
import org.Aayush.forecast.frame.Observation;
import org.Aayush.forecast.frame.TimeSeriesFrame;
import org.Aayush.forecast.seasonality.SeasonalitySetting;

import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Quickstart smoke run: fits three years of synthetic daily data and prints the forecast tail.
 */
public class Main {
    static final Instant HISTORY_START = Instant.parse("2020-01-01T00:00:00Z");
    static final int HISTORY_DAYS = 3 * 365;
    static final int DEFAULT_HORIZON_DAYS = 30;
    private static final int TAIL_ROWS = 5;

    /**
     * Runs the quickstart.
     *
     * @param args optional forecast horizon in days.
     */
    public static void main(String[] args) {
        int horizon = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_HORIZON_DAYS;
        run(System.out, horizon);
    }

    /**
     * Fits the synthetic history, predicts {@code horizonDays} past it and prints the last rows.
     *
     * @return all forecast rows.
     */
    static List<ForecastRow> run(PrintStream out, int horizonDays) {
        if (horizonDays <= 0) {
            throw new IllegalArgumentException("horizonDays must be > 0");
        }
        ForecastConfig config = ForecastConfig.builder()
                .yearlySeasonality(SeasonalitySetting.enabled())
                .weeklySeasonality(SeasonalitySetting.disabled())
                .build();
        ForecastEngine engine = new ForecastEngine(config);
        engine.fit(TimeSeriesFrame.of(syntheticHistory()));

        List<FuturePoint> future = new ArrayList<>(horizonDays);
        Instant last = HISTORY_START.plus(Duration.ofDays(HISTORY_DAYS - 1L));
        for (int d = 1; d <= horizonDays; d++) {
            future.add(FuturePoint.of(last.plus(Duration.ofDays(d))));
        }
        List<ForecastRow> rows = engine.predict(future, true);

        out.printf("%-22s %10s %10s %10s%n", "timestamp", "yhat", "yhat_lower", "yhat_upper");
        for (ForecastRow row : rows.subList(Math.max(0, rows.size() - TAIL_ROWS), rows.size())) {
            out.printf("%-22s %10.3f %10.3f %10.3f%n", row.getTimestamp(), row.getYhat(), row.getYhatLower(), row.getYhatUpper());
        }
        return rows;
    }

    /**
     * {@code 10 + 0.01 t + 5 sin(2 pi t / 365.25)} plus small seeded noise, one value per day.
     */
    static List<Observation> syntheticHistory() {
        Random noise = new Random(7L);
        List<Observation> history = new ArrayList<>(HISTORY_DAYS);
        for (int t = 0; t < HISTORY_DAYS; t++) {
            history.add(Observation.of(HISTORY_START.plus(Duration.ofDays(t)), truth(t) + 0.1d * noise.nextGaussian()));
        }
        return history;
    }

    static double truth(double day) {
        return 10.0d + 0.01d * day + 5.0d * Math.sin(2.0d * Math.PI * day / 365.25d);
    }
}
