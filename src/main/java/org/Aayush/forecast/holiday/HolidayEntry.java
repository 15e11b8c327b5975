package org.Aayush.forecast.holiday;

import lombok.Builder;
import lombok.Value;
import org.Aayush.forecast.design.ComponentMode;

import java.time.LocalDate;

/**
 * One labeled holiday occurrence with its effect window.
 *
 * <p>The window covers {@code [date - lowerWindow, date + upperWindow]}; every day offset in it
 * owns an independent coefficient shared by all occurrences of the same name.</p>
 */
@Value
@Builder
public class HolidayEntry {
    /** Holiday date (UTC calendar date). */
    LocalDate date;
    /** Holiday name; occurrences with the same name share coefficients. */
    String name;
    /** Days before {@link #date} covered by the window (non-negative). */
    int lowerWindow;
    /** Days after {@link #date} covered by the window (non-negative). */
    int upperWindow;
    /** Gaussian prior scale; {@code null} inherits the engine default. */
    Double priorScale;
    /** Combination mode; {@code null} inherits the engine default. */
    ComponentMode mode;

    /**
     * Creates a single-day holiday.
     */
    public static HolidayEntry of(String name, LocalDate date) {
        return HolidayEntry.builder().name(name).date(date).build();
    }
}
