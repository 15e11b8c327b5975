package org.Aayush.forecast.holiday;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.ComponentMode;
import org.Aayush.forecast.design.FeatureColumn;
import org.Aayush.forecast.design.FeatureInput;
import org.Aayush.forecast.design.FeatureSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Indicator columns for holiday windows.
 *
 * <p>A column exists per (holiday name, day offset) pair that occurs at least once inside
 * the training date range; pairs seen only outside it get no coefficient and contribute
 * nothing at prediction time. A row whose UTC date matches any occurrence of a pair gets a
 * {@code 1} in that pair's column.</p>
 */
@Slf4j
public final class HolidayModel implements FeatureSource {
    private final List<FeatureColumn> columns;
    private final Map<LocalDate, IntArrayList> columnsByDate;
    private final Set<String> holidayNames;

    /**
     * Plans holiday columns against the training date range.
     *
     * @param entries holiday occurrences.
     * @param trainingStart first training date (inclusive).
     * @param trainingEnd last training date (inclusive).
     * @param defaultPriorScale prior scale for entries that do not declare one.
     * @param defaultMode mode for entries that do not declare one.
     * @throws InvalidInputException when an entry is malformed or a name has inconsistent settings.
     */
    public HolidayModel(
            List<HolidayEntry> entries,
            LocalDate trainingStart,
            LocalDate trainingEnd,
            double defaultPriorScale,
            ComponentMode defaultMode
    ) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(trainingStart, "trainingStart");
        Objects.requireNonNull(trainingEnd, "trainingEnd");

        Map<String, HolidayEntry> settingsByName = new HashMap<>();
        TreeMap<String, TreeMap<Integer, List<LocalDate>>> occurrences = new TreeMap<>();
        for (HolidayEntry entry : entries) {
            HolidayEntry valid = validate(Objects.requireNonNull(entry, "holiday"));
            HolidayEntry previous = settingsByName.putIfAbsent(valid.getName(), valid);
            if (previous != null) {
                requireConsistent(previous, valid);
            }
            TreeMap<Integer, List<LocalDate>> byOffset = occurrences.computeIfAbsent(valid.getName(), k -> new TreeMap<>());
            for (int offset = -valid.getLowerWindow(); offset <= valid.getUpperWindow(); offset++) {
                byOffset.computeIfAbsent(offset, k -> new ArrayList<>()).add(valid.getDate().plusDays(offset));
            }
        }

        List<FeatureColumn> cols = new ArrayList<>();
        Map<LocalDate, IntArrayList> byDate = new HashMap<>();
        Set<String> names = new LinkedHashSet<>();
        int skipped = 0;
        for (Map.Entry<String, TreeMap<Integer, List<LocalDate>>> named : occurrences.entrySet()) {
            HolidayEntry settings = settingsByName.get(named.getKey());
            double priorScale = settings.getPriorScale() == null ? defaultPriorScale : settings.getPriorScale();
            ComponentMode mode = settings.getMode() == null ? defaultMode : settings.getMode();
            for (Map.Entry<Integer, List<LocalDate>> offsetDates : named.getValue().entrySet()) {
                if (!anyWithin(offsetDates.getValue(), trainingStart, trainingEnd)) {
                    skipped++;
                    continue;
                }
                int columnIndex = cols.size();
                cols.add(new FeatureColumn(
                        columnName(named.getKey(), offsetDates.getKey()),
                        named.getKey(),
                        mode,
                        priorScale
                ));
                names.add(named.getKey());
                for (LocalDate date : offsetDates.getValue()) {
                    IntArrayList indexes = byDate.computeIfAbsent(date, k -> new IntArrayList());
                    if (!indexes.contains(columnIndex)) {
                        indexes.add(columnIndex);
                    }
                }
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} holiday window offsets with no occurrence inside training range", skipped);
        }
        this.columns = List.copyOf(cols);
        this.columnsByDate = Collections.unmodifiableMap(byDate);
        this.holidayNames = Collections.unmodifiableSet(names);
    }

    /**
     * Returns names of holidays that own at least one column.
     */
    public Set<String> holidayNames() {
        return holidayNames;
    }

    @Override
    public List<FeatureColumn> columns() {
        return columns;
    }

    @Override
    public double[][] evaluate(FeatureInput input) {
        double[][] out = new double[input.size()][columns.size()];
        LocalDate[] dates = input.dates();
        for (int i = 0; i < dates.length; i++) {
            IntArrayList indexes = columnsByDate.get(dates[i]);
            if (indexes == null) {
                continue;
            }
            for (int c = 0; c < indexes.size(); c++) {
                out[i][indexes.getInt(c)] = 1.0d;
            }
        }
        return out;
    }

    /**
     * Returns the column name for a (holiday, offset) pair, e.g. {@code christmas_-1}, {@code christmas_+0}.
     */
    public static String columnName(String holiday, int offset) {
        return holiday + "_" + (offset < 0 ? "-" : "+") + Math.abs(offset);
    }

    private static boolean anyWithin(List<LocalDate> dates, LocalDate start, LocalDate end) {
        for (LocalDate date : dates) {
            if (!date.isBefore(start) && !date.isAfter(end)) {
                return true;
            }
        }
        return false;
    }

    private static HolidayEntry validate(HolidayEntry entry) {
        if (entry.getName() == null || entry.getName().isBlank()) {
            throw new InvalidInputException(InvalidInputException.REASON_CONFIG_INVALID, "holiday name must be non-blank");
        }
        if (entry.getDate() == null) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "holiday '" + entry.getName() + "' date is required"
            );
        }
        if (entry.getLowerWindow() < 0 || entry.getUpperWindow() < 0) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "holiday '" + entry.getName() + "' windows must be non-negative"
            );
        }
        if (entry.getPriorScale() != null && !(entry.getPriorScale() > 0.0d)) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "holiday '" + entry.getName() + "' priorScale must be positive"
            );
        }
        return entry;
    }

    private static void requireConsistent(HolidayEntry first, HolidayEntry other) {
        if (!Objects.equals(first.getPriorScale(), other.getPriorScale())
                || !Objects.equals(first.getMode(), other.getMode())) {
            throw new InvalidInputException(
                    InvalidInputException.REASON_CONFIG_INVALID,
                    "holiday '" + first.getName() + "' has inconsistent priorScale or mode across occurrences"
            );
        }
    }
}
