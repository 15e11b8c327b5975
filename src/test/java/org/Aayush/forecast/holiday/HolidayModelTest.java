package org.Aayush.forecast.holiday;

import org.Aayush.forecast.core.error.InvalidInputException;
import org.Aayush.forecast.design.ComponentMode;
import org.Aayush.forecast.design.FeatureColumn;
import org.Aayush.forecast.design.FeatureInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Holiday Model Tests")
class HolidayModelTest {
    private static final LocalDate TRAIN_START = LocalDate.of(2021, 1, 1);
    private static final LocalDate TRAIN_END = LocalDate.of(2021, 12, 31);

    @Test
    @DisplayName("Each window offset owns its own column")
    void testWindowColumns() {
        HolidayEntry christmas = HolidayEntry.builder()
                .name("christmas")
                .date(LocalDate.of(2021, 12, 25))
                .lowerWindow(1)
                .upperWindow(1)
                .build();
        HolidayModel model = new HolidayModel(List.of(christmas), TRAIN_START, TRAIN_END, 10.0d, ComponentMode.ADDITIVE);

        assertEquals(
                List.of("christmas_-1", "christmas_+0", "christmas_+1"),
                model.columns().stream().map(FeatureColumn::name).collect(Collectors.toList())
        );
        assertEquals(Set.of("christmas"), model.holidayNames());
        for (FeatureColumn column : model.columns()) {
            assertEquals("christmas", column.component());
            assertEquals(10.0d, column.priorScale());
        }
    }

    @Test
    @DisplayName("Occurrences are shared by name and indicators mark matching dates")
    void testIndicators() {
        HolidayModel model = new HolidayModel(
                List.of(
                        HolidayEntry.of("launch", LocalDate.of(2021, 3, 1)),
                        HolidayEntry.of("launch", LocalDate.of(2022, 3, 1))
                ),
                TRAIN_START,
                TRAIN_END,
                10.0d,
                ComponentMode.ADDITIVE
        );
        assertEquals(1, model.columns().size());

        FeatureInput input = new FeatureInput(
                new double[3],
                new LocalDate[]{LocalDate.of(2021, 3, 1), LocalDate.of(2021, 3, 2), LocalDate.of(2022, 3, 1)},
                Map.of()
        );
        double[][] features = model.evaluate(input);
        assertArrayEquals(new double[]{1.0d}, features[0]);
        assertArrayEquals(new double[]{0.0d}, features[1]);
        assertArrayEquals(new double[]{1.0d}, features[2]);
    }

    @Test
    @DisplayName("Holidays without any occurrence in the training range get no columns")
    void testOutOfRangeHolidaySkipped() {
        HolidayEntry future = HolidayEntry.builder()
                .name("future_event")
                .date(LocalDate.of(2023, 6, 1))
                .upperWindow(2)
                .build();
        HolidayEntry edge = HolidayEntry.builder()
                .name("edge")
                .date(LocalDate.of(2022, 1, 1))
                .lowerWindow(1)
                .build();
        HolidayModel model = new HolidayModel(List.of(future, edge), TRAIN_START, TRAIN_END, 10.0d, ComponentMode.ADDITIVE);

        assertEquals(List.of("edge_-1"), model.columns().stream().map(FeatureColumn::name).collect(Collectors.toList()));
        assertTrue(model.holidayNames().contains("edge"));
        assertFalse(model.holidayNames().contains("future_event"));
    }

    @Test
    @DisplayName("Per-holiday prior and mode override engine defaults")
    void testOverrides() {
        HolidayEntry sale = HolidayEntry.builder()
                .name("sale")
                .date(LocalDate.of(2021, 7, 1))
                .priorScale(2.0d)
                .mode(ComponentMode.MULTIPLICATIVE)
                .build();
        FeatureColumn column = new HolidayModel(List.of(sale), TRAIN_START, TRAIN_END, 10.0d, ComponentMode.ADDITIVE)
                .columns()
                .get(0);
        assertEquals(2.0d, column.priorScale());
        assertTrue(column.multiplicative());
        assertEquals("sale_+0", HolidayModel.columnName("sale", 0));
    }

    @Test
    @DisplayName("Malformed and inconsistent holidays are rejected")
    void testValidation() {
        HolidayEntry negative = HolidayEntry.builder().name("x").date(LocalDate.of(2021, 1, 5)).lowerWindow(-1).build();
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> new HolidayModel(
                List.of(negative), TRAIN_START, TRAIN_END, 10.0d, ComponentMode.ADDITIVE
        ));
        assertEquals(InvalidInputException.REASON_CONFIG_INVALID, ex.reasonCode());

        HolidayEntry first = HolidayEntry.builder().name("y").date(LocalDate.of(2021, 1, 5)).priorScale(1.0d).build();
        HolidayEntry second = HolidayEntry.builder().name("y").date(LocalDate.of(2021, 2, 5)).priorScale(3.0d).build();
        assertThrows(InvalidInputException.class, () -> new HolidayModel(
                List.of(first, second), TRAIN_START, TRAIN_END, 10.0d, ComponentMode.ADDITIVE
        ));

        HolidayEntry unnamed = HolidayEntry.builder().name(" ").date(LocalDate.of(2021, 1, 5)).build();
        assertThrows(InvalidInputException.class, () -> new HolidayModel(
                List.of(unnamed), TRAIN_START, TRAIN_END, 10.0d, ComponentMode.ADDITIVE
        ));
    }
}
