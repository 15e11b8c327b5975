package org.Aayush.forecast.frame;

import org.Aayush.forecast.core.error.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.Aayush.forecast.testutil.SyntheticSeries.day;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TimeSeriesFrame Tests")
class TimeSeriesFrameTest {

    @Test
    @DisplayName("Rows are sorted and duplicate timestamps keep the last observation")
    void testSortAndDeduplicate() {
        TimeSeriesFrame frame = TimeSeriesFrame.of(List.of(
                Observation.of(day(2), 3.0d),
                Observation.of(day(0), 1.0d),
                Observation.of(day(1), 2.0d),
                Observation.of(day(1), 5.0d)
        ));

        assertEquals(3, frame.size());
        assertEquals(List.of(day(0), day(1), day(2)), frame.timestamps());
        assertArrayEquals(new double[]{1.0d, 5.0d, 3.0d}, frame.values());
    }

    @Test
    @DisplayName("Time scales to [0, 1] and values scale by max absolute deviation from floor")
    void testScaling() {
        TimeSeriesFrame frame = TimeSeriesFrame.of(List.of(
                Observation.of(day(0), 2.0d),
                Observation.of(day(5), -4.0d),
                Observation.of(day(10), 8.0d)
        ));

        assertArrayEquals(new double[]{0.0d, 0.5d, 1.0d}, frame.scaledTimes(), 1e-12);
        assertEquals(8.0d, frame.scaling().yScale());
        assertArrayEquals(new double[]{0.25d, -0.5d, 1.0d}, frame.scaledValues(), 1e-12);
        assertEquals(10.0d, frame.spanDays(), 1e-12);
        assertEquals(2.0d, frame.toScaled(day(20)), 1e-12);
        assertEquals(-4.0d, frame.fromScaled(-0.5d), 1e-12);
    }

    @Test
    @DisplayName("All-zero history falls back to unit value scale")
    void testZeroScaleFallback() {
        TimeSeriesFrame frame = TimeSeriesFrame.of(List.of(
                Observation.of(day(0), 0.0d),
                Observation.of(day(1), 0.0d)
        ));
        assertEquals(1.0d, frame.scaling().yScale());
        assertTrue(frame.isConstant());
    }

    @Test
    @DisplayName("Distinct timestamps closer than epoch-day precision are rejected as too short")
    void testSubResolutionSpanRejected() {
        Instant start = day(0);
        List<Observation> rows = List.of(
                Observation.of(start, 1.0d),
                Observation.of(start.plusNanos(1), 2.0d)
        );

        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> TimeSeriesFrame.of(rows));
        assertEquals(InvalidInputException.REASON_HISTORY_TOO_SHORT, ex.reasonCode());
    }

    @Test
    @DisplayName("Millisecond spans still scale to a finite [0, 1] range")
    void testMillisecondSpanScales() {
        Instant start = day(0);
        TimeSeriesFrame frame = TimeSeriesFrame.of(List.of(
                Observation.of(start, 1.0d),
                Observation.of(start.plusMillis(1), 2.0d)
        ));

        assertArrayEquals(new double[]{0.0d, 1.0d}, frame.scaledTimes(), 0.0d);
        assertTrue(frame.spanDays() > 0.0d);
    }

    @Test
    @DisplayName("Non-finite values are dropped by default and rejected on request")
    void testNonFinitePolicies() {
        List<Observation> rows = List.of(
                Observation.of(day(0), 1.0d),
                Observation.of(day(1), Double.NaN),
                Observation.of(day(2), 3.0d),
                Observation.of(day(3), Double.POSITIVE_INFINITY)
        );

        assertEquals(2, TimeSeriesFrame.of(rows).size());
        InvalidInputException ex = assertThrows(
                InvalidInputException.class,
                () -> TimeSeriesFrame.of(rows, ValueTransform.IDENTITY, NonFinitePolicy.REJECT)
        );
        assertEquals(InvalidInputException.REASON_NON_FINITE_VALUE, ex.reasonCode());
    }

    @Test
    @DisplayName("Insufficient history raises deterministic reason codes")
    void testInsufficientHistory() {
        InvalidInputException allNaN = assertThrows(InvalidInputException.class, () -> TimeSeriesFrame.of(List.of(
                Observation.of(day(0), Double.NaN),
                Observation.of(day(1), Double.NaN)
        )));
        assertEquals(InvalidInputException.REASON_ALL_VALUES_NON_FINITE, allNaN.reasonCode());

        InvalidInputException single = assertThrows(InvalidInputException.class, () -> TimeSeriesFrame.of(List.of(
                Observation.of(day(0), 1.0d),
                Observation.of(day(0), 2.0d)
        )));
        assertEquals(InvalidInputException.REASON_HISTORY_TOO_SHORT, single.reasonCode());

        InvalidInputException empty = assertThrows(InvalidInputException.class, () -> TimeSeriesFrame.of(List.of()));
        assertEquals(InvalidInputException.REASON_HISTORY_TOO_SHORT, empty.reasonCode());
    }

    @Test
    @DisplayName("Log transform maps values and rejects non-positive input")
    void testLogTransform() {
        TimeSeriesFrame frame = TimeSeriesFrame.of(
                List.of(Observation.of(day(0), Math.E), Observation.of(day(1), Math.exp(2.0d))),
                ValueTransform.LOG,
                NonFinitePolicy.DROP
        );
        assertArrayEquals(new double[]{1.0d, 2.0d}, frame.values(), 1e-12);
        assertEquals(Math.exp(2.0d), frame.fromScaled(1.0d), 1e-9);

        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> TimeSeriesFrame.of(
                List.of(Observation.of(day(0), 1.0d), Observation.of(day(1), 0.0d)),
                ValueTransform.LOG,
                NonFinitePolicy.DROP
        ));
        assertEquals(InvalidInputException.REASON_NON_POSITIVE_VALUE, ex.reasonCode());
    }

    @Test
    @DisplayName("Caps, floors and regressor columns are materialized per row")
    void testCapsFloorsAndRegressors() {
        TimeSeriesFrame frame = TimeSeriesFrame.of(List.of(
                Observation.builder().timestamp(day(0)).value(2.0d).cap(10.0d).floor(1.0d).regressor("x", 4.0d).build(),
                Observation.builder().timestamp(day(1)).value(3.0d).cap(10.0d).build()
        ));

        assertArrayEquals(new double[]{1.0d, 0.0d}, frame.floors());
        assertTrue(frame.hasCapEverywhere());
        assertEquals(List.of("x"), List.copyOf(frame.regressorNames()));
        double[] column = frame.regressorColumn("x");
        assertEquals(4.0d, column[0]);
        assertTrue(Double.isNaN(column[1]));
        assertArrayEquals(new double[]{4.0d}, frame.presentRegressorValues("x"));
        assertTrue(Double.isNaN(frame.regressorColumn("absent")[0]));
        assertFalse(frame.isConstant());
        assertEquals(1.0d, frame.minimumSpacingDays(), 1e-12);
    }
}
