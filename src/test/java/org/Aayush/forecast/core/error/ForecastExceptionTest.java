package org.Aayush.forecast.core.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Forecast Exception Taxonomy Tests")
class ForecastExceptionTest {

    @Test
    @DisplayName("Three-arg constructor preserves reason code, message prefix, and cause")
    void testThreeArgConstructor() {
        IllegalStateException cause = new IllegalStateException("boom");
        ForecastException ex = new ForecastException("TEST_REASON", "details", cause);

        assertEquals("TEST_REASON", ex.reasonCode());
        assertEquals("[TEST_REASON] details", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank reason code is rejected deterministically")
    void testBlankReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ForecastException(" ", "details"));
        assertThrows(NullPointerException.class, () -> new ForecastException(null, "details"));
    }

    @Test
    @DisplayName("Typed failures carry their fixed reason codes")
    void testTypedReasonCodes() {
        assertEquals(NotFittedException.REASON_NOT_FITTED, new NotFittedException("x").reasonCode());
        assertEquals(ForecastCancelledException.REASON_CANCELLED, new ForecastCancelledException("x").reasonCode());
        assertEquals(
                AlreadyFittedException.REASON_FIT_IN_PROGRESS,
                new AlreadyFittedException(AlreadyFittedException.REASON_FIT_IN_PROGRESS, "x").reasonCode()
        );
        InvalidInputException invalid = new InvalidInputException(InvalidInputException.REASON_CAP_REQUIRED, "cap");
        assertTrue(invalid.getMessage().startsWith("[F_CAP_REQUIRED]"));
        assertTrue(invalid instanceof ForecastException);
    }

    @Test
    @DisplayName("Convergence failure copies the best point and exposes iteration details")
    void testConvergenceExceptionBestPoint() {
        double[] best = {1.0d, 2.0d};
        ConvergenceException ex = new ConvergenceException(
                ConvergenceException.REASON_BUDGET_EXHAUSTED,
                "not converged",
                7,
                3.5d,
                best
        );
        best[0] = 99.0d;

        assertArrayEquals(new double[]{1.0d, 2.0d}, ex.bestPoint());
        assertEquals(7, ex.iterations());
        assertEquals(3.5d, ex.objectiveValue());
        assertEquals("[F_OPTIMIZER_BUDGET_EXHAUSTED] not converged", ex.getMessage());
    }

    @Test
    @DisplayName("Subclass copy keeps reason, message, iterate, and cause")
    void testConvergenceExceptionCopy() {
        IllegalStateException cause = new IllegalStateException("singular");
        ConvergenceException original = new ConvergenceException(
                ConvergenceException.REASON_LAPLACE_HESSIAN_INVALID,
                "hessian not positive definite",
                new double[]{0.5d},
                cause
        );
        ConvergenceException copy = new ConvergenceException(original) {
        };

        assertEquals(original.getMessage(), copy.getMessage());
        assertEquals(original.reasonCode(), copy.reasonCode());
        assertArrayEquals(original.bestPoint(), copy.bestPoint());
        assertSame(cause, copy.getCause());
    }

    @Test
    @DisplayName("Error types expose no model types from higher layers")
    void testErrorTypesAreLayerFree() {
        for (Class<?> type : new Class<?>[]{ForecastException.class, ConvergenceException.class}) {
            for (Method method : type.getDeclaredMethods()) {
                assertFalse(
                        method.getReturnType().getName().startsWith("org.Aayush.forecast.engine"),
                        type.getSimpleName() + "." + method.getName()
                );
            }
            for (Field field : type.getDeclaredFields()) {
                assertFalse(
                        field.getType().getName().startsWith("org.Aayush.forecast.engine"),
                        type.getSimpleName() + "." + field.getName()
                );
            }
        }
    }
}
