package work.labinv.sp.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class SafeMathTest {
    @Test
    void divisionByZeroOrNullIsAbsent() {
        assertNull(SafeMath.safeDiv(1.0, 0.0));
        assertNull(SafeMath.safeDiv(1.0, -0.0));
        assertNull(SafeMath.safeDiv(1.0, null));
        assertNull(SafeMath.safeDiv(null, 2.0));
    }

    @Test
    void divisionOfPresentValues() {
        assertEquals(5.0, SafeMath.safeDiv(100.0, 20.0));
        assertEquals(0.0, SafeMath.safeDiv(0.0, 3.0));
    }

    @Test
    void overflowIsAbsentRatherThanInfinite() {
        assertNull(SafeMath.safeDiv(Double.MAX_VALUE, 1e-300));
    }

    @Test
    void absencePropagatesThroughCombinators() {
        assertNull(SafeMath.sum(1.0, null, 2.0));
        assertNull(SafeMath.multiply(null, 2.0));
        assertNull(SafeMath.subtract(3.0, null));
        assertEquals(6.0, SafeMath.sum(1.0, 2.0, 3.0));
        assertEquals(-1.0, SafeMath.subtract(2.0, 3.0));
    }
}
