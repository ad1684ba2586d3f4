package work.labinv.sp.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ValueFormatterTest {
    @Test
    void numbersAreRoundedAndTrimmed() {
        assertEquals("0.667", ValueFormatter.format(2.0 / 3.0));
        assertEquals("10", ValueFormatter.format(10.0));
        assertEquals("4.233", ValueFormatter.format(4.233333));
        assertEquals("0.099", ValueFormatter.format(0.099));
        assertEquals("1.5", ValueFormatter.format(1.50));
    }

    @Test
    void absentUsesSentinel() {
        assertEquals("N/A", ValueFormatter.format(null));
        assertEquals("-", ValueFormatter.format(null, 2, "-"));
    }

    @Test
    void otherValuesUseTheirStringForm() {
        assertEquals("DMSO", ValueFormatter.format("DMSO"));
        assertEquals("true", ValueFormatter.format(Boolean.TRUE));
        assertEquals("", ValueFormatter.format(""));
    }

    @Test
    void digitsAreConfigurable() {
        assertEquals("0.67", ValueFormatter.format(2.0 / 3.0, 2, "N/A"));
        assertEquals("1", ValueFormatter.format(0.6, 0, "N/A"));
        assertEquals("0", ValueFormatter.format(-0.0001, 3, "N/A"));
    }
}
