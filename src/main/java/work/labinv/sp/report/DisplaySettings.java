package work.labinv.sp.report;

import java.util.Objects;
import work.labinv.sp.shared.ValueFormatter;

/**
 * How values are rendered: decimals kept for numbers and the text shown for absent values.
 */
public record DisplaySettings(int digits, String sentinel) {
    public DisplaySettings {
        Objects.requireNonNull(sentinel, "sentinel");
        if (digits < 0) {
            throw new IllegalArgumentException("digits must be >= 0: " + digits);
        }
    }

    public static DisplaySettings defaults() {
        return new DisplaySettings(ValueFormatter.DEFAULT_DIGITS, ValueFormatter.MISSING);
    }

    public String format(Object value) {
        return ValueFormatter.format(value, digits, sentinel);
    }
}
