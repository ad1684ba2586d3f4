package work.labinv.sp.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns calculated values into display strings.
 */
public final class ValueFormatter {
    public static final String MISSING = "N/A";
    public static final int DEFAULT_DIGITS = 3;

    private ValueFormatter() {}

    public static String format(Object value) {
        return format(value, DEFAULT_DIGITS, MISSING);
    }

    /**
     * Numbers are rounded half-up to {@code digits} decimals with trailing zeros (and a bare dot) removed;
     * {@code null} becomes {@code sentinel}; everything else uses {@link String#valueOf(Object)}.
     */
    public static String format(Object value, int digits, String sentinel) {
        if (value == null) {
            return sentinel;
        }
        if (value instanceof Number num && !(value instanceof BigDecimal)) {
            double raw = num.doubleValue();
            if (!Double.isFinite(raw)) {
                return sentinel;
            }
            return trim(BigDecimal.valueOf(raw).setScale(Math.max(0, digits), RoundingMode.HALF_UP));
        }
        if (value instanceof BigDecimal decimal) {
            return trim(decimal.setScale(Math.max(0, digits), RoundingMode.HALF_UP));
        }
        return String.valueOf(value);
    }

    private static String trim(BigDecimal scaled) {
        String text = scaled.toPlainString();
        if (text.indexOf('.') >= 0) {
            int end = text.length();
            while (text.charAt(end - 1) == '0') {
                end--;
            }
            if (text.charAt(end - 1) == '.') {
                end--;
            }
            text = text.substring(0, end);
        }
        return "-0".equals(text) ? "0" : text;
    }
}
