package work.labinv.sp.shared;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Lenient numeric coercion for request cells and operator inputs (e.g. {@code 8}, {@code "8.5"}, {@code "10 mM"}).
 * Never throws: anything that cannot be read as a number becomes {@link Optional#empty()}.
 */
public final class NumberParser {
    private NumberParser() {}

    public static Optional<Double> ensureFloat(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return Optional.empty();
        }
        if (raw instanceof Number num) {
            return finite(num.doubleValue());
        }
        String trimmed = raw.toString().trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            // plain decimal or exponent notation only; Java literal forms such as "8d" or "0x10p0" are rejected
            return finite(new BigDecimal(trimmed).doubleValue());
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * Reads the leading numeric token of a compound value: {@code "10 mM"} gives 10.0,
     * {@code " 7.5mg/mL"} gives 7.5, {@code "mM"} gives nothing.
     */
    public static Optional<Double> parseLeadingNumber(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return Optional.empty();
        }
        if (raw instanceof Number num) {
            return finite(num.doubleValue());
        }
        String trimmed = raw.toString().trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        var token = new StringBuilder();
        boolean dotSeen = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char ch = trimmed.charAt(i);
            if ((ch == '+' || ch == '-') && token.length() == 0) {
                token.append(ch);
            } else if (ch >= '0' && ch <= '9') {
                token.append(ch);
            } else if (ch == '.' && !dotSeen) {
                dotSeen = true;
                token.append(ch);
            } else {
                break;
            }
        }
        try {
            return finite(new BigDecimal(token.toString()).doubleValue());
        } catch (NumberFormatException ex) {
            // "", "+", "." and friends
            return Optional.empty();
        }
    }

    /**
     * Renders an identifier cell: integral numbers lose their decimals ({@code 12.0 -> "12"}), text is trimmed.
     */
    public static String identifier(Object raw) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof Number num) {
            return Long.toString(num.longValue());
        }
        return raw.toString().trim();
    }

    private static Optional<Double> finite(double value) {
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }
}
