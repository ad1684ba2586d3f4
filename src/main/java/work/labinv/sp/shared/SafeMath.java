package work.labinv.sp.shared;

/**
 * Arithmetic over nullable doubles. A {@code null} operand yields {@code null};
 * so does division by zero, so no formula ever produces an exception or an infinity.
 */
public final class SafeMath {
    private SafeMath() {}

    public static Double safeDiv(Double numerator, Double denominator) {
        if (numerator == null || denominator == null || denominator == 0.0d) {
            return null;
        }
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : null;
    }

    public static Double multiply(Double left, Double right) {
        if (left == null || right == null) {
            return null;
        }
        return left * right;
    }

    public static Double subtract(Double left, Double right) {
        if (left == null || right == null) {
            return null;
        }
        return left - right;
    }

    public static Double sum(Double... values) {
        double total = 0.0d;
        for (Double value : values) {
            if (value == null) {
                return null;
            }
            total += value;
        }
        return total;
    }
}
