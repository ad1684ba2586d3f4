package work.labinv.sp.field;

import java.util.Locale;

/**
 * Value type of a field. Numeric types hold {@link Double}; {@link #OPTIONAL_FLOAT} may also be absent.
 */
public enum DataType {
    FLOAT,
    OPTIONAL_FLOAT,
    STRING,
    ENUM,
    BOOL;

    public boolean isNumeric() {
        return this == FLOAT || this == OPTIONAL_FLOAT;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
