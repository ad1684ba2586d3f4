package work.labinv.sp.field;

import java.util.Locale;

/**
 * Provenance tag of a field. Informational only: how a value is obtained is decided by the engine and the formulas.
 */
public enum FieldSource {
    REQUEST,
    USER_INPUT,
    DERIVED,
    FIXED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isInput() {
        return this == REQUEST || this == USER_INPUT;
    }
}
