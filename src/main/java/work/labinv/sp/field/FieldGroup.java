package work.labinv.sp.field;

import java.util.Locale;

/**
 * Display buckets, declared in the order they are listed.
 */
public enum FieldGroup {
    INPUT_REQUEST("Request input fields"),
    INPUT_USER("Operator input fields"),
    OUTPUT_REDUCTION("Antibody reduction set-up"),
    OUTPUT_CONJUGATION("Antibody conjugation set-up"),
    META("Metadata");

    private final String title;

    FieldGroup(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
