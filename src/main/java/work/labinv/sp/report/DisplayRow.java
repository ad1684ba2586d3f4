package work.labinv.sp.report;

import work.labinv.sp.field.FieldGroup;

/**
 * One formatted line of a result table.
 */
public record DisplayRow(
    String key,
    String displayName,
    String unit,
    String value,
    FieldGroup group,
    boolean important
) {
    /**
     * Display name with the unit in brackets unless the name already carries it.
     */
    public String label() {
        if (unit.isEmpty() || displayName.contains("(" + unit)) {
            return displayName;
        }
        return displayName + " [" + unit + "]";
    }
}
