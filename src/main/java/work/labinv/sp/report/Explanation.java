package work.labinv.sp.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.labinv.sp.field.FieldSource;

/**
 * How one field got its value: the field itself, its formula and its direct dependencies with their current values.
 * An empty {@code dependencies} list means the field is a raw input or a fixed constant.
 */
public record Explanation(
    String key,
    String displayName,
    String unit,
    String value,
    FieldSource source,
    String description,
    String formulaText,
    List<Dependency> dependencies
) {
    static final String NO_DEPENDENCIES = "none (raw input or fixed constant)";

    public Explanation {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public boolean isRawOrFixed() {
        return dependencies.isEmpty();
    }

    public String toText() {
        var text = new StringBuilder();
        text.append(displayName);
        if (!unit.isEmpty()) {
            text.append(" [").append(unit).append(']');
        }
        text.append('\n');
        text.append("Value: ").append(value).append('\n');
        text.append("Source: ").append(source.wireName()).append('\n');
        if (!description.isEmpty()) {
            text.append("Description: ").append(description).append('\n');
        }
        if (!formulaText.isEmpty()) {
            text.append("Formula: ").append(formulaText).append('\n');
        }
        if (dependencies.isEmpty()) {
            text.append("Depends on: ").append(NO_DEPENDENCIES).append('\n');
        } else {
            text.append("Depends on:\n");
            for (Dependency dependency : dependencies) {
                text.append("  - ").append(dependency.displayName());
                if (!dependency.unit().isEmpty()) {
                    text.append(" [").append(dependency.unit()).append(']');
                }
                text.append(" (").append(dependency.key()).append(") = ").append(dependency.value()).append('\n');
            }
        }
        return text.toString();
    }

    /**
     * JSON-friendly form used when explanations are embedded in machine-readable output.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("key", key);
        map.put("displayName", displayName);
        map.put("unit", unit);
        map.put("value", value);
        map.put("source", source.wireName());
        map.put("description", description);
        map.put("formula", formulaText);
        var dependsOn = new ArrayList<Map<String, Object>>(dependencies.size());
        for (Dependency dependency : dependencies) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("key", dependency.key());
            entry.put("displayName", dependency.displayName());
            entry.put("unit", dependency.unit());
            entry.put("value", dependency.value());
            dependsOn.add(entry);
        }
        map.put("dependsOn", dependsOn);
        return map;
    }

    public record Dependency(String key, String displayName, String unit, String value) {}
}
