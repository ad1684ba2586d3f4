package work.labinv.sp.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.field.FieldDescriptor;
import work.labinv.sp.field.FieldGroup;

/**
 * Reference documentation for a catalog, as Markdown or JSON. Not used during calculations.
 */
public final class DocumentationGenerator {
    private static final ObjectMapper JSON = new ObjectMapper();

    public String renderMarkdown(FieldCatalog catalog) {
        var lines = new ArrayList<String>();
        lines.add("# " + catalog.name() + " setup parameters");
        FieldGroup currentGroup = null;
        for (FieldDescriptor field : catalog.listAll()) {
            if (field.group() != currentGroup) {
                currentGroup = field.group();
                lines.add("");
                lines.add("## " + currentGroup.title());
                lines.add("");
            }
            lines.add("- **" + field.displayName() + "**");
            lines.add("  - Key: `" + field.key() + "`");
            if (!field.unit().isEmpty()) {
                lines.add("  - Unit: " + field.unit());
            }
            lines.add("  - Type: " + field.dataType().wireName());
            lines.add("  - Source: " + field.source().wireName());
            if (field.important()) {
                lines.add("  - Important: yes");
            }
            if (!field.description().isEmpty()) {
                lines.add("  - Description: " + field.description());
            }
            if (field.hasDependencies()) {
                lines.add("  - Depends on: " + field.dependsOn().stream()
                    .map(key -> "`" + key + "`")
                    .collect(Collectors.joining(", ")));
            } else {
                lines.add("  - Depends on: " + Explanation.NO_DEPENDENCIES);
            }
            if (!field.formulaText().isEmpty()) {
                lines.add("  - Formula: " + field.formulaText());
            }
        }
        return String.join("\n", lines) + "\n";
    }

    public String renderJson(FieldCatalog catalog) {
        var fields = new ArrayList<Map<String, Object>>();
        for (FieldDescriptor field : catalog.listAll()) {
            fields.add(toMap(field));
        }
        var document = new LinkedHashMap<String, Object>();
        document.put("type", catalog.name());
        document.put("fields", fields);
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize catalog " + catalog.name() + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static Map<String, Object> toMap(FieldDescriptor field) {
        var map = new LinkedHashMap<String, Object>();
        map.put("key", field.key());
        map.put("displayName", field.displayName());
        map.put("unit", field.unit());
        map.put("type", field.dataType().wireName());
        map.put("source", field.source().wireName());
        map.put("group", field.group().wireName());
        map.put("important", field.important());
        map.put("description", field.description());
        map.put("formula", field.formulaText());
        map.put("dependsOn", List.copyOf(field.dependsOn()));
        field.defaultValue().ifPresent(value -> map.put("default", value));
        if (!field.allowedValues().isEmpty()) {
            map.put("allowedValues", field.allowedValues());
        }
        return map;
    }
}
