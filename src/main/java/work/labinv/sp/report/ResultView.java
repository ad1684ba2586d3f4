package work.labinv.sp.report;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import work.labinv.sp.field.FieldDescriptor;
import work.labinv.sp.field.FieldGroup;
import work.labinv.sp.runtime.CalculationResult;

/**
 * Read-only display wrapper around one {@link CalculationResult}.
 */
public final class ResultView {
    private final CalculationResult result;
    private final DisplaySettings settings;

    public ResultView(CalculationResult result) {
        this(result, DisplaySettings.defaults());
    }

    public ResultView(CalculationResult result, DisplaySettings settings) {
        this.result = Objects.requireNonNull(result, "result");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CalculationResult result() {
        return result;
    }

    public DisplaySettings settings() {
        return settings;
    }

    public Object value(String key) {
        return result.value(key);
    }

    public String formatted(String key) {
        return settings.format(result.value(key));
    }

    public DisplayRow row(String key) {
        return toRow(result.descriptor(key));
    }

    /**
     * All rows ordered by group, then display name.
     */
    public List<DisplayRow> rows() {
        return result.catalog().listAll().stream().map(this::toRow).collect(Collectors.toList());
    }

    public List<DisplayRow> rows(FieldGroup group) {
        return result.catalog().listByGroup(group).stream().map(this::toRow).collect(Collectors.toList());
    }

    public List<DisplayRow> importantRows() {
        return rows().stream().filter(DisplayRow::important).collect(Collectors.toList());
    }

    /**
     * Key to formatted value, in catalog declaration order.
     */
    public Map<String, String> formattedValues() {
        var map = new LinkedHashMap<String, String>();
        for (FieldDescriptor descriptor : result.catalog().descriptors()) {
            map.put(descriptor.key(), formatted(descriptor.key()));
        }
        return map;
    }

    private DisplayRow toRow(FieldDescriptor descriptor) {
        return new DisplayRow(
            descriptor.key(),
            descriptor.displayName(),
            descriptor.unit(),
            formatted(descriptor.key()),
            descriptor.group(),
            descriptor.important()
        );
    }
}
