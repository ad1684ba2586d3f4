package work.labinv.sp.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.field.FieldDescriptor;
import work.labinv.sp.field.UnknownFieldException;

/**
 * Immutable snapshot of one calculation: exactly one {@link FieldValue} per descriptor of the catalog.
 */
public final class CalculationResult {
    private final FieldCatalog catalog;
    private final Map<String, FieldValue> fields;

    CalculationResult(FieldCatalog catalog, Map<String, Object> values) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        var ordered = new LinkedHashMap<String, FieldValue>();
        for (FieldDescriptor descriptor : catalog.descriptors()) {
            if (!values.containsKey(descriptor.key())) {
                throw new IllegalStateException("No value computed for field " + descriptor.key());
            }
            ordered.put(descriptor.key(), new FieldValue(descriptor, values.get(descriptor.key())));
        }
        this.fields = Collections.unmodifiableMap(ordered);
    }

    public FieldCatalog catalog() {
        return catalog;
    }

    public FieldValue field(String key) {
        var field = key == null ? null : fields.get(key);
        if (field == null) {
            throw new UnknownFieldException(catalog.name(), key);
        }
        return field;
    }

    public Object value(String key) {
        return field(key).value();
    }

    public Double number(String key) {
        Object value = value(key);
        return value instanceof Number num ? num.doubleValue() : null;
    }

    public FieldDescriptor descriptor(String key) {
        return field(key).descriptor();
    }

    /**
     * Values in catalog declaration order.
     */
    public List<FieldValue> fields() {
        return List.copyOf(fields.values());
    }

    /**
     * Key to raw value; absent values map to {@code null}.
     */
    public Map<String, Object> asMap() {
        var map = new LinkedHashMap<String, Object>();
        fields.forEach((key, field) -> map.put(key, field.value()));
        return Collections.unmodifiableMap(map);
    }
}
