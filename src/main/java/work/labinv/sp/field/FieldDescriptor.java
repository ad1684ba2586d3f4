package work.labinv.sp.field;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one setup-parameter field: what it is called, how it is typed, where it comes from,
 * which other fields it reads and how its formula reads to a human.
 *
 * <p>{@code formulaText}, {@code description} and {@code important} have no computational role.</p>
 */
public record FieldDescriptor(
    String key,
    String displayName,
    String unit,
    DataType dataType,
    FieldSource source,
    FieldGroup group,
    List<String> dependsOn,
    String formulaText,
    String description,
    boolean important,
    Optional<Object> defaultValue,
    List<String> allowedValues
) {
    public FieldDescriptor {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(defaultValue, "defaultValue");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Field key must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? key : displayName;
        unit = unit == null ? "" : unit;
        formulaText = formulaText == null ? "" : formulaText;
        description = description == null ? "" : description;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependsOn));
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    public static final class Builder {
        private final String key;
        private String displayName;
        private String unit = "";
        private DataType dataType = DataType.STRING;
        private FieldSource source = FieldSource.DERIVED;
        private FieldGroup group = FieldGroup.META;
        private List<String> dependsOn = List.of();
        private String formulaText = "";
        private String description = "";
        private boolean important;
        private Object defaultValue;
        private List<String> allowedValues = List.of();

        private Builder(String key) {
            this.key = key;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder dataType(DataType dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder source(FieldSource source) {
            this.source = source;
            return this;
        }

        public Builder group(FieldGroup group) {
            this.group = group;
            return this;
        }

        public Builder dependsOn(String... keys) {
            this.dependsOn = List.of(keys);
            return this;
        }

        public Builder formula(String formulaText) {
            this.formulaText = formulaText;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder important() {
            this.important = true;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder allowedValues(String... values) {
            this.allowedValues = List.of(values);
            return this;
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(
                key,
                displayName,
                unit,
                dataType,
                source,
                group,
                dependsOn,
                formulaText,
                description,
                important,
                Optional.ofNullable(defaultValue),
                allowedValues
            );
        }
    }
}
