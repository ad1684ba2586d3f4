package work.labinv.sp.runtime;

import java.util.Objects;
import work.labinv.sp.field.FieldDescriptor;

/**
 * One calculated value together with the descriptor it was produced for. {@code value} may be {@code null}.
 */
public record FieldValue(FieldDescriptor descriptor, Object value) {
    public FieldValue {
        Objects.requireNonNull(descriptor, "descriptor");
    }

    public String key() {
        return descriptor.key();
    }

    public boolean isAbsent() {
        return value == null;
    }
}
