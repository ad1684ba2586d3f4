package work.labinv.sp.runtime;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import work.labinv.sp.field.FieldDescriptor;

/**
 * State handed to {@link FieldFormula}s during one calculation: the normalized request, the values computed so
 * far and the clock. Reads are limited to the current field's {@code dependsOn}, so what a formula consumes is
 * exactly what its descriptor (and therefore every explanation) declares.
 */
public final class EvaluationContext {
    private final Map<String, Object> normalizedRequest;
    private final Map<String, Object> computed = new HashMap<>();
    private final Clock clock;
    private FieldDescriptor current;

    EvaluationContext(Map<String, Object> normalizedRequest, Clock clock) {
        this.normalizedRequest = Objects.requireNonNull(normalizedRequest, "normalizedRequest");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Value of a declared dependency; {@code null} when it is absent.
     */
    public Object value(String key) {
        requireDeclared(key);
        return computed.get(key);
    }

    public Double number(String key) {
        Object value = value(key);
        return value instanceof Number num ? num.doubleValue() : null;
    }

    public String text(String key) {
        Object value = value(key);
        return value == null ? "" : value.toString();
    }

    /**
     * The normalized request entry stored under the current field's own key.
     */
    public Object carried() {
        return normalizedRequest.get(currentField().key());
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public FieldDescriptor currentField() {
        if (current == null) {
            throw new IllegalStateException("No field is being evaluated");
        }
        return current;
    }

    void enter(FieldDescriptor descriptor) {
        this.current = descriptor;
    }

    void record(String key, Object value) {
        computed.put(key, value);
    }

    Map<String, Object> computed() {
        return computed;
    }

    private void requireDeclared(String key) {
        var field = currentField();
        if (!field.dependsOn().contains(key)) {
            throw new IllegalStateException(
                "Field '" + field.key() + "' reads '" + key + "' which is not among its declared dependencies"
            );
        }
        if (!computed.containsKey(key)) {
            throw new IllegalStateException("Field '" + field.key() + "' evaluated before its dependency '" + key + "'");
        }
    }
}
