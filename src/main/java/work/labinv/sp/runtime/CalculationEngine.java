package work.labinv.sp.runtime;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labinv.sp.field.CatalogException;
import work.labinv.sp.field.DataType;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.field.FieldDescriptor;
import work.labinv.sp.shared.NumberParser;

/**
 * Evaluates a {@link FieldCatalog} in dependency order.
 *
 * <p>Request and operator fields are carried from the two input maps (operator fields fall back to the
 * descriptor default), every other field is produced by its {@link FieldFormula}. Numeric results are
 * normalized to {@link Double}; non-finite numbers become {@code null}. The engine holds no per-call state,
 * so one instance can serve concurrent callers.</p>
 */
public final class CalculationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(CalculationEngine.class);

    private final FieldCatalog catalog;
    private final Map<String, FieldFormula> formulas;
    private final Clock clock;

    public CalculationEngine(FieldCatalog catalog, Map<String, FieldFormula> formulas) {
        this(catalog, formulas, Clock.systemDefaultZone());
    }

    public CalculationEngine(FieldCatalog catalog, Map<String, FieldFormula> formulas, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.formulas = Map.copyOf(Objects.requireNonNull(formulas, "formulas"));
        this.clock = Objects.requireNonNull(clock, "clock");
        checkFormulas();
    }

    public FieldCatalog catalog() {
        return catalog;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Same catalog and formulas, different clock (used to pin the batch date).
     */
    public CalculationEngine withClock(Clock other) {
        return new CalculationEngine(catalog, formulas, other);
    }

    public CalculationResult calculate(Map<String, Object> normalizedRequest, Map<String, Object> operatorInputs) {
        Map<String, Object> request = normalizedRequest == null ? Map.of() : normalizedRequest;
        Map<String, Object> operator = operatorInputs == null ? Map.of() : operatorInputs;
        var ctx = new EvaluationContext(request, clock);

        for (FieldDescriptor descriptor : catalog.evaluationOrder()) {
            Object value;
            switch (descriptor.source()) {
                case REQUEST:
                    value = carryRequest(descriptor, request.get(descriptor.key()));
                    break;
                case USER_INPUT:
                    value = carryOperatorInput(descriptor, operator.get(descriptor.key()));
                    break;
                default:
                    ctx.enter(descriptor);
                    value = conform(descriptor, formulas.get(descriptor.key()).evaluate(ctx));
                    break;
            }
            ctx.record(descriptor.key(), value);
        }

        var result = new CalculationResult(catalog, new LinkedHashMap<>(ctx.computed()));
        if (LOG.isDebugEnabled()) {
            long absent = result.fields().stream().filter(FieldValue::isAbsent).count();
            LOG.debug("Calculated {} fields for catalog {} ({} absent)", catalog.size(), catalog.name(), absent);
        }
        return result;
    }

    private void checkFormulas() {
        for (FieldDescriptor descriptor : catalog.descriptors()) {
            boolean input = descriptor.source().isInput();
            boolean hasFormula = formulas.containsKey(descriptor.key());
            if (!input && !hasFormula) {
                throw new CatalogException("No formula for " + descriptor.source().wireName() + " field '" + descriptor.key() + "'");
            }
            if (input && hasFormula) {
                throw new CatalogException("Input field '" + descriptor.key() + "' must not declare a formula");
            }
        }
        for (String key : formulas.keySet()) {
            if (!catalog.contains(key)) {
                throw new CatalogException("Formula registered for unknown field '" + key + "' in catalog " + catalog.name());
            }
        }
    }

    private Object carryRequest(FieldDescriptor descriptor, Object raw) {
        if (descriptor.dataType().isNumeric()) {
            return NumberParser.ensureFloat(raw).orElse(null);
        }
        if (descriptor.dataType() == DataType.BOOL) {
            return toBoolean(raw, descriptor);
        }
        return raw == null ? "" : raw.toString();
    }

    private Object carryOperatorInput(FieldDescriptor descriptor, Object raw) {
        switch (descriptor.dataType()) {
            case FLOAT: {
                Optional<Double> parsed = NumberParser.ensureFloat(raw);
                Optional<Double> fallback = descriptor.defaultValue().flatMap(NumberParser::ensureFloat);
                if (fallback.isPresent() && (parsed.isEmpty() || parsed.get() == 0.0d)) {
                    return fallback.get();
                }
                return parsed.orElse(null);
            }
            case OPTIONAL_FLOAT:
                return NumberParser.ensureFloat(raw).orElse(null);
            case BOOL:
                return toBoolean(raw, descriptor);
            case ENUM:
                return enumValue(descriptor, raw);
            default:
                if (raw == null) {
                    return descriptor.defaultValue().map(Object::toString).orElse("");
                }
                return raw.toString();
        }
    }

    private String enumValue(FieldDescriptor descriptor, Object raw) {
        String text = raw == null ? "" : raw.toString().trim();
        if (text.isEmpty()) {
            return descriptor.defaultValue().map(Object::toString).orElse("");
        }
        for (String allowed : descriptor.allowedValues()) {
            if (allowed.equalsIgnoreCase(text)) {
                return allowed;
            }
        }
        if (!descriptor.allowedValues().isEmpty()) {
            LOG.warn("Value '{}' is not one of {} for field {}; keeping it as entered",
                text, descriptor.allowedValues(), descriptor.key());
        }
        return text;
    }

    private static Boolean toBoolean(Object raw, FieldDescriptor descriptor) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        if (raw == null) {
            return descriptor.defaultValue().map(v -> Boolean.TRUE.equals(v)).orElse(Boolean.FALSE);
        }
        if (raw instanceof Number num) {
            return num.doubleValue() != 0.0d;
        }
        switch (raw.toString().trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "y":
            case "yes":
            case "true":
                return Boolean.TRUE;
            default:
                return Boolean.FALSE;
        }
    }

    private static Object conform(FieldDescriptor descriptor, Object value) {
        if (value == null || !descriptor.dataType().isNumeric()) {
            return value;
        }
        if (value instanceof Number num) {
            double raw = num.doubleValue();
            return Double.isFinite(raw) ? raw : null;
        }
        throw new IllegalStateException(
            "Formula for numeric field '" + descriptor.key() + "' returned " + value.getClass().getSimpleName()
        );
    }
}
