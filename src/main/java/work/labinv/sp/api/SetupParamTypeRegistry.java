package work.labinv.sp.api;

import java.time.Clock;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labinv.sp.runtime.CalculationEngine;

/**
 * Maps setup-parameter type names (case-insensitive) to their implementation. Names can also be declared as
 * placeholders, which resolve to {@link UnsupportedSetupParamTypeException} until an implementation is registered.
 */
public final class SetupParamTypeRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SetupParamTypeRegistry.class);

    private final Map<String, SetupParamType> types = new ConcurrentHashMap<>();
    private final Set<String> placeholders = ConcurrentHashMap.newKeySet();
    private final Clock clock;

    public SetupParamTypeRegistry() {
        this(Clock.systemDefaultZone());
    }

    public SetupParamTypeRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Validates the definition's formulas against its catalog and makes it resolvable.
     */
    public SetupParamTypeRegistry register(SetupParamDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        var engine = new CalculationEngine(definition.catalog(), definition.formulas(), clock);
        String id = normalize(definition.typeName());
        types.put(id, new SetupParamType(definition.typeName(), definition.normalizer(), engine));
        placeholders.remove(id);
        return this;
    }

    public SetupParamTypeRegistry declare(String typeName) {
        String id = normalize(typeName);
        if (!types.containsKey(id)) {
            placeholders.add(id);
        }
        return this;
    }

    public SetupParamType resolve(String typeName) {
        String id = normalize(typeName);
        var type = types.get(id);
        if (type != null) {
            return type;
        }
        boolean placeholder = placeholders.contains(id);
        if (placeholder) {
            LOG.warn("Setup parameter type {} was requested but is not implemented yet", id);
        }
        throw new UnsupportedSetupParamTypeException(typeName == null ? "" : typeName.trim(), placeholder);
    }

    public boolean isSupported(String typeName) {
        return types.containsKey(normalize(typeName));
    }

    public Set<String> supportedTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(types.keySet()));
    }

    public Set<String> declaredTypes() {
        var all = new TreeSet<>(types.keySet());
        all.addAll(placeholders);
        return Collections.unmodifiableSet(all);
    }

    private static String normalize(String typeName) {
        return typeName == null ? "" : typeName.trim().toUpperCase(Locale.ROOT);
    }
}
