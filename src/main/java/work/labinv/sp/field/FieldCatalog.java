package work.labinv.sp.field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validated, read-only set of {@link FieldDescriptor}s for one setup-parameter type.
 *
 * <p>Construction checks that keys are unique, that every {@code dependsOn} entry names a field of the same
 * catalog and that the dependencies form a DAG. The catalog is immutable afterwards and can be shared freely.</p>
 */
public final class FieldCatalog {
    private static final Comparator<FieldDescriptor> DISPLAY_ORDER = Comparator
        .comparing(FieldDescriptor::group)
        .thenComparing(d -> d.displayName().toLowerCase(Locale.ROOT));

    private final String name;
    private final Map<String, FieldDescriptor> byKey;
    private final List<FieldDescriptor> evaluationOrder;

    public FieldCatalog(String name, List<FieldDescriptor> descriptors) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(descriptors, "descriptors");
        this.byKey = Collections.unmodifiableMap(index(name, descriptors));
        checkReferences();
        this.evaluationOrder = List.copyOf(topologicalOrder());
    }

    /**
     * Re-runs the construction checks: every dependency resolves, no field depends on itself, no cycles.
     * Duplicate keys are rejected while indexing and cannot reach this point.
     */
    public void validate() {
        checkReferences();
        topologicalOrder();
    }

    public String name() {
        return name;
    }

    public FieldDescriptor describe(String key) {
        var descriptor = key == null ? null : byKey.get(key);
        if (descriptor == null) {
            throw new UnknownFieldException(name, key);
        }
        return descriptor;
    }

    public boolean contains(String key) {
        return key != null && byKey.containsKey(key);
    }

    public int size() {
        return byKey.size();
    }

    /**
     * Descriptors in declaration order.
     */
    public List<FieldDescriptor> descriptors() {
        return List.copyOf(byKey.values());
    }

    /**
     * Fields of one group sorted by display name (case-insensitive, stable for equal names).
     */
    public List<FieldDescriptor> listByGroup(FieldGroup group) {
        return byKey.values().stream()
            .filter(d -> d.group() == group)
            .sorted(DISPLAY_ORDER)
            .collect(Collectors.toList());
    }

    /**
     * All fields ordered by group, then display name.
     */
    public List<FieldDescriptor> listAll() {
        return byKey.values().stream().sorted(DISPLAY_ORDER).collect(Collectors.toList());
    }

    /**
     * Dependencies before dependents; among independent fields the declaration order is kept.
     */
    public List<FieldDescriptor> evaluationOrder() {
        return evaluationOrder;
    }

    /**
     * Fields whose {@code dependsOn} lists {@code key} (one level only).
     */
    public List<FieldDescriptor> dependents(String key) {
        describe(key);
        return byKey.values().stream()
            .filter(d -> d.dependsOn().contains(key))
            .collect(Collectors.toList());
    }

    private static Map<String, FieldDescriptor> index(String name, List<FieldDescriptor> descriptors) {
        var map = new LinkedHashMap<String, FieldDescriptor>();
        for (FieldDescriptor descriptor : descriptors) {
            Objects.requireNonNull(descriptor, "descriptor");
            if (map.putIfAbsent(descriptor.key(), descriptor) != null) {
                throw new CatalogException("Duplicate field key '" + descriptor.key() + "' in catalog " + name);
            }
        }
        return map;
    }

    private void checkReferences() {
        for (FieldDescriptor descriptor : byKey.values()) {
            for (String dependency : descriptor.dependsOn()) {
                if (!byKey.containsKey(dependency)) {
                    throw new CatalogException(
                        "Field '" + descriptor.key() + "' depends on unknown field '" + dependency + "' in catalog " + name
                    );
                }
                if (dependency.equals(descriptor.key())) {
                    throw new CatalogException("Field '" + descriptor.key() + "' depends on itself in catalog " + name);
                }
            }
        }
    }

    private List<FieldDescriptor> topologicalOrder() {
        var state = new HashMap<String, Boolean>();
        var ordered = new ArrayList<FieldDescriptor>(byKey.size());
        for (FieldDescriptor descriptor : byKey.values()) {
            visit(descriptor, state, new ArrayList<>(), ordered);
        }
        return ordered;
    }

    // state: absent = unvisited, FALSE = on the current path, TRUE = emitted
    private void visit(
        FieldDescriptor descriptor,
        Map<String, Boolean> state,
        List<String> path,
        List<FieldDescriptor> ordered
    ) {
        Boolean seen = state.get(descriptor.key());
        if (Boolean.TRUE.equals(seen)) {
            return;
        }
        path.add(descriptor.key());
        if (Boolean.FALSE.equals(seen)) {
            var cycle = path.subList(path.indexOf(descriptor.key()), path.size());
            throw new CatalogException("Dependency cycle in catalog " + name + ": " + String.join(" -> ", cycle));
        }
        state.put(descriptor.key(), Boolean.FALSE);
        for (String dependency : descriptor.dependsOn()) {
            visit(byKey.get(dependency), state, path, ordered);
        }
        state.put(descriptor.key(), Boolean.TRUE);
        path.remove(path.size() - 1);
        ordered.add(descriptor);
    }
}
