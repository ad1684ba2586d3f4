package work.labinv.sp.runtime;

import java.util.Map;

/**
 * Extracts the fields a catalog needs from an upstream request record (keyed by external column names) and
 * coerces them to catalog keys and types. Must not throw on malformed cells and must not apply cross-field formulas.
 */
@FunctionalInterface
public interface RequestNormalizer {
    Map<String, Object> normalize(Map<String, ?> requestRecord);
}
