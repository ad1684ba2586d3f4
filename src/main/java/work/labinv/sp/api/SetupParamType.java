package work.labinv.sp.api;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.runtime.CalculationEngine;
import work.labinv.sp.runtime.CalculationResult;
import work.labinv.sp.runtime.RequestNormalizer;

/**
 * A resolved, ready-to-use setup-parameter type: its catalog plus the calculate entry point.
 */
public record SetupParamType(String name, RequestNormalizer normalizer, CalculationEngine engine) {
    public SetupParamType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(normalizer, "normalizer");
        Objects.requireNonNull(engine, "engine");
    }

    public FieldCatalog catalog() {
        return engine.catalog();
    }

    public Map<String, Object> normalize(Map<String, ?> requestRecord) {
        return normalizer.normalize(requestRecord);
    }

    public CalculationResult calculate(Map<String, Object> normalizedRequest, Map<String, Object> operatorInputs) {
        return engine.calculate(normalizedRequest, operatorInputs);
    }

    /**
     * Normalizes a raw request record and calculates in one go.
     */
    public CalculationResult calculateFromRequest(Map<String, ?> requestRecord, Map<String, Object> operatorInputs) {
        return calculate(normalize(requestRecord), operatorInputs);
    }

    public SetupParamType withClock(Clock clock) {
        return new SetupParamType(name, normalizer, engine.withClock(clock));
    }
}
