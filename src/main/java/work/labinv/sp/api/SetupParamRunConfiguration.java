package work.labinv.sp.api;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.labinv.sp.report.DisplaySettings;

/**
 * Immutable input of one {@link SetupParamRunner} invocation.
 */
public record SetupParamRunConfiguration(
    String typeName,
    Map<String, Object> requestRecord,
    Map<String, Object> operatorInputs,
    Clock clock,
    DisplaySettings display
) {
    public SetupParamRunConfiguration {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(display, "display");
        requestRecord = copy(requestRecord);
        operatorInputs = copy(operatorInputs);
    }

    public static Builder builder() {
        return new Builder();
    }

    // Map.copyOf rejects null values, which are legal here
    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {
        private String typeName = SetupParamTypes.DAR8;
        private Map<String, Object> requestRecord = Map.of();
        private Map<String, Object> operatorInputs = Map.of();
        private Clock clock = Clock.systemDefaultZone();
        private DisplaySettings display = DisplaySettings.defaults();

        public Builder typeName(String typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder requestRecord(Map<String, Object> requestRecord) {
            this.requestRecord = requestRecord;
            return this;
        }

        public Builder operatorInputs(Map<String, Object> operatorInputs) {
            this.operatorInputs = operatorInputs;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder display(DisplaySettings display) {
            this.display = display;
            return this;
        }

        public SetupParamRunConfiguration build() {
            return new SetupParamRunConfiguration(typeName, requestRecord, operatorInputs, clock, display);
        }
    }
}
