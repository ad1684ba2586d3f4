package work.labinv.sp.config;

import java.time.ZoneId;
import java.util.Objects;
import work.labinv.sp.report.DisplaySettings;

/**
 * Process-level settings: result display, the default setup-parameter type, the zone used for the batch date
 * and the log threshold.
 */
public record CalculatorSettings(
    DisplaySettings display,
    String defaultType,
    ZoneId zone,
    LogLevel logLevel
) {
    public static final String DEFAULT_TYPE = "DAR8";

    public CalculatorSettings {
        Objects.requireNonNull(display, "display");
        Objects.requireNonNull(defaultType, "defaultType");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static CalculatorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .digits(display.digits())
            .sentinel(display.sentinel())
            .defaultType(defaultType)
            .zone(zone)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private int digits = DisplaySettings.defaults().digits();
        private String sentinel = DisplaySettings.defaults().sentinel();
        private String defaultType = DEFAULT_TYPE;
        private ZoneId zone = ZoneId.systemDefault();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder digits(int digits) {
            this.digits = digits;
            return this;
        }

        public Builder sentinel(String sentinel) {
            this.sentinel = sentinel;
            return this;
        }

        public Builder defaultType(String defaultType) {
            this.defaultType = defaultType;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CalculatorSettings build() {
            return new CalculatorSettings(new DisplaySettings(digits, sentinel), defaultType, zone, logLevel);
        }
    }
}
