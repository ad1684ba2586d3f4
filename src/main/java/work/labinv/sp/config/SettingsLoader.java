package work.labinv.sp.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;

/**
 * Reads {@link CalculatorSettings} from a TOML file:
 *
 * <pre>
 * [display]
 * digits = 3
 * sentinel = "N/A"
 *
 * [calculation]
 * type = "DAR8"
 * zone = "Asia/Shanghai"
 *
 * [logging]
 * level = "warn"
 * </pre>
 *
 * Missing keys keep their defaults.
 */
public final class SettingsLoader {
    private SettingsLoader() {}

    public static CalculatorSettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new SettingsException("Settings file not found: " + path);
        }
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new SettingsException("Unable to read settings file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static CalculatorSettings parse(String text) {
        return parse(text, "<inline>");
    }

    private static CalculatorSettings parse(String text, String origin) {
        TomlParseResult result = Toml.parse(text == null ? "" : text);
        if (result.hasErrors()) {
            throw new SettingsException("Invalid settings in " + origin + ": " + result.errors().get(0).toString());
        }
        var builder = CalculatorSettings.builder();
        try {
            Long digits = result.getLong("display.digits");
            if (digits != null) {
                if (digits < 0 || digits > 12) {
                    throw new SettingsException("display.digits must be between 0 and 12 in " + origin);
                }
                builder.digits(digits.intValue());
            }
            String sentinel = result.getString("display.sentinel");
            if (sentinel != null) {
                builder.sentinel(sentinel);
            }
            String type = result.getString("calculation.type");
            if (type != null && !type.isBlank()) {
                builder.defaultType(type.trim());
            }
            String zone = result.getString("calculation.zone");
            if (zone != null && !zone.isBlank()) {
                builder.zone(ZoneId.of(zone.trim()));
            }
            String level = result.getString("logging.level");
            if (level != null) {
                builder.logLevel(LogLevel.from(level));
            }
        } catch (TomlInvalidTypeException | DateTimeException | IllegalArgumentException ex) {
            throw new SettingsException("Invalid settings in " + origin + ": " + ex.getMessage(), ex);
        }
        return builder.build();
    }
}
