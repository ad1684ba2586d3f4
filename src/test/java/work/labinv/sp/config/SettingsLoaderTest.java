package work.labinv.sp.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class SettingsLoaderTest {
    private static final Path SETTINGS = Path.of("src", "test", "resources", "settings");

    @Test
    void loadsEverySection() {
        var settings = SettingsLoader.load(SETTINGS.resolve("sp.toml"));
        assertEquals(2, settings.display().digits());
        assertEquals("-", settings.display().sentinel());
        assertEquals("dar8", settings.defaultType());
        assertEquals(ZoneId.of("UTC"), settings.zone());
        assertEquals(LogLevel.ERROR, settings.logLevel());
    }

    @Test
    void missingKeysKeepDefaults() {
        var settings = SettingsLoader.parse("[display]\nsentinel = \"?\"\n");
        assertEquals(3, settings.display().digits());
        assertEquals("?", settings.display().sentinel());
        assertEquals(CalculatorSettings.DEFAULT_TYPE, settings.defaultType());
        assertEquals(LogLevel.WARN, settings.logLevel());
    }

    @Test
    void emptyDocumentIsTheDefaults() {
        var settings = SettingsLoader.parse("");
        assertEquals(CalculatorSettings.defaults().display(), settings.display());
    }

    @Test
    void brokenTomlIsReported() {
        var ex = assertThrows(SettingsException.class, () -> SettingsLoader.load(SETTINGS.resolve("broken.toml")));
        assertTrue(ex.getMessage().startsWith("Invalid settings in "));
        assertEquals("settings_invalid", ex.code());
    }

    @Test
    void missingFileIsReported() {
        var ex = assertThrows(SettingsException.class, () -> SettingsLoader.load(SETTINGS.resolve("absent.toml")));
        assertTrue(ex.getMessage().startsWith("Settings file not found"));
    }

    @Test
    void invalidValuesAreReported() {
        assertThrows(SettingsException.class, () -> SettingsLoader.parse("[display]\ndigits = 20\n"));
        assertThrows(SettingsException.class, () -> SettingsLoader.parse("[display]\ndigits = \"three\"\n"));
        assertThrows(SettingsException.class, () -> SettingsLoader.parse("[calculation]\nzone = \"Mars/Base\"\n"));
        var ex = assertThrows(SettingsException.class, () -> SettingsLoader.parse("[logging]\nlevel = \"loud\"\n"));
        assertTrue(ex.getMessage().contains("Unsupported log level: loud"));
    }

    @Test
    void toBuilderKeepsValues() {
        var settings = SettingsLoader.load(SETTINGS.resolve("sp.toml")).toBuilder().digits(4).build();
        assertEquals(4, settings.display().digits());
        assertEquals("-", settings.display().sentinel());
        assertEquals(LogLevel.ERROR, settings.logLevel());
    }
}
