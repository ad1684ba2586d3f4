package work.labinv.sp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;
import work.labinv.sp.dar8.Dar8Fields;
import work.labinv.sp.dar8.Dar8SetupParam;

class SetupParamTypeRegistryTest {
    @Test
    void resolvesDar8CaseInsensitively() {
        var registry = SetupParamTypes.create();
        var type = registry.resolve(" dar8 ");
        assertEquals("DAR8", type.name());
        assertSame(Dar8Fields.CATALOG, type.catalog());
        assertTrue(registry.isSupported("Dar8"));
    }

    @Test
    void declaredTypesAreUnsupportedPlaceholders() {
        var registry = SetupParamTypes.create();
        for (String name : new String[] {"DAR4", "deblocking", "Thiomab"}) {
            var ex = assertThrows(UnsupportedSetupParamTypeException.class, () -> registry.resolve(name));
            assertTrue(ex.placeholder());
            assertEquals("unsupported_sp_type", ex.code());
            assertEquals("Setup parameter type " + name + " is not supported yet", ex.getMessage());
        }
        assertFalse(registry.isSupported("DAR4"));
    }

    @Test
    void unknownTypeIsNotAPlaceholder() {
        var ex = assertThrows(UnsupportedSetupParamTypeException.class, () -> SetupParamTypes.create().resolve("DAR2"));
        assertFalse(ex.placeholder());
        assertEquals("Unknown setup parameter type: DAR2", ex.getMessage());
    }

    @Test
    void listsSupportedAndDeclaredTypes() {
        var registry = SetupParamTypes.create();
        assertEquals(Set.of("DAR8"), registry.supportedTypes());
        assertEquals(Set.of("DAR8", "DAR4", "DEBLOCKING", "THIOMAB"), registry.declaredTypes());
    }

    @Test
    void registeringReplacesAPlaceholder() {
        var registry = new SetupParamTypeRegistry().declare("DAR8");
        assertFalse(registry.isSupported("DAR8"));
        registry.register(new Dar8SetupParam());
        assertTrue(registry.isSupported("DAR8"));
        assertEquals(Set.of("DAR8"), registry.declaredTypes());
    }
}
