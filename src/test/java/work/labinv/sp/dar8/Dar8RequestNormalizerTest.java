package work.labinv.sp.dar8;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.labinv.sp.support.SetupParamTestSupport;

class Dar8RequestNormalizerTest {
    private final Dar8RequestNormalizer normalizer = new Dar8RequestNormalizer();

    @Test
    void mapsTemplateColumnsToCatalogKeys() {
        var normalized = normalizer.normalize(SetupParamTestSupport.highConcentrationRequest());
        assertEquals(20.0, normalized.get(Dar8Fields.ANTIBODY_CONC));
        assertEquals(100.0, normalized.get(Dar8Fields.REACTION_SCALE));
        assertEquals(150000.0, normalized.get(Dar8Fields.MW_ANTIBODY));
        assertEquals("DMSO", normalized.get(Dar8Fields.DISSOLVED_IN));
        assertEquals("10 mM", normalized.get(Dar8Fields.LP_CONC_TEXT));
        assertEquals(10.0, normalized.get(Dar8Fields.LP_CONC));
        assertEquals("WBP1234", normalized.get(Dar8Fields.WBP_CODE));
        assertEquals("7", normalized.get(Dar8Fields.REQUEST_ID));
    }

    @Test
    void acceptsCorrectedConcentrationSpelling() {
        var normalized = normalizer.normalize(Map.of("Antibody concentration (mg/mL)", "8.5"));
        assertEquals(8.5, normalized.get(Dar8Fields.ANTIBODY_CONC));
    }

    @Test
    void malformedCellsBecomeAbsentWithoutThrowing() {
        var raw = new HashMap<String, Object>();
        raw.put("Antibody concention (mg/mL)", "high");
        raw.put("Reaction Scale (mg)", null);
        raw.put("LP浓度", "see notes");
        raw.put("ID", 12.0);
        var normalized = normalizer.normalize(raw);
        assertNull(normalized.get(Dar8Fields.ANTIBODY_CONC));
        assertNull(normalized.get(Dar8Fields.REACTION_SCALE));
        assertNull(normalized.get(Dar8Fields.MW_ANTIBODY));
        assertNull(normalized.get(Dar8Fields.LP_CONC));
        assertEquals("see notes", normalized.get(Dar8Fields.LP_CONC_TEXT));
        assertEquals("12", normalized.get(Dar8Fields.REQUEST_ID));
        assertEquals("", normalized.get(Dar8Fields.WBP_CODE));
    }

    @Test
    void nullRecordNormalizesToEmptyValues() {
        var normalized = normalizer.normalize(null);
        assertNull(normalized.get(Dar8Fields.ANTIBODY_CONC));
        assertEquals("", normalized.get(Dar8Fields.DISSOLVED_IN));
        assertEquals("", normalized.get(Dar8Fields.REQUEST_ID));
    }
}
