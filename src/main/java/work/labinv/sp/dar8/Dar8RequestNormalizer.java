package work.labinv.sp.dar8;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.labinv.sp.runtime.RequestNormalizer;
import work.labinv.sp.shared.NumberParser;

/**
 * Maps the request template columns onto DAR8 keys. Numbers are coerced leniently, the LP concentration text is
 * split into its leading number, and {@code ID} is rendered without decimals.
 */
public final class Dar8RequestNormalizer implements RequestNormalizer {
    // the request template spells it "concention"; the corrected spelling is accepted too
    static final List<String> ANTIBODY_CONC_COLUMNS = List.of("Antibody concention (mg/mL)", "Antibody concentration (mg/mL)");
    static final String REACTION_SCALE_COLUMN = "Reaction Scale (mg)";
    static final String MW_ANTIBODY_COLUMN = "MW of antibody (Da)";
    static final String DISSOLVED_IN_COLUMN = "Dissolved in";
    static final String LP_CONC_COLUMN = "LP浓度";
    static final String WBP_CODE_COLUMN = "WBP Code";
    static final String ID_COLUMN = "ID";

    @Override
    public Map<String, Object> normalize(Map<String, ?> requestRecord) {
        Map<String, ?> raw = requestRecord == null ? Map.of() : requestRecord;
        var result = new LinkedHashMap<String, Object>();
        result.put(Dar8Fields.ANTIBODY_CONC, NumberParser.ensureFloat(first(raw, ANTIBODY_CONC_COLUMNS)).orElse(null));
        result.put(Dar8Fields.REACTION_SCALE, NumberParser.ensureFloat(raw.get(REACTION_SCALE_COLUMN)).orElse(null));
        result.put(Dar8Fields.MW_ANTIBODY, NumberParser.ensureFloat(raw.get(MW_ANTIBODY_COLUMN)).orElse(null));
        result.put(Dar8Fields.DISSOLVED_IN, text(raw.get(DISSOLVED_IN_COLUMN)));
        Object lpConc = raw.get(LP_CONC_COLUMN);
        result.put(Dar8Fields.LP_CONC_TEXT, lpConc == null ? "" : lpConc.toString());
        result.put(Dar8Fields.LP_CONC, NumberParser.parseLeadingNumber(lpConc).orElse(null));
        result.put(Dar8Fields.WBP_CODE, text(raw.get(WBP_CODE_COLUMN)));
        result.put(Dar8Fields.REQUEST_ID, NumberParser.identifier(raw.get(ID_COLUMN)));
        return result;
    }

    private static Object first(Map<String, ?> raw, List<String> columns) {
        for (String column : columns) {
            Object value = raw.get(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
