package work.labinv.sp.dar8;

import java.util.Map;
import work.labinv.sp.api.SetupParamDefinition;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.runtime.FieldFormula;
import work.labinv.sp.runtime.RequestNormalizer;

public final class Dar8SetupParam implements SetupParamDefinition {
    private final RequestNormalizer normalizer = new Dar8RequestNormalizer();
    private final Map<String, FieldFormula> formulas = Map.copyOf(Dar8Formulas.create());

    @Override
    public String typeName() {
        return Dar8Fields.TYPE_NAME;
    }

    @Override
    public FieldCatalog catalog() {
        return Dar8Fields.CATALOG;
    }

    @Override
    public RequestNormalizer normalizer() {
        return normalizer;
    }

    @Override
    public Map<String, FieldFormula> formulas() {
        return formulas;
    }
}
