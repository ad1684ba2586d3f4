package work.labinv.sp.api;

import java.util.Map;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.runtime.FieldFormula;
import work.labinv.sp.runtime.RequestNormalizer;

/**
 * Everything a setup-parameter type contributes: its catalog, how requests are normalized for it and a formula
 * for each derived or fixed field. Adding a type means registering another definition, not touching the engine.
 */
public interface SetupParamDefinition {
    String typeName();

    FieldCatalog catalog();

    RequestNormalizer normalizer();

    Map<String, FieldFormula> formulas();
}
