package work.labinv.sp.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.labinv.sp.dar8.Dar8Fields;
import work.labinv.sp.field.FieldDescriptor;
import work.labinv.sp.field.FieldSource;
import work.labinv.sp.field.UnknownFieldException;
import work.labinv.sp.support.SetupParamTestSupport;

class ExplanationRendererTest {
    private final ExplanationRenderer renderer = new ExplanationRenderer();

    private static ResultView view() {
        var result = SetupParamTestSupport.dar8().calculateFromRequest(
            SetupParamTestSupport.highConcentrationRequest(),
            SetupParamTestSupport.referenceInputs()
        );
        return new ResultView(result);
    }

    @Test
    void listsExactlyTheDirectDependencies() {
        var explanation = renderer.explain(Dar8Fields.CONJ_TOTAL_VOLUME, view());
        List<String> keys = explanation.dependencies().stream()
            .map(Explanation.Dependency::key)
            .collect(Collectors.toList());
        assertEquals(List.of(Dar8Fields.REDUCTION_TOTAL_VOLUME, Dar8Fields.ORGANIC_RATIO_PERCENT), keys);
        assertEquals("12.5", explanation.value());
        assertEquals(FieldSource.DERIVED, explanation.source());
        assertFalse(explanation.isRawOrFixed());
    }

    @Test
    void everyFieldListsItsDeclaredDependenciesWithCurrentValues() {
        var view = view();
        for (FieldDescriptor descriptor : Dar8Fields.CATALOG.descriptors()) {
            var explanation = renderer.explain(descriptor.key(), view);
            List<String> keys = explanation.dependencies().stream()
                .map(Explanation.Dependency::key)
                .collect(Collectors.toList());
            assertEquals(descriptor.dependsOn(), keys, descriptor.key());
            assertEquals(!descriptor.hasDependencies(), explanation.isRawOrFixed(), descriptor.key());
            for (Explanation.Dependency dependency : explanation.dependencies()) {
                assertEquals(view.formatted(dependency.key()), dependency.value(), descriptor.key());
            }
        }
    }

    @Test
    void textShowsFormulaAndDependencyValues() {
        String text = renderer.explainText(Dar8Fields.ADD_ANTIBODY, view());
        assertTrue(text.startsWith("Add antibody (mL) [mL]\n"));
        assertTrue(text.contains("Value: 5\n"));
        assertTrue(text.contains("Formula: Add antibody (mL) = Reaction Scale (mg) / Antibody concentration (mg/mL)\n"));
        assertTrue(text.contains("  - Reaction Scale (mg) [mg] (reaction_scale_mg) = 100\n"));
        assertTrue(text.contains("  - Antibody concentration (mg/mL) [mg/mL] (antibody_conc_mg_ml) = 20\n"));
    }

    @Test
    void rawAndFixedFieldsSayTheyHaveNoDependencies() {
        var fixed = renderer.explain(Dar8Fields.REDUCTION_TEMPERATURE, view());
        assertTrue(fixed.isRawOrFixed());
        assertTrue(fixed.toText().contains("Depends on: " + Explanation.NO_DEPENDENCIES));

        String raw = renderer.explainText(Dar8Fields.REACTION_SCALE, view());
        assertTrue(raw.contains("Source: request\n"));
        assertTrue(raw.contains("Depends on: none (raw input or fixed constant)"));
    }

    @Test
    void absentValuesUseTheSentinel() {
        var result = SetupParamTestSupport.dar8().calculateFromRequest(
            SetupParamTestSupport.highConcentrationRequest(),
            Map.of()
        );
        var explanation = renderer.explain(Dar8Fields.ADD_ADDITIONAL_TCEP, new ResultView(result));
        assertEquals("N/A", explanation.value());
        assertEquals("N/A", explanation.dependencies().stream()
            .filter(d -> d.key().equals(Dar8Fields.ADDITIONAL_TCEP_EQ))
            .findFirst()
            .orElseThrow()
            .value());
    }

    @Test
    void unknownKeyIsRejected() {
        var ex = assertThrows(UnknownFieldException.class, () -> renderer.explain("no_such_field", view()));
        assertEquals("no_such_field", ex.key());
    }
}
