package work.labinv.sp.report;

import java.util.ArrayList;
import work.labinv.sp.field.FieldDescriptor;

/**
 * Builds {@link Explanation}s from a result view. Only direct dependencies are listed, never their own inputs.
 */
public final class ExplanationRenderer {
    public Explanation explain(String key, ResultView view) {
        FieldDescriptor descriptor = view.result().descriptor(key);
        var dependencies = new ArrayList<Explanation.Dependency>(descriptor.dependsOn().size());
        for (String dependencyKey : descriptor.dependsOn()) {
            FieldDescriptor dependency = view.result().descriptor(dependencyKey);
            dependencies.add(new Explanation.Dependency(
                dependency.key(),
                dependency.displayName(),
                dependency.unit(),
                view.formatted(dependencyKey)
            ));
        }
        return new Explanation(
            descriptor.key(),
            descriptor.displayName(),
            descriptor.unit(),
            view.formatted(key),
            descriptor.source(),
            descriptor.description(),
            descriptor.formulaText(),
            dependencies
        );
    }

    public String explainText(String key, ResultView view) {
        return explain(key, view).toText();
    }
}
