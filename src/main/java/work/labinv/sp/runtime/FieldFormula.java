package work.labinv.sp.runtime;

/**
 * Computes the value of one derived or fixed field. Implementations read their inputs only through
 * {@link EvaluationContext}, which rejects keys outside the field's declared dependencies.
 */
@FunctionalInterface
public interface FieldFormula {
    Object evaluate(EvaluationContext ctx);

    static FieldFormula constant(Object value) {
        return ctx -> value;
    }

    /**
     * Takes the value the request normalizer already produced under the field's own key.
     */
    static FieldFormula carriedFromRequest() {
        return EvaluationContext::carried;
    }

    /**
     * Copies a single dependency unchanged.
     */
    static FieldFormula copyOf(String key) {
        return ctx -> ctx.value(key);
    }
}
