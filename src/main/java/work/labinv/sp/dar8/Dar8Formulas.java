package work.labinv.sp.dar8;

import static work.labinv.sp.dar8.Dar8Fields.*;
import static work.labinv.sp.shared.SafeMath.multiply;
import static work.labinv.sp.shared.SafeMath.safeDiv;
import static work.labinv.sp.shared.SafeMath.subtract;
import static work.labinv.sp.shared.SafeMath.sum;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import work.labinv.sp.runtime.EvaluationContext;
import work.labinv.sp.runtime.FieldFormula;
import work.labinv.sp.shared.NumberParser;

/**
 * DAR8 formulas, one per derived or fixed field of {@link Dar8Fields#CATALOG}.
 */
public final class Dar8Formulas {
    /** Antibody concentration (mg/mL) at or above which the antibody is diluted to {@link #TARGET_MAB_CONC}. */
    public static final double DILUTION_THRESHOLD = 11.5;
    public static final double TARGET_MAB_CONC = 10.0;
    static final double EDTA_FRACTION = 0.01;
    static final double REACTION_TEMPERATURE_C = 22.0;
    static final double REACTION_TIME_H = 18.0;

    private static final DateTimeFormatter BATCH_DATE = DateTimeFormatter.ofPattern("yyMMdd");

    private Dar8Formulas() {}

    public static Map<String, FieldFormula> create() {
        var formulas = new LinkedHashMap<String, FieldFormula>();
        formulas.put(LP_CONC, Dar8Formulas::lpConcentration);
        formulas.put(ADD_ANTIBODY, Dar8Formulas::addAntibody);
        formulas.put(ADD_TCEP, Dar8Formulas::addTcep);
        formulas.put(ADD_BUFFER, Dar8Formulas::addBuffer);
        formulas.put(ADD_EDTA, Dar8Formulas::addEdta);
        formulas.put(MAB_CONC_REDUCTION, Dar8Formulas::mabConcInReaction);
        formulas.put(REDUCTION_TOTAL_VOLUME, Dar8Formulas::reductionTotalVolume);
        formulas.put(REDUCTION_TEMPERATURE, FieldFormula.constant(REACTION_TEMPERATURE_C));
        formulas.put(REDUCTION_TIME, FieldFormula.constant(REACTION_TIME_H));
        formulas.put(ADD_ADDITIONAL_TCEP, Dar8Formulas::addAdditionalTcep);
        formulas.put(ORGANIC_RATIO_PERCENT_OUT, FieldFormula.copyOf(ORGANIC_RATIO_PERCENT));
        formulas.put(ORGANIC_RATIO_UNIT, FieldFormula.copyOf(DISSOLVED_IN));
        formulas.put(LP_PER_AB_OUT, FieldFormula.copyOf(LP_PER_AB));
        formulas.put(CONJ_TOTAL_VOLUME, Dar8Formulas::conjugationTotalVolume);
        formulas.put(ADD_LP_STOCK, Dar8Formulas::addLpStock);
        formulas.put(ADD_ORGANIC_SOLVENT, Dar8Formulas::addOrganicSolvent);
        formulas.put(CONJ_CONC, Dar8Formulas::conjugationConcentration);
        formulas.put(CONJ_TEMPERATURE, FieldFormula.constant(REACTION_TEMPERATURE_C));
        formulas.put(CONJ_TIME, FieldFormula.constant(REACTION_TIME_H));
        formulas.put(ADDITIONAL_LP_OUT, FieldFormula.copyOf(ADDITIONAL_LP));
        formulas.put(ADDITIONAL_REACTION_TIME_OUT, FieldFormula.copyOf(ADDITIONAL_REACTION_TIME));
        formulas.put(BATCH_NO, Dar8Formulas::batchNumber);
        return formulas;
    }

    /**
     * True when the antibody is concentrated enough to be diluted (fixed reaction concentration branch).
     */
    public static boolean dilutes(double antibodyConcentration) {
        return antibodyConcentration >= DILUTION_THRESHOLD;
    }

    /**
     * {@code scale / mw * equivalents / stock * 1000}; the factor converts mg/Da and mM into mL.
     */
    static Double volumeFromEquivalents(Double scaleMg, Double mwDa, Double equivalents, Double stockMm) {
        return multiply(safeDiv(multiply(safeDiv(scaleMg, mwDa), equivalents), stockMm), 1000.0);
    }

    static Double ratioFraction(Double percent) {
        return percent == null ? null : percent / 100.0;
    }

    private static Object lpConcentration(EvaluationContext ctx) {
        Object carried = ctx.carried();
        if (carried != null) {
            return NumberParser.ensureFloat(carried).orElse(null);
        }
        return NumberParser.parseLeadingNumber(ctx.text(LP_CONC_TEXT)).orElse(null);
    }

    private static Object addAntibody(EvaluationContext ctx) {
        return safeDiv(ctx.number(REACTION_SCALE), ctx.number(ANTIBODY_CONC));
    }

    private static Object addTcep(EvaluationContext ctx) {
        return volumeFromEquivalents(
            ctx.number(REACTION_SCALE),
            ctx.number(MW_ANTIBODY),
            ctx.number(TCEP_EQ),
            ctx.number(TCEP_STOCK)
        );
    }

    private static Object addBuffer(EvaluationContext ctx) {
        Double antibodyConc = ctx.number(ANTIBODY_CONC);
        if (antibodyConc == null) {
            return null;
        }
        if (!dilutes(antibodyConc)) {
            return 0.0;
        }
        Double totalVolume = safeDiv(ctx.number(REACTION_SCALE), TARGET_MAB_CONC);
        Double remaining = subtract(subtract(totalVolume, ctx.number(ADD_ANTIBODY)), ctx.number(ADD_TCEP));
        return subtract(remaining, multiply(totalVolume, EDTA_FRACTION));
    }

    private static Object addEdta(EvaluationContext ctx) {
        return multiply(EDTA_FRACTION, sum(ctx.number(ADD_ANTIBODY), ctx.number(ADD_TCEP), ctx.number(ADD_BUFFER)));
    }

    // below the threshold the volumes are summed as agreed with the lab, units notwithstanding
    private static Object mabConcInReaction(EvaluationContext ctx) {
        Double antibodyConc = ctx.number(ANTIBODY_CONC);
        if (antibodyConc == null) {
            return null;
        }
        if (dilutes(antibodyConc)) {
            return TARGET_MAB_CONC;
        }
        return sum(ctx.number(ADD_ANTIBODY), ctx.number(ADD_EDTA), ctx.number(ADD_TCEP));
    }

    private static Object reductionTotalVolume(EvaluationContext ctx) {
        return safeDiv(ctx.number(REACTION_SCALE), ctx.number(MAB_CONC_REDUCTION));
    }

    private static Object addAdditionalTcep(EvaluationContext ctx) {
        Double additionalEq = ctx.number(ADDITIONAL_TCEP_EQ);
        if (additionalEq == null) {
            return null;
        }
        return volumeFromEquivalents(
            ctx.number(REACTION_SCALE),
            ctx.number(MW_ANTIBODY),
            additionalEq,
            ctx.number(TCEP_STOCK)
        );
    }

    private static Object conjugationTotalVolume(EvaluationContext ctx) {
        Double fraction = ratioFraction(ctx.number(ORGANIC_RATIO_PERCENT));
        return safeDiv(ctx.number(REDUCTION_TOTAL_VOLUME), subtract(1.0, fraction));
    }

    private static Object addLpStock(EvaluationContext ctx) {
        return volumeFromEquivalents(
            ctx.number(REACTION_SCALE),
            ctx.number(MW_ANTIBODY),
            ctx.number(LP_PER_AB),
            ctx.number(LP_CONC)
        );
    }

    private static Object addOrganicSolvent(EvaluationContext ctx) {
        Double fraction = ratioFraction(ctx.number(ORGANIC_RATIO_PERCENT));
        return subtract(multiply(ctx.number(CONJ_TOTAL_VOLUME), fraction), ctx.number(ADD_LP_STOCK));
    }

    private static Object conjugationConcentration(EvaluationContext ctx) {
        return safeDiv(ctx.number(REACTION_SCALE), ctx.number(CONJ_TOTAL_VOLUME));
    }

    private static Object batchNumber(EvaluationContext ctx) {
        String code = ctx.text(WBP_CODE);
        String id = ctx.text(REQUEST_ID);
        if (code.isEmpty() && id.isEmpty()) {
            return "";
        }
        return code + "-" + BATCH_DATE.format(ctx.today()) + id;
    }
}
