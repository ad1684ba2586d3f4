package work.labinv.sp.dar8;

import static work.labinv.sp.field.DataType.ENUM;
import static work.labinv.sp.field.DataType.FLOAT;
import static work.labinv.sp.field.DataType.OPTIONAL_FLOAT;
import static work.labinv.sp.field.DataType.STRING;
import static work.labinv.sp.field.FieldGroup.INPUT_REQUEST;
import static work.labinv.sp.field.FieldGroup.INPUT_USER;
import static work.labinv.sp.field.FieldGroup.META;
import static work.labinv.sp.field.FieldGroup.OUTPUT_CONJUGATION;
import static work.labinv.sp.field.FieldGroup.OUTPUT_REDUCTION;
import static work.labinv.sp.field.FieldSource.DERIVED;
import static work.labinv.sp.field.FieldSource.FIXED;
import static work.labinv.sp.field.FieldSource.REQUEST;
import static work.labinv.sp.field.FieldSource.USER_INPUT;

import java.util.List;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.field.FieldDescriptor;

/**
 * Field keys and the literal catalog of the DAR8 setup parameters (antibody reduction followed by
 * linker-payload conjugation).
 */
public final class Dar8Fields {
    public static final String TYPE_NAME = "DAR8";

    // request
    public static final String ANTIBODY_CONC = "antibody_conc_mg_ml";
    public static final String REACTION_SCALE = "reaction_scale_mg";
    public static final String MW_ANTIBODY = "mw_antibody_da";
    public static final String DISSOLVED_IN = "dissolved_in";
    public static final String LP_CONC_TEXT = "lp_conc_str";
    public static final String LP_CONC = "lp_conc_mM";
    public static final String WBP_CODE = "wbp_code";
    public static final String REQUEST_ID = "request_id";

    // operator
    public static final String TCEP_EQ = "tcep_eq";
    public static final String TCEP_STOCK = "tcep_stock_mM";
    public static final String ORGANIC_RATIO_PERCENT = "conj_org_ratio_percent";
    public static final String LP_PER_AB = "x_lp_per_ab";
    public static final String ADDITIONAL_TCEP_EQ = "add_additional_tcep_eq";
    public static final String ADDITIONAL_LP = "add_additional_lp";
    public static final String ADDITIONAL_REACTION_TIME = "additional_reaction_time_h";
    public static final String REACTION_STATUS = "reaction_status";

    // reduction
    public static final String ADD_ANTIBODY = "add_antibody_ml";
    public static final String ADD_TCEP = "add_tcep_ml";
    public static final String ADD_BUFFER = "add_buffer_ml";
    public static final String ADD_EDTA = "add_edta_ml";
    public static final String MAB_CONC_REDUCTION = "mab_conc_reduction_mg_ml";
    public static final String REDUCTION_TOTAL_VOLUME = "reduction_total_volume_ml";
    public static final String REDUCTION_TEMPERATURE = "reduction_reaction_temperature_c";
    public static final String REDUCTION_TIME = "reduction_reaction_time_h";
    public static final String ADD_ADDITIONAL_TCEP = "add_additional_tcep_ml";

    // conjugation
    public static final String ORGANIC_RATIO_PERCENT_OUT = "conj_org_ratio_percent_out";
    public static final String ORGANIC_RATIO_UNIT = "conj_org_ratio_unit";
    public static final String LP_PER_AB_OUT = "x_lp_per_ab_out";
    public static final String CONJ_TOTAL_VOLUME = "conj_total_volume_ml";
    public static final String ADD_LP_STOCK = "add_lp_stock_ml";
    public static final String ADD_ORGANIC_SOLVENT = "add_org_solvent_ml";
    public static final String CONJ_CONC = "conj_conc_mg_ml";
    public static final String CONJ_TEMPERATURE = "conj_reaction_temperature_c";
    public static final String CONJ_TIME = "conj_reaction_time_h";
    public static final String ADDITIONAL_LP_OUT = "add_additional_lp_out";
    public static final String ADDITIONAL_REACTION_TIME_OUT = "additional_reaction_time_h_out";

    // meta
    public static final String BATCH_NO = "batch_no";

    public static final List<FieldDescriptor> DESCRIPTORS = List.of(
        FieldDescriptor.builder(ANTIBODY_CONC)
            .displayName("Antibody concentration (mg/mL)").unit("mg/mL")
            .dataType(FLOAT).source(REQUEST).group(INPUT_REQUEST)
            .description("Antibody concentration taken from the request.")
            .build(),
        FieldDescriptor.builder(REACTION_SCALE)
            .displayName("Reaction Scale (mg)").unit("mg")
            .dataType(FLOAT).source(REQUEST).group(INPUT_REQUEST)
            .description("Amount of antibody to conjugate, from the request.")
            .build(),
        FieldDescriptor.builder(MW_ANTIBODY)
            .displayName("MW of antibody (Da)").unit("Da")
            .dataType(FLOAT).source(REQUEST).group(INPUT_REQUEST)
            .description("Molecular weight of the antibody, from the request.")
            .build(),
        FieldDescriptor.builder(DISSOLVED_IN)
            .displayName("Dissolved in")
            .dataType(STRING).source(REQUEST).group(INPUT_REQUEST)
            .description("Organic solvent the linker-payload is dissolved in.")
            .build(),
        FieldDescriptor.builder(LP_CONC_TEXT)
            .displayName("LP concentration (raw)")
            .dataType(STRING).source(REQUEST).group(INPUT_REQUEST)
            .description("Linker-payload stock concentration as written in the request, e.g. '10 mM'.")
            .build(),
        FieldDescriptor.builder(LP_CONC)
            .displayName("LP concentration (mM)").unit("mM")
            .dataType(OPTIONAL_FLOAT).source(DERIVED).group(INPUT_REQUEST)
            .dependsOn(LP_CONC_TEXT)
            .description("Leading number of the raw LP concentration; absent when the text does not start with a number.")
            .formula("LP concentration (mM) = leading number of LP concentration (raw), e.g. '10 mM' -> 10.0")
            .build(),
        FieldDescriptor.builder(WBP_CODE)
            .displayName("WBP Code")
            .dataType(STRING).source(REQUEST).group(INPUT_REQUEST)
            .build(),
        FieldDescriptor.builder(REQUEST_ID)
            .displayName("ID")
            .dataType(STRING).source(REQUEST).group(INPUT_REQUEST)
            .build(),

        FieldDescriptor.builder(TCEP_EQ)
            .displayName("TCEP equivalents").unit("eq")
            .dataType(FLOAT).source(USER_INPUT).group(INPUT_USER)
            .defaultValue(8.0)
            .description("TCEP equivalents per antibody; 8.0 when not entered.")
            .build(),
        FieldDescriptor.builder(TCEP_STOCK)
            .displayName("TCEP stock (mM)").unit("mM")
            .dataType(FLOAT).source(USER_INPUT).group(INPUT_USER)
            .defaultValue(8.0)
            .description("Concentration of the TCEP stock solution; 8.0 when not entered.")
            .build(),
        FieldDescriptor.builder(ORGANIC_RATIO_PERCENT)
            .displayName("Conjugation organic solvent ratio (%)").unit("%")
            .dataType(FLOAT).source(USER_INPUT).group(INPUT_USER)
            .defaultValue(0.0)
            .description("Organic solvent share of the conjugation volume, 0-100.")
            .formula("ratio_fraction = percentage / 100, e.g. 20 (%) -> 0.20")
            .build(),
        FieldDescriptor.builder(LP_PER_AB)
            .displayName("x LP/Ab")
            .dataType(FLOAT).source(USER_INPUT).group(INPUT_USER)
            .defaultValue(12.0)
            .description("Linker-payload equivalents per antibody; 12.0 when not entered.")
            .build(),
        FieldDescriptor.builder(ADDITIONAL_TCEP_EQ)
            .displayName("Add additional TCEP (eq, input)").unit("eq")
            .dataType(OPTIONAL_FLOAT).source(USER_INPUT).group(INPUT_USER)
            .description("Optional extra TCEP equivalents.")
            .build(),
        FieldDescriptor.builder(ADDITIONAL_LP)
            .displayName("Add additional LP (input)")
            .dataType(OPTIONAL_FLOAT).source(USER_INPUT).group(INPUT_USER)
            .description("Optional extra linker-payload amount, in the unit agreed by the operator.")
            .build(),
        FieldDescriptor.builder(ADDITIONAL_REACTION_TIME)
            .displayName("Additional reaction time (h, input)").unit("h")
            .dataType(OPTIONAL_FLOAT).source(USER_INPUT).group(INPUT_USER)
            .description("Optional extra reaction time in hours.")
            .build(),
        FieldDescriptor.builder(REACTION_STATUS)
            .displayName("Reaction status")
            .dataType(ENUM).source(USER_INPUT).group(INPUT_USER)
            .allowedValues("clear", "cloudy", "precipitate")
            .description("Operator's observation of the reaction: clear, cloudy or precipitate.")
            .build(),

        FieldDescriptor.builder(ADD_ANTIBODY)
            .displayName("Add antibody (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_REDUCTION).important()
            .dependsOn(REACTION_SCALE, ANTIBODY_CONC)
            .description("Volume of antibody solution to add.")
            .formula("Add antibody (mL) = Reaction Scale (mg) / Antibody concentration (mg/mL)")
            .build(),
        FieldDescriptor.builder(ADD_TCEP)
            .displayName("Add TCEP (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_REDUCTION).important()
            .dependsOn(REACTION_SCALE, MW_ANTIBODY, TCEP_EQ, TCEP_STOCK)
            .description("Volume of TCEP stock to add.")
            .formula("Add TCEP (mL) = Reaction Scale (mg) / MW of antibody (Da) * TCEP eq / TCEP stock (mM) * 1000")
            .build(),
        FieldDescriptor.builder(ADD_BUFFER)
            .displayName("Add buffer to adjust Ab conc. (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_REDUCTION).important()
            .dependsOn(ANTIBODY_CONC, REACTION_SCALE, ADD_ANTIBODY, ADD_TCEP)
            .description("Buffer that dilutes a concentrated antibody down to the reaction concentration.")
            .formula("If Antibody concentration >= 11.5: V = Reaction Scale (mg) / 10.0 (the Reduction Total volume of"
                + " this branch), Add buffer (mL) = V - Add antibody (mL) - Add TCEP (mL) - V * 0.01; otherwise 0.0")
            .build(),
        FieldDescriptor.builder(ADD_EDTA)
            .displayName("Add 200mM EDTA (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_REDUCTION).important()
            .dependsOn(ADD_ANTIBODY, ADD_TCEP, ADD_BUFFER)
            .description("Volume of 200 mM EDTA to add.")
            .formula("Add 200mM EDTA (mL) = 0.01 * (Add antibody (mL) + Add TCEP (mL) + Add buffer (mL))")
            .build(),
        FieldDescriptor.builder(MAB_CONC_REDUCTION)
            .displayName("mAb conc. in reaction (mg/mL)").unit("mg/mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_REDUCTION)
            .dependsOn(ANTIBODY_CONC, ADD_ANTIBODY, ADD_EDTA, ADD_TCEP)
            .description("Antibody concentration of the reduction mix. Below 11.5 mg/mL the agreed convention sums"
                + " the three added volumes (mL), which is not dimensionally a concentration.")
            .formula("If Antibody concentration < 11.5: Add antibody (mL) + Add 200mM EDTA (mL) + Add TCEP (mL);"
                + " otherwise 10.0")
            .build(),
        FieldDescriptor.builder(REDUCTION_TOTAL_VOLUME)
            .displayName("Reduction Total volume (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_REDUCTION)
            .dependsOn(REACTION_SCALE, MAB_CONC_REDUCTION)
            .description("Total volume of the reduction mix.")
            .formula("Reduction Total volume (mL) = Reaction Scale (mg) / mAb conc. in reaction (mg/mL)")
            .build(),
        FieldDescriptor.builder(REDUCTION_TEMPERATURE)
            .displayName("Reduction Reaction temperature (°C)").unit("°C")
            .dataType(FLOAT).source(FIXED).group(OUTPUT_REDUCTION)
            .description("Reduction runs at 22 °C.")
            .formula("Fixed: 22 °C")
            .build(),
        FieldDescriptor.builder(REDUCTION_TIME)
            .displayName("Reduction Reaction time (h)").unit("h")
            .dataType(FLOAT).source(FIXED).group(OUTPUT_REDUCTION)
            .description("Reduction runs for 18 h.")
            .formula("Fixed: 18 h")
            .build(),
        FieldDescriptor.builder(ADD_ADDITIONAL_TCEP)
            .displayName("Add additional TCEP (mL)").unit("mL")
            .dataType(OPTIONAL_FLOAT).source(DERIVED).group(OUTPUT_REDUCTION)
            .dependsOn(REACTION_SCALE, MW_ANTIBODY, ADDITIONAL_TCEP_EQ, TCEP_STOCK)
            .description("Extra TCEP volume; only calculated when additional TCEP equivalents were entered.")
            .formula("Only with Add additional TCEP (eq): Reaction Scale (mg) / MW of antibody (Da)"
                + " * Add additional TCEP (eq) / TCEP stock (mM) * 1000")
            .build(),

        FieldDescriptor.builder(ORGANIC_RATIO_PERCENT_OUT)
            .displayName("Conjugation organic solvent ratio (%)").unit("%")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(ORGANIC_RATIO_PERCENT)
            .description("Operator's organic solvent ratio, repeated with the conjugation outputs.")
            .formula("Equal to the entered Conjugation organic solvent ratio (%)")
            .build(),
        FieldDescriptor.builder(ORGANIC_RATIO_UNIT)
            .displayName("unit of Conjugation organic solvent ratio")
            .dataType(STRING).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(DISSOLVED_IN)
            .description("Solvent the ratio refers to, copied from the request's Dissolved in.")
            .formula("unit = Dissolved in")
            .build(),
        FieldDescriptor.builder(LP_PER_AB_OUT)
            .displayName("x LP/Ab (output)")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(LP_PER_AB)
            .description("Operator's x LP/Ab, repeated with the conjugation outputs.")
            .formula("Equal to the entered x LP/Ab")
            .build(),
        FieldDescriptor.builder(CONJ_TOTAL_VOLUME)
            .displayName("Conjugation Total volume (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(REDUCTION_TOTAL_VOLUME, ORGANIC_RATIO_PERCENT)
            .description("Total volume of the conjugation mix once the organic solvent is added.")
            .formula("Conjugation Total volume (mL) = Reduction Total volume (mL) / (1 - ratio_fraction),"
                + " ratio_fraction = Conjugation organic solvent ratio (%) / 100")
            .build(),
        FieldDescriptor.builder(ADD_LP_STOCK)
            .displayName("Add stock LP solution (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(REACTION_SCALE, MW_ANTIBODY, LP_PER_AB, LP_CONC)
            .description("Volume of linker-payload stock; absent when the LP concentration could not be read.")
            .formula("Add stock LP solution (mL) = Reaction Scale (mg) / MW of antibody (Da) * x LP/Ab"
                + " / LP concentration (mM) * 1000")
            .build(),
        FieldDescriptor.builder(ADD_ORGANIC_SOLVENT)
            .displayName("Add organic solvent to reaction (mL)").unit("mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(CONJ_TOTAL_VOLUME, ORGANIC_RATIO_PERCENT, ADD_LP_STOCK)
            .description("Organic solvent added on top of the LP stock to reach the target ratio.")
            .formula("Add organic solvent (mL) = Conjugation Total volume (mL) * ratio_fraction"
                + " - Add stock LP solution (mL)")
            .build(),
        FieldDescriptor.builder(CONJ_CONC)
            .displayName("Conjugation Concentration (mg/mL)").unit("mg/mL")
            .dataType(FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(REACTION_SCALE, CONJ_TOTAL_VOLUME)
            .description("Antibody concentration of the conjugation mix.")
            .formula("Conjugation Concentration (mg/mL) = Reaction Scale (mg) / Conjugation Total volume (mL)")
            .build(),
        FieldDescriptor.builder(CONJ_TEMPERATURE)
            .displayName("Conjugation Reaction temperature (°C)").unit("°C")
            .dataType(FLOAT).source(FIXED).group(OUTPUT_CONJUGATION)
            .description("Conjugation runs at 22 °C.")
            .formula("Fixed: 22 °C")
            .build(),
        FieldDescriptor.builder(CONJ_TIME)
            .displayName("Conjugation Reaction time (h)").unit("h")
            .dataType(FLOAT).source(FIXED).group(OUTPUT_CONJUGATION)
            .description("Conjugation runs for 18 h.")
            .formula("Fixed: 18 h")
            .build(),
        FieldDescriptor.builder(ADDITIONAL_LP_OUT)
            .displayName("Add additional LP (output)")
            .dataType(OPTIONAL_FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(ADDITIONAL_LP)
            .description("Entered additional LP, if any.")
            .formula("Add additional LP (output) = entered Add additional LP; absent otherwise")
            .build(),
        FieldDescriptor.builder(ADDITIONAL_REACTION_TIME_OUT)
            .displayName("Additional reaction time (h, output)").unit("h")
            .dataType(OPTIONAL_FLOAT).source(DERIVED).group(OUTPUT_CONJUGATION)
            .dependsOn(ADDITIONAL_REACTION_TIME)
            .description("Entered additional reaction time, if any.")
            .formula("Additional reaction time (output) = entered Additional reaction time; absent otherwise")
            .build(),

        FieldDescriptor.builder(BATCH_NO)
            .displayName("Batch#")
            .dataType(STRING).source(DERIVED).group(META)
            .dependsOn(WBP_CODE, REQUEST_ID)
            .description("Batch number WBP Code-YYMMDDID, YYMMDD being the calculation date; empty when both"
                + " WBP Code and ID are empty.")
            .formula("Batch# = WBP Code + '-' + current date (YYMMDD) + ID")
            .build()
    );

    public static final FieldCatalog CATALOG = new FieldCatalog(TYPE_NAME, DESCRIPTORS);

    private Dar8Fields() {}
}
