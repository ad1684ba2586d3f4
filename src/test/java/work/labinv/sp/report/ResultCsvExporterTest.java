package work.labinv.sp.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.labinv.sp.support.SetupParamTestSupport;

class ResultCsvExporterTest {
    private static ResultView view() {
        return new ResultView(SetupParamTestSupport.dar8().calculateFromRequest(
            SetupParamTestSupport.highConcentrationRequest(),
            SetupParamTestSupport.referenceInputs()
        ));
    }

    @Test
    void writesHeaderAndOneRecordPerField() {
        String csv = new ResultCsvExporter().export(view());
        String[] lines = csv.split("\n");
        assertEquals("key,name,unit,value,group", lines[0]);
        assertEquals("antibody_conc_mg_ml,Antibody concentration (mg/mL),mg/mL,20,input_request", lines[1]);
        assertEquals(view().rows().size() + 1, lines.length);
        assertTrue(csv.contains("\nadd_tcep_ml,Add TCEP (mL),mL,0.667,output_reduction\n"));
        assertTrue(csv.contains("\nadd_additional_tcep_ml,Add additional TCEP (mL),mL,N/A,output_reduction\n"));
    }

    @Test
    void leavesTheTargetOpen() {
        var target = new StringBuilder("# export\n");
        new ResultCsvExporter().write(view(), target);
        assertTrue(target.toString().startsWith("# export\nkey,name,unit,value,group\n"));
    }
}
