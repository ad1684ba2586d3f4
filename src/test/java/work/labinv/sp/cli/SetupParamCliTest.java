package work.labinv.sp.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SetupParamCliTest {
    private static final Path RESOURCES = Path.of("src", "test", "resources");
    private static final String REQUEST = RESOURCES.resolve("requests/dar8-high-conc.json").toString();
    private static final String INPUTS = RESOURCES.resolve("requests/dar8-inputs.json").toString();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void calcPrintsGroupedTable() {
        int exit = run("calc", "--request", REQUEST, "--inputs", INPUTS, "--date", "2024-03-05");
        assertEquals(0, exit, err.toString());
        String table = out.toString();
        assertTrue(table.contains("== Request input fields"));
        assertTrue(table.contains("== Antibody reduction set-up"));
        assertTrue(table.indexOf("== Antibody reduction set-up") < table.indexOf("== Antibody conjugation set-up"));
        assertTrue(table.lines().anyMatch(line -> line.startsWith("* Add antibody (mL)") && line.endsWith("  5")));
        assertTrue(table.lines().anyMatch(line -> line.startsWith("  Batch#") && line.endsWith("WBP1234-2403057")));
    }

    @Test
    void calcWritesJson() throws Exception {
        int exit = run("calc", "-r", REQUEST, "-i", INPUTS, "--date", "2024-03-05", "--format", "json");
        assertEquals(0, exit, err.toString());
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertEquals("success", json.get("status").asText());
        assertEquals("1.7", json.get("formatted").get("add_org_solvent_ml").asText());
        assertEquals("WBP1234-2403057", json.get("values").get("batch_no").asText());
    }

    @Test
    void calcWritesCsv() {
        int exit = run("calc", "-r", REQUEST, "-i", INPUTS, "-f", "csv");
        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().startsWith("key,name,unit,value,group\n"));
    }

    @Test
    void inlineOverridesWinOverInputsFile() {
        int exit = run("calc", "-r", REQUEST, "-i", INPUTS, "-I", "conj_org_ratio_percent=0", "-f", "json");
        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("\"conj_total_volume_ml\" : \"10\""));
    }

    @Test
    void calcAppendsExplanations() {
        int exit = run("calc", "-r", REQUEST, "-i", INPUTS, "--explain", "add_edta_ml");
        assertEquals(0, exit, err.toString());
        String text = out.toString();
        assertTrue(text.contains("Add 200mM EDTA (mL) [mL]\nValue: 0.099\n"));
        assertTrue(text.contains("  - Add buffer to adjust Ab conc. (mL) [mL] (add_buffer_ml) = 4.233\n"));
    }

    @Test
    void jsonOutputEmbedsExplanations() throws Exception {
        int exit = run("calc", "-r", REQUEST, "-i", INPUTS, "-f", "json", "-e", "add_edta_ml", "-e", "add_tcep_ml");
        assertEquals(0, exit, err.toString());
        JsonNode json = new ObjectMapper().readTree(out.toString());
        JsonNode explanations = json.get("explanations");
        assertEquals(2, explanations.size());
        assertEquals("add_edta_ml", explanations.get(0).get("key").asText());
        assertEquals("0.099", explanations.get(0).get("value").asText());
        assertEquals(3, explanations.get(0).get("dependsOn").size());
        assertEquals("add_buffer_ml", explanations.get(0).get("dependsOn").get(2).get("key").asText());
        assertEquals("4.233", explanations.get(0).get("dependsOn").get(2).get("value").asText());
    }

    @Test
    void csvOutputSendsExplanationsToStderr() {
        int exit = run("calc", "-r", REQUEST, "-i", INPUTS, "-f", "csv", "--explain", "add_edta_ml");
        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().startsWith("key,name,unit,value,group\n"));
        assertTrue(!out.toString().contains("Value: "));
        assertTrue(err.toString().contains("Add 200mM EDTA (mL) [mL]\nValue: 0.099\n"));
    }

    @Test
    void versionListsSupportedAndPendingTypes() {
        int exit = run("--version");
        assertEquals(0, exit);
        String text = out.toString();
        assertTrue(text.contains("labinv-sp " + VersionProvider.version()));
        assertTrue(text.contains("Setup parameter types: DAR8"));
        assertTrue(text.contains("Declared, not yet supported: DAR4, DEBLOCKING, THIOMAB"));
    }

    @Test
    void inlineJsonRequestAndSettingsFile() {
        int exit = run(
            "calc",
            "-r", "{\"Antibody concention (mg/mL)\": 5, \"Reaction Scale (mg)\": 100, \"MW of antibody (Da)\": 150000}",
            "-c", RESOURCES.resolve("settings/sp.toml").toString(),
            "-f", "json"
        );
        assertEquals(0, exit, err.toString());
        String json = out.toString();
        assertTrue(json.contains("\"add_antibody_ml\" : \"20\""));
        assertTrue(json.contains("\"add_lp_stock_ml\" : \"-\""));
        assertTrue(json.contains("\"add_tcep_ml\" : \"0.67\""));
    }

    @Test
    void placeholderTypeExitsWithTwo() {
        int exit = run("calc", "-r", REQUEST, "--type", "DAR4");
        assertEquals(2, exit);
        assertTrue(err.toString().contains("Setup parameter type DAR4 is not supported yet"));
        assertEquals("", out.toString());
    }

    @Test
    void unknownExplainKeyFailsWithCode() {
        int exit = run("calc", "-r", REQUEST, "--explain", "nope");
        assertEquals(1, exit);
        assertTrue(err.toString().contains("[unknown_field]"));
    }

    @Test
    void malformedRequestIsAUsageError() {
        int exit = run("calc", "-r", "{not json");
        assertEquals(2, exit);
        assertTrue(err.toString().contains("--request must be a JSON object"));
    }

    @Test
    void docRendersMarkdown() {
        int exit = run("doc");
        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().startsWith("# DAR8 setup parameters\n"));
    }

    @Test
    void docWritesJsonFile(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("docs/dar8.json");
        int exit = run("doc", "--format", "json", "--output", target.toString());
        assertEquals(0, exit, err.toString());
        JsonNode json = new ObjectMapper().readTree(Files.readString(target));
        assertEquals("DAR8", json.get("type").asText());
    }

    @Test
    void docRejectsPlaceholderType() {
        int exit = run("doc", "--type", "deblocking");
        assertEquals(2, exit);
        assertTrue(err.toString().contains("not supported yet"));
    }
}
