package work.labinv.sp.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.labinv.sp.api.RunResult;
import work.labinv.sp.api.SetupParamTypes;
import work.labinv.sp.api.UnsupportedSetupParamTypeException;
import work.labinv.sp.field.FieldCatalog;
import work.labinv.sp.report.DocumentationGenerator;

@CommandLine.Command(
    name = "doc",
    description = "Render the field reference of a setup parameter type.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class DocCommand implements Callable<Integer> {
    enum DocFormat { MARKDOWN, JSON }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-t", "--type"}, description = "Setup parameter type.", defaultValue = "DAR8")
    private String type;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES}.",
        defaultValue = "MARKDOWN"
    )
    private DocFormat format;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @Override
    public Integer call() throws IOException {
        FieldCatalog catalog;
        try {
            catalog = SetupParamTypes.create().resolve(type).catalog();
        } catch (UnsupportedSetupParamTypeException ex) {
            spec.commandLine().getErr().println(ex.getMessage());
            return RunResult.Status.UNSUPPORTED.exitCode();
        }
        var generator = new DocumentationGenerator();
        String document = format == DocFormat.JSON ? generator.renderJson(catalog) : generator.renderMarkdown(catalog);
        if (output == null) {
            spec.commandLine().getOut().print(document);
            spec.commandLine().getOut().flush();
            return 0;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, document, StandardCharsets.UTF_8);
        spec.commandLine().getOut().println("Wrote " + catalog.name() + " reference to " + output);
        return 0;
    }
}
