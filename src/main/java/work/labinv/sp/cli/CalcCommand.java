package work.labinv.sp.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.labinv.sp.api.RunResult;
import work.labinv.sp.api.SetupParamRunConfiguration;
import work.labinv.sp.api.SetupParamRunner;
import work.labinv.sp.api.SetupParamTypes;
import work.labinv.sp.config.CalculatorSettings;
import work.labinv.sp.config.LogLevel;
import work.labinv.sp.config.LoggingSetup;
import work.labinv.sp.config.SettingsLoader;
import work.labinv.sp.field.FieldGroup;
import work.labinv.sp.report.DisplayRow;
import work.labinv.sp.report.Explanation;
import work.labinv.sp.report.ExplanationRenderer;
import work.labinv.sp.report.ResultCsvExporter;
import work.labinv.sp.report.ResultView;

@CommandLine.Command(
    name = "calc",
    description = "Calculate the setup parameters of a request.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class CalcCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    enum OutputFormat { TABLE, JSON, CSV }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-r", "--request"},
        required = true,
        paramLabel = "PATH|-|JSON",
        description = "Request record as a JSON object: file path, '-' for stdin, or inline JSON."
    )
    private String request;

    @CommandLine.Option(
        names = {"-i", "--inputs"},
        paramLabel = "PATH|JSON",
        description = "Operator inputs as a JSON object: file path or inline JSON.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String inputs;

    @CommandLine.Option(
        names = {"-I", "--input"},
        paramLabel = "KEY=VALUE",
        description = "Single operator input; overrides --inputs."
    )
    private Map<String, String> inputOverrides = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"-t", "--type"},
        description = "Setup parameter type (default: from settings, else DAR8).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String type;

    @CommandLine.Option(
        names = {"-e", "--explain"},
        paramLabel = "KEY",
        description = "Explain how a field was calculated (repeatable)."
    )
    private List<String> explain = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES}.",
        defaultValue = "TABLE"
    )
    private OutputFormat format;

    @CommandLine.Option(
        names = "--date",
        paramLabel = "YYYY-MM-DD",
        description = "Calculation date used in the batch number (default: today).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String date;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML settings file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        CalculatorSettings settings = config != null ? SettingsLoader.load(config) : CalculatorSettings.defaults();
        LoggingSetup.apply(logLevelRaw != null ? LogLevel.from(logLevelRaw) : settings.logLevel());

        Map<String, Object> operatorInputs = new LinkedHashMap<>();
        if (inputs != null && !inputs.isBlank()) {
            operatorInputs.putAll(readJsonObject(inputs, "--inputs"));
        }
        operatorInputs.putAll(inputOverrides);

        var configuration = SetupParamRunConfiguration.builder()
            .typeName(type != null ? type : settings.defaultType())
            .requestRecord(readJsonObject(request, "--request"))
            .operatorInputs(operatorInputs)
            .clock(resolveClock(settings))
            .display(settings.display())
            .build();

        RunResult result = new SetupParamRunner(SetupParamTypes.create()).run(configuration);
        PrintWriter out = spec.commandLine().getOut();
        if (!result.isSuccess()) {
            spec.commandLine().getErr().println(result.message());
            return result.status().exitCode();
        }

        ResultView view = result.view().orElseThrow();
        var renderer = new ExplanationRenderer();
        List<Explanation> explanations = new ArrayList<>(explain.size());
        for (String key : explain) {
            explanations.add(renderer.explain(key, view));
        }
        switch (format) {
            case JSON:
                out.println(result.toPrettyJson(explanations));
                break;
            case CSV:
                // stdout stays a single CSV document
                out.print(new ResultCsvExporter().export(view));
                printExplanations(spec.commandLine().getErr(), explanations);
                break;
            default:
                printTable(out, view);
                printExplanations(out, explanations);
                break;
        }
        out.flush();
        return result.status().exitCode();
    }

    private Clock resolveClock(CalculatorSettings settings) {
        if (date == null || date.isBlank()) {
            return Clock.system(settings.zone());
        }
        try {
            var day = LocalDate.parse(date.trim());
            return Clock.fixed(day.atStartOfDay(settings.zone()).toInstant(), settings.zone());
        } catch (DateTimeParseException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid --date value: " + date);
        }
    }

    private static void printExplanations(PrintWriter target, List<Explanation> explanations) {
        for (Explanation explanation : explanations) {
            target.println();
            target.print(explanation.toText());
        }
        target.flush();
    }

    private static void printTable(PrintWriter out, ResultView view) {
        int width = view.rows().stream().mapToInt(row -> row.label().length()).max().orElse(1);
        for (FieldGroup group : FieldGroup.values()) {
            List<DisplayRow> rows = view.rows(group);
            if (rows.isEmpty()) {
                continue;
            }
            out.println("== " + group.title());
            for (DisplayRow row : rows) {
                out.printf("%s %-" + width + "s  %s%n", row.important() ? "*" : " ", row.label(), row.value());
            }
        }
    }

    private Map<String, Object> readJsonObject(String value, String option) {
        String payload;
        String trimmed = value.trim();
        if ("-".equals(trimmed)) {
            payload = readStdin();
        } else if (trimmed.startsWith("{")) {
            payload = trimmed;
        } else {
            Path path = Paths.get(trimmed).toAbsolutePath().normalize();
            try {
                payload = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read " + option + " file: " + path);
            }
        }
        try {
            Map<String, Object> parsed = JSON.readValue(payload, MAP_TYPE);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(
                spec.commandLine(),
                option + " must be a JSON object: " + ex.getMessage()
            );
        }
    }

    private String readStdin() {
        try {
            byte[] bytes = System.in.readAllBytes();
            return bytes.length == 0 ? "{}" : new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
