package work.labinv.sp.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "labinv-sp",
    description = "Calculate and document setup parameters for conjugation requests.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {CalcCommand.class, DocCommand.class, CommandLine.HelpCommand.class}
)
final class SetupParamCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (calc or doc).");
    }
}
