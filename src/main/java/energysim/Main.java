package energysim;

import energysim.cli.CompareCommand;
import energysim.cli.DescribeCommand;
import energysim.cli.RunCommand;
import energysim.cli.SobolCommand;
import energysim.cli.SweepCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
        name = "energysim",
        mixinStandardHelpOptions = true,
        version = "energysim 1.0",
        description = "Energy-economy-climate simulation 2025-2100",
        subcommands = {
                RunCommand.class,
                DescribeCommand.class,
                SweepCommand.class,
                SobolCommand.class,
                CompareCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class Main implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        // без подкоманды печатаем справку
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Командная строка со всеми подкомандами и опциями параметров Tier-1.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        RunCommand.registerParameterOptions(commandLine.getSubcommands().get("run").getCommandSpec());
        return commandLine;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }
}
