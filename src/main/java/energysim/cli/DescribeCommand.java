package energysim.cli;

import energysim.io.ParameterSchemaWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
        name = "describe",
        mixinStandardHelpOptions = true,
        description = "Prints the Tier-1 parameter schema (or the output units catalogue) as JSON."
)
public class DescribeCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--units", description = "Print units of the output series instead of the parameter schema")
    private boolean units;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        ParameterSchemaWriter writer = new ParameterSchemaWriter();
        if (units) {
            writer.writeUnits(out);
        } else {
            writer.write(out);
        }
        out.println();
        out.flush();
        return 0;
    }
}
