package energysim.cli;

import energysim.config.ScenarioParametersBuilder;
import energysim.config.TunableParameter;
import energysim.config.TunableParameterPool;
import energysim.engine.SimulationResult;
import energysim.engine.trace.ArrayTraceSession;
import energysim.io.ForecastReport;
import energysim.io.ResultsCsvWriter;
import energysim.io.ResultsJsonWriter;
import energysim.io.Scenario;
import energysim.io.ScenarioLoadException;
import energysim.io.ScenarioLoader;
import energysim.io.SimulationTraceExporter;
import energysim.io.SummaryReport;
import energysim.metrics.ScenarioMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Один прогон сценария. Параметры Tier-1 задаются опциями {@code --<name>=<value>}
 * поверх сценария.
 */
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        description = "Runs a single scenario and prints the results."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    public enum OutputFormat { SUMMARY, JSON, FORECAST, CSV }

    @Spec
    private CommandSpec spec;

    @Mixin
    private ScenarioOptions scenarioOptions;

    @Option(names = "--format", defaultValue = "summary",
            description = "Output format: summary, json, forecast, csv (default: ${DEFAULT-VALUE})")
    private OutputFormat format;

    @Option(names = "--trace", paramLabel = "PATH", description = "Write the per-year main-loop trace as CSV")
    private Path tracePath;

    /**
     * Регистрирует опцию {@code --<name>} для каждого параметра Tier-1.
     */
    public static void registerParameterOptions(CommandSpec spec) {
        for (TunableParameter p : TunableParameterPool.all()) {
            String description = String.format(Locale.ROOT, "%s [%s..%s %s]",
                    p.description(), p.min(), p.max(), p.unit());
            spec.addOption(OptionSpec.builder("--" + p.name())
                    .type(Double.class)
                    .paramLabel("<value>")
                    .description(description.replace("%", "%%"))
                    .build());
        }
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Scenario scenario;
        try {
            scenario = applyParameterOptions(scenarioOptions.load());
        } catch (ScenarioLoadException e) {
            err.println("Error loading scenario: " + e.getMessage());
            err.flush();
            return 1;
        }

        SimulationResult result;
        if (tracePath != null) {
            ArrayTraceSession trace = new ArrayTraceSession();
            result = scenario.run(trace);
            SimulationTraceExporter.exportToCsv(tracePath, trace.records());
            LOGGER.info("Trace written to {}", tracePath);
        } else {
            result = scenario.run();
        }

        ScenarioMetrics metrics = ScenarioMetrics.of(result);
        switch (format) {
            case JSON -> new ResultsJsonWriter().write(out, scenario.name(), result, metrics);
            case FORECAST -> ForecastReport.write(out, result, metrics, scenario.name());
            case CSV -> ResultsCsvWriter.write(out, result);
            default -> SummaryReport.write(out, metrics, scenario.name());
        }
        out.flush();
        return 0;
    }

    private Scenario applyParameterOptions(Scenario scenario) throws ScenarioLoadException {
        ScenarioParametersBuilder b = ScenarioParametersBuilder.from(scenario.parameters());
        boolean changed = false;
        for (TunableParameter p : TunableParameterPool.all()) {
            OptionSpec option = spec.findOption("--" + p.name());
            if (option == null) {
                continue;
            }
            Double value = option.getValue();
            if (value != null) {
                ScenarioLoader.applyParameter(b, p.name(), value);
                changed = true;
            }
        }
        return changed ? scenario.withParameters(b.build()) : scenario;
    }
}
