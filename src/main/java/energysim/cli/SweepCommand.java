package energysim.cli;

import energysim.config.TunableParameter;
import energysim.config.TunableParameterPool;
import energysim.io.Scenario;
import energysim.io.ScenarioLoadException;
import energysim.io.SweepResultsCsvWriter;
import energysim.io.SweepResultsExcelWriter;
import energysim.metrics.ScenarioMetric;
import energysim.sweep.SweepOutcome;
import energysim.sweep.SweepPlan;
import energysim.sweep.SweepRunner;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Перебор одного или двух параметров Tier-1 по сетке с выгрузкой в .xlsx или .csv.
 */
@Command(
        name = "sweep",
        mixinStandardHelpOptions = true,
        description = "Runs a one- or two-parameter grid and writes results to .xlsx or .csv."
)
public class SweepCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ScenarioOptions scenarioOptions;

    @Option(names = "--param1", description = "First swept parameter")
    private String param1;

    @Option(names = "--values1", split = ",", description = "Grid values of the first parameter")
    private double[] values1;

    @Option(names = "--param2", description = "Second swept parameter (two-parameter grid)")
    private String param2;

    @Option(names = "--values2", split = ",", description = "Grid values of the second parameter")
    private double[] values2;

    @Option(names = "--steps", defaultValue = "5",
            description = "Grid size over the parameter range when values are not given (default: ${DEFAULT-VALUE})")
    private int steps;

    @Option(names = "--metrics", split = ",", description = "Metric columns (default: a standard set)")
    private List<String> metricKeys;

    @Option(names = {"-o", "--output"}, required = true, paramLabel = "PATH",
            description = "Output file, .xlsx or .csv")
    private Path output;

    @Option(names = "--threads", description = "Worker threads (default: available processors)")
    private Integer threads;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String file = output.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean excel = file.endsWith(".xlsx");
        if (!excel && !file.endsWith(".csv")) {
            throw new ParameterException(spec.commandLine(), "Output must be a .xlsx or .csv file: " + output);
        }

        Scenario scenario;
        try {
            scenario = scenarioOptions.load();
        } catch (ScenarioLoadException e) {
            err.println("Error loading scenario: " + e.getMessage());
            err.flush();
            return 1;
        }

        SweepPlan plan = buildPlan();
        List<ScenarioMetric> columns = columns();

        int nThreads = threads != null ? threads : Runtime.getRuntime().availableProcessors();
        ExecutorService ex = Executors.newFixedThreadPool(Math.max(1, nThreads));
        List<SweepOutcome> outcomes;
        try {
            outcomes = new SweepRunner(ex).run(scenario.model(), scenario.parameters(), plan);
        } finally {
            ex.shutdown();
        }

        if (excel) {
            SweepResultsExcelWriter.writeXlsx(output, plan, scenario.parameters(), outcomes, columns);
        } else {
            SweepResultsCsvWriter.write(output, plan, scenario.parameters(), outcomes, columns);
        }

        for (ScenarioMetric m : columns) {
            DescriptiveStatistics s = SweepRunner.statistics(outcomes, m);
            if (s.getN() == 0) {
                out.printf(Locale.ROOT, "%-24s no events%n", m.key());
            } else {
                out.printf(Locale.ROOT, "%-24s mean=%.3f min=%.3f max=%.3f%n",
                        m.key(), s.getMean(), s.getMin(), s.getMax());
            }
        }
        out.println("Saved: " + output);
        out.flush();
        return 0;
    }

    private SweepPlan buildPlan() {
        if (param1 == null) {
            if (param2 != null) {
                throw new ParameterException(spec.commandLine(), "--param2 requires --param1");
            }
            return SweepPlan.single();
        }
        TunableParameter p1 = parameter(param1);
        double[] g1 = grid(p1, values1);
        if (param2 == null) {
            return SweepPlan.oneParameter(p1, g1);
        }
        TunableParameter p2 = parameter(param2);
        try {
            return SweepPlan.twoParameters(p1, g1, p2, grid(p2, values2));
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    private double[] grid(TunableParameter p, double[] values) {
        if (values != null && values.length > 0) {
            return values;
        }
        if (steps < 1) {
            throw new ParameterException(spec.commandLine(), "--steps must be >= 1");
        }
        return SweepPlan.linspace(p.min(), p.max(), steps);
    }

    private TunableParameter parameter(String name) {
        try {
            return TunableParameterPool.byName(name);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Unknown parameter: " + name);
        }
    }

    private List<ScenarioMetric> columns() {
        if (metricKeys == null || metricKeys.isEmpty()) {
            return SweepResultsExcelWriter.DEFAULT_COLUMNS;
        }
        try {
            return metricKeys.stream().map(ScenarioMetric::fromKey).toList();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
    }
}
