package energysim.cli;

import energysim.config.TunableParamId;
import energysim.io.Scenario;
import energysim.io.ScenarioLoadException;
import energysim.sobol.OutputMetric;
import energysim.sobol.SobolAnalyzer;
import energysim.sobol.SobolConfig;
import energysim.sobol.SobolResult;
import energysim.sobol.SobolResultPrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Command(
        name = "sobol",
        mixinStandardHelpOptions = true,
        description = "Sobol sensitivity indices (Saltelli 2010) over selected Tier-1 parameters."
)
public class SobolCommand implements Callable<Integer> {

    static final List<TunableParamId> DEFAULT_PARAMS = List.of(
            TunableParamId.CARBON_PRICE,
            TunableParamId.SOLAR_ALPHA,
            TunableParamId.SOLAR_GROWTH,
            TunableParamId.ELECTRIFICATION_TARGET,
            TunableParamId.EFFICIENCY_MULTIPLIER,
            TunableParamId.CLIM_SENSITIVITY);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ScenarioOptions scenarioOptions;

    @Option(names = "--params", split = ",", description = "Varied parameters (default: the six core parameters)")
    private List<String> paramNames;

    @Option(names = "--metric", split = ",",
            description = "Output metrics: warming2100, damages2100, peakEmissions, cumulative2100, elec2100 (default: all)")
    private List<String> metricKeys;

    @Option(names = {"-n", "--samples"}, defaultValue = "64", description = "Sobol base sample size N (default: ${DEFAULT-VALUE})")
    private int samples;

    @Option(names = "--threads", description = "Worker threads (default: available processors)")
    private Integer threads;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Scenario scenario;
        try {
            scenario = scenarioOptions.load();
        } catch (ScenarioLoadException e) {
            err.println("Error loading scenario: " + e.getMessage());
            err.flush();
            return 1;
        }

        SobolConfig cfg;
        List<OutputMetric> metrics;
        try {
            List<TunableParamId> ids = paramNames == null || paramNames.isEmpty()
                    ? DEFAULT_PARAMS
                    : paramNames.stream().map(TunableParamId::fromKey).toList();
            cfg = SobolConfig.fromIds(samples, ids);
            metrics = metricKeys == null || metricKeys.isEmpty()
                    ? Arrays.asList(OutputMetric.values())
                    : metricKeys.stream().map(OutputMetric::fromKey).toList();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }

        int nThreads = threads != null ? threads : Runtime.getRuntime().availableProcessors();
        ExecutorService ex = Executors.newFixedThreadPool(Math.max(1, nThreads));
        SobolResult result;
        try {
            result = new SobolAnalyzer(ex).run(scenario.model(), scenario.parameters(), cfg);
        } finally {
            ex.shutdown();
        }

        SobolResultPrinter.printTable(out, result, metrics);
        out.flush();
        return 0;
    }
}
