package energysim.io;

import energysim.config.ScenarioParameters;
import energysim.config.SimulationConstants;
import energysim.engine.SimulationResult;
import energysim.engine.YearState;
import energysim.metrics.ScenarioMetric;
import energysim.metrics.ScenarioMetrics;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * Прогноз на столетие в Markdown: средние по эпохам, ключевые переходы
 * и итоги 2100 года.
 */
public final class ForecastReport {

    /**
     * Эпоха прогноза, границы включительно.
     */
    record Era(String name, int start, int end) {
    }

    static final List<Era> ERAS = List.of(
            new Era("2025-29", 2025, 2029),
            new Era("2030-39", 2030, 2039),
            new Era("2040-49", 2040, 2049),
            new Era("2050-59", 2050, 2059),
            new Era("2060-69", 2060, 2069),
            new Era("2070-79", 2070, 2079),
            new Era("2080-2100", 2080, 2100));

    private ForecastReport() {}

    public static void write(PrintWriter out, SimulationResult result, ScenarioMetrics m, String scenarioName) {
        double[] population = result.getDemographics().global().population();
        double[] demand = result.adjustedDemand();
        double[] perCapitaDay = new double[demand.length];
        for (int i = 0; i < demand.length; i++) {
            perCapitaDay[i] = demand[i] * 1e9 / population[i] / SimulationConstants.DAYS_PER_YEAR;
        }
        double[] dependency = result.getDemographics().global().dependency();
        double[] robots = result.series(YearState::robotsDensity);
        double[] temperature = result.temperature();
        ScenarioParameters p = result.getScenario();

        out.println();
        out.println("# Twin-Engine Century Forecast");
        out.println();
        out.println("**Scenario:** " + scenarioName);
        out.println(String.format(Locale.ROOT, "**Parameters:** Carbon price $%s/ton, Climate sensitivity %s°C",
                num(p.getCarbonPrice()), num(p.getClimSensitivity())));
        out.println();
        out.println("---");
        out.println();
        out.println("## Global Headline Metrics");
        out.println();
        out.println("| Era | Final Energy (kWh/person·day) | GMST (°C) | Old-Age Dependency | Robots/1000 Workers |");
        out.println("|-----|-------------------------------|-----------|-------------------|---------------------|");
        for (Era era : ERAS) {
            int from = SimulationConstants.yearIndex(era.start());
            int to = SimulationConstants.yearIndex(era.end());
            out.println(String.format(Locale.ROOT, "| %s | %.1f | %.2f | %.0f%% | %.0f |",
                    era.name(),
                    average(perCapitaDay, from, to),
                    temperature[to],
                    average(dependency, from, to) * 100,
                    robots[to]));
        }

        out.println();
        out.println("---");
        out.println();
        out.println("## Key Transition Points");
        out.println();
        out.println("- **Solar beats gas LCOE:** " + year(m, ScenarioMetric.SOLAR_CROSSES_GAS, "Already happened"));
        out.println("- **Grid below 100 kg CO₂/MWh:** " + year(m, ScenarioMetric.GRID_BELOW_100, "Not reached"));
        out.println("- **Peak global emissions:** " + year(m, ScenarioMetric.PEAK_EMISSIONS_YEAR, "n/a"));
        out.println("- **Peak copper demand:** " + year(m, ScenarioMetric.COPPER_PEAK_YEAR, "n/a"));
        out.println("- **Population peak:** " + year(m, ScenarioMetric.POP_PEAK_YEAR, "n/a"));
        out.println("- **China college workers peak:** " + year(m, ScenarioMetric.CHINA_COLLEGE_PEAK_YEAR, "n/a"));

        int last = SimulationConstants.YEAR_COUNT - 1;
        out.println();
        out.println("---");
        out.println();
        out.println("## End-of-Century Summary");
        out.println();
        out.println(String.format(Locale.ROOT, "- **Population:** %.2fB", population[last] / 1e9));
        out.println(String.format(Locale.ROOT, "- **Warming:** %.2f°C above preindustrial", temperature[last]));
        out.println(String.format(Locale.ROOT, "- **Electricity demand:** %.0f TWh", demand[last]));
        out.println(String.format(Locale.ROOT, "- **Per-capita energy:** %.1f kWh/person/day", perCapitaDay[last]));
        out.println(String.format(Locale.ROOT, "- **Robots per 1000 workers:** %.0f", robots[last]));
        out.println(String.format(Locale.ROOT, "- **Dependency ratio:** %.0f%%", dependency[last] * 100));
        out.println();
        out.flush();
    }

    static double average(double[] series, int from, int to) {
        double sum = 0.0;
        for (int i = from; i <= to; i++) {
            sum += series[i];
        }
        return sum / (to - from + 1);
    }

    private static String year(ScenarioMetrics m, ScenarioMetric metric, String missing) {
        Double v = m.get(metric);
        return v == null ? missing : Integer.toString(v.intValue());
    }

    private static String num(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }
}
