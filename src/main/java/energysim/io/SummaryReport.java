package energysim.io;

import energysim.metrics.ScenarioMetric;
import energysim.metrics.ScenarioMetrics;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Краткая текстовая сводка прогона.
 */
public final class SummaryReport {

    private SummaryReport() {}

    public static void write(PrintWriter out, ScenarioMetrics m, String scenarioName) {
        out.println();
        out.println("=== Energy Simulation Results (" + scenarioName + ") ===");
        out.println();

        out.println("Climate:");
        line(out, "Warming by 2100:", fmt("%.2f°C", m.get(ScenarioMetric.WARMING_2100)));
        line(out, "Peak emissions year:", year(m, ScenarioMetric.PEAK_EMISSIONS_YEAR, "n/a"));
        line(out, "Grid zero-carbon:", year(m, ScenarioMetric.GRID_BELOW_100, "Not reached"));

        out.println();
        out.println("Energy Transitions:");
        // пересечение раньше начала горизонта не фиксируется
        line(out, "Solar beats gas:", year(m, ScenarioMetric.SOLAR_CROSSES_GAS, "Already"));
        line(out, "Solar+battery beats gas:", year(m, ScenarioMetric.SOLAR_BATTERY_CROSSES_GAS, "Already"));
        line(out, "Coal uneconomic:", year(m, ScenarioMetric.COAL_UNECONOMIC, "Already"));

        out.println();
        out.println("Demographics:");
        line(out, "Population peak:", year(m, ScenarioMetric.POP_PEAK_YEAR, "n/a"));
        line(out, "Population 2100:", fmt("%.2fB", scaled(m.get(ScenarioMetric.POP_2100), 1e-9)));
        line(out, "College share 2050:", fmt("%.1f%%", scaled(m.get(ScenarioMetric.COLLEGE_SHARE_2050), 100)));
        line(out, "Dependency 2075:", fmt("%.0f%%", scaled(m.get(ScenarioMetric.DEPENDENCY_2075), 100)));

        out.println();
        out.println("Economy:");
        line(out, "K/Y ratio 2025:", fmt("%.2f", m.get(ScenarioMetric.K_Y_2025)));
        line(out, "Interest rate 2025:", fmt("%.1f%%", scaled(m.get(ScenarioMetric.INTEREST_RATE_2025), 100)));
        line(out, "Robots/1000 (2050):", fmt("%.1f", m.get(ScenarioMetric.ROBOTS_DENSITY_2050)));
        line(out, "Energy burden peak:", fmt("%.1f%%", scaled(m.get(ScenarioMetric.ENERGY_BURDEN_PEAK), 100))
                + " (" + year(m, ScenarioMetric.ENERGY_BURDEN_PEAK_YEAR, "n/a") + ")");

        out.println();
        out.println("Resources:");
        line(out, "Copper peak year:", year(m, ScenarioMetric.COPPER_PEAK_YEAR, "n/a"));
        line(out, "Lithium reserves 2100:",
                fmt("%.0f%% consumed", scaled(m.get(ScenarioMetric.LITHIUM_RESERVE_RATIO_2100), 100)));
        line(out, "Farmland 2050:", fmt("%.0f Mha", m.get(ScenarioMetric.FARMLAND_2050)));
        out.println();
        out.flush();
    }

    private static void line(PrintWriter out, String label, String value) {
        out.println(String.format(Locale.ROOT, "  %-24s %s", label, value));
    }

    private static String year(ScenarioMetrics m, ScenarioMetric metric, String missing) {
        Double v = m.get(metric);
        return v == null ? missing : Integer.toString(v.intValue());
    }

    private static Double scaled(Double v, double k) {
        return v == null ? null : v * k;
    }

    private static String fmt(String pattern, Double v) {
        if (v == null || !Double.isFinite(v)) return "n/a";
        return String.format(Locale.ROOT, pattern, v);
    }
}
