package energysim.io;

import energysim.config.DispatchSource;
import energysim.config.Sector;
import energysim.config.SimulationConstants;
import energysim.engine.SimulationResult;
import energysim.engine.YearState;
import energysim.engine.demand.DemandSeries;
import energysim.engine.dispatch.DispatchResult;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Сравнение сценариев между собой и с траекториями IPCC AR6 (SSP) по потеплению к 2100 г.
 */
public final class ScenarioComparison {

    private static final int DESCRIPTION_WIDTH = 60;

    /**
     * Строка сравнения одного сценария.
     */
    public record Entry(String name,
                        String description,
                        double warming2050,
                        double warming2100,
                        double peakEmissions,
                        int peakEmissionsYear,
                        double gdp2050,
                        double gdp2100,
                        double electrification2050,
                        double electrification2100,
                        double transportElec2050,
                        double buildingsElec2050,
                        double industryElec2050,
                        double fossilShare2050,
                        double fossilShare2100,
                        String sspCategory) {
    }

    private ScenarioComparison() {}

    /**
     * Категория SSP по потеплению 2100 г. относительно доиндустриального уровня.
     */
    public static String categorizeSsp(double warming2100) {
        if (warming2100 < 1.6) return "SSP1-1.9 (1.0-1.8°C)";
        if (warming2100 < 2.2) return "SSP1-2.6 (1.3-2.4°C)";
        if (warming2100 < 3.2) return "SSP2-4.5 (2.1-3.5°C)";
        if (warming2100 < 4.1) return "SSP3-7.0 (2.8-4.6°C)";
        return "SSP5-8.5 (3.3-5.7°C)";
    }

    public static Entry entry(String name, String description, SimulationResult r) {
        int i2050 = SimulationConstants.yearIndex(2050);
        int i2100 = r.getYears().size() - 1;
        double[] temperature = r.temperature();
        DemandSeries global = r.getDemand().global();
        YearState y2050 = r.getYears().get(i2050);
        YearState y2100 = r.getYears().get(i2100);

        String desc = description == null || description.isEmpty() ? name : description;
        if (desc.length() > DESCRIPTION_WIDTH) {
            desc = desc.substring(0, DESCRIPTION_WIDTH);
        }

        return new Entry(
                name,
                desc,
                temperature[i2050],
                temperature[i2100],
                r.getPeakEmissionsValue(),
                r.getPeakEmissionsYear(),
                y2050.grossGdp(),
                y2100.grossGdp(),
                global.electrificationRate(i2050),
                global.electrificationRate(i2100),
                global.sector(Sector.TRANSPORT).electrificationRate(i2050),
                global.sector(Sector.BUILDINGS).electrificationRate(i2050),
                global.sector(Sector.INDUSTRY).electrificationRate(i2050),
                fossilShare(y2050.dispatch()),
                fossilShare(y2100.dispatch()),
                categorizeSsp(temperature[i2100]));
    }

    /**
     * Доля газа и угля в выработке.
     */
    static double fossilShare(DispatchResult d) {
        double total = d.dispatched();
        if (total <= 0) {
            return 0.0;
        }
        return (d.generation(DispatchSource.GAS) + d.generation(DispatchSource.COAL)) / total;
    }

    /**
     * Прогон сценариев; результат упорядочен по потеплению 2100 г.
     */
    public static List<Entry> compare(List<Scenario> scenarios) {
        List<Entry> entries = new ArrayList<>(scenarios.size());
        for (Scenario s : scenarios) {
            entries.add(entry(s.name(), s.description(), s.run()));
        }
        entries.sort(Comparator.comparingDouble(Entry::warming2100));
        return entries;
    }

    public static void print(PrintWriter out, List<Entry> entries) {
        out.println("=== Scenario Comparison vs IPCC SSP Pathways ===");
        out.println();

        /* ---------- Temperature & Emissions ---------- */
        out.println("=== Temperature & Emissions ===");
        out.println();
        out.println("Scenario               2050°C  2100°C  Peak Gt   Year   SSP Category");
        out.println("--------               ------  ------  -------   ----   ------------");
        for (Entry e : entries) {
            out.println(String.format(Locale.ROOT, "%-22s %5.2f   %5.2f   %6.1f   %d   %s",
                    e.name(), e.warming2050(), e.warming2100(), e.peakEmissions(),
                    e.peakEmissionsYear(), e.sspCategory()));
        }

        /* ---------- Economic & Electrification ---------- */
        out.println();
        out.println("=== Economic & Electrification ===");
        out.println();
        out.println("Scenario               GDP2050  GDP2100  Elec2050  Elec2100  Fossil2050");
        out.println("--------               -------  -------  --------  --------  ----------");
        for (Entry e : entries) {
            out.println(String.format(Locale.ROOT, "%-22s %7s  %7s    %3.0f%%      %3.0f%%       %3.0f%%",
                    e.name(),
                    String.format(Locale.ROOT, "$%.0fT", e.gdp2050()),
                    String.format(Locale.ROOT, "$%.0fT", e.gdp2100()),
                    e.electrification2050() * 100,
                    e.electrification2100() * 100,
                    e.fossilShare2050() * 100));
        }

        /* ---------- Sector Electrification 2050 ---------- */
        out.println();
        out.println("=== Sector Electrification 2050 ===");
        out.println();
        out.println("Scenario               Transport  Buildings  Industry");
        out.println("--------               ---------  ---------  --------");
        for (Entry e : entries) {
            out.println(String.format(Locale.ROOT, "%-22s    %3.0f%%       %3.0f%%      %3.0f%%",
                    e.name(),
                    e.transportElec2050() * 100,
                    e.buildingsElec2050() * 100,
                    e.industryElec2050() * 100));
        }

        /* ---------- Summary by SSP Category ---------- */
        out.println();
        out.println("=== Summary by SSP Category ===");
        out.println();
        Map<String, List<Entry>> bySsp = new LinkedHashMap<>();
        for (Entry e : entries) {
            bySsp.computeIfAbsent(e.sspCategory(), k -> new ArrayList<>()).add(e);
        }
        for (Map.Entry<String, List<Entry>> g : bySsp.entrySet()) {
            out.println(g.getKey() + ":");
            for (Entry e : g.getValue()) {
                out.println(String.format(Locale.ROOT, "  - %s: %.2f°C", e.name(), e.warming2100()));
            }
            out.println();
        }
        out.flush();
    }
}
