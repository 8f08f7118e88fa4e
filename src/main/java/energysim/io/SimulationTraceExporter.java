package energysim.io;

import energysim.config.DispatchSource;
import energysim.config.SourceType;
import energysim.engine.YearState;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Выгрузка пошагового трейса основного цикла в CSV (разделитель ';', русская локаль).
 */
public final class SimulationTraceExporter {

    private static final Locale RU = Locale.forLanguageTag("ru-RU");

    private SimulationTraceExporter() {}

    public static void exportToCsv(Path path, List<YearState> recs) throws IOException {

        if (recs.isEmpty()) {
            throw new IllegalArgumentException("Empty trace");
        }

        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {

            /* ---------- HEADER ---------- */
            StringBuilder h = new StringBuilder("year;D_exp;ROBOT_L;MULT;D");
            for (SourceType s : SourceType.values()) {
                h.append(";CAP_").append(s.key());
            }
            for (DispatchSource s : DispatchSource.values()) {
                h.append(";LCOE_").append(s.key());
            }
            for (DispatchSource s : DispatchSource.values()) {
                h.append(";GEN_").append(s.key());
            }
            h.append(";SHORT;GI;E_el;E_nonel;CUM;PPM;T;DMG_%;Y_gross;Y_net;BURDEN;S;PHI;K;I;r;ROBOTS");

            w.write(h.toString());
            w.newLine();

            /* ---------- DATA ---------- */
            for (YearState r : recs) {

                StringBuilder s = new StringBuilder();
                s.append(r.year())
                        .append(';').append(f(r.expansion().adjustedDemand()))
                        .append(';').append(f(r.expansion().robotLoadTwh()))
                        .append(';').append(f3(r.expansion().expansionMultiplier()))
                        .append(';').append(f(r.demandTwh()));

                for (SourceType src : SourceType.values()) {
                    s.append(';').append(f(r.capacity(src)));
                }
                for (DispatchSource src : DispatchSource.values()) {
                    s.append(';').append(f(r.lcoe().forDispatch(src)));
                }
                for (DispatchSource src : DispatchSource.values()) {
                    s.append(';').append(f(r.dispatch().generation(src)));
                }

                s.append(';').append(f(r.dispatch().shortfall()))
                        .append(';').append(f(r.dispatch().gridIntensity()))
                        .append(';').append(f(r.emissions().electricity()))
                        .append(';').append(f(r.emissions().nonElectricity()))
                        .append(';').append(f(r.cumulativeEmissions()))
                        .append(';').append(f(r.co2ppm()))
                        .append(';').append(f2(r.temperature()))
                        .append(';').append(f2(r.globalDamage() * 100.0))
                        .append(';').append(f(r.grossGdp()))
                        .append(';').append(f(r.netGdp()))
                        .append(';').append(f3(r.energyBurden().burden()))
                        .append(';').append(f3(r.savings().global()))
                        .append(';').append(f3(r.stability()))
                        .append(';').append(f(r.capital()))
                        .append(';').append(f(r.investment()))
                        .append(';').append(f3(r.interestRate()))
                        .append(';').append(f(r.robotsDensity()));

                w.write(s.toString());
                w.newLine();
            }
        }
    }

    private static String f(double v) {
        if (!Double.isFinite(v)) return "";
        return String.format(RU, "%.1f", v);
    }

    private static String f2(double v) {
        if (!Double.isFinite(v)) return "";
        return String.format(RU, "%.2f", v);
    }

    private static String f3(double v) {
        if (!Double.isFinite(v)) return "";
        return String.format(RU, "%.3f", v);
    }
}
