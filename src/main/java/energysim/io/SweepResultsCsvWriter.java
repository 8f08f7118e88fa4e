package energysim.io;

import energysim.config.ScenarioParameters;
import energysim.metrics.ScenarioMetric;
import energysim.sweep.SweepMode;
import energysim.sweep.SweepOutcome;
import energysim.sweep.SweepPlan;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * CSV-выгрузка перебора параметров (разделитель ';', десятичная запятая).
 */
public final class SweepResultsCsvWriter {

    private static final Locale RU = new Locale("ru", "RU");

    private SweepResultsCsvWriter() {}

    public static void write(Path path,
                             SweepPlan plan,
                             ScenarioParameters baseParams,
                             List<SweepOutcome> outcomes,
                             List<ScenarioMetric> columns) throws IOException {

        if (plan.size() != outcomes.size()) {
            throw new IllegalArgumentException("plan.size != outcomes.size");
        }

        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {

            w.write(csvCell(SweepResultsExcelWriter.buildPassport(plan, baseParams)));
            w.newLine();

            // Заголовок зависит от режима
            StringBuilder hdr = new StringBuilder("k");
            if (plan.getMode() == SweepMode.SWEEP_2) {
                hdr.append(';').append(plan.getParam1().name()).append(';').append(plan.getParam2().name());
            } else if (plan.getMode() == SweepMode.SWEEP_1) {
                hdr.append(';').append(plan.getParam1().name());
            }
            for (ScenarioMetric m : columns) {
                hdr.append(';').append(m.key());
            }
            w.write(hdr.toString());
            w.newLine();

            for (int k = 0; k < outcomes.size(); k++) {
                SweepOutcome o = outcomes.get(k);

                StringBuilder sb = new StringBuilder(256);
                sb.append(k);

                if (plan.getMode() == SweepMode.SWEEP_2) {
                    sb.append(';').append(fmt3(plan.value1(k)))
                            .append(';').append(fmt3(plan.value2(k)));
                } else if (plan.getMode() == SweepMode.SWEEP_1) {
                    sb.append(';').append(fmt3(plan.value1(k)));
                } // SINGLE: параметров нет

                for (ScenarioMetric m : columns) {
                    double v = o.value(m);
                    sb.append(';').append(m.kind() == ScenarioMetric.Kind.YEAR ? fmtYear(v) : fmt3(v));
                }

                w.write(sb.toString());
                w.newLine();
            }
        }
    }

    private static String csvCell(String s) {
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    private static String fmtYear(double v) {
        return Double.isFinite(v) ? Integer.toString((int) v) : "";
    }

    private static String fmt3(double v) {
        return Double.isFinite(v) ? String.format(RU, "%.3f", v) : "";
    }
}
