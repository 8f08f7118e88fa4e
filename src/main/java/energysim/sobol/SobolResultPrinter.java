package energysim.sobol;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

public final class SobolResultPrinter {

    private SobolResultPrinter() {}

    public static void printTable(PrintWriter out, SobolResult r, List<OutputMetric> metrics) {
        StringBuilder hdr = new StringBuilder("param");
        for (OutputMetric m : metrics) {
            hdr.append("\tS_").append(m.key()).append("\tST_").append(m.key());
        }
        out.println(hdr);

        List<SobolFactor> factors = r.getConfig().getFactors();
        for (int i = 0; i < factors.size(); i++) {
            StringBuilder sb = new StringBuilder(factors.get(i).getName());
            for (OutputMetric m : metrics) {
                sb.append(String.format(Locale.US, "\t%.4f\t%.4f", r.firstOrder(m)[i], r.total(m)[i]));
            }
            out.println(sb);
        }
    }
}
