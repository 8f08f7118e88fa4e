package energysim.sobol;

import java.util.Map;

public final class SobolResult {

    private final SobolConfig config;
    private final Map<OutputMetric, double[]> firstOrder;
    private final Map<OutputMetric, double[]> total;

    public SobolResult(SobolConfig config,
                       Map<OutputMetric, double[]> firstOrder,
                       Map<OutputMetric, double[]> total) {
        this.config = config;
        this.firstOrder = firstOrder;
        this.total = total;
    }

    public SobolConfig getConfig() { return config; }

    /** S_j по факторам в порядке конфигурации. */
    public double[] firstOrder(OutputMetric metric) { return firstOrder.get(metric).clone(); }

    /** ST_j по факторам в порядке конфигурации. */
    public double[] total(OutputMetric metric) { return total.get(metric).clone(); }
}
