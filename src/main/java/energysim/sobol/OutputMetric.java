package energysim.sobol;

import energysim.engine.SimulationResult;

import java.util.function.ToDoubleFunction;

/**
 * Скалярный выход прогона, по которому считаются индексы Соболя.
 */
public enum OutputMetric {

    WARMING_2100("warming2100", r -> last(r.temperature())),
    DAMAGES_2100("damages2100", r -> last(r.globalDamagesPercent())),
    PEAK_EMISSIONS("peakEmissions", SimulationResult::getPeakEmissionsValue),
    CUMULATIVE_2100("cumulative2100", r -> last(r.cumulativeEmissions())),
    ELEC_2100("elec2100", r -> last(r.getDemand().global().electricityDemand()));

    private final String key;
    private final ToDoubleFunction<SimulationResult> extractor;

    OutputMetric(String key, ToDoubleFunction<SimulationResult> extractor) {
        this.key = key;
        this.extractor = extractor;
    }

    public String key() {
        return key;
    }

    public double extract(SimulationResult result) {
        return extractor.applyAsDouble(result);
    }

    public static OutputMetric fromKey(String key) {
        for (OutputMetric m : values()) {
            if (m.key.equals(key)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown output metric: " + key);
    }

    private static double last(double[] series) {
        return series[series.length - 1];
    }
}
