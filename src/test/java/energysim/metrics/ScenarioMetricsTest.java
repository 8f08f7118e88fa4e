package energysim.metrics;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.config.SimulationConstants;
import energysim.engine.SimulationEngine;
import energysim.engine.SimulationResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("integration")
class ScenarioMetricsTest {

    private static SimulationResult result;
    private static ScenarioMetrics metrics;

    @BeforeAll
    static void run() {
        result = new SimulationEngine(ModelParameters.defaults(), ScenarioParameters.defaults()).run();
        metrics = ScenarioMetrics.of(result);
    }

    @Test
    @DisplayName("Every metric has an entry, absent events map to null")
    void of_shouldCoverAllMetrics() {
        assertThat(metrics.asMap()).containsOnlyKeys(ScenarioMetric.values());
    }

    @Test
    @DisplayName("Point metrics read the matching series values")
    void of_shouldReadSeries() {
        int last = SimulationConstants.YEAR_COUNT - 1;

        assertThat(metrics.get(ScenarioMetric.WARMING_2100)).isCloseTo(result.temperature()[last], within(1e-12));
        assertThat(metrics.get(ScenarioMetric.EMISSIONS_2025)).isCloseTo(result.emissions()[0], within(1e-12));
        assertThat(metrics.get(ScenarioMetric.GRID_INTENSITY_2025)).isCloseTo(result.gridIntensity()[0], within(1e-12));
        assertThat(metrics.get(ScenarioMetric.CAPITAL_STOCK_2025)).isCloseTo(result.year(2025).capital(), within(1e-12));
    }

    @Test
    @DisplayName("Peak emissions come from the simulation result")
    void of_shouldReportPeak() {
        assertThat(metrics.year(ScenarioMetric.PEAK_EMISSIONS_YEAR)).hasValue(result.getPeakEmissionsYear());
        assertThat(metrics.get(ScenarioMetric.PEAK_EMISSIONS_GT)).isEqualTo(result.getPeakEmissionsValue());
    }

    @Test
    @DisplayName("Year lookup is only valid for year metrics")
    void year_shouldRejectValueMetric() {
        assertThatThrownBy(() -> metrics.year(ScenarioMetric.WARMING_2100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("warming2100");
    }

    @Test
    @DisplayName("Year metrics, when present, fall within the simulated horizon")
    void yearMetrics_shouldStayInHorizon() {
        for (ScenarioMetric m : ScenarioMetric.values()) {
            if (m.kind() == ScenarioMetric.Kind.YEAR && metrics.get(m) != null) {
                assertThat(metrics.get(m)).as(m.key()).isBetween(2025.0, 2100.0);
            }
        }
    }

    @Test
    @DisplayName("Metric keys round-trip and unknown keys are rejected")
    void fromKey_shouldResolveKeys() {
        assertThat(ScenarioMetric.fromKey("gridBelow100")).isEqualTo(ScenarioMetric.GRID_BELOW_100);
        assertThatThrownBy(() -> ScenarioMetric.fromKey("nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
