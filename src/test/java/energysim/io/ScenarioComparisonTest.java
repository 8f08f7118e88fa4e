package energysim.io;

import energysim.config.DispatchSource;
import energysim.config.ScenarioParameters;
import energysim.config.ScenarioParametersBuilder;
import energysim.engine.dispatch.DispatchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScenarioComparisonTest {

    @Test
    @Tag("unit")
    @DisplayName("SSP category follows the 2100 warming thresholds")
    void categorizeSsp_shouldUseThresholds() {
        assertThat(ScenarioComparison.categorizeSsp(1.5)).startsWith("SSP1-1.9");
        assertThat(ScenarioComparison.categorizeSsp(1.6)).startsWith("SSP1-2.6");
        assertThat(ScenarioComparison.categorizeSsp(2.7)).startsWith("SSP2-4.5");
        assertThat(ScenarioComparison.categorizeSsp(3.2)).startsWith("SSP3-7.0");
        assertThat(ScenarioComparison.categorizeSsp(4.1)).startsWith("SSP5-8.5");
    }

    @Test
    @Tag("unit")
    @DisplayName("Fossil share counts gas and coal against dispatched energy")
    void fossilShare_shouldUseDispatchedEnergy() {
        DispatchResult d = new DispatchResult(1000,
                Map.of(DispatchSource.SOLAR, 500.0, DispatchSource.GAS, 200.0, DispatchSource.COAL, 100.0),
                200, 300);

        assertThat(ScenarioComparison.fossilShare(d)).isCloseTo(300.0 / 800.0, within(1e-12));
        assertThat(ScenarioComparison.fossilShare(new DispatchResult(0, Map.of(), 0, 0))).isZero();
    }

    @Test
    @Tag("integration")
    @DisplayName("Comparison orders scenarios by 2100 warming and prints both tables")
    void compare_shouldSortByWarming() {
        // Arrange
        Scenario base = Scenario.defaults();
        ScenarioParameters highTax = ScenarioParametersBuilder.from(ScenarioParameters.defaults())
                .setCarbonPrice(150)
                .build();
        Scenario tax = new Scenario("High Tax", "", base.model(), highTax);

        // Act
        List<ScenarioComparison.Entry> entries = ScenarioComparison.compare(List.of(base, tax));
        StringWriter sw = new StringWriter();
        ScenarioComparison.print(new PrintWriter(sw, true), entries);

        // Assert
        assertThat(entries).extracting(ScenarioComparison.Entry::name).containsExactly("High Tax", "Baseline");
        assertThat(entries.get(0).description()).isEqualTo("High Tax");
        assertThat(sw.toString())
                .contains("=== Temperature & Emissions ===")
                .contains("=== Economic & Electrification ===")
                .contains("High Tax");
    }
}
