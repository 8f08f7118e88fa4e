package energysim.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.SimulationResult;
import energysim.engine.YearState;
import energysim.engine.capacity.SourceHistory;
import energysim.metrics.ScenarioMetrics;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class ResultWritersTest {

    private static SimulationResult result;
    private static ScenarioMetrics metrics;

    @TempDir
    Path tmp;

    @BeforeAll
    static void run() {
        result = Scenario.defaults().run();
        metrics = ScenarioMetrics.of(result);
    }

    @Test
    @DisplayName("JSON output carries params, 76 years and every result section")
    void json_shouldContainAllSections() throws Exception {
        // Arrange
        StringWriter sw = new StringWriter();

        // Act
        new ResultsJsonWriter().write(sw, "Baseline", result, metrics);

        // Assert
        JsonNode root = new ObjectMapper().readTree(sw.toString());
        assertThat(root.get("scenario").asText()).isEqualTo("Baseline");
        assertThat(root.get("params").get("carbonPrice").asDouble()).isEqualTo(35.0);
        assertThat(root.get("params").get("windAlpha").isNull()).isTrue();
        assertThat(root.get("years")).hasSize(SimulationConstants.YEAR_COUNT);
        assertThat(root.get("years").get(0).asInt()).isEqualTo(2025);
        for (String section : List.of("results", "dispatch", "climate", "capital", "demand",
                "demographics", "resources", "metrics")) {
            assertThat(root.has(section)).as(section).isTrue();
        }
        assertThat(root.get("climate").get("temperature")).hasSize(SimulationConstants.YEAR_COUNT);
        assertThat(root.get("metrics").get("warming2100").asDouble())
                .isEqualTo(result.temperature()[SimulationConstants.YEAR_COUNT - 1]);
    }

    @Test
    @DisplayName("JSON output carries the raw capacity history per source")
    void json_shouldContainCapacityHistory() {
        // Act
        JsonNode state = new ResultsJsonWriter().toTree("Baseline", result, metrics).get("capacityState");

        // Assert
        for (SourceType s : SourceType.values()) {
            JsonNode source = state.get(s.key());
            SourceHistory h = result.getCapacity().history(s);
            assertThat(source.get("installed")).as(s.key()).hasSize(h.size());
            assertThat(source.get("additions")).as(s.key()).hasSize(h.size());
            assertThat(source.get("retirements")).as(s.key()).hasSize(h.size());
        }
        SourceHistory solar = result.getCapacity().history(SourceType.SOLAR);
        JsonNode solarNode = state.get("solar");
        assertThat(solarNode.get("installed").get(0).asDouble()).isEqualTo(1500.0);
        assertThat(solarNode.get("additions").get(5).asDouble()).isEqualTo(solar.additions(5));
        assertThat(solarNode.get("retirements").get(5).asDouble()).isEqualTo(solar.retirements(5));
    }

    @Test
    @DisplayName("CSV output has a header and one row per year")
    void csv_shouldWriteRowPerYear() {
        StringWriter sw = new StringWriter();

        ResultsCsvWriter.write(new PrintWriter(sw), result);

        String[] lines = sw.toString().split("\\R");
        assertThat(lines).hasSize(SimulationConstants.YEAR_COUNT + 1);
        assertThat(lines[0]).isEqualTo("year,population,electricity_twh,temperature_c,emissions_gt,"
                + "dependency_ratio,robots_per_1000,solar_lcoe,gas_lcoe");
        assertThat(lines[1]).startsWith("2025,");
        assertThat(lines[1].split(",")).hasSize(9);
    }

    @Test
    @DisplayName("Summary report lists the headline sections")
    void summary_shouldListSections() {
        StringWriter sw = new StringWriter();

        SummaryReport.write(new PrintWriter(sw, true), metrics, "Baseline");

        assertThat(sw.toString())
                .contains("=== Energy Simulation Results (Baseline) ===")
                .contains("Warming by 2100:")
                .contains("Energy Transitions:")
                .contains("Demographics:");
    }

    @Test
    @DisplayName("Forecast report renders a markdown headline table")
    void forecast_shouldRenderMarkdown() {
        StringWriter sw = new StringWriter();

        ForecastReport.write(new PrintWriter(sw, true), result, metrics, "Baseline");

        assertThat(sw.toString())
                .contains("# Twin-Engine Century Forecast")
                .contains("**Scenario:** Baseline")
                .contains("## Global Headline Metrics");
    }

    @Test
    @DisplayName("Trace CSV uses semicolons and writes one line per recorded year")
    void trace_shouldExportCsv() throws Exception {
        Path file = tmp.resolve("trace.csv");

        SimulationTraceExporter.exportToCsv(file, result.getYears());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(SimulationConstants.YEAR_COUNT + 1);
        assertThat(lines.get(0)).startsWith("year;D_exp;ROBOT_L;MULT;D;CAP_");
        assertThat(lines.get(1)).startsWith("2025;");
        assertThat(lines.get(1).split(";")).hasSameSizeAs(lines.get(0).split(";"));
    }

    @Test
    @DisplayName("Empty trace cannot be exported")
    void trace_shouldRejectEmpty() {
        assertThatThrownBy(() -> SimulationTraceExporter.exportToCsv(tmp.resolve("t.csv"), List.<YearState>of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
