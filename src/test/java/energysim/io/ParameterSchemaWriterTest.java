package energysim.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import energysim.config.TunableParamId;
import energysim.metrics.SeriesUnits;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ParameterSchemaWriterTest {

    @Test
    @DisplayName("Schema describes every tunable parameter")
    void write_shouldDescribeAllParameters() throws Exception {
        // Act
        StringWriter sw = new StringWriter();
        new ParameterSchemaWriter().write(sw);

        // Assert
        JsonNode root = new ObjectMapper().readTree(sw.toString());
        assertThat(root.size()).isEqualTo(TunableParamId.values().length);

        JsonNode cp = root.get("carbonPrice");
        assertThat(cp.get("type").asText()).isEqualTo("number");
        assertThat(cp.get("default").asDouble()).isEqualTo(35.0);
        assertThat(cp.get("min").asDouble()).isEqualTo(0.0);
        assertThat(cp.get("max").asDouble()).isEqualTo(200.0);
        assertThat(cp.get("tier").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Optional parameters report a null default and the model value")
    void schema_shouldMarkOptionalDefaults() {
        JsonNode wind = new ParameterSchemaWriter().schema().get("windAlpha");

        assertThat(wind.get("default").isNull()).isTrue();
        assertThat(wind.get("hardcoded").asDouble()).isEqualTo(0.23);
    }

    @Test
    @DisplayName("Units catalogue lists every output series with its unit")
    void units_shouldListSeries() {
        JsonNode units = new ParameterSchemaWriter().units();

        assertThat(units.size()).isEqualTo(SeriesUnits.values().length);
        assertThat(units.get("gridIntensity").get("unit").asText()).isEqualTo("kg CO₂/MWh");
        assertThat(units.get("temperature").get("unit").asText()).isEqualTo("°C");
        assertThat(units.get("lcoe").get("description").asText()).isNotBlank();
    }
}
