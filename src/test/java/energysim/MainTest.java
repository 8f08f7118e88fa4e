package energysim;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @TempDir
    Path tmp;

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmd = Main.newCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    @Test
    @Tag("unit")
    @DisplayName("Without a subcommand the usage is printed")
    void noArgs_shouldPrintUsage() {
        int exit = cmd.execute();

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Usage: energysim").contains("run").contains("sweep");
    }

    @Test
    @Tag("unit")
    @DisplayName("describe prints the parameter schema as JSON")
    void describe_shouldPrintSchema() throws Exception {
        int exit = cmd.execute("describe");

        assertThat(exit).isZero();
        JsonNode schema = new ObjectMapper().readTree(out.toString());
        assertThat(schema.has("carbonPrice")).isTrue();
        assertThat(schema.get("carbonPrice").get("unit").asText()).isEqualTo("$/ton CO₂");
    }

    @Test
    @Tag("unit")
    @DisplayName("describe --units prints the output units catalogue")
    void describe_shouldPrintUnits() throws Exception {
        int exit = cmd.execute("describe", "--units");

        assertThat(exit).isZero();
        JsonNode units = new ObjectMapper().readTree(out.toString());
        assertThat(units.get("electricityDemand").get("unit").asText()).isEqualTo("TWh");
    }

    @Test
    @Tag("unit")
    @DisplayName("Every tunable parameter is exposed as a run option")
    void run_shouldExposeParameterOptions() {
        CommandLine run = cmd.getSubcommands().get("run");

        assertThat(run.getCommandSpec().findOption("--carbonPrice")).isNotNull();
        assertThat(run.getCommandSpec().findOption("--yieldGrowthRate")).isNotNull();
    }

    @Test
    @Tag("integration")
    @DisplayName("run --format=csv applies parameter options and prints a table")
    void run_shouldPrintCsv() {
        int exit = cmd.execute("run", "--format=csv", "--carbonPrice=50");

        assertThat(exit).isZero();
        String[] lines = out.toString().split("\\R");
        assertThat(lines[0]).startsWith("year,population,electricity_twh");
        assertThat(lines).hasSize(77);
    }

    @Test
    @Tag("integration")
    @DisplayName("run --format=json reports the scenario name and overridden parameter")
    void run_shouldPrintJson() throws Exception {
        Path scenario = tmp.resolve("tax.json");
        Files.writeString(scenario, "{\"name\":\"Tax\",\"params\":{\"carbonPrice\":90}}", StandardCharsets.UTF_8);

        int exit = cmd.execute("run", "--scenario", scenario.toString(), "--format", "JSON", "--climSensitivity", "3.5");

        assertThat(exit).isZero();
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.get("scenario").asText()).isEqualTo("Tax");
        assertThat(root.get("params").get("carbonPrice").asDouble()).isEqualTo(90.0);
        assertThat(root.get("params").get("climSensitivity").asDouble()).isEqualTo(3.5);
    }

    @Test
    @Tag("integration")
    @DisplayName("run --trace writes the per-year trace file")
    void run_shouldWriteTrace() throws Exception {
        Path trace = tmp.resolve("trace.csv");

        int exit = cmd.execute("run", "--trace", trace.toString());

        assertThat(exit).isZero();
        assertThat(Files.readAllLines(trace, StandardCharsets.UTF_8)).hasSize(77);
        assertThat(out.toString()).contains("Warming by 2100:");
    }

    @Test
    @Tag("unit")
    @DisplayName("Missing scenario file exits with 1 and a load error")
    void run_shouldFailOnMissingScenario() {
        int exit = cmd.execute("run", "--scenario", tmp.resolve("missing.json").toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Error loading scenario");
    }

    @Test
    @Tag("unit")
    @DisplayName("Unknown options are usage errors")
    void run_shouldRejectUnknownOption() {
        int exit = cmd.execute("run", "--warpFactor=9");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("--warpFactor");
    }

    @Test
    @Tag("unit")
    @DisplayName("Sweep output must be .xlsx or .csv")
    void sweep_shouldRejectUnknownExtension() {
        int exit = cmd.execute("sweep", "--param1", "carbonPrice", "--values1", "0", "-o", tmp.resolve("out.txt").toString());

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains(".xlsx or .csv");
    }

    @Test
    @Tag("integration")
    @DisplayName("Sweep writes the CSV file and prints metric statistics")
    void sweep_shouldWriteCsv() {
        Path file = tmp.resolve("sweep.csv");

        int exit = cmd.execute("sweep", "--param1", "carbonPrice", "--values1", "0,100",
                "--metrics", "warming2100", "--threads", "2", "-o", file.toString());

        assertThat(exit).isZero();
        assertThat(file).exists();
        assertThat(out.toString()).contains("warming2100").contains("mean=").contains("Saved: ");
    }

    @Test
    @Tag("integration")
    @DisplayName("compare names unnamed scenarios after their files")
    void compare_shouldUseFileNames() throws Exception {
        Path dir = Files.createDirectory(tmp.resolve("scenarios"));
        Files.writeString(dir.resolve("low-tax.json"), "{\"params\":{\"carbonPrice\":10}}", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("high-tax.json"), "{\"params\":{\"carbonPrice\":150}}", StandardCharsets.UTF_8);

        int exit = cmd.execute("compare", dir.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("low-tax").contains("high-tax").contains("SSP");
    }

    @Test
    @Tag("unit")
    @DisplayName("Unknown Sobol parameter is a usage error")
    void sobol_shouldRejectUnknownParameter() {
        int exit = cmd.execute("sobol", "--params", "warpFactor", "-n", "2");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("warpFactor");
    }

    @Test
    @Tag("integration")
    @DisplayName("Sobol prints a tab-separated index table")
    void sobol_shouldPrintTable() {
        int exit = cmd.execute("sobol", "--params", "carbonPrice,climSensitivity", "--metric", "warming2100",
                "-n", "4", "--threads", "2");

        assertThat(exit).isZero();
        String[] lines = out.toString().split("\\R");
        assertThat(lines[0]).isEqualTo("param\tS_warming2100\tST_warming2100");
        assertThat(lines[1]).startsWith("carbonPrice\t");
        assertThat(lines[2]).startsWith("climSensitivity\t");
    }
}
