package energysim.io;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.config.TunableParamId;
import energysim.config.TunableParameterPool;
import energysim.metrics.ScenarioMetric;
import energysim.sweep.SweepOutcome;
import energysim.sweep.SweepPlan;
import energysim.sweep.SweepRunner;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class SweepResultsWritersTest {

    private static final List<ScenarioMetric> COLUMNS = List.of(
            ScenarioMetric.WARMING_2100, ScenarioMetric.PEAK_EMISSIONS_YEAR);

    private static ExecutorService executor;
    private static SweepPlan plan;
    private static List<SweepOutcome> outcomes;

    @TempDir
    Path tmp;

    @BeforeAll
    static void sweep() throws Exception {
        executor = Executors.newFixedThreadPool(2);
        plan = SweepPlan.twoParameters(
                TunableParameterPool.get(TunableParamId.CARBON_PRICE), new double[]{0, 100},
                TunableParameterPool.get(TunableParamId.CLIM_SENSITIVITY), new double[]{2.5, 4.0});
        outcomes = new SweepRunner(executor).run(ModelParameters.defaults(), ScenarioParameters.defaults(), plan);
    }

    @AfterAll
    static void shutdown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Column letters follow spreadsheet numbering")
    void colLetter_shouldMatchSpreadsheetColumns() {
        assertThat(SweepResultsExcelWriter.colLetter(1)).isEqualTo("A");
        assertThat(SweepResultsExcelWriter.colLetter(26)).isEqualTo("Z");
        assertThat(SweepResultsExcelWriter.colLetter(27)).isEqualTo("AA");
        assertThat(SweepResultsExcelWriter.colLetter(703)).isEqualTo("AAA");
    }

    @Test
    @DisplayName("Passport lists the mode and the scenario parameters that are set")
    void buildPassport_shouldListParameters() {
        String passport = SweepResultsExcelWriter.buildPassport(plan, ScenarioParameters.defaults());

        assertThat(passport).startsWith("mode=SWEEP_2; ").contains("carbonPrice=35.0").doesNotContain("windAlpha");
    }

    @Test
    @DisplayName("Workbook has a RAW sheet with one row per point and a SWEEP_2 grid of formulas")
    void writeXlsx_shouldWriteRawAndGrid() throws Exception {
        // Arrange
        Path file = tmp.resolve("sweep.xlsx");

        // Act
        SweepResultsExcelWriter.writeXlsx(file, plan, ScenarioParameters.defaults(), outcomes, COLUMNS);

        // Assert
        try (InputStream in = Files.newInputStream(file); XSSFWorkbook wb = new XSSFWorkbook(in)) {
            Sheet raw = wb.getSheet("RAW");
            assertThat(raw).isNotNull();
            Row hdr = raw.getRow(1);
            assertThat(hdr.getCell(0).getStringCellValue()).isEqualTo("carbonPrice");
            assertThat(hdr.getCell(1).getStringCellValue()).isEqualTo("climSensitivity");
            assertThat(hdr.getCell(2).getStringCellValue()).isEqualTo("warming2100");
            assertThat(raw.getLastRowNum()).isEqualTo(1 + plan.size());
            assertThat(raw.getRow(2).getCell(0).getNumericCellValue()).isEqualTo(0.0);
            assertThat(raw.getRow(3).getCell(1).getNumericCellValue()).isEqualTo(4.0);
            assertThat(raw.getRow(2).getCell(2).getNumericCellValue())
                    .isEqualTo(outcomes.get(0).value(ScenarioMetric.WARMING_2100));

            Sheet grid = wb.getSheet("SWEEP_2");
            assertThat(grid).isNotNull();
            assertThat(grid.getRow(0).getCell(0).getStringCellValue()).isEqualTo("warming2100");
            Cell formula = grid.getRow(2).getCell(1);
            assertThat(formula.getCellType()).isEqualTo(CellType.FORMULA);
            assertThat(formula.getCellFormula()).contains("AVERAGEIFS(RAW!$C:$C");
        }
    }

    @Test
    @DisplayName("CSV export writes a quoted passport, header and one line per point")
    void writeCsv_shouldWriteSemicolonTable() throws Exception {
        Path file = tmp.resolve("sweep.csv");

        SweepResultsCsvWriter.write(file, plan, ScenarioParameters.defaults(), outcomes, COLUMNS);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2 + plan.size());
        assertThat(lines.get(0)).startsWith("\"mode=SWEEP_2");
        assertThat(lines.get(1)).isEqualTo("k;carbonPrice;climSensitivity;warming2100;peakEmissionsYear");
        assertThat(lines.get(2)).startsWith("0;");
    }

    @Test
    @DisplayName("Outcome count must match the plan")
    void writers_shouldRejectMismatchedOutcomes() {
        assertThatThrownBy(() -> SweepResultsCsvWriter.write(tmp.resolve("x.csv"), plan,
                ScenarioParameters.defaults(), outcomes.subList(0, 1), COLUMNS))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SweepResultsExcelWriter.writeXlsx(tmp.resolve("x.xlsx"), plan,
                ScenarioParameters.defaults(), outcomes.subList(0, 1), COLUMNS))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
