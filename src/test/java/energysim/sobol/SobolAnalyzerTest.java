package energysim.sobol;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.config.TunableParamId;
import energysim.config.TunableParameterPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SobolAnalyzerTest {

    /**
     * Выходы модели y = g(x) для матриц A, B и AB_j; метрика одна (индекс 0).
     */
    private static double[][][] outputs(int n, int d, ToDoubleFunction<double[]> g) {
        double[][][] ab = SobolAnalyzer.generateABBySobolSequence(n, d);
        double[][] a = ab[0];
        double[][] b = ab[1];
        double[][] yA = new double[n][1];
        double[][] yB = new double[n][1];
        double[][] yAB = new double[d * n][1];
        for (int i = 0; i < n; i++) {
            yA[i][0] = g.applyAsDouble(a[i]);
            yB[i][0] = g.applyAsDouble(b[i]);
            for (int j = 0; j < d; j++) {
                double[] row = a[i].clone();
                row[j] = b[i][j];
                yAB[j * n + i][0] = g.applyAsDouble(row);
            }
        }
        return new double[][][]{yA, yB, yAB};
    }

    private static double[][][] split(double[][] flat, int n, int d) {
        double[][][] out = new double[d][n][];
        for (int j = 0; j < d; j++) {
            for (int i = 0; i < n; i++) {
                out[j][i] = flat[j * n + i];
            }
        }
        return out;
    }

    @Test
    @Tag("unit")
    @DisplayName("A and B come from disjoint halves of one unit-cube Sobol sequence")
    void generateAB_shouldStayInUnitCube() {
        double[][][] ab = SobolAnalyzer.generateABBySobolSequence(64, 3);

        assertThat(ab[0]).hasNumberOfRows(64);
        assertThat(ab[1]).hasNumberOfRows(64);
        for (int i = 0; i < 64; i++) {
            assertThat(ab[0][i]).hasSize(3).allSatisfy(v -> assertThat(v).isBetween(0.0, 1.0));
            assertThat(ab[1][i]).hasSize(3).allSatisfy(v -> assertThat(v).isBetween(0.0, 1.0));
        }
    }

    @Test
    @Tag("unit")
    @DisplayName("Output that depends on one factor attributes all variance to it")
    void indices_shouldIsolateSingleFactor() {
        // Arrange
        int n = 1024;
        int d = 2;
        double[][][] y = outputs(n, d, x -> x[0]);
        double[] s = new double[d];
        double[] st = new double[d];

        // Act
        SobolAnalyzer.computeSobolIndicesSaltelli2010(y[0], y[1], split(y[2], n, d), d, 0, s, st);

        // Assert
        assertThat(s[0]).isCloseTo(1.0, within(0.05));
        assertThat(st[0]).isCloseTo(1.0, within(0.05));
        assertThat(s[1]).isCloseTo(0.0, within(1e-12));
        assertThat(st[1]).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @Tag("unit")
    @DisplayName("Additive model splits variance by coefficient squared")
    void indices_shouldSplitAdditiveVariance() {
        int n = 2048;
        int d = 2;
        double[][][] y = outputs(n, d, x -> x[0] + 2 * x[1]);
        double[] s = new double[d];
        double[] st = new double[d];

        SobolAnalyzer.computeSobolIndicesSaltelli2010(y[0], y[1], split(y[2], n, d), d, 0, s, st);

        assertThat(s[0]).isCloseTo(0.2, within(0.05));
        assertThat(s[1]).isCloseTo(0.8, within(0.05));
        assertThat(st[0]).isCloseTo(0.2, within(0.05));
        assertThat(st[1]).isCloseTo(0.8, within(0.05));
    }

    @Test
    @Tag("unit")
    @DisplayName("Constant output yields undefined indices")
    void indices_shouldBeNaNForZeroVariance() {
        int n = 16;
        int d = 2;
        double[][][] y = outputs(n, d, x -> 3.0);
        double[] s = new double[d];
        double[] st = new double[d];

        SobolAnalyzer.computeSobolIndicesSaltelli2010(y[0], y[1], split(y[2], n, d), d, 0, s, st);

        assertThat(s).containsOnly(Double.NaN);
        assertThat(st).containsOnly(Double.NaN);
    }

    @Test
    @Tag("unit")
    @DisplayName("A unit-cube row is scaled to factor ranges and applied on a copy")
    void parameterSet_shouldScaleAndApply() {
        // Arrange
        SobolConfig cfg = SobolConfig.fromIds(4, List.of(TunableParamId.CARBON_PRICE, TunableParamId.CLIM_SENSITIVITY));
        ScenarioParameters base = ScenarioParameters.defaults();

        // Act
        ParameterSet set = ParameterSet.fromUnitRow(new double[] {0.25, 1.0}, cfg);
        ScenarioParameters applied = set.applyTo(base);

        // Assert
        assertThat(set.value(0)).isEqualTo(50.0);
        assertThat(set.value(1)).isEqualTo(4.5);
        assertThat(applied.getCarbonPrice()).isEqualTo(50.0);
        assertThat(applied.getClimSensitivity()).isEqualTo(4.5);
        assertThat(base.getCarbonPrice()).isEqualTo(35.0);
        assertThat(set.toString()).isEqualTo("{carbonPrice=50.0, climSensitivity=4.5}");
        assertThatThrownBy(() -> ParameterSet.fromUnitRow(new double[] {0.5}, cfg))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    @DisplayName("Configuration counts N·(d+2) runs and rejects empty input")
    void config_shouldValidate() {
        SobolConfig cfg = SobolConfig.fromIds(8, List.of(TunableParamId.CARBON_PRICE, TunableParamId.CLIM_SENSITIVITY));

        assertThat(cfg.dim()).isEqualTo(2);
        assertThat(cfg.runCount()).isEqualTo(32);
        assertThat(cfg.getFactors().get(0).getMin()).isEqualTo(0.0);
        assertThat(cfg.getFactors().get(0).getMax()).isEqualTo(200.0);
        assertThatThrownBy(() -> SobolConfig.fromIds(8, List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SobolConfig.fromIds(0, List.of(TunableParamId.CARBON_PRICE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SobolFactor(TunableParameterPool.get(TunableParamId.CARBON_PRICE), 5, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    @DisplayName("Output metric keys resolve and unknown keys are rejected")
    void outputMetric_shouldResolveKeys() {
        assertThat(OutputMetric.fromKey("warming2100")).isEqualTo(OutputMetric.WARMING_2100);
        assertThatThrownBy(() -> OutputMetric.fromKey("gdp"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown output metric");
    }

    @Test
    @Tag("unit")
    @DisplayName("Printer writes one tab-separated row per factor")
    void printer_shouldWriteTable() {
        // Arrange
        SobolConfig cfg = SobolConfig.fromIds(4, List.of(TunableParamId.CARBON_PRICE, TunableParamId.CLIM_SENSITIVITY));
        Map<OutputMetric, double[]> s = new EnumMap<>(OutputMetric.class);
        Map<OutputMetric, double[]> st = new EnumMap<>(OutputMetric.class);
        s.put(OutputMetric.WARMING_2100, new double[]{0.25, 0.5});
        st.put(OutputMetric.WARMING_2100, new double[]{0.3, 0.6});
        StringWriter sw = new StringWriter();

        // Act
        SobolResultPrinter.printTable(new PrintWriter(sw, true), new SobolResult(cfg, s, st),
                List.of(OutputMetric.WARMING_2100));

        // Assert
        String[] lines = sw.toString().split("\\R");
        assertThat(lines[0]).isEqualTo("param\tS_warming2100\tST_warming2100");
        assertThat(lines[1]).isEqualTo("carbonPrice\t0.2500\t0.3000");
        assertThat(lines[2]).isEqualTo("climSensitivity\t0.5000\t0.6000");
    }

    @Test
    @Tag("integration")
    @DisplayName("Small Sobol run on the engine gives finite indices for warming")
    void run_shouldProduceIndicesFromEngine() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            SobolConfig cfg = SobolConfig.fromIds(4, List.of(TunableParamId.CARBON_PRICE, TunableParamId.CLIM_SENSITIVITY));

            SobolResult r = new SobolAnalyzer(executor).run(ModelParameters.defaults(), ScenarioParameters.defaults(), cfg);

            assertThat(r.firstOrder(OutputMetric.WARMING_2100)).hasSize(2).allSatisfy(v -> assertThat(v).isFinite());
            assertThat(r.total(OutputMetric.WARMING_2100)).hasSize(2).allSatisfy(v -> assertThat(v).isFinite());
        } finally {
            executor.shutdownNow();
        }
    }
}
