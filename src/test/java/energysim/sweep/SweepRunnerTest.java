package energysim.sweep;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.config.TunableParamId;
import energysim.config.TunableParameterPool;
import energysim.metrics.ScenarioMetric;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class SweepRunnerTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Carbon price sweep returns ordered outcomes with falling warming")
    void run_shouldKeepPlanOrder() throws Exception {
        // Arrange
        SweepPlan plan = SweepPlan.oneParameter(
                TunableParameterPool.get(TunableParamId.CARBON_PRICE), new double[]{0, 75, 150});

        // Act
        List<SweepOutcome> outcomes = new SweepRunner(executor)
                .run(ModelParameters.defaults(), ScenarioParameters.defaults(), plan);

        // Assert
        assertThat(outcomes).extracting(SweepOutcome::index).containsExactly(0, 1, 2);
        assertThat(outcomes).extracting(o -> o.parameters().getCarbonPrice()).containsExactly(0.0, 75.0, 150.0);
        double w0 = outcomes.get(0).value(ScenarioMetric.WARMING_2100);
        double w2 = outcomes.get(2).value(ScenarioMetric.WARMING_2100);
        assertThat(w2).isLessThan(w0);

        DescriptiveStatistics stats = SweepRunner.statistics(outcomes, ScenarioMetric.WARMING_2100);
        assertThat(stats.getN()).isEqualTo(3);
        assertThat(stats.getMin()).isLessThanOrEqualTo(w2);
        assertThat(stats.getMax()).isGreaterThanOrEqualTo(w0);
    }
}
