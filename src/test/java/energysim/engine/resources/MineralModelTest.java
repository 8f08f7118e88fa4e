package energysim.engine.resources;

import energysim.config.Mineral;
import energysim.config.MineralParams;
import energysim.config.ModelParameters;
import energysim.config.ResourceParams;
import energysim.config.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class MineralModelTest {

    private final ResourceParams params = ModelParameters.defaults().resources();
    private final MineralParams copper = params.mineral(Mineral.COPPER);
    private final MineralParams lithium = params.mineral(Mineral.LITHIUM);

    @Test
    @DisplayName("Copper for 100 GW of solar: 0.28 Mt gross, 15% recycled")
    void demand_shouldConvertKgPerMwToMegatonnes() {
        // Act
        MineralDemand d = new MineralModel(params).demand(copper, Map.of(SourceType.SOLAR, 100.0), 0, 0.0);

        // Assert
        assertThat(d.grossDemand()).isCloseTo(0.28, within(1e-12));
        assertThat(d.recyclingRate()).isCloseTo(0.15, within(1e-12));
        assertThat(d.demand()).isCloseTo(0.238, within(1e-12));
        assertThat(d.cumulative()).isCloseTo(0.238, within(1e-12));
        assertThat(d.reserveRatio()).isCloseTo(0.238 / 880, within(1e-12));
    }

    @Test
    @DisplayName("Battery additions are taken per GWh")
    void demand_shouldUseBatteryGwh() {
        MineralDemand d = new MineralModel(params).demand(lithium, Map.of(SourceType.BATTERY, 1000.0), 0, 0.0);

        assertThat(d.grossDemand()).isCloseTo(1000 * 600 / 1e9, within(1e-15));
    }

    @Test
    @DisplayName("Recycling rises from the base rate toward the maximum with stock in use")
    void recyclingRate_shouldSaturate() {
        assertThat(MineralModel.recyclingRate(lithium, 0)).isCloseTo(0.05, within(1e-12));
        assertThat(MineralModel.recyclingRate(lithium, 20))
                .isCloseTo(0.05 + 0.25 * (1 - Math.exp(-1)), within(1e-12));
        assertThat(MineralModel.recyclingRate(lithium, 1e6)).isCloseTo(0.30, within(1e-9));
    }

    @Test
    @DisplayName("Learning multiplier speeds up the decline in material intensity")
    void intensityFactor_shouldScaleWithLearningMultiplier() {
        double base = new MineralModel(params).intensityFactor(copper, 25);
        double fast = new MineralModel(params.withMineralLearningMultiplier(2.0)).intensityFactor(copper, 25);

        assertThat(base).isCloseTo(Math.pow(0.98, 25), within(1e-12));
        assertThat(fast).isCloseTo(Math.pow(0.96, 25), within(1e-12));
    }

    @Test
    @DisplayName("Unlimited reserves report a zero reserve ratio")
    void demand_shouldReportZeroRatioForUnlimitedReserves() {
        MineralParams steel = params.mineral(Mineral.STEEL);

        MineralDemand d = new MineralModel(params).demand(steel, Map.of(SourceType.WIND, 50.0), 5, 100.0);

        assertThat(d.grossDemand()).isPositive();
        assertThat(d.reserveRatio()).isZero();
    }
}
