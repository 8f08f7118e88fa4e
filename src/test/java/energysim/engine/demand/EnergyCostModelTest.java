package energysim.engine.demand;

import energysim.config.DispatchSource;
import energysim.config.Fuel;
import energysim.config.ModelParameters;
import energysim.engine.cost.LcoeSet;
import energysim.engine.dispatch.DispatchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class EnergyCostModelTest {

    private final EnergyCostModel model = new EnergyCostModel(ModelParameters.defaults());

    @Test
    @DisplayName("Electricity cost sums generation x LCOE and skips solar+battery")
    void cost_shouldSkipSolarPlusBattery() {
        // Arrange
        Map<DispatchSource, Double> gen = new EnumMap<>(DispatchSource.class);
        gen.put(DispatchSource.SOLAR, 1_000_000.0);
        gen.put(DispatchSource.SOLAR_PLUS_BATTERY, 1_000_000.0);
        gen.put(DispatchSource.GAS, 1_000_000.0);
        DispatchResult dispatch = new DispatchResult(3_000_000, gen, 0, 0);
        LcoeSet lcoe = new LcoeSet(30, 32, 60, 70, 90, 40, 140, 150);

        // Act
        EnergyCost cost = model.cost(dispatch, lcoe, Map.of(), 0);

        // Assert: (30 + 60) $/MWh x 1e6 TWh / 1e6
        assertThat(cost.electricity()).isCloseTo(90.0, within(1e-9));
        assertThat(cost.nonElectric()).isZero();
    }

    @Test
    @DisplayName("Non-electric cost adds the carbon price by fuel intensity")
    void nonElectricCost_shouldIncludeCarbon() {
        // Arrange
        Map<Fuel, Double> fuels = new EnumMap<>(Fuel.class);
        fuels.put(Fuel.OIL, 1_000_000.0);
        fuels.put(Fuel.BIOMASS, 1_000_000.0);

        // Act
        double cost = model.nonElectricCost(fuels, 100);

        // Assert: oil 50 + 0.267 x 100, biomass 40
        assertThat(cost).isCloseTo(50 + 26.7 + 40, within(1e-9));
    }

    @Test
    @DisplayName("Burden below the 8% threshold causes no damage")
    void burden_shouldBeFreeBelowThreshold() {
        EnergyBurden b = model.burden(6, 100);

        assertThat(b.burden()).isCloseTo(0.06, within(1e-12));
        assertThat(b.damage()).isZero();
        assertThat(b.constrained()).isFalse();
    }

    @Test
    @DisplayName("Burden above the threshold costs 1.5x the excess")
    void burden_shouldApplyElasticityAboveThreshold() {
        EnergyBurden b = model.burden(12, 100);

        assertThat(b.damage()).isCloseTo(0.06, within(1e-12));
        assertThat(b.constrained()).isTrue();
        assertThat(b.aboveHistoricalMax()).isFalse();
    }

    @Test
    @DisplayName("Burden damage is capped and extreme burden is flagged")
    void burden_shouldCapDamage() {
        EnergyBurden b = model.burden(50, 100);

        assertThat(b.damage()).isEqualTo(0.30);
        assertThat(b.aboveHistoricalMax()).isTrue();
    }

    @Test
    @DisplayName("Zero GDP gives zero burden instead of a division by zero")
    void burden_shouldHandleZeroGdp() {
        EnergyBurden b = model.burden(12, 0);

        assertThat(b.burden()).isZero();
        assertThat(b.damage()).isZero();
    }
}
