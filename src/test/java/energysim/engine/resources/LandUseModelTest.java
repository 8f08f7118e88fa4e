package energysim.engine.resources;

import energysim.config.LandParams;
import energysim.config.ModelParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class LandUseModelTest {

    private final ModelParameters defaults = ModelParameters.defaults();
    private final LandParams land = defaults.resources().land();
    private final LandUseModel model = new LandUseModel(land);
    private final FoodDemand food = new FoodModel(defaults.resources().food()).demand(8.3e9, 15_000, 2025);

    @Test
    @DisplayName("Farmland is grain over yield times the non-food multiplier")
    void landUse_shouldDeriveFarmland() {
        LandUse u = model.landUse(food, 8.3e9, 15_000, 15_000, 2025, 1.2, null);

        assertThat(u.yield()).isCloseTo(4.0, within(1e-12));
        assertThat(u.farmland()).isCloseTo(food.grainEquivalent() / 4.0 * 4.9, within(1e-9));
        assertThat(u.urban()).isCloseTo(8.3e9 * 0.04 / 1e6, within(1e-9));
        assertThat(u.forestChange()).isZero();
    }

    @Test
    @DisplayName("Warming above the threshold accelerates desertification")
    void landUse_shouldRespondToTemperature() {
        LandUse cool = model.landUse(food, 8.3e9, 15_000, 15_000, 2035, 1.0, null);
        LandUse hot = model.landUse(food, 8.3e9, 15_000, 15_000, 2035, 3.0, null);

        assertThat(hot.desert()).isGreaterThan(cool.desert());
        assertThat(hot.forest()).isCloseTo(cool.forest(), within(1e-9));
    }

    @Test
    @DisplayName("Forest change is measured against the previous year")
    void landUse_shouldTrackForestChange() {
        LandUse first = model.landUse(food, 8.3e9, 15_000, 15_000, 2025, 1.2, null);
        LandUse second = model.landUse(food, 8.3e9, 15_000, 15_000, 2026, 1.2, first);

        assertThat(second.forestChange()).isCloseTo(second.forest() - first.forest(), within(1e-12));
    }

    @Test
    @DisplayName("Zero population gives zero GDP per capita and no urban land")
    void landUse_shouldHandleEmptyPopulation() {
        double perCapita = ResourceModel.perCapita(119, 0);
        FoodDemand none = new FoodModel(defaults.resources().food()).demand(0, perCapita, 2025);

        LandUse u = model.landUse(none, 0, perCapita, perCapita, 2025, 1.2, null);

        assertThat(perCapita).isZero();
        assertThat(ResourceModel.perCapita(119, 8.3e9)).isCloseTo(119e12 / 8.3e9, within(1e-6));
        assertThat(u.urban()).isZero();
        assertThat(u.farmland()).isZero();
        assertThat(u.forest()).isFinite();
    }
}
