package energysim.engine.resources;

import energysim.config.ModelParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ForestCarbonTest {

    private final ForestCarbon carbon = new ForestCarbon(ModelParameters.defaults().resources().land());

    @Test
    @DisplayName("Deforestation releases half the carbon now and defers the rest")
    void flux_shouldSplitDeforestationEmissions() {
        // Act
        CarbonFlux f = carbon.flux(-10, 0.0);

        // Assert: 10 Mha × 150 tC/ha × 3.67
        double released = 10 * 1e6 * 150 * 3.67 / 1e9;
        assertThat(f.deforestationEmissions()).isCloseTo(released / 2, within(1e-12));
        assertThat(f.decayPool()).isCloseTo(released / 2, within(1e-12));
        assertThat(f.sequestration()).isZero();
        assertThat(f.netFlux()).isCloseTo(released / 2, within(1e-12));
    }

    @Test
    @DisplayName("Forest growth sequesters carbon and yields a negative net flux")
    void flux_shouldSequesterOnGrowth() {
        CarbonFlux f = carbon.flux(10, 0.0);

        assertThat(f.sequestration()).isCloseTo(0.075, within(1e-12));
        assertThat(f.netFlux()).isCloseTo(-0.075, within(1e-12));
    }

    @Test
    @DisplayName("Deferred pool decays at 5% a year")
    void flux_shouldDecayPool() {
        CarbonFlux f = carbon.flux(0, 2.0);

        assertThat(f.decayEmissions()).isCloseTo(0.1, within(1e-12));
        assertThat(f.decayPool()).isCloseTo(1.9, within(1e-12));
    }
}
