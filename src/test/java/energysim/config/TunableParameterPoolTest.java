package energysim.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class TunableParameterPoolTest {

    @Test
    @DisplayName("Pool describes every parameter id with a valid range")
    void all_shouldCoverEveryId() {
        List<TunableParameter> all = TunableParameterPool.all();

        assertThat(all).extracting(TunableParameter::id).containsExactly(TunableParamId.values());
        for (TunableParameter p : all) {
            assertThat(p.min()).as(p.name()).isLessThanOrEqualTo(p.max());
            assertThat(p.inRange(p.hardcodedValue())).as(p.name()).isTrue();
            assertThat(p.description()).as(p.name()).isNotBlank();
        }
    }

    @Test
    @DisplayName("Core parameters carry scenario defaults, optional ones defer to the model")
    void defaults_shouldSplitCoreAndOptional() {
        assertThat(TunableParameterPool.get(TunableParamId.CARBON_PRICE).defaultValue()).isEqualTo(35.0);
        assertThat(TunableParameterPool.get(TunableParamId.WIND_ALPHA).defaultValue()).isNull();

        ScenarioParameters sp = ScenarioParameters.defaults();
        assertThat(sp.get(TunableParamId.CARBON_PRICE)).isEqualTo(35.0);
        assertThat(sp.get(TunableParamId.WIND_ALPHA)).isNull();
    }

    @Test
    @DisplayName("Lookup by name resolves keys and rejects unknown names")
    void byName_shouldResolveKeys() {
        assertThat(TunableParameterPool.byName("climSensitivity").id()).isEqualTo(TunableParamId.CLIM_SENSITIVITY);
        assertThatThrownBy(() -> TunableParameterPool.byName("warpFactor"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("warpFactor");
    }

    @Test
    @DisplayName("applyTo returns a modified copy and leaves the base untouched")
    void applyTo_shouldCopy() {
        ScenarioParameters base = ScenarioParameters.defaults();

        ScenarioParameters changed = TunableParameterPool.get(TunableParamId.CARBON_PRICE).applyTo(base, 120);

        assertThat(changed.getCarbonPrice()).isEqualTo(120.0);
        assertThat(base.getCarbonPrice()).isEqualTo(35.0);
    }

    @Test
    @DisplayName("scaleFromUnit maps [0,1] onto the range and clamps outside it")
    void scaleFromUnit_shouldClamp() {
        TunableParameter p = TunableParameterPool.get(TunableParamId.CARBON_PRICE);

        assertThat(p.scaleFromUnit(0.5)).isCloseTo(100.0, within(1e-12));
        assertThat(p.scaleFromUnit(-1)).isEqualTo(0.0);
        assertThat(p.scaleFromUnit(2)).isEqualTo(200.0);
    }

    @Test
    @DisplayName("Effective parameters apply scenario overrides without touching the base model")
    void resolve_shouldOverlayScenario() {
        // Arrange
        ModelParameters base = ModelParameters.defaults();
        ScenarioParameters sp = ScenarioParametersBuilder.from(ScenarioParameters.defaults())
                .setSolarGrowth(0.30)
                .setClimSensitivity(4.5)
                .set(TunableParamId.WIND_ALPHA, 0.30)
                .build();

        // Act
        ModelParameters m = EffectiveParameters.resolve(base, sp);

        // Assert
        assertThat(m.source(SourceType.SOLAR).growthRate()).isEqualTo(0.30);
        assertThat(m.source(SourceType.WIND).alpha()).isEqualTo(0.30);
        assertThat(m.climate().climSensitivity()).isEqualTo(4.5);
        assertThat(base.climate().climSensitivity()).isEqualTo(3.0);
        assertThat(m.source(SourceType.NUCLEAR)).isEqualTo(base.source(SourceType.NUCLEAR));
    }
}
