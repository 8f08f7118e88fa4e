package energysim.engine.capacity;

import energysim.config.ModelParameters;
import energysim.config.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CapacityStateMachineTest {

    private static final double DEMAND = 30_000;

    private ModelParameters params;
    private CapacityStateMachine machine;
    private CapacityState state;

    @BeforeEach
    void setUp() {
        params = ModelParameters.defaults();
        machine = new CapacityStateMachine(params);
        state = CapacityState.initial(params.energySources());
    }

    @Test
    @DisplayName("Initial state holds 2025 capacities with no additions")
    void initial_shouldHoldCapacity2025() {
        assertThat(state.size()).isEqualTo(1);
        assertThat(state.installed(SourceType.SOLAR, 0)).isEqualTo(1500.0);
        assertThat(state.installed(SourceType.BATTERY, 0)).isEqualTo(2000.0);
        assertThat(state.history(SourceType.SOLAR).additions(0)).isZero();
        assertThat(state.history(SourceType.SOLAR).retirements(0)).isZero();
    }

    @Test
    @DisplayName("Advancing out of order is rejected")
    void advance_shouldRejectWrongYearIndex() {
        assertThatThrownBy(() -> machine.advance(state, 2, DEMAND, 25))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Solar grows at its target rate when investment and ceiling allow")
    void advance_shouldGrowSolarAtTargetRate() {
        // Act
        machine.advance(state, 1, DEMAND, 25);

        // Assert
        assertThat(state.installed(SourceType.SOLAR, 1)).isCloseTo(1875.0, within(1e-9));
        assertThat(state.history(SourceType.SOLAR).additions(1)).isCloseTo(375.0, within(1e-9));
    }

    @Test
    @DisplayName("Coal follows its decline path regardless of caps")
    void advance_shouldDeclineCoal() {
        // Act
        machine.advance(state, 1, DEMAND, 0);
        machine.advance(state, 2, DEMAND, 0);

        // Assert
        assertThat(state.installed(SourceType.COAL, 1)).isCloseTo(2058.0, within(1e-9));
        assertThat(state.history(SourceType.COAL).additions(1)).isCloseTo(-42.0, within(1e-9));
        assertThat(state.installed(SourceType.COAL, 2)).isLessThan(state.installed(SourceType.COAL, 1));
    }

    @Test
    @DisplayName("Gas is not limited by investment or demand ceiling")
    void advance_shouldGrowGasWithoutInvestment() {
        machine.advance(state, 1, 1_000, 0);

        assertThat(state.installed(SourceType.GAS, 1)).isCloseTo(2525.0, within(1e-9));
    }

    @Test
    @DisplayName("Clean sources cannot be built without investment")
    void advance_shouldNotBuildCleanWithoutInvestment() {
        machine.advance(state, 1, DEMAND, 0);

        assertThat(state.history(SourceType.SOLAR).additions(1)).isZero();
        assertThat(state.history(SourceType.WIND).additions(1)).isZero();
        assertThat(state.installed(SourceType.SOLAR, 1)).isEqualTo(1500.0);
    }

    @Test
    @DisplayName("Capacity above the useful ceiling receives no additions")
    void advance_shouldRespectDemandCeiling() {
        // Arrange: 1000 TWh supports ~457 GW of solar, far below 1500 GW installed
        assertThat(machine.maxUsefulCapacity(SourceType.SOLAR, 1_000)).isLessThan(1500.0);

        // Act
        machine.advance(state, 1, 1_000, 25);

        // Assert
        assertThat(state.history(SourceType.SOLAR).additions(1)).isZero();
    }

    @Test
    @DisplayName("Fossil backup has no useful-capacity ceiling")
    void maxUsefulCapacity_shouldBeUnboundedForFossil() {
        assertThat(machine.maxUsefulCapacity(SourceType.GAS, DEMAND)).isInfinite();
        assertThat(machine.maxUsefulCapacity(SourceType.COAL, DEMAND)).isInfinite();
        assertThat(machine.maxUsefulCapacity(SourceType.SOLAR, DEMAND))
                .isCloseTo(DEMAND * 0.8 / (0.2 * 8760) * 1000, within(1e-6));
    }

    @Test
    @DisplayName("Clean-energy share ramps from 15% to 30% over 25 years")
    void cleanEnergyShare_shouldRampLinearly() {
        assertThat(machine.cleanEnergyShare(0)).isCloseTo(0.15, within(1e-12));
        assertThat(machine.cleanEnergyShare(25)).isCloseTo(0.30, within(1e-12));
        assertThat(machine.cleanEnergyShare(60)).isCloseTo(0.30, within(1e-12));
    }

    @Test
    @DisplayName("No retirements before the lifetime is reached")
    void retirement_shouldBeZeroBeforeLifetime() {
        for (int i = 1; i <= 30; i++) {
            machine.advance(state, i, DEMAND, 25);
        }

        assertThat(machine.retirement(state, SourceType.SOLAR, 29)).isZero();
        assertThat(machine.retirement(state, SourceType.SOLAR, 30))
                .isCloseTo(state.installed(SourceType.SOLAR, 29) / 30.0, within(1e-9));
    }

    @Test
    @DisplayName("Installed = previous + additions - retirements for every source and year")
    void advance_shouldKeepBalanceIdentity() {
        // Act
        for (int i = 1; i < 76; i++) {
            machine.advance(state, i, DEMAND * (1 + 0.02 * i), 25 + 0.3 * i);
        }

        // Assert
        for (SourceType s : SourceType.values()) {
            SourceHistory h = state.history(s);
            for (int i = 1; i < 76; i++) {
                assertThat(h.installed(i))
                        .as("%s year %d", s, i)
                        .isCloseTo(h.installed(i - 1) + h.additions(i) - h.retirements(i), within(1e-6));
                assertThat(h.installed(i)).isGreaterThanOrEqualTo(0.0);
            }
        }
    }
}
