package energysim.engine.cost;

import energysim.config.ModelParameters;
import energysim.config.SourceType;
import energysim.engine.capacity.CapacityState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CostModelTest {

    private final ModelParameters params = ModelParameters.defaults();
    private final CostModel model = new CostModel(params);

    @Test
    @DisplayName("Learning curve returns cost0 at the 2025 cumulative level")
    void learningCurve_shouldReturnCost0AtUnitCumulative() {
        assertThat(CostModel.learningCurve(35, 1.0, 0.36)).isEqualTo(35.0);
    }

    @Test
    @DisplayName("Learning curve falls by 2^-alpha per doubling")
    void learningCurve_shouldApplyWrightsLawPerDoubling() {
        // Act
        double doubled = CostModel.learningCurve(100, 2.0, 0.2);

        // Assert: ~13% per doubling at alpha 0.2
        assertThat(doubled).isCloseTo(100 * Math.pow(2, -0.2), within(1e-9));
        assertThat(doubled).isCloseTo(87.06, within(0.01));
    }

    @Test
    @DisplayName("Non-positive cumulative capacity returns cost0")
    void learningCurve_shouldReturnCost0ForNonPositiveCumulative() {
        assertThat(CostModel.learningCurve(35, 0.0, 0.36)).isEqualTo(35.0);
        assertThat(CostModel.learningCurve(35, -1.0, 0.36)).isEqualTo(35.0);
    }

    @Test
    @DisplayName("Depletion lowers EROEI and keeps net energy in (0, 1)")
    void depletion_shouldLowerEroeiWithExtraction() {
        // Act
        DepletionState fresh = model.depletion(200, 0, 30);
        DepletionState half = model.depletion(200, 100, 30);

        // Assert
        assertThat(fresh.eroei()).isCloseTo(30.0, within(1e-9));
        assertThat(fresh.netEnergy()).isCloseTo(1 - 1 / 30.0, within(1e-12));
        assertThat(half.eroei()).isCloseTo(30 * Math.sqrt(0.5), within(1e-9));
        assertThat(half.netEnergy()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Exhausted reserves clamp remaining and EROEI to their floors")
    void depletion_shouldClampAtFloors() {
        DepletionState exhausted = model.depletion(200, 500, 30);

        assertThat(exhausted.remaining()).isEqualTo(0.01);
        assertThat(exhausted.eroei()).isEqualTo(1.1);
    }

    @Test
    @DisplayName("Doubling the carbon price from 35 to 70 adds 14 to gas and 31.5 to coal")
    void fossilLcoe_shouldAddCarbonCostByIntensity() {
        // Arrange
        var gas = params.source(SourceType.GAS);
        var coal = params.source(SourceType.COAL);

        // Act
        double gasDelta = CostModel.fossilLcoe(gas, gas.eroei0(), 70) - CostModel.fossilLcoe(gas, gas.eroei0(), 35);
        double coalDelta = CostModel.fossilLcoe(coal, coal.eroei0(), 70) - CostModel.fossilLcoe(coal, coal.eroei0(), 35);

        // Assert
        assertThat(CostModel.fossilLcoe(gas, gas.eroei0(), 35)).isCloseTo(59.0, within(1e-9));
        assertThat(gasDelta).isCloseTo(14.0, within(1e-9));
        assertThat(coalDelta).isCloseTo(31.5, within(1e-9));
    }

    @Test
    @DisplayName("Depleted fuel raises the base cost in proportion to lost EROEI")
    void fossilLcoe_shouldRiseWithDepletion() {
        var gas = params.source(SourceType.GAS);

        assertThat(CostModel.fossilLcoe(gas, 15, 0)).isCloseTo(90.0, within(1e-9));
    }

    @Test
    @DisplayName("Year 0 LCOE uses 2025 costs for learning technologies")
    void lcoeForYear_shouldStartAtCost0() {
        // Arrange
        CapacityState state = CapacityState.initial(params.energySources());
        ExtractionLedger ledger = new ExtractionLedger(params.cost(), params.energySources());
        ledger.accrue(SourceType.GAS, null);
        ledger.accrue(SourceType.COAL, null);

        // Act
        LcoeSet lcoe = model.lcoeForYear(state, 0, ledger, 35);

        // Assert
        assertThat(lcoe.solar()).isCloseTo(35.0, within(1e-9));
        assertThat(lcoe.wind()).isCloseTo(35.0, within(1e-9));
        assertThat(lcoe.battery()).isCloseTo(140.0, within(1e-9));
        assertThat(lcoe.hydro()).isEqualTo(40.0);
        assertThat(lcoe.solarPlusBattery()).isCloseTo(35.0 + 140.0 * 4 / (365 * 15 * 0.85) * 1000, within(1e-9));
        assertThat(lcoe.gas()).isGreaterThan(59.0);
        assertThat(lcoe.cheapestClean()).isEqualTo(35.0);
    }

    @Test
    @DisplayName("Extraction ledger accrues bootstrap generation in the first year")
    void extractionLedger_shouldScaleExtractionByGeneration() {
        // Arrange
        ExtractionLedger ledger = new ExtractionLedger(params.cost(), params.energySources());

        // Act
        ledger.accrue(SourceType.GAS, null);
        ledger.accrue(SourceType.GAS, 1250.0);

        // Assert: 2 (bootstrap) + 2 * 1250 / 2500
        assertThat(ledger.extracted(SourceType.GAS)).isCloseTo(3.0, within(1e-12));
        assertThat(ledger.extracted(SourceType.COAL)).isZero();
    }

    @Test
    @DisplayName("Extraction is tracked for fossil sources only")
    void extractionLedger_shouldRejectNonFossil() {
        ExtractionLedger ledger = new ExtractionLedger(params.cost(), params.energySources());

        assertThatThrownBy(() -> ledger.accrue(SourceType.SOLAR, 10.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
