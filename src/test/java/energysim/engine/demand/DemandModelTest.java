package energysim.engine.demand;

import energysim.config.DemographicParams;
import energysim.config.Fuel;
import energysim.config.ModelParameters;
import energysim.config.Region;
import energysim.config.RegionDemography;
import energysim.config.Sector;
import energysim.config.SimulationConstants;
import energysim.engine.demographics.CohortDemographicsModel;
import energysim.engine.demographics.DemographicsData;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class DemandModelTest {

    private static DemographicsData demographics;

    private final DemandModel model = new DemandModel(ModelParameters.defaults(), 1.0);

    @BeforeAll
    static void project() {
        demographics = new CohortDemographicsModel().project(ModelParameters.defaults().demographics());
    }

    @Test
    @DisplayName("Electrification starts at the 2025 share and approaches the target")
    void electrificationRate_shouldApproachTarget() {
        assertThat(model.electrificationRate(0)).isCloseTo(0.25, within(1e-12));
        assertThat(model.electrificationRate(10)).isGreaterThan(model.electrificationRate(0));
        assertThat(model.electrificationRate(75)).isLessThan(0.65).isGreaterThan(0.6);
    }

    @Test
    @DisplayName("Sector electrification follows its own curve")
    void sectorElectrification_shouldUseSectorProfile() {
        double expected = 0.85 - (0.85 - 0.02) * Math.exp(-0.06 * 25);

        assertThat(model.sectorElectrification(Sector.TRANSPORT, 0)).isCloseTo(0.02, within(1e-12));
        assertThat(model.sectorElectrification(Sector.TRANSPORT, 25)).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("Fuel shares interpolate linearly and hold after the transition")
    void fuelShare_shouldInterpolate() {
        assertThat(model.fuelShare(Sector.TRANSPORT, Fuel.OIL, 0)).isCloseTo(0.92, within(1e-12));
        assertThat(model.fuelShare(Sector.TRANSPORT, Fuel.OIL, 75)).isCloseTo(0.60, within(1e-12));
        assertThat(model.fuelShare(Sector.TRANSPORT, Fuel.HYDROGEN, 30))
                .isCloseTo(0.30 * 30 / 75, within(1e-12));
    }

    @Test
    @DisplayName("2025 electricity demand is about 30,000 TWh")
    void run_shouldMatchBaseYearDemand() {
        // Act
        DemandData data = model.run(demographics, DemandFeedback.none());

        // Assert
        double gdp = 58 * 0.70 + 18 * 2.04 + 35 * 0.93 + 8 * 1.53;
        assertThat(data.global().electricityDemand(0)).isCloseTo(gdp * 1000 * 0.25, within(1e-6));
        assertThat(data.global().electricityDemand(0)).isCloseTo(30_000, within(3_000.0));
        assertThat(data.global().gdp(0)).isCloseTo(119.0, within(1e-9));
    }

    @Test
    @DisplayName("Global series aggregates regional demand")
    void run_shouldAggregateRegions() {
        DemandData data = model.run(demographics, DemandFeedback.none());

        for (int i : new int[]{0, 25, SimulationConstants.YEAR_COUNT - 1}) {
            double sum = 0;
            for (Region r : Region.values()) {
                sum += data.region(r).electricityDemand(i);
            }
            assertThat(data.global().electricityDemand(i)).isCloseTo(sum, within(1e-6));
        }
    }

    @Test
    @DisplayName("Climate damage feedback lowers later GDP")
    void run_shouldApplyDamageFeedback() {
        // Arrange
        Map<Region, double[]> damage = new EnumMap<>(Region.class);
        for (Region r : Region.values()) {
            double[] d = new double[SimulationConstants.YEAR_COUNT];
            Arrays.fill(d, 0.05);
            damage.put(r, d);
        }
        double[] burden = new double[SimulationConstants.YEAR_COUNT];

        // Act
        DemandData free = model.run(demographics, DemandFeedback.none());
        DemandData damaged = model.run(demographics, DemandFeedback.of(damage, burden));

        // Assert
        int last = SimulationConstants.YEAR_COUNT - 1;
        assertThat(damaged.global().gdp(0)).isCloseTo(free.global().gdp(0), within(1e-9));
        assertThat(damaged.global().gdp(last)).isLessThan(free.global().gdp(last));
    }

    @Test
    @DisplayName("Higher efficiency multiplier lowers 2100 demand")
    void run_shouldRespondToEfficiency() {
        DemandData base = model.run(demographics, DemandFeedback.none());
        DemandData efficient = new DemandModel(ModelParameters.defaults(), 2.0).run(demographics, DemandFeedback.none());

        int last = SimulationConstants.YEAR_COUNT - 1;
        assertThat(efficient.global().electricityDemand(last)).isLessThan(base.global().electricityDemand(last));
    }

    @Test
    @DisplayName("A region without population or workforce keeps every demand series finite")
    void run_shouldStayFiniteWithEmptyRegion() {
        // Arrange
        DemographicsData empty = new CohortDemographicsModel()
                .project(withEmptyRegion(ModelParameters.defaults().demographics(), Region.ROW));

        // Act
        DemandData data = model.run(empty, DemandFeedback.none());

        // Assert
        DemandSeries row = data.region(Region.ROW);
        assertThat(row.gdpPerWorking()).containsOnly(0.0);
        assertThat(row.electricityPerWorking()).containsOnly(0.0);
        assertThat(row.growthRate()).allSatisfy(v -> assertThat(v).isFinite());
        assertThat(data.global().gdp()).allSatisfy(v -> assertThat(v).isPositive().isFinite());
        assertThat(data.global().finalEnergyPerCapitaDay()).allSatisfy(v -> assertThat(v).isPositive().isFinite());
    }

    @Test
    @DisplayName("Per-person ratios fall back to zero for an empty denominator")
    void perUnit_shouldGuardZeroDenominator() {
        assertThat(DemandModel.perUnit(10.0, 0.0)).isZero();
        assertThat(DemandModel.perUnit(10.0, 4.0)).isEqualTo(2.5);
    }

    private static DemographicParams withEmptyRegion(DemographicParams p, Region empty) {
        Map<Region, RegionDemography> regions = new EnumMap<>(p.regions());
        RegionDemography d = regions.get(empty);
        regions.put(empty, new RegionDemography(0.0, d.fertility(), d.fertilityFloor(), d.fertilityDecay(),
                d.lifeExpectancy(), d.young(), d.working(), d.old(), d.migrationRate()));
        return new DemographicParams(regions, p.education(), p.lifeExpectancyGrowth(),
                p.fertilityFloorMultiplier(), p.migrationMultiplier());
    }
}
