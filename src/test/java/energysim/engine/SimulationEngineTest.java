package energysim.engine;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.config.ScenarioParametersBuilder;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.capacity.SourceHistory;
import energysim.engine.dispatch.DispatchResult;
import energysim.engine.trace.ArrayTraceSession;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("integration")
class SimulationEngineTest {

    private static final ModelParameters MODEL = ModelParameters.defaults();

    private static SimulationResult baseline;

    @BeforeAll
    static void runBaseline() {
        baseline = new SimulationEngine(MODEL, ScenarioParameters.defaults()).run();
    }

    private static SimulationResult runWithCarbonPrice(double carbonPrice) {
        ScenarioParameters sp = ScenarioParametersBuilder.from(ScenarioParameters.defaults())
                .setCarbonPrice(carbonPrice)
                .build();
        return new SimulationEngine(MODEL, sp).run();
    }

    @Test
    @DisplayName("Result covers 2025 through 2100")
    void run_shouldProduceEveryYear() {
        assertThat(baseline.getYears()).hasSize(SimulationConstants.YEAR_COUNT);
        assertThat(baseline.getYears().get(0).year()).isEqualTo(2025);
        assertThat(baseline.getYears().get(SimulationConstants.YEAR_COUNT - 1).year()).isEqualTo(2100);
    }

    @Test
    @DisplayName("Identical inputs give identical trajectories")
    void run_shouldBeDeterministic() {
        SimulationResult again = new SimulationEngine(MODEL, ScenarioParameters.defaults()).run();

        assertThat(again.temperature()).containsExactly(baseline.temperature());
        assertThat(again.emissions()).containsExactly(baseline.emissions());
        assertThat(again.installedCapacity(SourceType.SOLAR)).containsExactly(baseline.installedCapacity(SourceType.SOLAR));
    }

    @Test
    @DisplayName("2025 starts from the observed fleet and climate")
    void run_shouldStartFromObservedState() {
        YearState first = baseline.year(2025);

        assertThat(first.capacity(SourceType.SOLAR)).isEqualTo(1500.0);
        assertThat(first.temperature()).isCloseTo(1.2, within(0.12));
        assertThat(first.demandTwh()).isCloseTo(30_000, within(4_000.0));
        assertThat(baseline.getDemographics().global().population(0)).isCloseTo(8.3e9, within(1e8));
        assertThat(first.dispatch().gridIntensity()).isBetween(200.0, 500.0);
        assertThat(first.emissions().total()).isBetween(25.0, 50.0);
    }

    @Test
    @DisplayName("Coal capacity declines every year")
    void run_shouldRetireCoal() {
        double[] coal = baseline.installedCapacity(SourceType.COAL);

        for (int i = 1; i < coal.length; i++) {
            assertThat(coal[i]).as("year %d", 2025 + i).isLessThan(coal[i - 1]);
        }
    }

    @Test
    @DisplayName("Dispatched generation plus shortfall meets demand")
    void run_shouldBalanceDispatch() {
        for (YearState y : baseline.getYears()) {
            DispatchResult d = y.dispatch();
            double generated = d.generation().values().stream().mapToDouble(Double::doubleValue).sum();
            assertThat(generated + d.shortfall())
                    .as("year %d", y.year())
                    .isCloseTo(y.demandTwh(), within(1e-6 * Math.max(1.0, y.demandTwh())));
        }
    }

    @Test
    @DisplayName("Capacity history keeps installed = previous + additions - retirements")
    void run_shouldKeepCapacityBalance() {
        for (SourceType s : SourceType.values()) {
            SourceHistory h = baseline.getCapacity().history(s);
            for (int i = 1; i < h.size(); i++) {
                assertThat(h.installed(i))
                        .as("%s year %d", s, i)
                        .isCloseTo(h.installed(i - 1) + h.additions(i) - h.retirements(i), within(1e-6));
            }
        }
    }

    @Test
    @DisplayName("Baseline 2100 warming lands between 2.0 and 3.5 C and never falls while emissions are positive")
    void run_shouldWarmPlausibly() {
        double[] t = baseline.temperature();

        assertThat(t[t.length - 1]).isBetween(2.0, 3.5);
        for (int i = 1; i < t.length; i++) {
            assertThat(t[i]).as("year %d", 2025 + i).isGreaterThanOrEqualTo(t[i - 1] - 1e-9);
        }
    }

    @Test
    @DisplayName("Without a carbon price 2100 warming lands between 2 and 4 C")
    void run_shouldWarmUnderBusinessAsUsual() {
        SimulationResult bau = runWithCarbonPrice(0);

        double t2100 = bau.temperature()[SimulationConstants.YEAR_COUNT - 1];
        assertThat(t2100).isBetween(2.0, 4.0);
    }

    @Test
    @DisplayName("A high carbon price lowers 2100 warming")
    void run_shouldCoolUnderHighCarbonPrice() {
        SimulationResult high = runWithCarbonPrice(150);

        int last = SimulationConstants.YEAR_COUNT - 1;
        assertThat(high.temperature()[last]).isLessThan(baseline.temperature()[last]);
        assertThat(high.temperature()[last]).isLessThan(2.6);
    }

    @Test
    @DisplayName("Raising the carbon price from 35 to 70 lowers 2100 warming")
    void run_shouldCoolWhenCarbonPriceDoubles() {
        SimulationResult doubled = runWithCarbonPrice(70);

        int last = SimulationConstants.YEAR_COUNT - 1;
        assertThat(doubled.temperature()[last]).isLessThan(baseline.temperature()[last]);
    }

    @Test
    @DisplayName("Doubling the carbon price adds its carbon cost to 2025 fossil LCOE")
    void run_shouldPassCarbonPriceIntoFossilLcoe() {
        SimulationResult doubled = runWithCarbonPrice(70);

        YearState base = baseline.year(2025);
        YearState high = doubled.year(2025);
        assertThat(high.lcoe().gas() - base.lcoe().gas()).isCloseTo(14.0, within(1e-9));
        assertThat(high.lcoe().coal() - base.lcoe().coal()).isCloseTo(31.5, within(1e-9));
        assertThat(high.lcoe().solar()).isCloseTo(base.lcoe().solar(), within(1e-12));
    }

    @Test
    @DisplayName("Trace session receives one record per year")
    void run_shouldFeedTraceSession() {
        ArrayTraceSession trace = new ArrayTraceSession();

        new SimulationEngine(MODEL, ScenarioParameters.defaults()).run(trace);

        assertThat(trace.records()).hasSize(SimulationConstants.YEAR_COUNT);
        assertThat(trace.records().get(0).year()).isEqualTo(2025);
    }

    @Test
    @DisplayName("Land-use flux from the resource sweep is folded into yearly emissions")
    void run_shouldIncludeLandFlux() {
        for (int i = 0; i < SimulationConstants.YEAR_COUNT; i++) {
            YearState y = baseline.getYears().get(i);
            assertThat(y.emissions().landUse())
                    .isCloseTo(baseline.getResources().carbon().get(i).netFlux(), within(1e-12));
        }
        assertThat(baseline.getPeakEmissionsYear()).isBetween(2025, 2100);
    }
}
