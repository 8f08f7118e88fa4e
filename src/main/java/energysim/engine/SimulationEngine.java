package energysim.engine;

import energysim.config.DispatchSource;
import energysim.config.EffectiveParameters;
import energysim.config.Fuel;
import energysim.config.ModelParameters;
import energysim.config.Region;
import energysim.config.ScenarioParameters;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.capacity.CapacitySnapshot;
import energysim.engine.capacity.CapacityState;
import energysim.engine.capacity.CapacityStateMachine;
import energysim.engine.capital.CapitalModel;
import energysim.engine.capital.SavingsRates;
import energysim.engine.climate.ClimateModel;
import energysim.engine.climate.ClimateState;
import energysim.engine.climate.EmissionsBreakdown;
import energysim.engine.cost.CostModel;
import energysim.engine.cost.ExtractionLedger;
import energysim.engine.cost.LcoeSet;
import energysim.engine.demand.DemandData;
import energysim.engine.demand.DemandExpansion;
import energysim.engine.demand.DemandFeedback;
import energysim.engine.demand.DemandModel;
import energysim.engine.demand.EnergyBurden;
import energysim.engine.demand.EnergyCost;
import energysim.engine.demand.EnergyCostModel;
import energysim.engine.demand.ExpansionResult;
import energysim.engine.demographics.CohortDemographicsModel;
import energysim.engine.demographics.DemographicsData;
import energysim.engine.demographics.DemographicsProvider;
import energysim.engine.dispatch.DispatchResult;
import energysim.engine.dispatch.MeritOrderDispatcher;
import energysim.engine.resources.ResourceData;
import energysim.engine.resources.ResourceModel;
import energysim.engine.trace.NoTraceSession;
import energysim.engine.trace.TraceSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Оркестратор прогона 2025–2100.
 * Порядок:
 * - демография;
 * - первый проход спроса без обратной связи;
 * - быстрый предварительный проход климата и энергетической нагрузки;
 * - второй проход спроса с запаздывающей обратной связью;
 * - основной цикл по годам (мощности, LCOE, расширение спроса, диспетчеризация,
 *   выбросы, климат, ущерб, нагрузка, инвестиции, ввод мощностей на следующий год);
 * - модель ресурсов и поправка выбросов на землепользование.
 * <p>
 * ВАЖНО:
 * - прогон детерминирован, общего изменяемого состояния между прогонами нет;
 * - базовые параметры не изменяются, эффективная копия строится на каждый прогон.
 */
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private final ModelParameters baseParameters;
    private final ScenarioParameters scenario;
    private final DemographicsProvider demographicsProvider;

    public SimulationEngine(ModelParameters baseParameters, ScenarioParameters scenario) {
        this(baseParameters, scenario, new CohortDemographicsModel());
    }

    public SimulationEngine(ModelParameters baseParameters,
                            ScenarioParameters scenario,
                            DemographicsProvider demographicsProvider) {
        this.baseParameters = Objects.requireNonNull(baseParameters, "baseParameters");
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.demographicsProvider = Objects.requireNonNull(demographicsProvider, "demographicsProvider");
    }

    public SimulationResult run() {
        return run(new NoTraceSession());
    }

    public SimulationResult run(TraceSession trace) {
        ModelParameters p = EffectiveParameters.resolve(baseParameters, scenario);
        double carbonPrice = scenario.getCarbonPrice();
        log.info("Simulation start: carbonPrice={}, solarAlpha={}, climSensitivity={}",
                carbonPrice, scenario.getSolarAlpha(), scenario.getClimSensitivity());

        // ===== Демография и спрос =====
        DemographicsData demographics = demographicsProvider.project(p.demographics());
        DemandModel demandModel = new DemandModel(p, scenario.getEfficiencyMultiplier());
        DemandData firstPass = demandModel.run(demographics, DemandFeedback.none());
        log.debug("Demand pass 1 done: electricity 2100 = {} TWh",
                firstPass.global().electricityDemand(SimulationConstants.YEAR_COUNT - 1));

        ClimateModel climate = new ClimateModel(p);
        EnergyCostModel costs = new EnergyCostModel(p);
        DemandFeedback feedback = new FeedbackPrePass(p, climate, costs).estimate(firstPass, carbonPrice);
        DemandData demand = demandModel.run(demographics, feedback);
        log.debug("Demand pass 2 done: electricity 2100 = {} TWh",
                demand.global().electricityDemand(SimulationConstants.YEAR_COUNT - 1));

        // ===== Основной цикл =====
        CapacityState capacity = CapacityState.initial(p.energySources());
        List<YearState> years = mainLoop(p, carbonPrice, demographics, demand, climate, costs, capacity, trace);

        // ===== Ресурсы и землепользование =====
        double[] temperature = new double[years.size()];
        for (int i = 0; i < temperature.length; i++) {
            temperature[i] = years.get(i).temperature();
        }
        ResourceData resources = new ResourceModel(p.resources())
                .run(demographics.global(), demand, capacity, temperature, p.climate().currentTemp());
        List<YearState> adjusted = applyLandUse(years, resources, p.climate().cumulativeCO2_2025());

        // пик по выбросам основного цикла, без поправки на землепользование
        int peakYear = SimulationConstants.START_YEAR;
        double peakValue = Double.NEGATIVE_INFINITY;
        for (YearState y : years) {
            if (y.emissions().total() > peakValue) {
                peakValue = y.emissions().total();
                peakYear = y.year();
            }
        }

        YearState last = adjusted.get(adjusted.size() - 1);
        log.info("Simulation done: warming 2100 = {} °C, cumulative = {} Gt",
                String.format("%.2f", last.temperature()), String.format("%.0f", last.cumulativeEmissions()));

        return new SimulationResult(p, scenario, adjusted, demographics, firstPass, demand, capacity, resources,
                peakYear, peakValue);
    }

    private List<YearState> mainLoop(ModelParameters p,
                                     double carbonPrice,
                                     DemographicsData demographics,
                                     DemandData demand,
                                     ClimateModel climate,
                                     EnergyCostModel costs,
                                     CapacityState capacity,
                                     TraceSession trace) {
        CostModel costModel = new CostModel(p);
        ExtractionLedger extraction = new ExtractionLedger(p.cost(), p.energySources());
        CapacityStateMachine capacityMachine = new CapacityStateMachine(p);
        MeritOrderDispatcher dispatcher = new MeritOrderDispatcher(p);
        DemandExpansion expansion = new DemandExpansion(p.expansion());
        CapitalModel capitalModel = new CapitalModel(p.capital());

        List<YearState> out = new ArrayList<>(SimulationConstants.YEAR_COUNT);
        ClimateState climateState = climate.initialState();
        double capital = capitalModel.initialCapital();
        double previousAdjusted = demand.global().electricityDemand(0);
        int lastIndex = SimulationConstants.YEAR_COUNT - 1;

        for (int i = 0; i <= lastIndex; i++) {
            int year = SimulationConstants.yearAt(i);
            CapacitySnapshot snapshot = capacity.snapshot(i);

            // ===== LCOE =====
            DispatchResult previousDispatch = i > 0 ? out.get(i - 1).dispatch() : null;
            extraction.accrue(SourceType.GAS, previousDispatch == null ? null : previousDispatch.generation(DispatchSource.GAS));
            extraction.accrue(SourceType.COAL, previousDispatch == null ? null : previousDispatch.generation(DispatchSource.COAL));
            LcoeSet lcoe = costModel.lcoeForYear(capacity, i, extraction, carbonPrice);

            // ===== Расширение спроса и потолок =====
            double effectiveWorkers = demographics.global().effectiveWorkers(i);
            double robots = capitalModel.robotsDensity(capital, effectiveWorkers, year);
            ExpansionResult expanded = expansion.expand(demand.global().electricityDemand(i), lcoe.cheapestClean(),
                    year, demographics.global().working(i), OptionalDouble.of(robots));
            SavingsRates savings = capitalModel.aggregateSavings(demographics, i);
            double demandTwh = Math.min(expanded.adjustedDemand(),
                    expansion.infrastructureCeiling(previousAdjusted, savings.global()));
            previousAdjusted = demandTwh;

            // ===== Диспетчеризация и выбросы =====
            DispatchResult dispatch = dispatcher.dispatch(demandTwh, lcoe, snapshot);
            Map<Fuel, Double> fuels = demand.global().fuelsAt(i);
            EmissionsBreakdown emissions = new EmissionsBreakdown(
                    climate.electricityEmissions(dispatch), climate.nonElectricEmissions(fuels), 0.0);
            climateState = climate.advance(climateState, emissions.total());

            // ===== Ущерб =====
            Map<Region, Double> damage = new EnumMap<>(Region.class);
            double gross = 0.0;
            double net = 0.0;
            for (Region r : Region.values()) {
                double d = climate.damageFraction(climateState.temperature(), r);
                double regionGdp = demand.region(r).gdp(i);
                damage.put(r, d);
                gross += regionGdp;
                net += regionGdp * (1 - d);
            }
            double globalDamage = gross > 0 ? 1 - net / gross : 0.0;

            EnergyCost energyCost = costs.cost(dispatch, lcoe, fuels, carbonPrice);
            EnergyBurden burden = costs.burden(energyCost.total(), gross);

            // ===== Капитал =====
            double stability = capitalModel.stabilityFactor(globalDamage);
            double investment = CapitalModel.investment(net, savings.global(), stability);

            YearState state = new YearState(year, snapshot.asMap(), lcoe, expanded, demandTwh, dispatch, emissions,
                    climateState.cumulativeEmissions(), climateState.co2ppm(), climateState.temperature(),
                    damage, globalDamage, gross, net, energyCost, burden, savings, stability, capital, investment,
                    capitalModel.interestRate(gross, capital), robots,
                    CapitalModel.capitalPerWorker(capital, effectiveWorkers));
            out.add(state);
            if (trace.enabled()) {
                trace.recordYear(state);
            }

            if (i < lastIndex) {
                capacityMachine.advance(capacity, i + 1, demandTwh, investment);
                capital = capitalModel.nextCapital(capital, investment);
            }
        }
        return out;
    }

    /**
     * Добавляет поток углерода землепользования к выбросам и пересчитывает
     * накопленные выбросы от уровня 2025 года.
     */
    static List<YearState> applyLandUse(List<YearState> years, ResourceData resources, double cumulative2025) {
        List<YearState> out = new ArrayList<>(years.size());
        double cumulative = cumulative2025;
        for (int i = 0; i < years.size(); i++) {
            YearState y = years.get(i);
            double flux = resources.carbon().get(i).netFlux();
            cumulative += y.emissions().total() + flux;
            out.add(y.withLandUse(flux, cumulative));
        }
        return out;
    }
}
