package energysim.engine;

import energysim.config.DispatchSource;
import energysim.config.ModelParameters;
import energysim.config.Region;
import energysim.config.ScenarioParameters;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.capacity.CapacityState;
import energysim.engine.demand.DemandData;
import energysim.engine.demographics.DemographicsData;
import energysim.engine.resources.ResourceData;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Результат одного прогона: состояния лет и выходы сопутствующих моделей.
 * <p>
 * Ущерб в рядах {@link #globalDamagesPercent()} и {@link #regionalDamagesPercent(Region)}
 * выражен в процентах ВВП, в {@link YearState} в долях.
 */
public final class SimulationResult {

    private final ModelParameters parameters;
    private final ScenarioParameters scenario;
    private final List<YearState> years;
    private final DemographicsData demographics;
    private final DemandData firstPassDemand;
    private final DemandData demand;
    private final CapacityState capacity;
    private final ResourceData resources;
    private final int peakEmissionsYear;
    private final double peakEmissionsValue;

    SimulationResult(ModelParameters parameters,
                     ScenarioParameters scenario,
                     List<YearState> years,
                     DemographicsData demographics,
                     DemandData firstPassDemand,
                     DemandData demand,
                     CapacityState capacity,
                     ResourceData resources,
                     int peakEmissionsYear,
                     double peakEmissionsValue) {
        this.parameters = parameters;
        this.scenario = scenario;
        this.years = List.copyOf(years);
        this.demographics = demographics;
        this.firstPassDemand = firstPassDemand;
        this.demand = demand;
        this.capacity = capacity;
        this.resources = resources;
        this.peakEmissionsYear = peakEmissionsYear;
        this.peakEmissionsValue = peakEmissionsValue;
    }

    // --------- Getters ---------

    /**
     * Эффективные параметры модели этого прогона.
     */
    public ModelParameters getParameters() {
        return parameters;
    }

    public ScenarioParameters getScenario() {
        return scenario;
    }

    public List<YearState> getYears() {
        return years;
    }

    public YearState year(int year) {
        return years.get(SimulationConstants.yearIndex(year));
    }

    public DemographicsData getDemographics() {
        return demographics;
    }

    public DemandData getFirstPassDemand() {
        return firstPassDemand;
    }

    public DemandData getDemand() {
        return demand;
    }

    public CapacityState getCapacity() {
        return capacity;
    }

    public ResourceData getResources() {
        return resources;
    }

    public int getPeakEmissionsYear() {
        return peakEmissionsYear;
    }

    public double getPeakEmissionsValue() {
        return peakEmissionsValue;
    }

    // --------- Ряды ---------

    public double[] series(ToDoubleFunction<YearState> field) {
        double[] out = new double[years.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = field.applyAsDouble(years.get(i));
        }
        return out;
    }

    public int[] yearNumbers() {
        return SimulationConstants.years();
    }

    public double[] lcoe(DispatchSource source) {
        return series(y -> y.lcoe().forDispatch(source));
    }

    /**
     * Стоимость накопителей, $/kWh.
     */
    public double[] batteryCost() {
        return series(y -> y.lcoe().battery());
    }

    public double[] generation(DispatchSource source) {
        return series(y -> y.dispatch().generation(source));
    }

    public double[] installedCapacity(SourceType source) {
        return series(y -> y.capacity(source));
    }

    public double[] gridIntensity() {
        return series(y -> y.dispatch().gridIntensity());
    }

    public double[] emissions() {
        return series(y -> y.emissions().total());
    }

    public double[] cumulativeEmissions() {
        return series(YearState::cumulativeEmissions);
    }

    public double[] temperature() {
        return series(YearState::temperature);
    }

    public double[] globalDamagesPercent() {
        return series(y -> y.globalDamage() * 100.0);
    }

    public double[] regionalDamagesPercent(Region region) {
        return series(y -> y.regionalDamage(region) * 100.0);
    }

    public double[] adjustedDemand() {
        return series(YearState::demandTwh);
    }
}
