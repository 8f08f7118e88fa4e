package energysim.engine.demand;

import energysim.config.Fuel;
import energysim.config.Sector;
import energysim.config.SimulationConstants;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Ряды спроса одного региона или мира.
 * <p>
 * growthRate и energyIntensity заполняются только для регионов,
 * electrificationRate и finalEnergyPerCapitaDay только для мира.
 */
public final class DemandSeries {

    private final double[] gdp = new double[SimulationConstants.YEAR_COUNT];
    private final double[] growthRate = new double[SimulationConstants.YEAR_COUNT];
    private final double[] energyIntensity = new double[SimulationConstants.YEAR_COUNT];
    private final double[] electricityDemand = new double[SimulationConstants.YEAR_COUNT];
    private final double[] electrificationRate = new double[SimulationConstants.YEAR_COUNT];
    private final double[] gdpPerWorking = new double[SimulationConstants.YEAR_COUNT];
    private final double[] electricityPerWorking = new double[SimulationConstants.YEAR_COUNT];
    private final double[] totalFinalEnergy = new double[SimulationConstants.YEAR_COUNT];
    private final double[] nonElectricEnergy = new double[SimulationConstants.YEAR_COUNT];
    private final double[] finalEnergyPerCapitaDay = new double[SimulationConstants.YEAR_COUNT];
    private final Map<Sector, SectorSeries> sectors = new EnumMap<>(Sector.class);
    private final Map<Fuel, double[]> fuels = new EnumMap<>(Fuel.class);

    DemandSeries() {
        for (Sector s : Sector.values()) {
            sectors.put(s, new SectorSeries());
        }
        for (Fuel f : Fuel.values()) {
            fuels.put(f, new double[SimulationConstants.YEAR_COUNT]);
        }
    }

    // --------- запись (пакет demand) ---------

    void recordEconomy(int i, double gdpT, double growth, double intensity) {
        gdp[i] = gdpT;
        growthRate[i] = growth;
        energyIntensity[i] = intensity;
    }

    void recordEnergy(int i, double electricity, double totalFinal, double nonElectric) {
        electricityDemand[i] = electricity;
        totalFinalEnergy[i] = totalFinal;
        nonElectricEnergy[i] = nonElectric;
    }

    void recordPerWorking(int i, double gdpPerPerson, double kwhPerPerson) {
        gdpPerWorking[i] = gdpPerPerson;
        electricityPerWorking[i] = kwhPerPerson;
    }

    void recordGlobal(int i, double electrification, double perCapitaDay) {
        electrificationRate[i] = electrification;
        finalEnergyPerCapitaDay[i] = perCapitaDay;
    }

    void addFuel(int i, Fuel fuel, double twh) {
        fuels.get(fuel)[i] += twh;
    }

    SectorSeries sectorSeries(Sector sector) {
        return sectors.get(sector);
    }

    // --------- Getters ---------

    public double gdp(int i) {
        return gdp[i];
    }

    public double electricityDemand(int i) {
        return electricityDemand[i];
    }

    public double electrificationRate(int i) {
        return electrificationRate[i];
    }

    public double totalFinalEnergy(int i) {
        return totalFinalEnergy[i];
    }

    public double fuel(Fuel fuel, int i) {
        return fuels.get(fuel)[i];
    }

    /**
     * Потребление топлива за год, TWh.
     */
    public Map<Fuel, Double> fuelsAt(int i) {
        Map<Fuel, Double> out = new EnumMap<>(Fuel.class);
        for (Map.Entry<Fuel, double[]> e : fuels.entrySet()) {
            out.put(e.getKey(), e.getValue()[i]);
        }
        return out;
    }

    public SectorSeries sector(Sector sector) {
        return sectors.get(sector);
    }

    public Map<Sector, SectorSeries> sectors() {
        return Collections.unmodifiableMap(sectors);
    }

    public double[] fuel(Fuel fuel) {
        return fuels.get(fuel).clone();
    }

    public double[] gdp() {
        return gdp.clone();
    }

    public double[] growthRate() {
        return growthRate.clone();
    }

    public double[] energyIntensity() {
        return energyIntensity.clone();
    }

    public double[] electricityDemand() {
        return electricityDemand.clone();
    }

    public double[] electrificationRate() {
        return electrificationRate.clone();
    }

    public double[] gdpPerWorking() {
        return gdpPerWorking.clone();
    }

    public double[] electricityPerWorking() {
        return electricityPerWorking.clone();
    }

    public double[] totalFinalEnergy() {
        return totalFinalEnergy.clone();
    }

    public double[] nonElectricEnergy() {
        return nonElectricEnergy.clone();
    }

    public double[] finalEnergyPerCapitaDay() {
        return finalEnergyPerCapitaDay.clone();
    }
}
