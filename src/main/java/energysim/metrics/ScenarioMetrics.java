package energysim.metrics;

import energysim.config.DispatchSource;
import energysim.config.Fuel;
import energysim.config.Mineral;
import energysim.config.Region;
import energysim.config.Sector;
import energysim.config.SimulationConstants;
import energysim.engine.SimulationResult;
import energysim.engine.YearState;
import energysim.engine.demand.DemandSeries;
import energysim.engine.demographics.CohortSeries;
import energysim.engine.demographics.DemographicsData;
import energysim.engine.resources.CarbonFlux;
import energysim.engine.resources.FoodDemand;
import energysim.engine.resources.LandUse;
import energysim.engine.resources.MineralDemand;
import energysim.engine.resources.ResourceData;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Плоский набор сводных показателей прогона.
 * <p>
 * Значение {@code null} означает, что событие (пересечение, порог) в горизонте
 * моделирования не наступило.
 */
public final class ScenarioMetrics {

    /** Доля EM, относимая к Азиатско-Тихоокеанскому региону. */
    private static final double EM_ASIA_SHARE = 0.6;

    private static final double KWH_PER_TWH = 1e9;

    private final Map<ScenarioMetric, Double> values;

    private ScenarioMetrics(Map<ScenarioMetric, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public Double get(ScenarioMetric metric) {
        return values.get(metric);
    }

    /**
     * Год события, если оно наступило.
     */
    public OptionalInt year(ScenarioMetric metric) {
        if (metric.kind() != ScenarioMetric.Kind.YEAR) {
            throw new IllegalArgumentException(metric.key() + " is not a year metric");
        }
        Double v = values.get(metric);
        return v == null ? OptionalInt.empty() : OptionalInt.of(v.intValue());
    }

    /**
     * Все показатели в порядке объявления; отсутствующие события дают null.
     */
    public Map<ScenarioMetric, Double> asMap() {
        return values;
    }

    public static ScenarioMetrics of(SimulationResult result) {
        Map<ScenarioMetric, Double> m = new EnumMap<>(ScenarioMetric.class);
        for (ScenarioMetric metric : ScenarioMetric.values()) {
            m.put(metric, null);
        }
        int[] years = result.yearNumbers();
        int i2025 = 0;
        int i2050 = SimulationConstants.yearIndex(2050);
        int i2075 = SimulationConstants.yearIndex(2075);
        int i2100 = years.length - 1;

        crossovers(result, years, m);
        climate(result, years, m, i2025, i2050, i2075, i2100);
        demand(result, years, m, i2025, i2050, i2100);
        demographics(result.getDemographics(), years, m, i2025, i2050, i2075, i2100);
        capital(result, m, i2025, i2050, i2075, i2100);
        resources(result.getResources(), years, m, i2025, i2050, i2100);
        return new ScenarioMetrics(m);
    }

    // ===== Пересечения =====

    private static void crossovers(SimulationResult r, int[] years, Map<ScenarioMetric, Double> m) {
        double[] solar = r.lcoe(DispatchSource.SOLAR);
        double[] solarBattery = r.lcoe(DispatchSource.SOLAR_PLUS_BATTERY);
        double[] wind = r.lcoe(DispatchSource.WIND);
        double[] gas = r.lcoe(DispatchSource.GAS);
        double[] coal = r.lcoe(DispatchSource.COAL);

        putYear(m, ScenarioMetric.SOLAR_CROSSES_GAS, SeriesQueries.firstCrossBelow(years, solar, gas));
        putYear(m, ScenarioMetric.SOLAR_BATTERY_CROSSES_GAS, SeriesQueries.firstCrossBelow(years, solarBattery, gas));
        putYear(m, ScenarioMetric.COAL_UNECONOMIC,
                SeriesQueries.firstCrossAbove(years, coal, SeriesQueries.min(solar, wind)));
        putYear(m, ScenarioMetric.WIND_CROSSES_GAS, SeriesQueries.firstCrossBelow(years, wind, gas));

        DemandSeries oecd = r.getDemand().region(Region.OECD);
        DemandSeries china = r.getDemand().region(Region.CHINA);
        DemandSeries em = r.getDemand().region(Region.EM);
        putCrossover(m, ScenarioMetric.CHINA_ELEC_CROSSES_OECD,
                SeriesQueries.crossover(years, china.electricityDemand(), oecd.electricityDemand()));
        putCrossover(m, ScenarioMetric.EM_ELEC_CROSSES_CHINA,
                SeriesQueries.crossover(years, em.electricityDemand(), china.electricityDemand()));
        putCrossover(m, ScenarioMetric.CHINA_PER_CAP_ELEC_CROSSES_OECD,
                SeriesQueries.crossover(years,
                        electricityPerCapita(r, Region.CHINA), electricityPerCapita(r, Region.OECD)));

        double[] grid = r.gridIntensity();
        putYear(m, ScenarioMetric.GRID_BELOW_200, SeriesQueries.firstBelow(years, grid, 200));
        putYear(m, ScenarioMetric.GRID_BELOW_100, SeriesQueries.firstBelow(years, grid, 100));
        putYear(m, ScenarioMetric.GRID_BELOW_50, SeriesQueries.firstBelow(years, grid, 50));
    }

    // ===== Климат и нагрузка =====

    private static void climate(SimulationResult r, int[] years, Map<ScenarioMetric, Double> m,
                                int i2025, int i2050, int i2075, int i2100) {
        double[] damages = r.globalDamagesPercent();
        double[] grid = r.gridIntensity();
        double[] emissions = r.emissions();

        m.put(ScenarioMetric.PEAK_EMISSIONS_YEAR, (double) r.getPeakEmissionsYear());
        m.put(ScenarioMetric.PEAK_EMISSIONS_GT, r.getPeakEmissionsValue());
        m.put(ScenarioMetric.WARMING_2100, r.temperature()[i2100]);
        m.put(ScenarioMetric.DAMAGES_2075, damages[i2075]);
        m.put(ScenarioMetric.DAMAGES_2100, damages[i2100]);
        m.put(ScenarioMetric.GRID_INTENSITY_2025, grid[i2025]);
        m.put(ScenarioMetric.GRID_INTENSITY_2050, grid[i2050]);
        m.put(ScenarioMetric.GRID_INTENSITY_2100, grid[i2100]);
        m.put(ScenarioMetric.EMISSIONS_2025, emissions[i2025]);
        m.put(ScenarioMetric.EMISSIONS_2050, emissions[i2050]);
        m.put(ScenarioMetric.EMISSIONS_2100, emissions[i2100]);

        double[] burden = r.series(y -> y.energyBurden().burden());
        double[] cost = r.series(y -> y.energyCost().total());
        int peak = SeriesQueries.argMax(burden);
        m.put(ScenarioMetric.ENERGY_BURDEN_2025, burden[i2025]);
        m.put(ScenarioMetric.ENERGY_BURDEN_2050, burden[i2050]);
        m.put(ScenarioMetric.ENERGY_BURDEN_PEAK, burden[peak]);
        m.put(ScenarioMetric.ENERGY_BURDEN_PEAK_YEAR, (double) years[peak]);
        m.put(ScenarioMetric.ENERGY_COST_2025, cost[i2025]);
        m.put(ScenarioMetric.ENERGY_COST_2050, cost[i2050]);
    }

    // ===== Спрос и конечная энергия =====

    private static void demand(SimulationResult r, int[] years, Map<ScenarioMetric, Double> m,
                               int i2025, int i2050, int i2100) {
        DemandSeries global = r.getDemand().global();
        double[] elec = global.electricityDemand();
        m.put(ScenarioMetric.ELEC_2025, elec[i2025]);
        m.put(ScenarioMetric.ELEC_2050, elec[i2050]);
        m.put(ScenarioMetric.ELEC_2100, elec[i2100]);
        m.put(ScenarioMetric.ELECTRIFICATION_2050, global.electrificationRate(i2050));
        putYear(m, ScenarioMetric.DEMAND_DOUBLING,
                SeriesQueries.firstYear(years, elec, v -> v >= elec[0] * 2));
        double asia = r.getDemand().region(Region.CHINA).electricityDemand(i2050)
                + r.getDemand().region(Region.EM).electricityDemand(i2050) * EM_ASIA_SHARE;
        m.put(ScenarioMetric.ASIA_SHARE_2050, asia / elec[i2050]);

        double[] perCapita = SeriesQueries.perCapita(elec, r.getDemographics().global().population(), KWH_PER_TWH);
        m.put(ScenarioMetric.ELEC_PER_CAPITA_2025, perCapita[i2025]);
        m.put(ScenarioMetric.ELEC_PER_CAPITA_2050, perCapita[i2050]);
        m.put(ScenarioMetric.ELEC_PER_CAPITA_2100, perCapita[i2100]);
        m.put(ScenarioMetric.ELEC_PER_CAPITA_2050_OECD, electricityPerCapita(r, Region.OECD)[i2050]);
        m.put(ScenarioMetric.ELEC_PER_CAPITA_2050_CHINA, electricityPerCapita(r, Region.CHINA)[i2050]);
        m.put(ScenarioMetric.ELEC_PER_CAPITA_2050_EM, electricityPerCapita(r, Region.EM)[i2050]);
        m.put(ScenarioMetric.ELEC_PER_CAPITA_2050_ROW, electricityPerCapita(r, Region.ROW)[i2050]);

        YearState y2050 = r.getYears().get(i2050);
        YearState y2100 = r.getYears().get(i2100);
        m.put(ScenarioMetric.EXPANSION_MULTIPLIER_2050, y2050.expansion().expansionMultiplier());
        m.put(ScenarioMetric.EXPANSION_MULTIPLIER_2100, y2100.expansion().expansionMultiplier());
        m.put(ScenarioMetric.ROBOT_LOAD_TWH_2050, y2050.expansion().robotLoadTwh());
        m.put(ScenarioMetric.ROBOT_LOAD_TWH_2100, y2100.expansion().robotLoadTwh());
        m.put(ScenarioMetric.ADJUSTED_DEMAND_2050, y2050.demandTwh());
        m.put(ScenarioMetric.ADJUSTED_DEMAND_2100, y2100.demandTwh());
        m.put(ScenarioMetric.ROBOTS_PER_1000_2050, y2050.expansion().robotsPer1000());
        m.put(ScenarioMetric.ROBOTS_PER_1000_2100, y2100.expansion().robotsPer1000());

        double[] perDay = global.finalEnergyPerCapitaDay();
        m.put(ScenarioMetric.FINAL_ENERGY_PER_CAPITA_DAY_2025, perDay[i2025]);
        m.put(ScenarioMetric.FINAL_ENERGY_PER_CAPITA_DAY_2050, perDay[i2050]);
        m.put(ScenarioMetric.FINAL_ENERGY_PER_CAPITA_DAY_2100, perDay[i2100]);
        m.put(ScenarioMetric.TOTAL_FINAL_ENERGY_2025, global.totalFinalEnergy(i2025));
        m.put(ScenarioMetric.TOTAL_FINAL_ENERGY_2050, global.totalFinalEnergy(i2050));
        m.put(ScenarioMetric.TOTAL_FINAL_ENERGY_2100, global.totalFinalEnergy(i2100));
        double nonElectric = global.nonElectricEnergy()[i2050];
        m.put(ScenarioMetric.NON_ELECTRIC_ENERGY_2050, nonElectric);
        m.put(ScenarioMetric.TRANSPORT_ELECTRIFICATION_2050,
                global.sector(Sector.TRANSPORT).electrificationRate(i2050));
        m.put(ScenarioMetric.BUILDINGS_ELECTRIFICATION_2050,
                global.sector(Sector.BUILDINGS).electrificationRate(i2050));
        m.put(ScenarioMetric.INDUSTRY_ELECTRIFICATION_2050,
                global.sector(Sector.INDUSTRY).electrificationRate(i2050));
        m.put(ScenarioMetric.OIL_SHARE_OF_FINAL_2050, share(global.fuel(Fuel.OIL, i2050), nonElectric));
        m.put(ScenarioMetric.GAS_SHARE_OF_FINAL_2050, share(global.fuel(Fuel.GAS, i2050), nonElectric));
    }

    // ===== Демография =====

    private static void demographics(DemographicsData d, int[] years, Map<ScenarioMetric, Double> m,
                                     int i2025, int i2050, int i2075, int i2100) {
        CohortSeries global = d.global();
        CohortSeries china = d.region(Region.CHINA);
        m.put(ScenarioMetric.POP_PEAK_YEAR, (double) SeriesQueries.peak(years, global.population()).year());
        m.put(ScenarioMetric.POP_2100, global.population(i2100));
        m.put(ScenarioMetric.DEPENDENCY_2075, global.dependency(i2075));
        m.put(ScenarioMetric.CHINA_COLLEGE_PEAK_YEAR,
                (double) SeriesQueries.peak(years, china.workingCollege()).year());
        double[] college = global.collegeShare();
        m.put(ScenarioMetric.COLLEGE_SHARE_2025, college[i2025]);
        m.put(ScenarioMetric.COLLEGE_SHARE_2050, college[i2050]);
        m.put(ScenarioMetric.COLLEGE_SHARE_2100, college[i2100]);
        double[] chinaCollege = china.collegeShare();
        m.put(ScenarioMetric.CHINA_COLLEGE_SHARE_2025, chinaCollege[i2025]);
        m.put(ScenarioMetric.CHINA_COLLEGE_SHARE_2050, chinaCollege[i2050]);
    }

    // ===== Капитал =====

    private static void capital(SimulationResult r, Map<ScenarioMetric, Double> m,
                                int i2025, int i2050, int i2075, int i2100) {
        YearState y2025 = r.getYears().get(i2025);
        YearState y2050 = r.getYears().get(i2050);
        YearState y2075 = r.getYears().get(i2075);
        YearState y2100 = r.getYears().get(i2100);
        DemandSeries global = r.getDemand().global();

        m.put(ScenarioMetric.K_Y_2025, y2025.capital() / global.gdp(i2025));
        m.put(ScenarioMetric.K_Y_2050, y2050.capital() / global.gdp(i2050));
        m.put(ScenarioMetric.INTEREST_RATE_2025, y2025.interestRate());
        m.put(ScenarioMetric.INTEREST_RATE_2050, y2050.interestRate());
        m.put(ScenarioMetric.ROBOTS_DENSITY_2025, y2025.robotsDensity());
        m.put(ScenarioMetric.ROBOTS_DENSITY_2050, y2050.robotsDensity());
        m.put(ScenarioMetric.ROBOTS_DENSITY_2100, y2100.robotsDensity());
        m.put(ScenarioMetric.SAVINGS_RATE_2025, y2025.savings().global());
        m.put(ScenarioMetric.SAVINGS_RATE_2075, y2075.savings().global());
        m.put(ScenarioMetric.CAPITAL_STOCK_2025, y2025.capital());
        m.put(ScenarioMetric.CAPITAL_STOCK_2100, y2100.capital());
        m.put(ScenarioMetric.K_PER_WORKER_2025, y2025.capitalPerWorker());
        m.put(ScenarioMetric.K_PER_WORKER_2100, y2100.capitalPerWorker());
    }

    // ===== Ресурсы =====

    private static void resources(ResourceData res, int[] years, Map<ScenarioMetric, Double> m,
                                  int i2025, int i2050, int i2100) {
        mineral(res, Mineral.COPPER, years, m, i2050, i2100,
                ScenarioMetric.COPPER_PEAK_YEAR, ScenarioMetric.COPPER_PEAK_DEMAND,
                ScenarioMetric.COPPER_CUMULATIVE_2050, ScenarioMetric.COPPER_CUMULATIVE_2100,
                ScenarioMetric.COPPER_RESERVE_RATIO_2050, ScenarioMetric.COPPER_RESERVE_RATIO_2100);
        mineral(res, Mineral.LITHIUM, years, m, i2050, i2100,
                ScenarioMetric.LITHIUM_PEAK_YEAR, ScenarioMetric.LITHIUM_PEAK_DEMAND,
                ScenarioMetric.LITHIUM_CUMULATIVE_2050, ScenarioMetric.LITHIUM_CUMULATIVE_2100,
                ScenarioMetric.LITHIUM_RESERVE_RATIO_2050, ScenarioMetric.LITHIUM_RESERVE_RATIO_2100);

        FoodDemand f2050 = res.food().get(i2050);
        FoodDemand f2100 = res.food().get(i2100);
        m.put(ScenarioMetric.PROTEIN_SHARE_2050, f2050.proteinShare());
        m.put(ScenarioMetric.PROTEIN_SHARE_2100, f2100.proteinShare());
        m.put(ScenarioMetric.GLP1_EFFECT_2050, f2050.glp1Effect());
        m.put(ScenarioMetric.GRAIN_DEMAND_2050, f2050.grainEquivalent());
        m.put(ScenarioMetric.GRAIN_DEMAND_2100, f2100.grainEquivalent());

        LandUse l2025 = res.land().get(i2025);
        LandUse l2050 = res.land().get(i2050);
        LandUse l2100 = res.land().get(i2100);
        m.put(ScenarioMetric.FARMLAND_2025, l2025.farmland());
        m.put(ScenarioMetric.FARMLAND_2050, l2050.farmland());
        m.put(ScenarioMetric.FARMLAND_2100, l2100.farmland());
        m.put(ScenarioMetric.FARMLAND_CHANGE, (l2100.farmland() - l2025.farmland()) / l2025.farmland());
        m.put(ScenarioMetric.URBAN_2050, l2050.urban());
        m.put(ScenarioMetric.FOREST_2100, l2100.forest());
        m.put(ScenarioMetric.FOREST_LOSS, (l2025.forest() - l2100.forest()) / l2025.forest());
        m.put(ScenarioMetric.DESERT_2025, l2025.desert());
        m.put(ScenarioMetric.DESERT_2050, l2050.desert());
        m.put(ScenarioMetric.DESERT_2100, l2100.desert());

        double[] netFlux = res.carbonSeries(CarbonFlux::netFlux);
        m.put(ScenarioMetric.NET_FLUX_2025, netFlux[i2025]);
        m.put(ScenarioMetric.NET_FLUX_2050, netFlux[i2050]);
        m.put(ScenarioMetric.NET_FLUX_2100, netFlux[i2100]);
        m.put(ScenarioMetric.CUMULATIVE_SEQUESTRATION_2100, res.cumulativeSequestration()[i2100]);
    }

    private static void mineral(ResourceData res, Mineral mineral, int[] years, Map<ScenarioMetric, Double> m,
                                int i2050, int i2100,
                                ScenarioMetric peakYear, ScenarioMetric peakDemand,
                                ScenarioMetric cumulative2050, ScenarioMetric cumulative2100,
                                ScenarioMetric ratio2050, ScenarioMetric ratio2100) {
        SeriesQueries.Peak peak = SeriesQueries.peak(years, res.mineralSeries(mineral, MineralDemand::demand));
        m.put(peakYear, (double) peak.year());
        m.put(peakDemand, peak.value());
        MineralDemand d2050 = res.mineral(mineral).get(i2050);
        MineralDemand d2100 = res.mineral(mineral).get(i2100);
        m.put(cumulative2050, d2050.cumulative());
        m.put(cumulative2100, d2100.cumulative());
        m.put(ratio2050, d2050.reserveRatio());
        m.put(ratio2100, d2100.reserveRatio());
    }

    // ===== Вспомогательные =====

    /**
     * Электропотребление на душу населения региона, кВт·ч/чел.
     */
    public static double[] electricityPerCapita(SimulationResult r, Region region) {
        return SeriesQueries.perCapita(r.getDemand().region(region).electricityDemand(),
                r.getDemographics().region(region).population(), KWH_PER_TWH);
    }

    private static double share(double part, double total) {
        return total > 0 ? part / total : 0.0;
    }

    private static void putYear(Map<ScenarioMetric, Double> m, ScenarioMetric metric, OptionalInt year) {
        if (year.isPresent()) {
            m.put(metric, (double) year.getAsInt());
        }
    }

    private static void putCrossover(Map<ScenarioMetric, Double> m, ScenarioMetric metric,
                                     Optional<SeriesQueries.Crossover> crossover) {
        crossover.ifPresent(c -> m.put(metric, (double) c.year()));
    }
}
