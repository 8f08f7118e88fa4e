package energysim.engine.resources;

import energysim.config.Mineral;
import energysim.config.ResourceParams;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.capacity.CapacityState;
import energysim.engine.demand.DemandData;
import energysim.engine.demographics.CohortSeries;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Модель ресурсов, запускаемая после основного цикла.
 * <p>
 * Минералы считаются по фактическому приросту мощностей из состояния,
 * земли используют температуру предыдущего года.
 */
public final class ResourceModel {

    private static final SourceType[] MINERAL_SOURCES = {
            SourceType.SOLAR, SourceType.WIND, SourceType.BATTERY, SourceType.NUCLEAR
    };

    private final ResourceParams params;
    private final MineralModel minerals;
    private final FoodModel food;
    private final LandUseModel land;
    private final ForestCarbon forestCarbon;

    public ResourceModel(ResourceParams params) {
        this.params = params;
        this.minerals = new MineralModel(params);
        this.food = new FoodModel(params.food());
        this.land = new LandUseModel(params.land());
        this.forestCarbon = new ForestCarbon(params.land());
    }

    /**
     * @param population   глобальное население
     * @param demand       спрос второго прохода (глобальный ВВП)
     * @param capacity     состояние мощностей после основного цикла
     * @param temperature  температура по годам основного цикла
     * @param initialTemp  температура для 2025 года
     */
    public ResourceData run(CohortSeries population, DemandData demand, CapacityState capacity,
                            double[] temperature, double initialTemp) {
        Map<Mineral, List<MineralDemand>> mineralRows = new EnumMap<>(Mineral.class);
        Map<Mineral, Double> stock = new EnumMap<>(Mineral.class);
        for (Mineral m : Mineral.values()) {
            mineralRows.put(m, new ArrayList<>());
            stock.put(m, 0.0);
        }
        List<FoodDemand> foodRows = new ArrayList<>();
        List<LandUse> landRows = new ArrayList<>();
        List<CarbonFlux> carbonRows = new ArrayList<>();
        double[] cumulativeSeq = new double[SimulationConstants.YEAR_COUNT];

        double gdpPerCapita2025 = perCapita(demand.global().gdp(0), population.population(0));
        double decayPool = 0.0;
        double sequestered = 0.0;
        LandUse previousLand = null;

        for (int i = 0; i < SimulationConstants.YEAR_COUNT; i++) {
            int year = SimulationConstants.yearAt(i);
            double pop = population.population(i);
            double gdpPerCapita = perCapita(demand.global().gdp(i), pop);

            // ===== Минералы =====
            Map<SourceType, Double> additions = capacityAdditions(capacity, i);
            for (Mineral m : Mineral.values()) {
                MineralDemand row = minerals.demand(params.mineral(m), additions, i, stock.get(m));
                mineralRows.get(m).add(row);
                stock.put(m, row.cumulative());
            }

            // ===== Продовольствие и земли =====
            FoodDemand foodRow = food.demand(pop, gdpPerCapita, year);
            foodRows.add(foodRow);
            double laggedTemp = i > 0 ? temperature[i - 1] : initialTemp;
            LandUse landRow = land.landUse(foodRow, pop, gdpPerCapita, gdpPerCapita2025, year, laggedTemp, previousLand);
            landRows.add(landRow);

            // ===== Углерод лесов =====
            CarbonFlux flux = forestCarbon.flux(landRow.forestChange(), decayPool);
            carbonRows.add(flux);
            decayPool = flux.decayPool();
            sequestered += flux.sequestration();
            cumulativeSeq[i] = sequestered;
            previousLand = landRow;
        }
        return new ResourceData(mineralRows, foodRows, landRows, carbonRows, cumulativeSeq);
    }

    /**
     * Положительный прирост установленной мощности за год.
     * Для 2025 года предыдущая мощность оценивается долей от текущей.
     */
    Map<SourceType, Double> capacityAdditions(CapacityState capacity, int i) {
        Map<SourceType, Double> out = new EnumMap<>(SourceType.class);
        for (SourceType s : MINERAL_SOURCES) {
            double current = capacity.installed(s, i);
            double previous = i > 0 ? capacity.installed(s, i - 1) : current * params.priorYearCapacityRatio(s);
            out.put(s, Math.max(0.0, current - previous));
        }
        return out;
    }

    /** ВВП на душу, $; 0 при нулевом населении. */
    static double perCapita(double gdpTrillions, double population) {
        return population > 0 ? gdpTrillions * SimulationConstants.TRILLION / population : 0.0;
    }
}
