package energysim.engine;

import energysim.config.ModelParameters;
import energysim.config.PreEstimateParams;
import energysim.config.Region;
import energysim.config.SimulationConstants;
import energysim.engine.climate.ClimateModel;
import energysim.engine.climate.ClimateState;
import energysim.engine.demand.DemandData;
import energysim.engine.demand.DemandFeedback;
import energysim.engine.demand.DemandSeries;
import energysim.engine.demand.EnergyCostModel;

import java.util.EnumMap;
import java.util.Map;

/**
 * Быстрый предварительный проход климата и энергетической нагрузки по спросу
 * первого прохода.
 * <p>
 * Вместо диспетчеризации используются замкнутые траектории: интенсивность сети
 * и средний LCOE экспоненциально снижаются, неэлектрические выбросы падают с
 * электрификацией. Результат задаёт запаздывающую обратную связь второго прохода.
 */
public final class FeedbackPrePass {

    private final PreEstimateParams params;
    private final double nonElecEmissions2025;
    private final double electrification2025;
    private final ClimateModel climate;
    private final EnergyCostModel costs;

    public FeedbackPrePass(ModelParameters p, ClimateModel climate, EnergyCostModel costs) {
        this.params = p.preEstimate();
        this.nonElecEmissions2025 = p.climate().nonElecEmissions2025();
        this.electrification2025 = p.demand().electrification2025();
        this.climate = climate;
        this.costs = costs;
    }

    public DemandFeedback estimate(DemandData firstPass, double carbonPrice) {
        DemandSeries global = firstPass.global();
        Map<Region, double[]> damage = new EnumMap<>(Region.class);
        for (Region r : Region.values()) {
            damage.put(r, new double[SimulationConstants.YEAR_COUNT]);
        }
        double[] burden = new double[SimulationConstants.YEAR_COUNT];

        ClimateState state = climate.initialState();
        for (int i = 0; i < SimulationConstants.YEAR_COUNT; i++) {
            double elecDemand = global.electricityDemand(i);

            // ===== Выбросы и климат =====
            double gridIntensity = params.gridIntensity2025() * Math.exp(-params.gridIntensityDecline() * i);
            double elecEmissions = elecDemand * gridIntensity / SimulationConstants.KG_TWH_TO_GT;
            double nonElecEmissions = nonElecEmissions2025 * (1 - global.electrificationRate(i)) / (1 - electrification2025);
            state = climate.advance(state, elecEmissions + nonElecEmissions);

            for (Region r : Region.values()) {
                damage.get(r)[i] = climate.damageFraction(state.temperature(), r);
            }

            // ===== Нагрузка =====
            double avgLcoe = params.lcoe2025() * Math.exp(-params.lcoeDecline() * i)
                    + carbonPrice * params.carbonPassThrough() * Math.exp(-params.carbonPassThroughDecline() * i);
            double elecCost = elecDemand * avgLcoe / 1e6;
            double fuelPrice = params.nonElecFuelPrice() + carbonPrice * params.nonElecCarbonPassThrough();
            double nonElecCost = (global.totalFinalEnergy(i) - elecDemand) * fuelPrice / 1e6;
            burden[i] = costs.burden(elecCost + nonElecCost, global.gdp(i)).damage();
        }
        return DemandFeedback.of(damage, burden);
    }
}
