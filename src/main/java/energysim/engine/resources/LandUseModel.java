package energysim.engine.resources;

import energysim.config.LandParams;
import energysim.config.SimulationConstants;

/**
 * Баланс земель: пашня по зерновому спросу и урожайности, городские земли по
 * населению и богатству, леса с потерями и восстановлением на заброшенной
 * пашне, пустыни как остаток плюс опустынивание при потеплении.
 */
public final class LandUseModel {

    private final LandParams params;

    public LandUseModel(LandParams params) {
        this.params = params;
    }

    /**
     * @param previous    землепользование прошлого года или {@code null} для 2025
     * @param temperature температура прошлого года, °C
     */
    public LandUse landUse(FoodDemand food, double population, double gdpPerCapita, double gdpPerCapita2025,
                           int year, double temperature, LandUse previous) {
        int t = year - SimulationConstants.START_YEAR;
        double yield = params.yield2025() * Math.pow(1 + params.yieldGrowthRate(), t);
        double farmland = food.grainEquivalent() / yield * params.nonFoodMultiplier();

        double wealthFactor = gdpPerCapita2025 > 0
                ? Math.pow(gdpPerCapita / gdpPerCapita2025, params.urbanWealthElasticity())
                : 1.0;
        double urban = population * params.urbanPerCapita() * wealthFactor / 1e6;

        double released = Math.max(0, params.farmland2025() - farmland);
        double pressure = Math.max(0, farmland - params.farmland2025()) / params.farmland2025();
        // при сокращении пашни базовые потери леса вдвое ниже
        double lossMultiplier = released > 0 ? 0.5 : 1 + pressure;
        double forest = params.forestArea2025() * Math.pow(1 - params.forestLossRate() * lossMultiplier, t)
                + released * params.reforestationRate();

        double climateExcess = Math.max(0, temperature - params.desertificationThreshold());
        double desertification = t > 0
                ? params.desert2025() * params.desertificationRate() * (1 + params.desertificationClimateCoeff() * climateExcess) * t
                : 0.0;
        double desert = Math.max(0, params.totalLandArea() - farmland - urban - forest + desertification);

        double forestChange = previous == null ? 0.0 : forest - previous.forest();
        return new LandUse(farmland, urban, forest, desert, yield, forestChange);
    }
}
