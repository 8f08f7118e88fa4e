package energysim.config;

/**
 * Параметры землепользования и углерода лесов. Площади в Mha.
 */
public record LandParams(double farmland2025,
                         double yieldGrowthRate,
                         double yield2025,
                         double nonFoodMultiplier,
                         double urbanPerCapita,
                         double urbanWealthElasticity,
                         double forestArea2025,
                         double forestLossRate,
                         double reforestationRate,
                         double totalLandArea,
                         double desert2025,
                         double desertificationRate,
                         double desertificationClimateCoeff,
                         double desertificationThreshold,
                         double forestCarbonDensity,
                         double sequestrationRate,
                         double deforestationEmissionFactor,
                         double decayRate) {

    public LandParams withYieldGrowthRate(double v) {
        return new LandParams(farmland2025, v, yield2025, nonFoodMultiplier, urbanPerCapita,
                urbanWealthElasticity, forestArea2025, forestLossRate, reforestationRate, totalLandArea,
                desert2025, desertificationRate, desertificationClimateCoeff, desertificationThreshold,
                forestCarbonDensity, sequestrationRate, deforestationEmissionFactor, decayRate);
    }
}
