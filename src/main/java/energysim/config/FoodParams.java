package energysim.config;

/**
 * Параметры продовольственного спроса (закон Беннета + препараты GLP-1).
 */
public record FoodParams(double caloriesPerCapita2025,
                         double caloriesGrowthRate,
                         double proteinShare2025,
                         double proteinShareMax,
                         double proteinGDPHalfway,
                         double glp1HalfwayYear,
                         double glp1Steepness,
                         double glp1MaxPenetration,
                         double glp1CalorieReduction,
                         double grainToProteinRatio,
                         double caloriesPerKgGrain,
                         double proteinCaloriesPerKg) {

    public FoodParams withGlp1MaxPenetration(double v) {
        return new FoodParams(caloriesPerCapita2025, caloriesGrowthRate, proteinShare2025, proteinShareMax,
                proteinGDPHalfway, glp1HalfwayYear, glp1Steepness, v, glp1CalorieReduction,
                grainToProteinRatio, caloriesPerKgGrain, proteinCaloriesPerKg);
    }
}
