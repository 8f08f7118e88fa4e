package energysim.engine.resources;

import energysim.config.FoodParams;
import energysim.config.SimulationConstants;

/**
 * Продовольствие: закон Беннета для доли белка и логистическое внедрение GLP-1.
 */
public final class FoodModel {

    private final FoodParams params;

    public FoodModel(FoodParams params) {
        this.params = params;
    }

    public FoodDemand demand(double population, double gdpPerCapita, int year) {
        int t = year - SimulationConstants.START_YEAR;
        double baseCalories = params.caloriesPerCapita2025() * Math.pow(1 + params.caloriesGrowthRate(), t);

        double adoption = params.glp1MaxPenetration()
                / (1 + Math.exp(-params.glp1Steepness() * (year - params.glp1HalfwayYear())));
        double effect = adoption * params.glp1CalorieReduction();
        double netCalories = baseCalories * (1 - effect);

        double proteinShare = params.proteinShare2025()
                + (params.proteinShareMax() - params.proteinShare2025()) * (gdpPerCapita / (gdpPerCapita + params.proteinGDPHalfway()));

        double totalPcal = population * netCalories * SimulationConstants.DAYS_PER_YEAR / 1e15;
        double proteinPcal = totalPcal * proteinShare;

        // Mt: прямое зерно плюс корм для белка
        double directGrain = (totalPcal - proteinPcal) * 1e15 / params.caloriesPerKgGrain() / 1e9;
        double feedGrain = proteinPcal * 1e15 / params.proteinCaloriesPerKg() * params.grainToProteinRatio() / 1e9;

        return new FoodDemand(netCalories, totalPcal, proteinShare, proteinPcal, directGrain + feedGrain, adoption, effect);
    }
}
