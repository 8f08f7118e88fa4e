package energysim.engine.resources;

/**
 * Спрос на продовольствие за год.
 *
 * @param caloriesPerCapita ккал/человек/день после эффекта GLP-1
 * @param totalCalories     Pcal/год
 * @param proteinShare      доля белковых калорий
 * @param proteinCalories   Pcal/год
 * @param grainEquivalent   зерновой эквивалент, Mt/год
 * @param glp1Adoption      доля населения на GLP-1
 * @param glp1Effect        сокращение калорий, доля
 */
public record FoodDemand(double caloriesPerCapita,
                         double totalCalories,
                         double proteinShare,
                         double proteinCalories,
                         double grainEquivalent,
                         double glp1Adoption,
                         double glp1Effect) {
}
