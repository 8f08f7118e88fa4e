package energysim.config;

/**
 * Экономика региона на 2025 год.
 *
 * @param gdp2025          ВВП, $T
 * @param tfpGrowth        рост совокупной производительности
 * @param tfpDecay         годовое затухание догоняющего роста
 * @param energyIntensity  конечная энергия на $ ВВП, PWh/$T
 * @param intensityDecline годовое снижение энергоёмкости
 */
public record RegionEconomy(double gdp2025,
                            double tfpGrowth,
                            double tfpDecay,
                            double energyIntensity,
                            double intensityDecline) {
}
