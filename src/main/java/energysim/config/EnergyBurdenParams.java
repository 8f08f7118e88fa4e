package energysim.config;

/**
 * Ограничение роста из-за доли расходов на энергию в ВВП.
 *
 * @param threshold          доля ВВП, выше которой возникает ущерб
 * @param elasticity         ущерб на единицу превышения
 * @param maxBurden          справочный верхний уровень нагрузки
 * @param maxDamage          предел ущерба
 * @param persistentFraction доля ущерба, переносимая в рост следующего года
 */
public record EnergyBurdenParams(double threshold,
                                 double elasticity,
                                 double maxBurden,
                                 double maxDamage,
                                 double persistentFraction) {
}
