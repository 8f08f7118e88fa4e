package energysim.engine.demand;

/**
 * Энергетическая нагрузка: доля расходов на энергию в ВВП и вызванный ею ущерб.
 *
 * @param burden             расходы на энергию / ВВП
 * @param damage             потеря ВВП, доля
 * @param constrained        нагрузка выше порога
 * @param aboveHistoricalMax нагрузка выше исторического максимума (кризис 1970-х)
 */
public record EnergyBurden(double burden, double damage, boolean constrained, boolean aboveHistoricalMax) {
}
