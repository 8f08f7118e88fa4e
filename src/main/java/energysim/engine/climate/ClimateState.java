package energysim.engine.climate;

/**
 * Состояние климата на конец года.
 *
 * @param cumulativeEmissions накопленные выбросы с доиндустриального периода, Gt CO2
 * @param co2ppm              концентрация CO2, ppm
 * @param equilibriumTemp     равновесная температура, °C
 * @param temperature         фактическая температура с запаздыванием, °C
 */
public record ClimateState(double cumulativeEmissions,
                           double co2ppm,
                           double equilibriumTemp,
                           double temperature) {
}
