package energysim.engine.resources;

/**
 * Потоки углерода лесов за год, Gt CO2.
 *
 * @param sequestration          поглощение растущим лесом
 * @param deforestationEmissions немедленный выброс при сведении леса
 * @param decayEmissions         выброс из пула разложения
 * @param netFlux                чистый поток; положительный означает выброс
 * @param decayPool              остаток пула разложения на конец года
 */
public record CarbonFlux(double sequestration,
                         double deforestationEmissions,
                         double decayEmissions,
                         double netFlux,
                         double decayPool) {
}
