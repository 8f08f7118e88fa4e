package energysim.engine.demand;

/**
 * Результат расширения спроса за год.
 *
 * @param adjustedDemand      скорректированный спрос до инфраструктурного потолка, TWh
 * @param robotLoadTwh        нагрузка автоматизации, TWh
 * @param expansionMultiplier множитель удешевления энергии
 * @param robotsPer1000       роботов на 1000 работников
 */
public record ExpansionResult(double adjustedDemand,
                              double robotLoadTwh,
                              double expansionMultiplier,
                              double robotsPer1000) {
}
