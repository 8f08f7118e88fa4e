package energysim.config;

/**
 * Материалоёмкость и рециклинг минерала.
 *
 * @param perMWSolar       kg на MW СЭС
 * @param perGWhBattery    kg на GWh накопителей
 * @param reserves         известные запасы, Mt (0 - без ограничения)
 * @param recyclingHalfway Mt в обороте на полпути к максимуму рециклинга
 */
public record MineralParams(double perMWSolar,
                            double perMWWind,
                            double perMWNuclear,
                            double perGWhBattery,
                            double learningRate,
                            double reserves,
                            double recyclingBase,
                            double recyclingMax,
                            double recyclingHalfway) {

    public MineralParams withLearningRate(double v) {
        return new MineralParams(perMWSolar, perMWWind, perMWNuclear, perGWhBattery, v, reserves,
                recyclingBase, recyclingMax, recyclingHalfway);
    }
}
