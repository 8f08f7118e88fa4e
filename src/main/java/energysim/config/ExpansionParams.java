package energysim.config;

/**
 * Параметры расширения спроса: нагрузка роботов и рост от дешёвой энергии.
 */
public record ExpansionParams(double energyPerRobotMWh,
                              double robotGrowthRate,
                              double robotBaseline2025,
                              double robotCap,
                              double baselineLCOE,
                              double minCheapestLCOE,
                              double expansionCoefficient,
                              double baseMaxDemandGrowthRate,
                              double baseInvestmentRate) {

    public ExpansionParams withRobotGrowthRate(double v) {
        return new ExpansionParams(energyPerRobotMWh, v, robotBaseline2025, robotCap, baselineLCOE,
                minCheapestLCOE, expansionCoefficient, baseMaxDemandGrowthRate, baseInvestmentRate);
    }
}
