package energysim.engine.demand;

import energysim.config.ExpansionParams;
import energysim.config.SimulationConstants;

import java.util.OptionalDouble;

/**
 * Расширение спроса: нагрузка автоматизации и рост активности при удешевлении
 * чистой энергии, с инфраструктурным потолком по норме сбережений.
 */
public final class DemandExpansion {

    private final ExpansionParams params;

    public DemandExpansion(ExpansionParams params) {
        this.params = params;
    }

    /**
     * @param baseDemandTwh   базовый спрос на электроэнергию, TWh
     * @param cheapestClean   минимальный LCOE чистой генерации, $/MWh
     * @param year            календарный год
     * @param workers         глобальное число работников
     * @param robotsPer1000   плотность роботов из цепочки капитала; если пусто, экзогенная траектория
     */
    public ExpansionResult expand(double baseDemandTwh, double cheapestClean, int year, double workers,
                                  OptionalDouble robotsPer1000) {
        int t = year - SimulationConstants.START_YEAR;
        double robots = robotsPer1000.isPresent()
                ? robotsPer1000.getAsDouble()
                : Math.min(params.robotBaseline2025() * Math.pow(1 + params.robotGrowthRate(), t), params.robotCap());

        double robotLoad = robots / 1000.0 * workers * params.energyPerRobotMWh() / 1e6;

        double costRatio = params.baselineLCOE() / Math.max(params.minCheapestLCOE(), cheapestClean);
        double multiplier = 1 + params.expansionCoefficient() * Math.log(Math.max(1.0, costRatio)) / Math.log(2.0);

        return new ExpansionResult((baseDemandTwh + robotLoad) * multiplier, robotLoad, multiplier, robots);
    }

    /**
     * Потолок роста спроса: prev·(1 + g0·s/s0).
     */
    public double infrastructureCeiling(double previousAdjusted, double savingsRate) {
        double maxGrowth = params.baseMaxDemandGrowthRate() * savingsRate / params.baseInvestmentRate();
        return previousAdjusted * (1 + maxGrowth);
    }
}
