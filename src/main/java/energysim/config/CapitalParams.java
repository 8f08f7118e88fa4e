package energysim.config;

import java.util.Map;

/**
 * Параметры накопления капитала и автоматизации.
 *
 * @param alpha                доля капитала (Кобб-Дуглас)
 * @param depreciation         годовое выбытие капитала
 * @param savingsPremium       региональная надбавка к норме сбережений
 * @param stabilityLambda      чувствительность инвестиций к ущербу
 * @param automationShareCap   предельная доля автоматизации в капитале
 * @param robotsPerCapitalUnit роботов на 1000 рабочих на $1000 автоматизации на рабочего
 * @param initialCapitalStock  капитал 2025, $T
 */
public record CapitalParams(double alpha,
                            double depreciation,
                            double savingsYoung,
                            double savingsWorking,
                            double savingsOld,
                            Map<Region, Double> savingsPremium,
                            double stabilityLambda,
                            double automationShare2025,
                            double automationGrowth,
                            double automationShareCap,
                            double robotsPerCapitalUnit,
                            double initialCapitalStock,
                            double fallbackInterestRate) {

    public CapitalParams {
        savingsPremium = EnumMaps.copyOf(Region.class, savingsPremium);
    }

    public double savingsPremium(Region region) {
        return EnumMaps.getOrZero(savingsPremium, region);
    }

    public CapitalParams withSavingsWorking(double v) {
        return new CapitalParams(alpha, depreciation, savingsYoung, v, savingsOld, savingsPremium, stabilityLambda,
                automationShare2025, automationGrowth, automationShareCap, robotsPerCapitalUnit,
                initialCapitalStock, fallbackInterestRate);
    }

    public CapitalParams withAutomationGrowth(double v) {
        return new CapitalParams(alpha, depreciation, savingsYoung, savingsWorking, savingsOld, savingsPremium,
                stabilityLambda, automationShare2025, v, automationShareCap, robotsPerCapitalUnit,
                initialCapitalStock, fallbackInterestRate);
    }

    public CapitalParams withStabilityLambda(double v) {
        return new CapitalParams(alpha, depreciation, savingsYoung, savingsWorking, savingsOld, savingsPremium, v,
                automationShare2025, automationGrowth, automationShareCap, robotsPerCapitalUnit,
                initialCapitalStock, fallbackInterestRate);
    }
}
