package energysim.engine.capital;

import energysim.config.CapitalParams;
import energysim.config.Region;
import energysim.config.SimulationConstants;
import energysim.engine.demographics.CohortSeries;
import energysim.engine.demographics.DemographicsData;

import java.util.EnumMap;
import java.util.Map;

/**
 * Цепочка капитала: сбережения по когортам, фактор стабильности,
 * инвестиции, накопление капитала, процентная ставка и плотность роботов.
 */
public final class CapitalModel {

    private final CapitalParams params;

    public CapitalModel(CapitalParams params) {
        this.params = params;
    }

    public CapitalParams params() {
        return params;
    }

    public double initialCapital() {
        return params.initialCapitalStock();
    }

    /**
     * Норма сбережений по возрастной структуре плюс региональная надбавка.
     * Регион с нулевым населением получает только надбавку и не входит в среднее.
     */
    public SavingsRates aggregateSavings(DemographicsData demographics, int yearIndex) {
        Map<Region, Double> regional = new EnumMap<>(Region.class);
        double totalPop = 0.0;
        double weighted = 0.0;
        for (Region r : Region.values()) {
            CohortSeries s = demographics.region(r);
            double pop = s.population(yearIndex);
            if (pop <= 0) {
                regional.put(r, params.savingsPremium(r));
                continue;
            }
            double base = (s.young(yearIndex) * params.savingsYoung()
                    + s.working(yearIndex) * params.savingsWorking()
                    + s.old(yearIndex) * params.savingsOld()) / pop;
            double rate = base + params.savingsPremium(r);
            regional.put(r, rate);
            totalPop += pop;
            weighted += rate * pop;
        }
        return new SavingsRates(regional, totalPop > 0 ? weighted / totalPop : 0.0);
    }

    /**
     * Φ = 1 / (1 + λ·u²), u как доля (не процент).
     */
    public double stabilityFactor(double uncertainty) {
        return 1.0 / (1.0 + params.stabilityLambda() * uncertainty * uncertainty);
    }

    public static double investment(double gdp, double savingsRate, double stability) {
        return gdp * savingsRate * stability;
    }

    /**
     * K' = (1 − δ)K + I.
     */
    public double nextCapital(double capital, double investment) {
        return (1.0 - params.depreciation()) * capital + investment;
    }

    /**
     * Предельный продукт капитала минус амортизация; при K ≤ 0 резервная ставка.
     */
    public double interestRate(double gdp, double capital) {
        if (capital <= 0) {
            return params.fallbackInterestRate();
        }
        return params.alpha() * gdp / capital - params.depreciation();
    }

    public double automationShare(int year) {
        int t = year - SimulationConstants.START_YEAR;
        double share = params.automationShare2025() * Math.pow(1.0 + params.automationGrowth(), t);
        return Math.min(share, params.automationShareCap());
    }

    /**
     * Роботов на 1000 работников; 0 при отсутствии работников.
     *
     * @param capital запас капитала, $T
     * @param workers эффективные работники, человек
     * @param year    календарный год
     */
    public double robotsDensity(double capital, double workers, int year) {
        if (workers <= 0) {
            return 0.0;
        }
        double automationCapital = capital * automationShare(year);
        double dollarsPerWorker = automationCapital * SimulationConstants.TRILLION / workers;
        return dollarsPerWorker / 1000.0 * params.robotsPerCapitalUnit();
    }

    /**
     * Капитал на эффективного работника, тыс. $ (0 без работников).
     */
    public static double capitalPerWorker(double capital, double workers) {
        if (workers <= 0) {
            return 0.0;
        }
        return capital * SimulationConstants.TRILLION / workers / 1000.0;
    }
}
