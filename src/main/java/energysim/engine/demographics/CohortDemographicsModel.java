package energysim.engine.demographics;

import energysim.config.DemographicParams;
import energysim.config.EducationProfile;
import energysim.config.Region;
import energysim.config.RegionDemography;
import energysim.config.SimulationConstants;

import java.util.EnumMap;
import java.util.Map;

/**
 * Трёхкогортная модель населения (0–19, 20–64, 65+) с разделением рабочей и
 * старшей когорт по наличию высшего образования.
 * <p>
 * Каждый год фиксируется текущее состояние региона, затем когорты сдвигаются
 * на год вперёд: рождения по суммарной рождаемости, смертность по возрастной
 * структуре и ожидаемой продолжительности жизни, старение по длине когорт,
 * миграция преимущественно в рабочую когорту.
 */
public final class CohortDemographicsModel implements DemographicsProvider {

    // ===================== КАЛИБРОВКА КОГОРТ =====================

    private static final double YOUNG_COHORT_YEARS = 20.0;
    private static final double WORKING_COHORT_YEARS = 45.0;
    private static final double YOUNG_MORTALITY = 0.001;
    private static final double WORKING_MORTALITY = 0.003;
    private static final double MIN_REMAINING_LIFE_AT_65 = 15.0;
    private static final double MIN_REMAINING_LIFE_NON_COLLEGE = 10.0;
    private static final double CHILDBEARING_SPAN_YEARS = 32.0;

    // доли мигрантов по когортам
    private static final double MIGRANT_WORKING_SHARE = 0.8;
    private static final double MIGRANT_COLLEGE_SHARE = 0.7;
    private static final double MIGRANT_YOUNG_SHARE = 0.15;
    private static final double MIGRANT_OLD_SHARE = 0.05;

    @Override
    public DemographicsData project(DemographicParams params) {
        Map<Region, CohortSeries> regions = new EnumMap<>(Region.class);
        Map<Region, RegionState> states = new EnumMap<>(Region.class);
        for (Region r : Region.values()) {
            regions.put(r, new CohortSeries());
            states.put(r, RegionState.initial(params.region(r), params.education(r)));
        }
        CohortSeries global = new CohortSeries();

        for (int t = 0; t < SimulationConstants.YEAR_COUNT; t++) {
            double gPop = 0, gYoung = 0, gWorking = 0, gOld = 0;
            double gWc = 0, gWnc = 0, gOc = 0, gOnc = 0, gEffective = 0;

            for (Region r : Region.values()) {
                RegionDemography demo = params.region(r);
                EducationProfile edu = params.education(r);
                RegionState s = states.get(r);
                CohortSeries series = regions.get(r);

                double tfr = fertility(demo.fertility(), demo.fertilityFloor() * params.fertilityFloorMultiplier(),
                        demo.fertilityDecay(), t);
                double enrollment = enrollmentRate(edu, t);
                double premium = wagePremium(edu, t);
                double effective = effectiveWorkers(s.workingCollege, s.workingNonCollege, premium);

                series.recordCohorts(t, s.population, s.young * s.population, s.working * s.population,
                        s.old * s.population);
                series.recordEducation(t, s.workingCollege, s.workingNonCollege, s.oldCollege, s.oldNonCollege,
                        effective);
                series.recordRates(t, tfr, enrollment, premium);

                gPop += s.population;
                gYoung += s.young * s.population;
                gWorking += s.working * s.population;
                gOld += s.old * s.population;
                gWc += s.workingCollege;
                gWnc += s.workingNonCollege;
                gOc += s.oldCollege;
                gOnc += s.oldNonCollege;
                gEffective += effective;

                if (t < SimulationConstants.YEAR_COUNT - 1) {
                    RegionState next = age(s, tfr, t, edu, demo.migrationRate() * params.migrationMultiplier());
                    next.lifeExpectancy = demo.lifeExpectancy() + t * params.lifeExpectancyGrowth();
                    states.put(r, next);
                }
            }

            global.recordCohorts(t, gPop, gYoung, gWorking, gOld);
            global.recordEducation(t, gWc, gWnc, gOc, gOnc, gEffective);
        }
        return new DemographicsData(regions, global);
    }

    // ===================== ПРОЕКЦИИ =====================

    /**
     * Суммарная рождаемость сходится к полу экспоненциально.
     */
    static double fertility(double tfr0, double floor, double decay, int t) {
        return floor + (tfr0 - floor) * Math.exp(-decay * t);
    }

    static double enrollmentRate(EducationProfile p, int t) {
        return p.enrollmentTarget() - (p.enrollmentTarget() - p.enrollmentRate2025()) * Math.exp(-p.enrollmentGrowth() * t);
    }

    static double wagePremium(EducationProfile p, int t) {
        return p.wagePremiumTarget() + (p.wagePremium2025() - p.wagePremiumTarget()) * Math.exp(-p.premiumDecay() * t);
    }

    /**
     * Работники, взвешенные по производительности: выпускники учитываются с премией.
     */
    static double effectiveWorkers(double workingCollege, double workingNonCollege, double premium) {
        return workingNonCollege + workingCollege * premium;
    }

    static double birthRate(double tfr, double workingShare, double youngShare) {
        double womenOfChildbearingAge = youngShare * 0.25 + workingShare * 0.65;
        return tfr * womenOfChildbearingAge * 0.5 / CHILDBEARING_SPAN_YEARS;
    }

    static double deathRate(double youngShare, double workingShare, double oldShare, double lifeExpectancy) {
        double remainingAt65 = Math.max(MIN_REMAINING_LIFE_AT_65, lifeExpectancy - 55);
        return youngShare * YOUNG_MORTALITY + workingShare * WORKING_MORTALITY + oldShare / remainingAt65;
    }

    // ===================== СДВИГ КОГОРТ =====================

    private static RegionState age(RegionState s, double tfr, int t, EducationProfile edu, double migrationRate) {
        double pop = s.population;
        double births = birthRate(tfr, s.working, s.young) * pop;

        double outOfYoung = s.young * pop / YOUNG_COHORT_YEARS;
        double outOfWorking = s.working * pop / WORKING_COHORT_YEARS;
        double youngDeaths = s.young * pop * YOUNG_MORTALITY;
        double workingDeaths = s.working * pop * WORKING_MORTALITY;

        // образование: новые работники делятся по охвату высшим образованием
        double enrollment = enrollmentRate(edu, t);
        double newCollege = outOfYoung * enrollment;
        double newNonCollege = outOfYoung * (1 - enrollment);

        double totalWorking = s.workingCollege + s.workingNonCollege;
        double collegeShareWorking = totalWorking > 0 ? s.workingCollege / totalWorking : 0.5;
        double retiringCollege = outOfWorking * collegeShareWorking;
        double retiringNonCollege = outOfWorking * (1 - collegeShareWorking);

        // у выпускников старшего возраста больше оставшаяся продолжительность жизни
        double remainingBase = Math.max(MIN_REMAINING_LIFE_AT_65, s.lifeExpectancy - 55);
        double remainingCollege = remainingBase + edu.lifeExpectancyBonus() * 0.5;
        double remainingNonCollege = Math.max(MIN_REMAINING_LIFE_NON_COLLEGE, remainingBase - edu.lifeExpectancyPenalty() * 0.5);
        double oldDeathsCollege = Math.min(s.oldCollege / remainingCollege, s.oldCollege);
        double oldDeathsNonCollege = Math.min(s.oldNonCollege / remainingNonCollege, s.oldNonCollege);

        double wc = Math.max(0, s.workingCollege + newCollege - retiringCollege - workingDeaths * collegeShareWorking);
        double wnc = Math.max(0, s.workingNonCollege + newNonCollege - retiringNonCollege
                - workingDeaths * (1 - collegeShareWorking));
        double oc = Math.max(0, s.oldCollege + retiringCollege - oldDeathsCollege);
        double onc = Math.max(0, s.oldNonCollege + retiringNonCollege - oldDeathsNonCollege);
        double young = Math.max(0, s.young * pop + births - outOfYoung - youngDeaths);

        // миграция
        double migration = pop * migrationRate;
        wc += migration * MIGRANT_WORKING_SHARE * MIGRANT_COLLEGE_SHARE;
        wnc += migration * MIGRANT_WORKING_SHARE * (1 - MIGRANT_COLLEGE_SHARE);
        young += migration * MIGRANT_YOUNG_SHARE;
        double oldTotal = oc + onc + migration * MIGRANT_OLD_SHARE;
        oc += migration * MIGRANT_OLD_SHARE * 0.5;
        onc += migration * MIGRANT_OLD_SHARE * 0.5;

        double working = wc + wnc;
        double newPop = young + working + oldTotal;

        RegionState next = new RegionState();
        next.population = newPop;
        // пустой регион остаётся пустым, доли нулевые
        next.young = newPop > 0 ? young / newPop : 0.0;
        next.working = newPop > 0 ? working / newPop : 0.0;
        next.old = newPop > 0 ? oldTotal / newPop : 0.0;
        next.workingCollege = wc;
        next.workingNonCollege = wnc;
        next.oldCollege = oc;
        next.oldNonCollege = onc;
        return next;
    }

    /**
     * Изменяемое состояние региона между шагами проекции.
     */
    private static final class RegionState {
        double population;
        double young;
        double working;
        double old;
        double lifeExpectancy;
        double workingCollege;
        double workingNonCollege;
        double oldCollege;
        double oldNonCollege;

        static RegionState initial(RegionDemography demo, EducationProfile edu) {
            RegionState s = new RegionState();
            s.population = demo.population2025();
            s.young = demo.young();
            s.working = demo.working();
            s.old = demo.old();
            s.lifeExpectancy = demo.lifeExpectancy();
            double workingPop = demo.population2025() * demo.working();
            double oldPop = demo.population2025() * demo.old();
            s.workingCollege = workingPop * edu.collegeShare2025();
            s.workingNonCollege = workingPop * (1 - edu.collegeShare2025());
            // выпускники среди пожилых: вдвое меньшая доля
            s.oldCollege = oldPop * edu.collegeShare2025() * 0.5;
            s.oldNonCollege = oldPop * (1 - edu.collegeShare2025() * 0.5);
            return s;
        }
    }
}
