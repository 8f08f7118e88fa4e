package energysim.engine.demand;

import energysim.config.DemandParams;
import energysim.config.EconomicParams;
import energysim.config.FinalEnergyParams;
import energysim.config.Fuel;
import energysim.config.ModelParameters;
import energysim.config.Region;
import energysim.config.RegionEconomy;
import energysim.config.Sector;
import energysim.config.SectorProfile;
import energysim.config.SimulationConstants;
import energysim.engine.demographics.CohortSeries;
import energysim.engine.demographics.DemographicsData;

import java.util.EnumMap;
import java.util.Map;

/**
 * Модель спроса: ВВП регионов, энергоёмкость, электрификация,
 * конечная энергия по секторам и топливам.
 * <p>
 * Рост ВВП складывается из затухающей совокупной производительности, вклада
 * эффективных работников и демографической поправки. Запаздывающий ущерб
 * (климатический и от энергетической нагрузки) снижает рост только в
 * стойкой части.
 */
public final class DemandModel {

    private final EconomicParams economic;
    private final DemandParams demand;
    private final FinalEnergyParams finalEnergy;
    private final double efficiencyMultiplier;

    public DemandModel(ModelParameters p, double efficiencyMultiplier) {
        this(p.economic(), p.demand(), p.finalEnergy(), efficiencyMultiplier);
    }

    public DemandModel(EconomicParams economic, DemandParams demand, FinalEnergyParams finalEnergy,
                       double efficiencyMultiplier) {
        this.economic = economic;
        this.demand = demand;
        this.finalEnergy = finalEnergy;
        this.efficiencyMultiplier = efficiencyMultiplier;
    }

    // ===================== ЭЛЕКТРИФИКАЦИЯ =====================

    public double electrificationRate(int t) {
        return demand.electrificationTarget()
                - (demand.electrificationTarget() - demand.electrification2025()) * Math.exp(-demand.electrificationSpeed() * t);
    }

    public double sectorElectrification(Sector sector, int t) {
        SectorProfile s = finalEnergy.sector(sector);
        return s.electrificationTarget()
                - (s.electrificationTarget() - s.electrification2025()) * Math.exp(-s.electrificationSpeed() * t);
    }

    /**
     * Доля топлива в неэлектрической части сектора: линейно от 2025 к 2100.
     */
    public double fuelShare(Sector sector, Fuel fuel, int t) {
        double progress = Math.min(1.0, t / finalEnergy.transitionYears());
        double from = finalEnergy.fuelShare2025(sector, fuel);
        double to = finalEnergy.fuelShare2100(sector, fuel);
        return from + (to - from) * progress;
    }

    // ===================== ПРОГОН =====================

    public DemandData run(DemographicsData demographics, DemandFeedback feedback) {
        Map<Region, DemandSeries> regions = new EnumMap<>(Region.class);
        Map<Region, double[]> state = new EnumMap<>(Region.class);
        for (Region r : Region.values()) {
            regions.put(r, new DemandSeries());
            RegionEconomy econ = economic.region(r);
            state.put(r, new double[]{econ.gdp2025(), econ.energyIntensity()});
        }
        DemandSeries global = new DemandSeries();
        double baselineDependency = demographics.global().dependency(0);

        for (int t = 0; t < SimulationConstants.YEAR_COUNT; t++) {
            double electRate = electrificationRate(t);
            double gGdp = 0, gElec = 0, gWorking = 0, gTotal = 0, gNonElec = 0;

            for (Region r : Region.values()) {
                RegionEconomy econ = economic.region(r);
                CohortSeries demo = demographics.region(r);
                DemandSeries series = regions.get(r);
                double[] s = state.get(r);

                double working = demo.working(t);
                double effective = demo.effectiveWorkers(t);
                double effectivePrev = t > 0 ? demo.effectiveWorkers(t - 1) : effective;
                double laborGrowth = t > 0 && effectivePrev > 0 ? (effective - effectivePrev) / effectivePrev : 0.0;
                double demographicAdj = demand.demographicFactor() * (baselineDependency - demo.dependency(t));
                double tfp = econ.tfpGrowth() * Math.pow(1 - econ.tfpDecay(), t);
                double growthRate = tfp + economic.laborShare() * laborGrowth + demographicAdj;

                if (t > 0) {
                    double persistentDamage = feedback.damage(r, t - 1) * economic.persistentDamageFraction();
                    double persistentBurden = feedback.burden(t - 1) * economic.energyBurden().persistentFraction();
                    s[0] = s[0] * (1 + growthRate) * (1 - persistentDamage) * (1 - persistentBurden);
                    s[1] = s[1] * (1 - econ.intensityDecline() * efficiencyMultiplier);
                }
                double gdp = s[0];
                series.recordEconomy(t, gdp, growthRate, s[1]);

                // TWh: ВВП в $T × МВт·ч на $1000 × 1000
                double totalEnergy = gdp * s[1] * 1000.0;
                double elecDemand = totalEnergy * electRate;
                double nonElec = totalEnergy - elecDemand;
                series.recordEnergy(t, elecDemand, totalEnergy, nonElec);
                series.recordPerWorking(t, perUnit(gdp * SimulationConstants.TRILLION, working), perUnit(elecDemand * 1e9, working));

                for (Sector sector : Sector.values()) {
                    double sectorRate = sectorElectrification(sector, t);
                    double sectorNonElec = nonElec * finalEnergy.sector(sector).share2025();
                    double sectorTotal = sectorNonElec / Math.max(finalEnergy.minNonElectricShare(), 1 - sectorRate);
                    double sectorElec = sectorTotal * sectorRate;
                    series.sectorSeries(sector).record(t, sectorTotal, sectorElec, sectorNonElec, sectorRate);
                    global.sectorSeries(sector).add(t, sectorTotal, sectorElec, sectorNonElec);

                    for (Fuel fuel : Fuel.values()) {
                        double twh = sectorNonElec * fuelShare(sector, fuel, t);
                        series.addFuel(t, fuel, twh);
                        global.addFuel(t, fuel, twh);
                    }
                }

                gGdp += gdp;
                gElec += elecDemand;
                gWorking += working;
                gTotal += totalEnergy;
                gNonElec += nonElec;
            }

            global.recordEconomy(t, gGdp, 0.0, 0.0);
            global.recordEnergy(t, gElec, gTotal, gNonElec);
            global.recordPerWorking(t, perUnit(gGdp * SimulationConstants.TRILLION, gWorking), perUnit(gElec * 1e9, gWorking));
            double perCapitaDay = perUnit(gTotal * 1e9, demographics.global().population(t)) / SimulationConstants.DAYS_PER_YEAR;
            global.recordGlobal(t, electRate, perCapitaDay);
            for (Sector sector : Sector.values()) {
                global.sectorSeries(sector).setElectrificationRate(t, sectorElectrification(sector, t));
            }
        }
        return new DemandData(regions, global);
    }

    /** Удельная величина; 0 при пустом знаменателе (нет населения или работников). */
    static double perUnit(double value, double people) {
        return people > 0 ? value / people : 0.0;
    }
}
