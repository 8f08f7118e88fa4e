package energysim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Чтение дерева HOCON energy-model в записи параметров.
 * Неизвестные ключи в перечислимых блоках считаются ошибкой конфигурации.
 */
final class ModelParametersReader {

    private ModelParametersReader() {
    }

    static ModelParameters read(Config c) {
        return new ModelParameters(
                readSources(c.getConfig("energySources")),
                readCost(c.getConfig("costParams")),
                readDispatch(c.getConfig("dispatchParams")),
                readCapacity(c.getConfig("capacityParams")),
                readClimate(c.getConfig("climateParams")),
                readCapital(c.getConfig("capitalParams")),
                readExpansion(c.getConfig("expansionParams")),
                readEconomic(c.getConfig("economicParams")),
                readDemand(c.getConfig("demandParams")),
                readFinalEnergy(c.getConfig("finalEnergyParams")),
                readPreEstimate(c.getConfig("preEstimateParams")),
                readDemographics(c.getConfig("demographics")),
                readResources(c.getConfig("resourceParams"))
        );
    }

    // ===================== ЭНЕРГЕТИКА =====================

    private static Map<SourceType, EnergySource> readSources(Config c) {
        Map<SourceType, EnergySource> m = new EnumMap<>(SourceType.class);
        for (String key : c.root().keySet()) {
            SourceType type = parseKey(c, key, SourceType.values(), SourceType::key);
            Config s = c.getConfig(key);
            m.put(type, new EnergySource(
                    s.getDouble("cost0"),
                    s.getDouble("alpha"),
                    s.getDouble("capacity2025"),
                    s.getDouble("growthRate"),
                    s.getDouble("carbonIntensity"),
                    s.getDouble("eroei0"),
                    s.getDouble("reserves"),
                    s.getDouble("extractionRate")));
        }
        return m;
    }

    private static CostParams readCost(Config c) {
        return new CostParams(
                c.getDouble("depletionExponent"),
                c.getDouble("eroeiFloor"),
                c.getDouble("minRemainingReserves"),
                c.getDouble("storageHours"),
                c.getDouble("storageLifeYears"),
                c.getDouble("roundTripEfficiency"),
                doubleMap(c.getConfig("bootstrapGeneration"), SourceType.class, SourceType.values(), SourceType::key));
    }

    private static DispatchParams readDispatch(Config c) {
        List<DispatchSource> order = new ArrayList<>();
        for (String key : c.getStringList("meritOrder")) {
            order.add(parseKey(c, key, DispatchSource.values(), DispatchSource::key));
        }
        return new DispatchParams(
                doubleMap(c.getConfig("capacityFactors"), DispatchSource.class, DispatchSource.values(), DispatchSource::key),
                c.getDouble("bareSolarMaxShare"),
                c.getDouble("totalSolarMaxShare"),
                c.getDouble("windMaxShare"),
                c.getDouble("firmableSolarShare"),
                c.getDouble("batteryFirmingRatio"),
                c.getDouble("shortfallTolerance"),
                order);
    }

    private static CapacityParams readCapacity(Config c) {
        Set<SourceType> learning = EnumSet.noneOf(SourceType.class);
        for (String key : c.getStringList("capexLearningSources")) {
            learning.add(parseKey(c, key, SourceType.values(), SourceType::key));
        }
        return new CapacityParams(
                sourceMap(c, "penetrationLimits"),
                c.getDouble("batteryFirmingShare"),
                sourceMap(c, "maxGrowthRates"),
                sourceMap(c, "lifetimes"),
                sourceMap(c, "capex"),
                c.getDouble("capexLearningFactor"),
                learning,
                sourceMap(c, "investmentAllocation"),
                c.getDouble("cleanShare2025"),
                c.getDouble("cleanShareIncrease"),
                c.getDouble("cleanShareRampYears"));
    }

    // ===================== КЛИМАТ И ЭКОНОМИКА =====================

    private static ClimateParams readClimate(Config c) {
        return new ClimateParams(
                c.getDouble("preindustrialCO2"),
                c.getDouble("cumulativeCO2_2025"),
                c.getDouble("airborneFraction"),
                c.getDouble("ppmPerGt"),
                c.getDouble("temperatureLag"),
                c.getDouble("climSensitivity"),
                c.getDouble("currentTemp"),
                c.getDouble("damageCoeff"),
                regionMap(c, "regionalDamage"),
                c.getDouble("tippingThreshold"),
                c.getDouble("tippingMultiplier"),
                c.getDouble("tippingSteepness"),
                c.getDouble("maxDamage"),
                c.getDouble("nonElecEmissions2025"));
    }

    private static CapitalParams readCapital(Config c) {
        return new CapitalParams(
                c.getDouble("alpha"),
                c.getDouble("depreciation"),
                c.getDouble("savingsYoung"),
                c.getDouble("savingsWorking"),
                c.getDouble("savingsOld"),
                regionMap(c, "savingsPremium"),
                c.getDouble("stabilityLambda"),
                c.getDouble("automationShare2025"),
                c.getDouble("automationGrowth"),
                c.getDouble("automationShareCap"),
                c.getDouble("robotsPerCapitalUnit"),
                c.getDouble("initialCapitalStock"),
                c.getDouble("fallbackInterestRate"));
    }

    private static ExpansionParams readExpansion(Config c) {
        return new ExpansionParams(
                c.getDouble("energyPerRobotMWh"),
                c.getDouble("robotGrowthRate"),
                c.getDouble("robotBaseline2025"),
                c.getDouble("robotCap"),
                c.getDouble("baselineLCOE"),
                c.getDouble("minCheapestLCOE"),
                c.getDouble("expansionCoefficient"),
                c.getDouble("baseMaxDemandGrowthRate"),
                c.getDouble("baseInvestmentRate"));
    }

    private static EconomicParams readEconomic(Config c) {
        Map<Region, RegionEconomy> regions = new EnumMap<>(Region.class);
        Config rc = c.getConfig("regions");
        for (String key : rc.root().keySet()) {
            Config r = rc.getConfig(key);
            regions.put(parseKey(rc, key, Region.values(), Region::key), new RegionEconomy(
                    r.getDouble("gdp2025"),
                    r.getDouble("tfpGrowth"),
                    r.getDouble("tfpDecay"),
                    r.getDouble("energyIntensity"),
                    r.getDouble("intensityDecline")));
        }
        Config b = c.getConfig("energyBurden");
        EnergyBurdenParams burden = new EnergyBurdenParams(
                b.getDouble("threshold"),
                b.getDouble("elasticity"),
                b.getDouble("maxBurden"),
                b.getDouble("maxDamage"),
                b.getDouble("persistentFraction"));
        return new EconomicParams(regions, c.getDouble("laborShare"), c.getDouble("persistentDamageFraction"), burden);
    }

    private static DemandParams readDemand(Config c) {
        return new DemandParams(
                c.getDouble("electrification2025"),
                c.getDouble("electrificationTarget"),
                c.getDouble("electrificationSpeed"),
                c.getDouble("demographicFactor"));
    }

    private static FinalEnergyParams readFinalEnergy(Config c) {
        Map<Sector, SectorProfile> sectors = new EnumMap<>(Sector.class);
        Config sc = c.getConfig("sectors");
        for (String key : sc.root().keySet()) {
            Config s = sc.getConfig(key);
            sectors.put(parseKey(sc, key, Sector.values(), Sector::key), new SectorProfile(
                    s.getDouble("share2025"),
                    s.getDouble("electrification2025"),
                    s.getDouble("electrificationTarget"),
                    s.getDouble("electrificationSpeed")));
        }
        return new FinalEnergyParams(
                sectors,
                c.getDouble("minNonElectricShare"),
                c.getDouble("transitionYears"),
                fuelMix(c.getConfig("fuelMix2025")),
                fuelMix(c.getConfig("fuelMix2100")),
                doubleMap(c.getConfig("carbonIntensity"), Fuel.class, Fuel.values(), Fuel::key),
                doubleMap(c.getConfig("fuelPrices"), Fuel.class, Fuel.values(), Fuel::key));
    }

    private static Map<Sector, Map<Fuel, Double>> fuelMix(Config c) {
        Map<Sector, Map<Fuel, Double>> mix = new EnumMap<>(Sector.class);
        for (String key : c.root().keySet()) {
            mix.put(parseKey(c, key, Sector.values(), Sector::key),
                    doubleMap(c.getConfig(key), Fuel.class, Fuel.values(), Fuel::key));
        }
        return mix;
    }

    private static PreEstimateParams readPreEstimate(Config c) {
        return new PreEstimateParams(
                c.getDouble("gridIntensity2025"),
                c.getDouble("gridIntensityDecline"),
                c.getDouble("lcoe2025"),
                c.getDouble("lcoeDecline"),
                c.getDouble("carbonPassThrough"),
                c.getDouble("carbonPassThroughDecline"),
                c.getDouble("nonElecFuelPrice"),
                c.getDouble("nonElecCarbonPassThrough"));
    }

    // ===================== ДЕМОГРАФИЯ И РЕСУРСЫ =====================

    private static DemographicParams readDemographics(Config c) {
        Map<Region, RegionDemography> regions = new EnumMap<>(Region.class);
        Config rc = c.getConfig("regions");
        for (String key : rc.root().keySet()) {
            Config r = rc.getConfig(key);
            regions.put(parseKey(rc, key, Region.values(), Region::key), new RegionDemography(
                    r.getDouble("population2025"),
                    r.getDouble("fertility"),
                    r.getDouble("fertilityFloor"),
                    r.getDouble("fertilityDecay"),
                    r.getDouble("lifeExpectancy"),
                    r.getDouble("young"),
                    r.getDouble("working"),
                    r.getDouble("old"),
                    r.getDouble("migrationRate")));
        }
        Map<Region, EducationProfile> education = new EnumMap<>(Region.class);
        Config ec = c.getConfig("education");
        for (String key : ec.root().keySet()) {
            Config e = ec.getConfig(key);
            education.put(parseKey(ec, key, Region.values(), Region::key), new EducationProfile(
                    e.getDouble("enrollmentRate2025"),
                    e.getDouble("enrollmentTarget"),
                    e.getDouble("enrollmentGrowth"),
                    e.getDouble("collegeShare2025"),
                    e.getDouble("wagePremium2025"),
                    e.getDouble("wagePremiumTarget"),
                    e.getDouble("premiumDecay"),
                    e.getDouble("lifeExpectancyBonus"),
                    e.getDouble("lifeExpectancyPenalty")));
        }
        return new DemographicParams(regions, education,
                c.getDouble("lifeExpectancyGrowth"),
                c.getDouble("fertilityFloorMultiplier"),
                c.getDouble("migrationMultiplier"));
    }

    private static ResourceParams readResources(Config c) {
        Map<Mineral, MineralParams> minerals = new EnumMap<>(Mineral.class);
        Config mc = c.getConfig("minerals");
        for (String key : mc.root().keySet()) {
            Config m = mc.getConfig(key);
            minerals.put(parseKey(mc, key, Mineral.values(), Mineral::key), new MineralParams(
                    m.getDouble("perMWSolar"),
                    m.getDouble("perMWWind"),
                    m.getDouble("perMWNuclear"),
                    m.getDouble("perGWhBattery"),
                    m.getDouble("learningRate"),
                    m.getDouble("reserves"),
                    m.getDouble("recyclingBase"),
                    m.getDouble("recyclingMax"),
                    m.getDouble("recyclingHalfway")));
        }
        Config f = c.getConfig("food");
        FoodParams food = new FoodParams(
                f.getDouble("caloriesPerCapita2025"),
                f.getDouble("caloriesGrowthRate"),
                f.getDouble("proteinShare2025"),
                f.getDouble("proteinShareMax"),
                f.getDouble("proteinGDPHalfway"),
                f.getDouble("glp1HalfwayYear"),
                f.getDouble("glp1Steepness"),
                f.getDouble("glp1MaxPenetration"),
                f.getDouble("glp1CalorieReduction"),
                f.getDouble("grainToProteinRatio"),
                f.getDouble("caloriesPerKgGrain"),
                f.getDouble("proteinCaloriesPerKg"));
        Config l = c.getConfig("land");
        LandParams land = new LandParams(
                l.getDouble("farmland2025"),
                l.getDouble("yieldGrowthRate"),
                l.getDouble("yield2025"),
                l.getDouble("nonFoodMultiplier"),
                l.getDouble("urbanPerCapita"),
                l.getDouble("urbanWealthElasticity"),
                l.getDouble("forestArea2025"),
                l.getDouble("forestLossRate"),
                l.getDouble("reforestationRate"),
                l.getDouble("totalLandArea"),
                l.getDouble("desert2025"),
                l.getDouble("desertificationRate"),
                l.getDouble("desertificationClimateCoeff"),
                l.getDouble("desertificationThreshold"),
                l.getDouble("forestCarbonDensity"),
                l.getDouble("sequestrationRate"),
                l.getDouble("deforestationEmissionFactor"),
                l.getDouble("decayRate"));
        return new ResourceParams(
                c.getDouble("mineralLearningMultiplier"),
                minerals,
                sourceMap(c, "priorYearCapacityRatio"),
                food,
                land);
    }

    // --------- helpers ---------

    private static Map<SourceType, Double> sourceMap(Config c, String path) {
        return doubleMap(c.getConfig(path), SourceType.class, SourceType.values(), SourceType::key);
    }

    private static Map<Region, Double> regionMap(Config c, String path) {
        return doubleMap(c.getConfig(path), Region.class, Region.values(), Region::key);
    }

    private static <E extends Enum<E>> Map<E, Double> doubleMap(Config c, Class<E> type, E[] values,
                                                                Function<E, String> keyOf) {
        Map<E, Double> m = new EnumMap<>(type);
        for (String key : c.root().keySet()) {
            m.put(parseKey(c, key, values, keyOf), c.getDouble(key));
        }
        return m;
    }

    private static <E extends Enum<E>> E parseKey(Config c, String key, E[] values, Function<E, String> keyOf) {
        for (E v : values) {
            if (keyOf.apply(v).equals(key)) {
                return v;
            }
        }
        throw new ConfigException.BadValue(c.origin(), key, "unknown key '" + key + "'");
    }
}
