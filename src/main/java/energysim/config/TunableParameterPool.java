package energysim.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Реестр параметров Tier-1 с диапазонами и описаниями.
 */
public final class TunableParameterPool {

    private static final Map<TunableParamId, TunableParameter> POOL;

    static {
        Map<TunableParamId, TunableParameter> m = new EnumMap<>(TunableParamId.class);

        // Основные
        put(m, TunableParamId.CARBON_PRICE, 35.0, 35.0, 0, 200, "$/ton CO₂",
                "Carbon tax applied to fossil fuel generation. Higher values accelerate transition to renewables.",
                ScenarioParametersBuilder::setCarbonPrice, ScenarioParameters::getCarbonPrice);
        put(m, TunableParamId.SOLAR_ALPHA, 0.36, 0.36, 0.1, 0.5, "dimensionless",
                "Wright's Law learning exponent for solar. 0.36 = 22% cost reduction per capacity doubling.",
                ScenarioParametersBuilder::setSolarAlpha, ScenarioParameters::getSolarAlpha);
        put(m, TunableParamId.SOLAR_GROWTH, 0.25, 0.25, 0.05, 0.40, "fraction/year",
                "Annual solar capacity growth rate. 0.25 = 25% per year.",
                ScenarioParametersBuilder::setSolarGrowth, ScenarioParameters::getSolarGrowth);
        put(m, TunableParamId.ELECTRIFICATION_TARGET, 0.65, 0.65, 0.40, 0.90, "fraction",
                "Target share of final energy from electricity by 2050. Drives electricity demand growth.",
                ScenarioParametersBuilder::setElectrificationTarget, ScenarioParameters::getElectrificationTarget);
        put(m, TunableParamId.EFFICIENCY_MULTIPLIER, 1.0, 1.0, 0.5, 2.0, "multiplier",
                "Multiplier on the annual energy-intensity decline. Above 1 means faster efficiency gains.",
                ScenarioParametersBuilder::setEfficiencyMultiplier, ScenarioParameters::getEfficiencyMultiplier);
        put(m, TunableParamId.CLIM_SENSITIVITY, 3.0, 3.0, 2.0, 4.5, "°C per CO₂ doubling",
                "Equilibrium climate sensitivity. IPCC likely range 2.5-4.0.",
                ScenarioParametersBuilder::setClimSensitivity, ScenarioParameters::getClimSensitivity);

        // Энергетика
        opt(m, TunableParamId.WIND_ALPHA, 0.23, 0.1, 0.4, "dimensionless",
                "Wright's Law learning exponent for wind.",
                ScenarioParametersBuilder::setWindAlpha, ScenarioParameters::getWindAlpha);
        opt(m, TunableParamId.WIND_GROWTH, 0.18, 0.05, 0.30, "fraction/year",
                "Annual wind capacity growth rate.",
                ScenarioParametersBuilder::setWindGrowth, ScenarioParameters::getWindGrowth);
        opt(m, TunableParamId.BATTERY_ALPHA, 0.26, 0.1, 0.4, "dimensionless",
                "Wright's Law learning exponent for battery storage.",
                ScenarioParametersBuilder::setBatteryAlpha, ScenarioParameters::getBatteryAlpha);
        opt(m, TunableParamId.NUCLEAR_GROWTH, 0.02, 0.0, 0.10, "fraction/year",
                "Annual nuclear capacity growth rate.",
                ScenarioParametersBuilder::setNuclearGrowth, ScenarioParameters::getNuclearGrowth);
        opt(m, TunableParamId.NUCLEAR_COST0, 90.0, 50, 150, "$/MWh",
                "Nuclear LCOE in 2025.",
                ScenarioParametersBuilder::setNuclearCost0, ScenarioParameters::getNuclearCost0);
        opt(m, TunableParamId.HYDRO_GROWTH, 0.01, 0.0, 0.05, "fraction/year",
                "Annual hydro capacity growth rate.",
                ScenarioParametersBuilder::setHydroGrowth, ScenarioParameters::getHydroGrowth);

        // Климат
        opt(m, TunableParamId.DAMAGE_COEFF, 0.00236, 0.001, 0.01, "fraction per °C²",
                "Quadratic climate damage coefficient (DICE-style).",
                ScenarioParametersBuilder::setDamageCoeff, ScenarioParameters::getDamageCoeff);
        opt(m, TunableParamId.TIPPING_THRESHOLD, 2.5, 1.5, 4.0, "°C",
                "Temperature at which damages accelerate through the tipping transition.",
                ScenarioParametersBuilder::setTippingThreshold, ScenarioParameters::getTippingThreshold);
        opt(m, TunableParamId.NON_ELEC_EMISSIONS_2025, 25.0, 15, 35, "Gt CO₂",
                "Non-electricity CO₂ emissions in 2025 used by the feedback pre-estimate.",
                ScenarioParametersBuilder::setNonElecEmissions2025, ScenarioParameters::getNonElecEmissions2025);

        // Капитал и автоматизация
        opt(m, TunableParamId.SAVINGS_WORKING, 0.45, 0.2, 0.6, "fraction",
                "Savings rate of the working-age cohort.",
                ScenarioParametersBuilder::setSavingsWorking, ScenarioParameters::getSavingsWorking);
        opt(m, TunableParamId.AUTOMATION_GROWTH, 0.03, 0.01, 0.10, "fraction/year",
                "Annual growth of the automation share of capital.",
                ScenarioParametersBuilder::setAutomationGrowth, ScenarioParameters::getAutomationGrowth);
        opt(m, TunableParamId.STABILITY_LAMBDA, 2.0, 0.5, 5.0, "dimensionless",
                "Sensitivity of investment to climate damage uncertainty.",
                ScenarioParametersBuilder::setStabilityLambda, ScenarioParameters::getStabilityLambda);
        opt(m, TunableParamId.ROBOT_GROWTH_RATE, 0.12, 0.05, 0.25, "fraction/year",
                "Fallback annual growth of robot density when the capital chain does not supply one.",
                ScenarioParametersBuilder::setRobotGrowthRate, ScenarioParameters::getRobotGrowthRate);

        // Демография
        opt(m, TunableParamId.FERTILITY_FLOOR_MULTIPLIER, 1.0, 0.5, 1.5, "multiplier",
                "Multiplier on the regional long-run fertility floors.",
                ScenarioParametersBuilder::setFertilityFloorMultiplier, ScenarioParameters::getFertilityFloorMultiplier);
        opt(m, TunableParamId.LIFE_EXPECTANCY_GROWTH, 0.1, 0.0, 0.3, "years/year",
                "Annual gain in life expectancy.",
                ScenarioParametersBuilder::setLifeExpectancyGrowth, ScenarioParameters::getLifeExpectancyGrowth);
        opt(m, TunableParamId.MIGRATION_MULTIPLIER, 1.0, 0.0, 3.0, "multiplier",
                "Multiplier on the regional net migration rates.",
                ScenarioParametersBuilder::setMigrationMultiplier, ScenarioParameters::getMigrationMultiplier);

        // Ресурсы
        opt(m, TunableParamId.MINERAL_LEARNING_MULTIPLIER, 1.0, 0.5, 2.0, "multiplier",
                "Multiplier on the annual decline of mineral intensity.",
                ScenarioParametersBuilder::setMineralLearningMultiplier, ScenarioParameters::getMineralLearningMultiplier);
        opt(m, TunableParamId.GLP1_MAX_PENETRATION, 0.15, 0.0, 0.4, "fraction",
                "Maximum population share using GLP-1 drugs.",
                ScenarioParametersBuilder::setGlp1MaxPenetration, ScenarioParameters::getGlp1MaxPenetration);
        opt(m, TunableParamId.YIELD_GROWTH_RATE, 0.01, 0.0, 0.03, "fraction/year",
                "Annual crop yield improvement.",
                ScenarioParametersBuilder::setYieldGrowthRate, ScenarioParameters::getYieldGrowthRate);

        POOL = Collections.unmodifiableMap(m);
    }

    private TunableParameterPool() {
    }

    @FunctionalInterface
    private interface DoubleSetter {
        ScenarioParametersBuilder set(ScenarioParametersBuilder b, double v);
    }

    @FunctionalInterface
    private interface BoxedSetter {
        ScenarioParametersBuilder set(ScenarioParametersBuilder b, Double v);
    }

    @FunctionalInterface
    private interface DoubleGetter {
        double get(ScenarioParameters p);
    }

    @FunctionalInterface
    private interface BoxedGetter {
        Double get(ScenarioParameters p);
    }

    private static void put(Map<TunableParamId, TunableParameter> m, TunableParamId id,
                            double defaultValue, double hardcoded, double min, double max,
                            String unit, String description, DoubleSetter setter, DoubleGetter getter) {
        m.put(id, new TunableParameter(id, defaultValue, hardcoded, min, max, unit, description,
                setter::set, p -> getter.get(p)));
    }

    private static void opt(Map<TunableParamId, TunableParameter> m, TunableParamId id,
                            double hardcoded, double min, double max,
                            String unit, String description, BoxedSetter setter, BoxedGetter getter) {
        m.put(id, new TunableParameter(id, null, hardcoded, min, max, unit, description,
                (b, v) -> setter.set(b, v), getter::get));
    }

    public static TunableParameter get(TunableParamId id) {
        TunableParameter p = POOL.get(id);
        if (p == null) {
            throw new IllegalArgumentException("Unknown parameter: " + id);
        }
        return p;
    }

    public static TunableParameter byName(String name) {
        return get(TunableParamId.fromKey(name));
    }

    public static List<TunableParameter> all() {
        return new ArrayList<>(POOL.values());
    }

    public static List<TunableParameter> of(List<TunableParamId> ids) {
        return ids.stream().map(TunableParameterPool::get).toList();
    }
}
