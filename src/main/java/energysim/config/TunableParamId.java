package energysim.config;

/**
 * Идентификаторы параметров уровня Tier-1, доступных из сценария, CLI,
 * перебора и анализа чувствительности.
 */
public enum TunableParamId {

    // Основные
    CARBON_PRICE("carbonPrice"),
    SOLAR_ALPHA("solarAlpha"),
    SOLAR_GROWTH("solarGrowth"),
    ELECTRIFICATION_TARGET("electrificationTarget"),
    EFFICIENCY_MULTIPLIER("efficiencyMultiplier"),
    CLIM_SENSITIVITY("climSensitivity"),

    // Энергетика
    WIND_ALPHA("windAlpha"),
    WIND_GROWTH("windGrowth"),
    BATTERY_ALPHA("batteryAlpha"),
    NUCLEAR_GROWTH("nuclearGrowth"),
    NUCLEAR_COST0("nuclearCost0"),
    HYDRO_GROWTH("hydroGrowth"),

    // Климат
    DAMAGE_COEFF("damageCoeff"),
    TIPPING_THRESHOLD("tippingThreshold"),
    NON_ELEC_EMISSIONS_2025("nonElecEmissions2025"),

    // Капитал и автоматизация
    SAVINGS_WORKING("savingsWorking"),
    AUTOMATION_GROWTH("automationGrowth"),
    STABILITY_LAMBDA("stabilityLambda"),
    ROBOT_GROWTH_RATE("robotGrowthRate"),

    // Демография
    FERTILITY_FLOOR_MULTIPLIER("fertilityFloorMultiplier"),
    LIFE_EXPECTANCY_GROWTH("lifeExpectancyGrowth"),
    MIGRATION_MULTIPLIER("migrationMultiplier"),

    // Ресурсы
    MINERAL_LEARNING_MULTIPLIER("mineralLearningMultiplier"),
    GLP1_MAX_PENETRATION("glp1MaxPenetration"),
    YIELD_GROWTH_RATE("yieldGrowthRate");

    private final String key;

    TunableParamId(String key) {
        this.key = key;
    }

    /**
     * Имя параметра в сценарии и в опциях CLI.
     */
    public String key() {
        return key;
    }

    public static TunableParamId fromKey(String key) {
        for (TunableParamId id : values()) {
            if (id.key.equals(key)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown parameter: " + key);
    }
}
