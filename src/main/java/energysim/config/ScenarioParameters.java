package energysim.config;

/**
 * Параметры сценария уровня Tier-1 (immutable).
 * <p>
 * Шесть основных параметров заданы всегда. Остальные могут быть null:
 * тогда действует значение модели (reference.conf или overrides сценария).
 */
public class ScenarioParameters {

    /**
     * Цена углерода, $/т CO2.
     */
    private final double carbonPrice;

    /**
     * Показатель кривой обучения СЭС.
     */
    private final double solarAlpha;

    /**
     * Желаемый годовой рост мощности СЭС.
     */
    private final double solarGrowth;

    /**
     * Целевая доля электричества в конечной энергии.
     */
    private final double electrificationTarget;

    /**
     * Множитель темпа снижения энергоёмкости.
     */
    private final double efficiencyMultiplier;

    /**
     * Чувствительность климата, °C на удвоение CO2.
     */
    private final double climSensitivity;

    // ---------- Необязательные параметры (null = значение модели) ----------

    private final Double windAlpha;
    private final Double windGrowth;
    private final Double batteryAlpha;
    private final Double nuclearGrowth;
    private final Double nuclearCost0;
    private final Double hydroGrowth;
    private final Double damageCoeff;
    private final Double tippingThreshold;
    private final Double nonElecEmissions2025;
    private final Double savingsWorking;
    private final Double automationGrowth;
    private final Double stabilityLambda;
    private final Double robotGrowthRate;
    private final Double fertilityFloorMultiplier;
    private final Double lifeExpectancyGrowth;
    private final Double migrationMultiplier;
    private final Double mineralLearningMultiplier;
    private final Double glp1MaxPenetration;
    private final Double yieldGrowthRate;

    ScenarioParameters(ScenarioParametersBuilder b) {
        this.carbonPrice = b.getCarbonPrice();
        this.solarAlpha = b.getSolarAlpha();
        this.solarGrowth = b.getSolarGrowth();
        this.electrificationTarget = b.getElectrificationTarget();
        this.efficiencyMultiplier = b.getEfficiencyMultiplier();
        this.climSensitivity = b.getClimSensitivity();
        this.windAlpha = b.getWindAlpha();
        this.windGrowth = b.getWindGrowth();
        this.batteryAlpha = b.getBatteryAlpha();
        this.nuclearGrowth = b.getNuclearGrowth();
        this.nuclearCost0 = b.getNuclearCost0();
        this.hydroGrowth = b.getHydroGrowth();
        this.damageCoeff = b.getDamageCoeff();
        this.tippingThreshold = b.getTippingThreshold();
        this.nonElecEmissions2025 = b.getNonElecEmissions2025();
        this.savingsWorking = b.getSavingsWorking();
        this.automationGrowth = b.getAutomationGrowth();
        this.stabilityLambda = b.getStabilityLambda();
        this.robotGrowthRate = b.getRobotGrowthRate();
        this.fertilityFloorMultiplier = b.getFertilityFloorMultiplier();
        this.lifeExpectancyGrowth = b.getLifeExpectancyGrowth();
        this.migrationMultiplier = b.getMigrationMultiplier();
        this.mineralLearningMultiplier = b.getMineralLearningMultiplier();
        this.glp1MaxPenetration = b.getGlp1MaxPenetration();
        this.yieldGrowthRate = b.getYieldGrowthRate();
    }

    /**
     * Значения по умолчанию (carbonPrice = 35 и т.д.), все необязательные параметры не заданы.
     */
    public static ScenarioParameters defaults() {
        return new ScenarioParametersBuilder().build();
    }

    /**
     * Значение параметра по идентификатору (null, если необязательный параметр не задан).
     */
    public Double get(TunableParamId id) {
        return TunableParameterPool.get(id).read(this);
    }

    // --------- Getters ---------

    public double getCarbonPrice() {
        return carbonPrice;
    }

    public double getSolarAlpha() {
        return solarAlpha;
    }

    public double getSolarGrowth() {
        return solarGrowth;
    }

    public double getElectrificationTarget() {
        return electrificationTarget;
    }

    public double getEfficiencyMultiplier() {
        return efficiencyMultiplier;
    }

    public double getClimSensitivity() {
        return climSensitivity;
    }

    public Double getWindAlpha() {
        return windAlpha;
    }

    public Double getWindGrowth() {
        return windGrowth;
    }

    public Double getBatteryAlpha() {
        return batteryAlpha;
    }

    public Double getNuclearGrowth() {
        return nuclearGrowth;
    }

    public Double getNuclearCost0() {
        return nuclearCost0;
    }

    public Double getHydroGrowth() {
        return hydroGrowth;
    }

    public Double getDamageCoeff() {
        return damageCoeff;
    }

    public Double getTippingThreshold() {
        return tippingThreshold;
    }

    public Double getNonElecEmissions2025() {
        return nonElecEmissions2025;
    }

    public Double getSavingsWorking() {
        return savingsWorking;
    }

    public Double getAutomationGrowth() {
        return automationGrowth;
    }

    public Double getStabilityLambda() {
        return stabilityLambda;
    }

    public Double getRobotGrowthRate() {
        return robotGrowthRate;
    }

    public Double getFertilityFloorMultiplier() {
        return fertilityFloorMultiplier;
    }

    public Double getLifeExpectancyGrowth() {
        return lifeExpectancyGrowth;
    }

    public Double getMigrationMultiplier() {
        return migrationMultiplier;
    }

    public Double getMineralLearningMultiplier() {
        return mineralLearningMultiplier;
    }

    public Double getGlp1MaxPenetration() {
        return glp1MaxPenetration;
    }

    public Double getYieldGrowthRate() {
        return yieldGrowthRate;
    }

}
