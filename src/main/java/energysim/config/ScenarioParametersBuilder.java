package energysim.config;

/**
 * Builder для ScenarioParameters.
 */
public class ScenarioParametersBuilder {

    private double carbonPrice = 35.0;
    private double solarAlpha = 0.36;
    private double solarGrowth = 0.25;
    private double electrificationTarget = 0.65;
    private double efficiencyMultiplier = 1.0;
    private double climSensitivity = 3.0;
    private Double windAlpha;
    private Double windGrowth;
    private Double batteryAlpha;
    private Double nuclearGrowth;
    private Double nuclearCost0;
    private Double hydroGrowth;
    private Double damageCoeff;
    private Double tippingThreshold;
    private Double nonElecEmissions2025;
    private Double savingsWorking;
    private Double automationGrowth;
    private Double stabilityLambda;
    private Double robotGrowthRate;
    private Double fertilityFloorMultiplier;
    private Double lifeExpectancyGrowth;
    private Double migrationMultiplier;
    private Double mineralLearningMultiplier;
    private Double glp1MaxPenetration;
    private Double yieldGrowthRate;

    public static ScenarioParametersBuilder from(ScenarioParameters base) {
        ScenarioParametersBuilder b = new ScenarioParametersBuilder();
        b.carbonPrice = base.getCarbonPrice();
        b.solarAlpha = base.getSolarAlpha();
        b.solarGrowth = base.getSolarGrowth();
        b.electrificationTarget = base.getElectrificationTarget();
        b.efficiencyMultiplier = base.getEfficiencyMultiplier();
        b.climSensitivity = base.getClimSensitivity();
        b.windAlpha = base.getWindAlpha();
        b.windGrowth = base.getWindGrowth();
        b.batteryAlpha = base.getBatteryAlpha();
        b.nuclearGrowth = base.getNuclearGrowth();
        b.nuclearCost0 = base.getNuclearCost0();
        b.hydroGrowth = base.getHydroGrowth();
        b.damageCoeff = base.getDamageCoeff();
        b.tippingThreshold = base.getTippingThreshold();
        b.nonElecEmissions2025 = base.getNonElecEmissions2025();
        b.savingsWorking = base.getSavingsWorking();
        b.automationGrowth = base.getAutomationGrowth();
        b.stabilityLambda = base.getStabilityLambda();
        b.robotGrowthRate = base.getRobotGrowthRate();
        b.fertilityFloorMultiplier = base.getFertilityFloorMultiplier();
        b.lifeExpectancyGrowth = base.getLifeExpectancyGrowth();
        b.migrationMultiplier = base.getMigrationMultiplier();
        b.mineralLearningMultiplier = base.getMineralLearningMultiplier();
        b.glp1MaxPenetration = base.getGlp1MaxPenetration();
        b.yieldGrowthRate = base.getYieldGrowthRate();
        return b;
    }

    /**
     * Установка параметра по идентификатору.
     */
    public ScenarioParametersBuilder set(TunableParamId id, double value) {
        TunableParameterPool.get(id).applier().apply(this, value);
        return this;
    }

    public double getCarbonPrice() {
        return carbonPrice;
    }

    public ScenarioParametersBuilder setCarbonPrice(double carbonPrice) {
        this.carbonPrice = carbonPrice;
        return this;
    }

    public double getSolarAlpha() {
        return solarAlpha;
    }

    public ScenarioParametersBuilder setSolarAlpha(double solarAlpha) {
        this.solarAlpha = solarAlpha;
        return this;
    }

    public double getSolarGrowth() {
        return solarGrowth;
    }

    public ScenarioParametersBuilder setSolarGrowth(double solarGrowth) {
        this.solarGrowth = solarGrowth;
        return this;
    }

    public double getElectrificationTarget() {
        return electrificationTarget;
    }

    public ScenarioParametersBuilder setElectrificationTarget(double electrificationTarget) {
        this.electrificationTarget = electrificationTarget;
        return this;
    }

    public double getEfficiencyMultiplier() {
        return efficiencyMultiplier;
    }

    public ScenarioParametersBuilder setEfficiencyMultiplier(double efficiencyMultiplier) {
        this.efficiencyMultiplier = efficiencyMultiplier;
        return this;
    }

    public double getClimSensitivity() {
        return climSensitivity;
    }

    public ScenarioParametersBuilder setClimSensitivity(double climSensitivity) {
        this.climSensitivity = climSensitivity;
        return this;
    }

    public Double getWindAlpha() {
        return windAlpha;
    }

    public ScenarioParametersBuilder setWindAlpha(Double windAlpha) {
        this.windAlpha = windAlpha;
        return this;
    }

    public Double getWindGrowth() {
        return windGrowth;
    }

    public ScenarioParametersBuilder setWindGrowth(Double windGrowth) {
        this.windGrowth = windGrowth;
        return this;
    }

    public Double getBatteryAlpha() {
        return batteryAlpha;
    }

    public ScenarioParametersBuilder setBatteryAlpha(Double batteryAlpha) {
        this.batteryAlpha = batteryAlpha;
        return this;
    }

    public Double getNuclearGrowth() {
        return nuclearGrowth;
    }

    public ScenarioParametersBuilder setNuclearGrowth(Double nuclearGrowth) {
        this.nuclearGrowth = nuclearGrowth;
        return this;
    }

    public Double getNuclearCost0() {
        return nuclearCost0;
    }

    public ScenarioParametersBuilder setNuclearCost0(Double nuclearCost0) {
        this.nuclearCost0 = nuclearCost0;
        return this;
    }

    public Double getHydroGrowth() {
        return hydroGrowth;
    }

    public ScenarioParametersBuilder setHydroGrowth(Double hydroGrowth) {
        this.hydroGrowth = hydroGrowth;
        return this;
    }

    public Double getDamageCoeff() {
        return damageCoeff;
    }

    public ScenarioParametersBuilder setDamageCoeff(Double damageCoeff) {
        this.damageCoeff = damageCoeff;
        return this;
    }

    public Double getTippingThreshold() {
        return tippingThreshold;
    }

    public ScenarioParametersBuilder setTippingThreshold(Double tippingThreshold) {
        this.tippingThreshold = tippingThreshold;
        return this;
    }

    public Double getNonElecEmissions2025() {
        return nonElecEmissions2025;
    }

    public ScenarioParametersBuilder setNonElecEmissions2025(Double nonElecEmissions2025) {
        this.nonElecEmissions2025 = nonElecEmissions2025;
        return this;
    }

    public Double getSavingsWorking() {
        return savingsWorking;
    }

    public ScenarioParametersBuilder setSavingsWorking(Double savingsWorking) {
        this.savingsWorking = savingsWorking;
        return this;
    }

    public Double getAutomationGrowth() {
        return automationGrowth;
    }

    public ScenarioParametersBuilder setAutomationGrowth(Double automationGrowth) {
        this.automationGrowth = automationGrowth;
        return this;
    }

    public Double getStabilityLambda() {
        return stabilityLambda;
    }

    public ScenarioParametersBuilder setStabilityLambda(Double stabilityLambda) {
        this.stabilityLambda = stabilityLambda;
        return this;
    }

    public Double getRobotGrowthRate() {
        return robotGrowthRate;
    }

    public ScenarioParametersBuilder setRobotGrowthRate(Double robotGrowthRate) {
        this.robotGrowthRate = robotGrowthRate;
        return this;
    }

    public Double getFertilityFloorMultiplier() {
        return fertilityFloorMultiplier;
    }

    public ScenarioParametersBuilder setFertilityFloorMultiplier(Double fertilityFloorMultiplier) {
        this.fertilityFloorMultiplier = fertilityFloorMultiplier;
        return this;
    }

    public Double getLifeExpectancyGrowth() {
        return lifeExpectancyGrowth;
    }

    public ScenarioParametersBuilder setLifeExpectancyGrowth(Double lifeExpectancyGrowth) {
        this.lifeExpectancyGrowth = lifeExpectancyGrowth;
        return this;
    }

    public Double getMigrationMultiplier() {
        return migrationMultiplier;
    }

    public ScenarioParametersBuilder setMigrationMultiplier(Double migrationMultiplier) {
        this.migrationMultiplier = migrationMultiplier;
        return this;
    }

    public Double getMineralLearningMultiplier() {
        return mineralLearningMultiplier;
    }

    public ScenarioParametersBuilder setMineralLearningMultiplier(Double mineralLearningMultiplier) {
        this.mineralLearningMultiplier = mineralLearningMultiplier;
        return this;
    }

    public Double getGlp1MaxPenetration() {
        return glp1MaxPenetration;
    }

    public ScenarioParametersBuilder setGlp1MaxPenetration(Double glp1MaxPenetration) {
        this.glp1MaxPenetration = glp1MaxPenetration;
        return this;
    }

    public Double getYieldGrowthRate() {
        return yieldGrowthRate;
    }

    public ScenarioParametersBuilder setYieldGrowthRate(Double yieldGrowthRate) {
        this.yieldGrowthRate = yieldGrowthRate;
        return this;
    }

    public ScenarioParameters build() {
        return new ScenarioParameters(this);
    }
}
