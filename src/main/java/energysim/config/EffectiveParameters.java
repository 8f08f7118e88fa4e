package energysim.config;

/**
 * Сборка эффективных параметров прогона: модель + значения Tier-1 сценария.
 * Исходный ModelParameters не изменяется.
 */
public final class EffectiveParameters {

    private EffectiveParameters() {
    }

    public static ModelParameters resolve(ModelParameters base, ScenarioParameters p) {
        ModelParameters m = base;

        // 1) источники энергии
        EnergySource solar = m.source(SourceType.SOLAR)
                .withAlpha(p.getSolarAlpha())
                .withGrowthRate(p.getSolarGrowth());
        m = m.withEnergySource(SourceType.SOLAR, solar);

        EnergySource wind = m.source(SourceType.WIND);
        if (p.getWindAlpha() != null) {
            wind = wind.withAlpha(p.getWindAlpha());
        }
        if (p.getWindGrowth() != null) {
            wind = wind.withGrowthRate(p.getWindGrowth());
        }
        m = m.withEnergySource(SourceType.WIND, wind);

        if (p.getBatteryAlpha() != null) {
            m = m.withEnergySource(SourceType.BATTERY, m.source(SourceType.BATTERY).withAlpha(p.getBatteryAlpha()));
        }
        EnergySource nuclear = m.source(SourceType.NUCLEAR);
        if (p.getNuclearGrowth() != null) {
            nuclear = nuclear.withGrowthRate(p.getNuclearGrowth());
        }
        if (p.getNuclearCost0() != null) {
            nuclear = nuclear.withCost0(p.getNuclearCost0());
        }
        m = m.withEnergySource(SourceType.NUCLEAR, nuclear);
        if (p.getHydroGrowth() != null) {
            m = m.withEnergySource(SourceType.HYDRO, m.source(SourceType.HYDRO).withGrowthRate(p.getHydroGrowth()));
        }

        // 2) климат
        ClimateParams climate = m.climate().withClimSensitivity(p.getClimSensitivity());
        if (p.getDamageCoeff() != null) {
            climate = climate.withDamageCoeff(p.getDamageCoeff());
        }
        if (p.getTippingThreshold() != null) {
            climate = climate.withTippingThreshold(p.getTippingThreshold());
        }
        if (p.getNonElecEmissions2025() != null) {
            climate = climate.withNonElecEmissions2025(p.getNonElecEmissions2025());
        }
        m = m.withClimate(climate);

        // 3) капитал и автоматизация
        CapitalParams capital = m.capital();
        if (p.getSavingsWorking() != null) {
            capital = capital.withSavingsWorking(p.getSavingsWorking());
        }
        if (p.getAutomationGrowth() != null) {
            capital = capital.withAutomationGrowth(p.getAutomationGrowth());
        }
        if (p.getStabilityLambda() != null) {
            capital = capital.withStabilityLambda(p.getStabilityLambda());
        }
        m = m.withCapital(capital);
        if (p.getRobotGrowthRate() != null) {
            m = m.withExpansion(m.expansion().withRobotGrowthRate(p.getRobotGrowthRate()));
        }

        // 4) спрос и демография
        m = m.withDemand(m.demand().withElectrificationTarget(p.getElectrificationTarget()));
        DemographicParams demo = m.demographics();
        if (p.getFertilityFloorMultiplier() != null) {
            demo = demo.withFertilityFloorMultiplier(p.getFertilityFloorMultiplier());
        }
        if (p.getLifeExpectancyGrowth() != null) {
            demo = demo.withLifeExpectancyGrowth(p.getLifeExpectancyGrowth());
        }
        if (p.getMigrationMultiplier() != null) {
            demo = demo.withMigrationMultiplier(p.getMigrationMultiplier());
        }
        m = m.withDemographics(demo);

        // 5) ресурсы
        ResourceParams res = m.resources();
        if (p.getMineralLearningMultiplier() != null) {
            res = res.withMineralLearningMultiplier(p.getMineralLearningMultiplier());
        }
        if (p.getGlp1MaxPenetration() != null) {
            res = res.withFood(res.food().withGlp1MaxPenetration(p.getGlp1MaxPenetration()));
        }
        if (p.getYieldGrowthRate() != null) {
            res = res.withLand(res.land().withYieldGrowthRate(p.getYieldGrowthRate()));
        }
        return m.withResources(res);
    }
}
