package energysim.config;

/**
 * Параметры источника энергии (immutable).
 *
 * @param cost0           базовая стоимость 2025, $/MWh (аккумулятор: $/kWh)
 * @param alpha           показатель кривой обучения
 * @param capacity2025    мощность 2025, GW (аккумулятор: GWh)
 * @param growthRate      желаемый годовой рост мощности (отрицательный для угля)
 * @param carbonIntensity kg CO2/MWh
 * @param eroei0          начальный EROEI (только ископаемые)
 * @param reserves        запасы в условных единицах добычи (только ископаемые)
 * @param extractionRate  добыча за год при базовой генерации
 */
public record EnergySource(double cost0,
                           double alpha,
                           double capacity2025,
                           double growthRate,
                           double carbonIntensity,
                           double eroei0,
                           double reserves,
                           double extractionRate) {

    public EnergySource withCost0(double value) {
        return new EnergySource(value, alpha, capacity2025, growthRate, carbonIntensity, eroei0, reserves, extractionRate);
    }

    public EnergySource withAlpha(double value) {
        return new EnergySource(cost0, value, capacity2025, growthRate, carbonIntensity, eroei0, reserves, extractionRate);
    }

    public EnergySource withGrowthRate(double value) {
        return new EnergySource(cost0, alpha, capacity2025, value, carbonIntensity, eroei0, reserves, extractionRate);
    }
}
