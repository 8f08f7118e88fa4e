package energysim.engine.climate;

import energysim.config.ClimateParams;
import energysim.config.DispatchSource;
import energysim.config.EnergySource;
import energysim.config.FinalEnergyParams;
import energysim.config.Fuel;
import energysim.config.ModelParameters;
import energysim.config.Region;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.dispatch.DispatchResult;

import java.util.Map;

/**
 * Климатическая цепочка: выбросы, концентрация CO2, температура и ущерб.
 * <p>
 * Концентрация выводится из накопленных выбросов, равновесная температура из
 * логарифма отношения концентраций, фактическая температура приближается к
 * равновесной с запаздыванием. Ущерб квадратичен по температуре с региональным
 * множителем и плавным переходом через точку невозврата.
 */
public final class ClimateModel {

    private final ClimateParams params;
    private final double gasIntensity;
    private final double coalIntensity;
    private final FinalEnergyParams finalEnergy;

    public ClimateModel(ModelParameters p) {
        this(p.climate(), p.energySources(), p.finalEnergy());
    }

    public ClimateModel(ClimateParams params, Map<SourceType, EnergySource> sources, FinalEnergyParams finalEnergy) {
        this.params = params;
        this.gasIntensity = sources.get(SourceType.GAS).carbonIntensity();
        this.coalIntensity = sources.get(SourceType.COAL).carbonIntensity();
        this.finalEnergy = finalEnergy;
    }

    public ClimateParams params() {
        return params;
    }

    // ===================== ВЫБРОСЫ =====================

    /**
     * Выбросы электроэнергетики, Gt CO2: газ и уголь по их углеродоёмкости.
     */
    public double electricityEmissions(DispatchResult dispatch) {
        return electricityEmissions(dispatch.generation(DispatchSource.GAS), dispatch.generation(DispatchSource.COAL));
    }

    public double electricityEmissions(double gasTwh, double coalTwh) {
        return (gasTwh * gasIntensity + coalTwh * coalIntensity) / SimulationConstants.KG_TWH_TO_GT;
    }

    /**
     * Неэлектрические выбросы по фактическому потреблению топлива, Gt CO2.
     */
    public double nonElectricEmissions(Map<Fuel, Double> fuelDemandTwh) {
        double total = 0.0;
        for (Map.Entry<Fuel, Double> e : fuelDemandTwh.entrySet()) {
            total += e.getValue() * finalEnergy.carbonIntensity(e.getKey()) / SimulationConstants.KG_TWH_TO_GT;
        }
        return total;
    }

    // ===================== КЛИМАТ =====================

    /**
     * Состояние на начало 2025 года: накопленные выбросы и наблюдаемая температура.
     */
    public ClimateState initialState() {
        ClimateState derived = update(params.cumulativeCO2_2025(), params.currentTemp());
        return new ClimateState(derived.cumulativeEmissions(), derived.co2ppm(), derived.equilibriumTemp(),
                params.currentTemp());
    }

    /**
     * Пересчёт концентрации и температуры по накопленным выбросам.
     *
     * @param cumulativeEmissions накопленные выбросы, Gt CO2
     * @param previousTemp        температура предыдущего года, °C
     */
    public ClimateState update(double cumulativeEmissions, double previousTemp) {
        double co2ppm = params.preindustrialCO2() + cumulativeEmissions * params.airborneFraction() * params.ppmPerGt();
        double equilibrium = params.climSensitivity() * log2(co2ppm / params.preindustrialCO2());
        double temperature = previousTemp + (equilibrium - previousTemp) / params.temperatureLag();
        return new ClimateState(cumulativeEmissions, co2ppm, equilibrium, temperature);
    }

    /**
     * Шаг года: выбросы добавляются к накопленным, затем пересчёт.
     */
    public ClimateState advance(ClimateState previous, double emissionsGt) {
        return update(previous.cumulativeEmissions() + emissionsGt, previous.temperature());
    }

    // ===================== УЩЕРБ =====================

    /**
     * Ущерб региона как доля ВВП, не более maxDamage.
     */
    public double damageFraction(double temperature, Region region) {
        double damage = params.damageCoeff() * temperature * temperature * params.regionalDamage(region);
        double tipping = 1.0 / (1.0 + Math.exp(-params.tippingSteepness() * (temperature - params.tippingThreshold())));
        damage *= 1.0 + (params.tippingMultiplier() - 1.0) * tipping;
        return Math.min(damage, params.maxDamage());
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }
}
