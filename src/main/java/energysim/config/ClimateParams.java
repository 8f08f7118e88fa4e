package energysim.config;

import java.util.Map;

/**
 * Параметры климатической цепочки: углеродный цикл, температура, ущерб.
 *
 * @param cumulativeCO2_2025   накопленные выбросы к 2025 с доиндустриальной эпохи, Gt CO2
 * @param temperatureLag       лаг релаксации температуры, лет
 * @param climSensitivity      °C на удвоение CO2
 * @param damageCoeff          доля ВВП на °C²
 * @param nonElecEmissions2025 неэлектрические выбросы 2025 для предварительной оценки, Gt CO2
 */
public record ClimateParams(double preindustrialCO2,
                            double cumulativeCO2_2025,
                            double airborneFraction,
                            double ppmPerGt,
                            double temperatureLag,
                            double climSensitivity,
                            double currentTemp,
                            double damageCoeff,
                            Map<Region, Double> regionalDamage,
                            double tippingThreshold,
                            double tippingMultiplier,
                            double tippingSteepness,
                            double maxDamage,
                            double nonElecEmissions2025) {

    public ClimateParams {
        regionalDamage = EnumMaps.copyOf(Region.class, regionalDamage);
    }

    public double regionalDamage(Region region) {
        return EnumMaps.getOrZero(regionalDamage, region);
    }

    public ClimateParams withClimSensitivity(double v) {
        return new ClimateParams(preindustrialCO2, cumulativeCO2_2025, airborneFraction, ppmPerGt, temperatureLag,
                v, currentTemp, damageCoeff, regionalDamage, tippingThreshold, tippingMultiplier,
                tippingSteepness, maxDamage, nonElecEmissions2025);
    }

    public ClimateParams withDamageCoeff(double v) {
        return new ClimateParams(preindustrialCO2, cumulativeCO2_2025, airborneFraction, ppmPerGt, temperatureLag,
                climSensitivity, currentTemp, v, regionalDamage, tippingThreshold, tippingMultiplier,
                tippingSteepness, maxDamage, nonElecEmissions2025);
    }

    public ClimateParams withTippingThreshold(double v) {
        return new ClimateParams(preindustrialCO2, cumulativeCO2_2025, airborneFraction, ppmPerGt, temperatureLag,
                climSensitivity, currentTemp, damageCoeff, regionalDamage, v, tippingMultiplier,
                tippingSteepness, maxDamage, nonElecEmissions2025);
    }

    public ClimateParams withNonElecEmissions2025(double v) {
        return new ClimateParams(preindustrialCO2, cumulativeCO2_2025, airborneFraction, ppmPerGt, temperatureLag,
                climSensitivity, currentTemp, damageCoeff, regionalDamage, tippingThreshold, tippingMultiplier,
                tippingSteepness, maxDamage, v);
    }
}
