package energysim.config;

/**
 * Аналитические траектории для предварительного прохода (климат и энергетическая нагрузка).
 *
 * @param gridIntensity2025        kg CO2/MWh
 * @param lcoe2025                 средний LCOE, $/MWh
 * @param carbonPassThrough        доля цены углерода в среднем LCOE
 * @param nonElecFuelPrice         средняя цена неэлектрического топлива, $/MWh
 * @param nonElecCarbonPassThrough доля цены углерода в цене топлива
 */
public record PreEstimateParams(double gridIntensity2025,
                                double gridIntensityDecline,
                                double lcoe2025,
                                double lcoeDecline,
                                double carbonPassThrough,
                                double carbonPassThroughDecline,
                                double nonElecFuelPrice,
                                double nonElecCarbonPassThrough) {
}
