package energysim.engine;

import energysim.config.Region;
import energysim.config.SourceType;
import energysim.engine.capital.SavingsRates;
import energysim.engine.climate.EmissionsBreakdown;
import energysim.engine.cost.LcoeSet;
import energysim.engine.demand.EnergyBurden;
import energysim.engine.demand.EnergyCost;
import energysim.engine.demand.ExpansionResult;
import energysim.engine.dispatch.DispatchResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Состояние одного года основного цикла.
 *
 * @param year                календарный год
 * @param capacity            установленная мощность на начало года (ГВт, накопители ГВт·ч)
 * @param lcoe                LCOE источников, $/MWh
 * @param expansion           расширение спроса до инфраструктурного потолка
 * @param demandTwh           спрос после потолка, распределяемый в диспетчеризации
 * @param dispatch            результат диспетчеризации
 * @param emissions           выбросы по источникам, Gt CO2
 * @param cumulativeEmissions накопленные выбросы, Gt CO2
 * @param co2ppm              концентрация CO2
 * @param temperature         температура, °C
 * @param regionalDamage      климатический ущерб по регионам, доля ВВП
 * @param globalDamage        глобальный ущерб, доля ВВП
 * @param grossGdp            мировой ВВП до ущерба, $T
 * @param netGdp              мировой ВВП после ущерба, $T
 * @param energyCost          расходы на энергию
 * @param energyBurden        энергетическая нагрузка
 * @param savings             нормы сбережений
 * @param stability           фактор стабильности Φ
 * @param capital             запас капитала на начало года, $T
 * @param investment          инвестиции года, $T
 * @param interestRate        реальная процентная ставка
 * @param robotsDensity       роботов на 1000 работников
 * @param capitalPerWorker    капитал на эффективного работника, тыс. $
 */
public record YearState(int year,
                        Map<SourceType, Double> capacity,
                        LcoeSet lcoe,
                        ExpansionResult expansion,
                        double demandTwh,
                        DispatchResult dispatch,
                        EmissionsBreakdown emissions,
                        double cumulativeEmissions,
                        double co2ppm,
                        double temperature,
                        Map<Region, Double> regionalDamage,
                        double globalDamage,
                        double grossGdp,
                        double netGdp,
                        EnergyCost energyCost,
                        EnergyBurden energyBurden,
                        SavingsRates savings,
                        double stability,
                        double capital,
                        double investment,
                        double interestRate,
                        double robotsDensity,
                        double capitalPerWorker) {

    public YearState {
        capacity = Collections.unmodifiableMap(new EnumMap<>(capacity));
        regionalDamage = Collections.unmodifiableMap(new EnumMap<>(regionalDamage));
    }

    public double capacity(SourceType source) {
        Double v = capacity.get(source);
        return v == null ? 0.0 : v;
    }

    public double regionalDamage(Region region) {
        return regionalDamage.get(region);
    }

    /**
     * Копия с учётом потока землепользования и пересчитанными накопленными выбросами.
     * Температура не пересчитывается.
     */
    public YearState withLandUse(double landFlux, double cumulative) {
        return new YearState(year, capacity, lcoe, expansion, demandTwh, dispatch, emissions.withLandUse(landFlux),
                cumulative, co2ppm, temperature, regionalDamage, globalDamage, grossGdp, netGdp, energyCost,
                energyBurden, savings, stability, capital, investment, interestRate, robotsDensity, capitalPerWorker);
    }
}
