package energysim.engine.demand;

import energysim.config.DispatchSource;
import energysim.config.EnergyBurdenParams;
import energysim.config.FinalEnergyParams;
import energysim.config.Fuel;
import energysim.config.ModelParameters;
import energysim.engine.cost.LcoeSet;
import energysim.engine.dispatch.DispatchResult;

import java.util.Map;

/**
 * Стоимость энергии и ограничение роста по энергетической нагрузке.
 * <p>
 * Электроэнергия оценивается по LCOE каждого источника; выработка
 * solar+battery не оценивается отдельно. Топливо по цене плюс углеродная
 * составляющая.
 */
public final class EnergyCostModel {

    private final FinalEnergyParams finalEnergy;
    private final EnergyBurdenParams burden;

    public EnergyCostModel(ModelParameters p) {
        this(p.finalEnergy(), p.economic().energyBurden());
    }

    public EnergyCostModel(FinalEnergyParams finalEnergy, EnergyBurdenParams burden) {
        this.finalEnergy = finalEnergy;
        this.burden = burden;
    }

    public EnergyCost cost(DispatchResult dispatch, LcoeSet lcoe, Map<Fuel, Double> fuelDemand, double carbonPrice) {
        double elecCost = 0.0;
        for (DispatchSource s : DispatchSource.values()) {
            if (s == DispatchSource.SOLAR_PLUS_BATTERY) {
                continue;
            }
            elecCost += dispatch.generation(s) * lcoe.forDispatch(s);
        }
        return new EnergyCost(elecCost / 1e6, nonElectricCost(fuelDemand, carbonPrice));
    }

    /**
     * Стоимость неэлектрического топлива, $T.
     */
    public double nonElectricCost(Map<Fuel, Double> fuelDemand, double carbonPrice) {
        double cost = 0.0;
        for (Map.Entry<Fuel, Double> e : fuelDemand.entrySet()) {
            Fuel f = e.getKey();
            double carbonCost = finalEnergy.carbonIntensity(f) / 1000.0 * carbonPrice;
            cost += e.getValue() * (finalEnergy.fuelPrice(f) + carbonCost);
        }
        return cost / 1e6;
    }

    /**
     * Нагрузка и ущерб: ниже порога ущерба нет, выше растёт с эластичностью до предела.
     */
    public EnergyBurden burden(double energyCost, double gdp) {
        double share = gdp > 0 ? energyCost / gdp : 0.0;
        boolean historical = share > burden.maxBurden();
        if (share <= burden.threshold()) {
            return new EnergyBurden(share, 0.0, false, historical);
        }
        double damage = Math.min(burden.maxDamage(), (share - burden.threshold()) * burden.elasticity());
        return new EnergyBurden(share, damage, true, historical);
    }
}
