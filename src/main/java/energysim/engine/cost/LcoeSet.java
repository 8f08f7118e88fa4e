package energysim.engine.cost;

import energysim.config.DispatchSource;

/**
 * LCOE всех источников за один год, $/MWh (battery: $/kWh).
 */
public record LcoeSet(double solar,
                      double wind,
                      double gas,
                      double coal,
                      double nuclear,
                      double hydro,
                      double battery,
                      double solarPlusBattery) {

    /**
     * Стоимость позиции merit-order списка.
     */
    public double forDispatch(DispatchSource source) {
        return switch (source) {
            case NUCLEAR -> nuclear;
            case HYDRO -> hydro;
            case SOLAR -> solar;
            case SOLAR_PLUS_BATTERY -> solarPlusBattery;
            case WIND -> wind;
            case GAS -> gas;
            case COAL -> coal;
        };
    }

    /**
     * Самый дешёвый переменный ВИЭ-источник (солнце или ветер).
     */
    public double cheapestClean() {
        return Math.min(solar, wind);
    }
}
