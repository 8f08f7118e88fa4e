package energysim.engine.climate;

/**
 * Годовые выбросы по источникам, Gt CO2.
 */
public record EmissionsBreakdown(double electricity, double nonElectricity, double landUse) {

    public double total() {
        return electricity + nonElectricity + landUse;
    }

    public EmissionsBreakdown withLandUse(double flux) {
        return new EmissionsBreakdown(electricity, nonElectricity, flux);
    }
}
