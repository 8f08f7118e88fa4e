package energysim.engine.demand;

/**
 * Годовые расходы на энергию, $T.
 */
public record EnergyCost(double electricity, double nonElectric) {

    public double total() {
        return electricity + nonElectric;
    }
}
