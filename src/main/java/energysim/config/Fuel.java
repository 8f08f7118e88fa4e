package energysim.config;

/**
 * Виды топлива неэлектрического конечного потребления.
 */
public enum Fuel {
    OIL("oil"),
    GAS("gas"),
    COAL("coal"),
    BIOMASS("biomass"),
    HYDROGEN("hydrogen"),
    BIOFUEL("biofuel");

    private final String key;

    Fuel(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
