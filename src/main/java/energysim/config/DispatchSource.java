package energysim.config;

/**
 * Позиции merit-order списка. Солнце представлено двумя позициями:
 * "голая" СЭС и СЭС с накопителем.
 */
public enum DispatchSource {
    NUCLEAR("nuclear"),
    HYDRO("hydro"),
    SOLAR("solar"),
    SOLAR_PLUS_BATTERY("solarPlusBattery"),
    WIND("wind"),
    GAS("gas"),
    COAL("coal");

    private final String key;

    DispatchSource(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isSolar() {
        return this == SOLAR || this == SOLAR_PLUS_BATTERY;
    }

    public static DispatchSource fromKey(String key) {
        for (DispatchSource s : values()) {
            if (s.key.equals(key)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown dispatch source: " + key);
    }
}
