package energysim.config;

/**
 * Источники, для которых ведётся учёт установленной мощности.
 * Для аккумуляторов мощность задаётся в GWh, для остальных в GW.
 */
public enum SourceType {
    SOLAR("solar"),
    WIND("wind"),
    GAS("gas"),
    COAL("coal"),
    NUCLEAR("nuclear"),
    HYDRO("hydro"),
    BATTERY("battery");

    private final String key;

    SourceType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isFossil() {
        return this == GAS || this == COAL;
    }

    /**
     * Ископаемая резервная генерация: без ограничения по спросу и инвестициям.
     */
    public boolean isDispatchableBackup() {
        return isFossil();
    }

    public static SourceType fromKey(String key) {
        for (SourceType s : values()) {
            if (s.key.equals(key)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown energy source: " + key);
    }
}
