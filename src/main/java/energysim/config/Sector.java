package energysim.config;

/**
 * Секторы конечного потребления энергии.
 */
public enum Sector {
    TRANSPORT("transport"),
    BUILDINGS("buildings"),
    INDUSTRY("industry");

    private final String key;

    Sector(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
