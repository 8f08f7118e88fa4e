package energysim.config;

/**
 * Макрорегионы модели.
 */
public enum Region {
    OECD("oecd"),
    CHINA("china"),
    EM("em"),
    ROW("row");

    private final String key;

    Region(String key) {
        this.key = key;
    }

    /**
     * Ключ региона в конфигурации и JSON-выгрузке.
     */
    public String key() {
        return key;
    }
}
