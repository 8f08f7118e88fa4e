package energysim.config;

public enum Mineral {
    COPPER("copper"),
    LITHIUM("lithium"),
    RARE_EARTHS("rareEarths"),
    STEEL("steel");

    private final String key;

    Mineral(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
