package energysim.config;

/**
 * Параметры электрификации и демографической поправки роста.
 */
public record DemandParams(double electrification2025,
                           double electrificationTarget,
                           double electrificationSpeed,
                           double demographicFactor) {

    public DemandParams withElectrificationTarget(double v) {
        return new DemandParams(electrification2025, v, electrificationSpeed, demographicFactor);
    }
}
