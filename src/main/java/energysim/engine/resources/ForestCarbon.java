package energysim.engine.resources;

import energysim.config.LandParams;

/**
 * Углерод лесов: поглощение при росте площади, выброс при сведении.
 * Часть выброса откладывается в пул разложения и высвобождается постепенно.
 */
public final class ForestCarbon {

    private static final double CO2_PER_CARBON = 3.67;

    private final LandParams params;

    public ForestCarbon(LandParams params) {
        this.params = params;
    }

    public CarbonFlux flux(double forestChange, double previousDecayPool) {
        double sequestration = forestChange > 0 ? forestChange * 1e6 * params.sequestrationRate() / 1e9 : 0.0;

        double lost = forestChange < 0 ? -forestChange : 0.0;
        double released = lost * 1e6 * params.forestCarbonDensity() * CO2_PER_CARBON / 1e9;
        double immediate = released * params.deforestationEmissionFactor();
        double deferred = released * (1 - params.deforestationEmissionFactor());

        double decay = previousDecayPool * params.decayRate();
        double pool = previousDecayPool + deferred - decay;
        return new CarbonFlux(sequestration, immediate, decay, immediate + decay - sequestration, pool);
    }
}
