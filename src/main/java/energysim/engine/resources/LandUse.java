package energysim.engine.resources;

/**
 * Землепользование за год, Mha (урожайность в т/га).
 */
public record LandUse(double farmland,
                      double urban,
                      double forest,
                      double desert,
                      double yield,
                      double forestChange) {
}
