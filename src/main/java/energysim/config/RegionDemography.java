package energysim.config;

/**
 * Демография региона на 2025 год. young/working/old заданы долями населения.
 */
public record RegionDemography(double population2025,
                               double fertility,
                               double fertilityFloor,
                               double fertilityDecay,
                               double lifeExpectancy,
                               double young,
                               double working,
                               double old,
                               double migrationRate) {
}
