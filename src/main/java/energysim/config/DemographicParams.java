package energysim.config;

import java.util.Map;

public record DemographicParams(Map<Region, RegionDemography> regions,
                                Map<Region, EducationProfile> education,
                                double lifeExpectancyGrowth,
                                double fertilityFloorMultiplier,
                                double migrationMultiplier) {

    public DemographicParams {
        regions = EnumMaps.copyOf(Region.class, regions);
        education = EnumMaps.copyOf(Region.class, education);
        for (Region r : Region.values()) {
            if (!regions.containsKey(r) || !education.containsKey(r)) {
                throw new IllegalArgumentException("demographics is missing region " + r.key());
            }
        }
    }

    public RegionDemography region(Region region) {
        return regions.get(region);
    }

    public EducationProfile education(Region region) {
        return education.get(region);
    }

    public DemographicParams withLifeExpectancyGrowth(double v) {
        return new DemographicParams(regions, education, v, fertilityFloorMultiplier, migrationMultiplier);
    }

    public DemographicParams withFertilityFloorMultiplier(double v) {
        return new DemographicParams(regions, education, lifeExpectancyGrowth, v, migrationMultiplier);
    }

    public DemographicParams withMigrationMultiplier(double v) {
        return new DemographicParams(regions, education, lifeExpectancyGrowth, fertilityFloorMultiplier, v);
    }
}
