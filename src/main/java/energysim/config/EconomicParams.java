package energysim.config;

import java.util.Map;

public record EconomicParams(Map<Region, RegionEconomy> regions,
                             double laborShare,
                             double persistentDamageFraction,
                             EnergyBurdenParams energyBurden) {

    public EconomicParams {
        regions = EnumMaps.copyOf(Region.class, regions);
        for (Region r : Region.values()) {
            if (!regions.containsKey(r)) {
                throw new IllegalArgumentException("economicParams.regions is missing region " + r.key());
            }
        }
    }

    public RegionEconomy region(Region region) {
        return regions.get(region);
    }
}
