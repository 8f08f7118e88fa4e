package energysim.engine.demographics;

import energysim.config.Region;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Результат демографической проекции: ряды по регионам и глобальный агрегат.
 */
public final class DemographicsData {

    private final Map<Region, CohortSeries> regions;
    private final CohortSeries global;

    DemographicsData(Map<Region, CohortSeries> regions, CohortSeries global) {
        this.regions = Collections.unmodifiableMap(new EnumMap<>(regions));
        this.global = global;
    }

    public CohortSeries region(Region region) {
        return regions.get(region);
    }

    public Map<Region, CohortSeries> regions() {
        return regions;
    }

    public CohortSeries global() {
        return global;
    }
}
