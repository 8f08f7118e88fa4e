package energysim.engine.demand;

import energysim.config.Region;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Результат модели спроса: регионы и глобальный агрегат.
 */
public final class DemandData {

    private final Map<Region, DemandSeries> regions;
    private final DemandSeries global;

    DemandData(Map<Region, DemandSeries> regions, DemandSeries global) {
        this.regions = Collections.unmodifiableMap(new EnumMap<>(regions));
        this.global = global;
    }

    public DemandSeries region(Region region) {
        return regions.get(region);
    }

    public Map<Region, DemandSeries> regions() {
        return regions;
    }

    public DemandSeries global() {
        return global;
    }
}
