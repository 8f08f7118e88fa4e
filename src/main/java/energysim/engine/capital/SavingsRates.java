package energysim.engine.capital;

import energysim.config.Region;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Нормы сбережений за год: по регионам и глобальная, взвешенная по населению.
 */
public record SavingsRates(Map<Region, Double> regional, double global) {

    public SavingsRates {
        regional = Collections.unmodifiableMap(new EnumMap<>(regional));
    }

    public double regional(Region region) {
        return regional.get(region);
    }
}
