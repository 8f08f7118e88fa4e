package energysim.engine.capacity;

import energysim.config.SourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Установленные мощности за один год (GW, аккумуляторы в GWh). Только для чтения.
 */
public final class CapacitySnapshot {

    private final int yearIndex;
    private final Map<SourceType, Double> installed;

    public CapacitySnapshot(int yearIndex, Map<SourceType, Double> installed) {
        this.yearIndex = yearIndex;
        EnumMap<SourceType, Double> copy = new EnumMap<>(SourceType.class);
        copy.putAll(installed);
        this.installed = Collections.unmodifiableMap(copy);
    }

    public int yearIndex() {
        return yearIndex;
    }

    public double installed(SourceType source) {
        Double v = installed.get(source);
        return v == null ? 0.0 : v;
    }

    /**
     * Мощность накопителей в GW при заданной длительности разряда.
     */
    public double batteryPowerGw(double storageHours) {
        return installed(SourceType.BATTERY) / storageHours;
    }

    public Map<SourceType, Double> asMap() {
        return installed;
    }
}
