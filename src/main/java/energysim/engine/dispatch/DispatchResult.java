package energysim.engine.dispatch;

import energysim.config.DispatchSource;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Результат диспетчеризации за год.
 */
public final class DispatchResult {

    private final double demand;
    private final Map<DispatchSource, Double> generation;
    private final double shortfall;
    private final double gridIntensity;

    public DispatchResult(double demand, Map<DispatchSource, Double> generation, double shortfall, double gridIntensity) {
        this.demand = demand;
        EnumMap<DispatchSource, Double> copy = new EnumMap<>(DispatchSource.class);
        for (DispatchSource s : DispatchSource.values()) {
            Double v = generation.get(s);
            copy.put(s, v == null ? 0.0 : v);
        }
        this.generation = Collections.unmodifiableMap(copy);
        this.shortfall = shortfall;
        this.gridIntensity = gridIntensity;
    }

    public double demand() {
        return demand;
    }

    /**
     * Выработка позиции, TWh.
     */
    public double generation(DispatchSource source) {
        return generation.get(source);
    }

    public Map<DispatchSource, Double> generation() {
        return generation;
    }

    /**
     * Неудовлетворённый спрос, TWh.
     */
    public double shortfall() {
        return shortfall;
    }

    /**
     * Фактически распределённая энергия, TWh.
     */
    public double dispatched() {
        return demand - shortfall;
    }

    /**
     * kg CO2/MWh по распределённой энергии.
     */
    public double gridIntensity() {
        return gridIntensity;
    }

    public double totalSolar() {
        return generation(DispatchSource.SOLAR) + generation(DispatchSource.SOLAR_PLUS_BATTERY);
    }
}
