package energysim.engine.capacity;

import energysim.config.EnergySource;
import energysim.config.SourceType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Состояние мощностей по всем источникам за весь прогон.
 * Записывает только {@link CapacityStateMachine#advance}; остальные модули читают снимки.
 */
public final class CapacityState {

    private final Map<SourceType, SourceHistory> histories = new EnumMap<>(SourceType.class);

    private CapacityState() {
    }

    /**
     * Начальное состояние: (capacity2025, 0, 0) для каждого источника.
     */
    public static CapacityState initial(Map<SourceType, EnergySource> sources) {
        CapacityState state = new CapacityState();
        for (SourceType s : SourceType.values()) {
            state.histories.put(s, new SourceHistory(sources.get(s).capacity2025()));
        }
        return state;
    }

    public SourceHistory history(SourceType source) {
        return histories.get(source);
    }

    /**
     * Количество записанных лет.
     */
    public int size() {
        return histories.get(SourceType.SOLAR).size();
    }

    public double installed(SourceType source, int yearIndex) {
        return histories.get(source).installed(yearIndex);
    }

    public double latestInstalled(SourceType source) {
        return histories.get(source).latestInstalled();
    }

    public double cumulativeAdditions(SourceType source, int yearIndex) {
        return histories.get(source).cumulativeAdditions(yearIndex);
    }

    public CapacitySnapshot snapshot(int yearIndex) {
        Map<SourceType, Double> m = new EnumMap<>(SourceType.class);
        for (SourceType s : SourceType.values()) {
            m.put(s, installed(s, yearIndex));
        }
        return new CapacitySnapshot(yearIndex, m);
    }

    void append(SourceType source, double installed, double additions, double retirements) {
        histories.get(source).append(installed, additions, retirements);
    }
}
