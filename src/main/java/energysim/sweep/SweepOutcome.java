package energysim.sweep;

import energysim.config.ScenarioParameters;
import energysim.metrics.ScenarioMetric;
import energysim.metrics.ScenarioMetrics;

/**
 * Результат одной точки перебора.
 *
 * @param index      номер точки в плане
 * @param parameters параметры точки
 * @param metrics    сводные показатели прогона
 */
public record SweepOutcome(int index, ScenarioParameters parameters, ScenarioMetrics metrics) {

    /**
     * Значение показателя; отсутствующее событие даёт NaN.
     */
    public double value(ScenarioMetric metric) {
        Double v = metrics.get(metric);
        return v == null ? Double.NaN : v;
    }
}
