package energysim.engine.cost;

import energysim.config.CostParams;
import energysim.config.EnergySource;
import energysim.config.SourceType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Накопленная добыча газа и угля за прогон.
 * Добыча года i считается по генерации года i-1; для 2025 используется
 * фиксированная стартовая генерация из costParams.bootstrapGeneration.
 */
public final class ExtractionLedger {

    private final CostParams params;
    private final Map<SourceType, EnergySource> sources;
    private final Map<SourceType, Double> extracted = new EnumMap<>(SourceType.class);

    public ExtractionLedger(CostParams params, Map<SourceType, EnergySource> sources) {
        this.params = params;
        this.sources = sources;
        extracted.put(SourceType.GAS, 0.0);
        extracted.put(SourceType.COAL, 0.0);
    }

    /**
     * Начисление добычи года.
     *
     * @param previousGeneration генерация источника в предыдущем году, TWh (null для 2025)
     */
    public void accrue(SourceType fossil, Double previousGeneration) {
        if (!fossil.isFossil()) {
            throw new IllegalArgumentException("Extraction is tracked for fossil sources only: " + fossil);
        }
        double bootstrap = params.bootstrapGeneration(fossil);
        double generation = previousGeneration == null ? bootstrap : previousGeneration;
        double rate = sources.get(fossil).extractionRate();
        extracted.merge(fossil, (generation / bootstrap) * rate, Double::sum);
    }

    public double extracted(SourceType fossil) {
        return extracted.getOrDefault(fossil, 0.0);
    }
}
