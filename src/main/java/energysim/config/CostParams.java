package energysim.config;

import java.util.Map;

/**
 * Параметры моделей стоимости: истощение запасов и накопители.
 *
 * @param bootstrapGeneration генерация "года до 2025" для расчёта добычи, TWh
 */
public record CostParams(double depletionExponent,
                         double eroeiFloor,
                         double minRemainingReserves,
                         double storageHours,
                         double storageLifeYears,
                         double roundTripEfficiency,
                         Map<SourceType, Double> bootstrapGeneration) {

    public CostParams {
        bootstrapGeneration = EnumMaps.copyOf(SourceType.class, bootstrapGeneration);
    }

    public double bootstrapGeneration(SourceType source) {
        return EnumMaps.getOrZero(bootstrapGeneration, source);
    }
}
