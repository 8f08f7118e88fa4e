package energysim.config;

import java.util.Map;

/**
 * Параметры ресурсного модуля.
 *
 * @param priorYearCapacityRatio мощность года до 2025 относительно 2025 (для прироста первого года)
 */
public record ResourceParams(double mineralLearningMultiplier,
                             Map<Mineral, MineralParams> minerals,
                             Map<SourceType, Double> priorYearCapacityRatio,
                             FoodParams food,
                             LandParams land) {

    public ResourceParams {
        minerals = EnumMaps.copyOf(Mineral.class, minerals);
        priorYearCapacityRatio = EnumMaps.copyOf(SourceType.class, priorYearCapacityRatio);
    }

    public MineralParams mineral(Mineral mineral) {
        return minerals.get(mineral);
    }

    public double priorYearCapacityRatio(SourceType source) {
        Double v = priorYearCapacityRatio.get(source);
        return v == null ? 1.0 : v;
    }

    public ResourceParams withMineralLearningMultiplier(double v) {
        return new ResourceParams(v, minerals, priorYearCapacityRatio, food, land);
    }

    public ResourceParams withFood(FoodParams v) {
        return new ResourceParams(mineralLearningMultiplier, minerals, priorYearCapacityRatio, v, land);
    }

    public ResourceParams withLand(LandParams v) {
        return new ResourceParams(mineralLearningMultiplier, minerals, priorYearCapacityRatio, food, v);
    }
}
