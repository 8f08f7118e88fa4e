package energysim.engine.resources;

import energysim.config.Mineral;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Результат модели ресурсов по годам: минералы, продовольствие, земли, углерод лесов.
 */
public final class ResourceData {

    private final Map<Mineral, List<MineralDemand>> minerals;
    private final List<FoodDemand> food;
    private final List<LandUse> land;
    private final List<CarbonFlux> carbon;
    private final double[] cumulativeSequestration;

    ResourceData(Map<Mineral, List<MineralDemand>> minerals, List<FoodDemand> food, List<LandUse> land,
                 List<CarbonFlux> carbon, double[] cumulativeSequestration) {
        Map<Mineral, List<MineralDemand>> copy = new EnumMap<>(Mineral.class);
        minerals.forEach((m, list) -> copy.put(m, List.copyOf(list)));
        this.minerals = Collections.unmodifiableMap(copy);
        this.food = List.copyOf(food);
        this.land = List.copyOf(land);
        this.carbon = List.copyOf(carbon);
        this.cumulativeSequestration = cumulativeSequestration.clone();
    }

    public List<MineralDemand> mineral(Mineral mineral) {
        return minerals.get(mineral);
    }

    public List<FoodDemand> food() {
        return food;
    }

    public List<LandUse> land() {
        return land;
    }

    public List<CarbonFlux> carbon() {
        return carbon;
    }

    public double[] cumulativeSequestration() {
        return cumulativeSequestration.clone();
    }

    public double[] mineralSeries(Mineral mineral, ToDoubleFunction<MineralDemand> field) {
        return toArray(minerals.get(mineral), field);
    }

    public double[] foodSeries(ToDoubleFunction<FoodDemand> field) {
        return toArray(food, field);
    }

    public double[] landSeries(ToDoubleFunction<LandUse> field) {
        return toArray(land, field);
    }

    public double[] carbonSeries(ToDoubleFunction<CarbonFlux> field) {
        return toArray(carbon, field);
    }

    private static <T> double[] toArray(List<T> rows, ToDoubleFunction<T> field) {
        double[] out = new double[rows.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = field.applyAsDouble(rows.get(i));
        }
        return out;
    }
}
