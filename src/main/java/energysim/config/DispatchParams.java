package energysim.config;

import java.util.List;
import java.util.Map;

/**
 * Параметры merit-order диспетчеризации.
 *
 * @param bareSolarMaxShare   потолок "голой" СЭС, доля спроса
 * @param totalSolarMaxShare  общий потолок СЭС + СЭС с накопителем
 * @param windMaxShare        потолок ВЭС
 * @param firmableSolarShare  доля солнечной мощности, которую можно "укрепить" накопителем
 * @param batteryFirmingRatio GW солнца на 1 GW накопителя
 * @param shortfallTolerance  порог предупреждения о дефиците, TWh
 * @param meritOrder          исходный порядок списка (разрешение равных LCOE)
 */
public record DispatchParams(Map<DispatchSource, Double> capacityFactors,
                             double bareSolarMaxShare,
                             double totalSolarMaxShare,
                             double windMaxShare,
                             double firmableSolarShare,
                             double batteryFirmingRatio,
                             double shortfallTolerance,
                             List<DispatchSource> meritOrder) {

    public DispatchParams {
        capacityFactors = EnumMaps.copyOf(DispatchSource.class, capacityFactors);
        meritOrder = List.copyOf(meritOrder);
        if (meritOrder.size() != DispatchSource.values().length || meritOrder.stream().distinct().count() != meritOrder.size()) {
            throw new IllegalArgumentException("meritOrder must list every dispatch source exactly once: " + meritOrder);
        }
    }

    public double capacityFactor(DispatchSource source) {
        return EnumMaps.getOrZero(capacityFactors, source);
    }
}
