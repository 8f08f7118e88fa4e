package energysim.config;

import java.util.Map;
import java.util.Set;

/**
 * Ограничения роста мощностей: потолки проникновения, темпы, сроки службы,
 * удельные капвложения и распределение инвестиционного бюджета.
 */
public record CapacityParams(Map<SourceType, Double> penetrationLimits,
                             double batteryFirmingShare,
                             Map<SourceType, Double> maxGrowthRates,
                             Map<SourceType, Double> lifetimes,
                             Map<SourceType, Double> capex,
                             double capexLearningFactor,
                             Set<SourceType> capexLearningSources,
                             Map<SourceType, Double> investmentAllocation,
                             double cleanShare2025,
                             double cleanShareIncrease,
                             double cleanShareRampYears) {

    public CapacityParams {
        penetrationLimits = EnumMaps.copyOf(SourceType.class, penetrationLimits);
        maxGrowthRates = EnumMaps.copyOf(SourceType.class, maxGrowthRates);
        lifetimes = EnumMaps.copyOf(SourceType.class, lifetimes);
        capex = EnumMaps.copyOf(SourceType.class, capex);
        capexLearningSources = Set.copyOf(capexLearningSources);
        investmentAllocation = EnumMaps.copyOf(SourceType.class, investmentAllocation);
    }

    public double penetrationLimit(SourceType s) {
        return EnumMaps.getOrZero(penetrationLimits, s);
    }

    public double maxGrowthRate(SourceType s) {
        return EnumMaps.getOrZero(maxGrowthRates, s);
    }

    public double lifetime(SourceType s) {
        return EnumMaps.getOrZero(lifetimes, s);
    }

    public double capex(SourceType s) {
        return EnumMaps.getOrZero(capex, s);
    }

    public double allocation(SourceType s) {
        return EnumMaps.getOrZero(investmentAllocation, s);
    }
}
