package energysim.engine.demand;

import energysim.config.Region;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Запаздывающая обратная связь для второго прохода спроса: климатический ущерб
 * по регионам и ущерб от энергетической нагрузки, доли ВВП по годам.
 * Значение года t − 1 влияет на рост года t.
 */
public final class DemandFeedback {

    private static final DemandFeedback NONE = new DemandFeedback(new EnumMap<>(Region.class), null);

    private final Map<Region, double[]> damageFractions;
    private final double[] burdenDamage;

    private DemandFeedback(Map<Region, double[]> damageFractions, double[] burdenDamage) {
        this.damageFractions = damageFractions;
        this.burdenDamage = burdenDamage;
    }

    public static DemandFeedback none() {
        return NONE;
    }

    public static DemandFeedback of(Map<Region, double[]> damageFractions, double[] burdenDamage) {
        Objects.requireNonNull(damageFractions, "damageFractions");
        Objects.requireNonNull(burdenDamage, "burdenDamage");
        Map<Region, double[]> copy = new EnumMap<>(Region.class);
        damageFractions.forEach((r, v) -> copy.put(r, v.clone()));
        return new DemandFeedback(Collections.unmodifiableMap(copy), burdenDamage.clone());
    }

    /**
     * Ущерб региона в году i, 0 при отсутствии данных.
     */
    public double damage(Region region, int i) {
        double[] series = damageFractions.get(region);
        return series == null || i < 0 || i >= series.length ? 0.0 : series[i];
    }

    public double burden(int i) {
        return burdenDamage == null || i < 0 || i >= burdenDamage.length ? 0.0 : burdenDamage[i];
    }
}
