package energysim.sobol;

import energysim.config.ScenarioParameters;
import energysim.config.TunableParameter;

import java.util.Objects;

/**
 * Варьируемый фактор: параметр Tier-1 и его диапазон.
 */
public final class SobolFactor {

    private final TunableParameter parameter;
    private final double min;
    private final double max;

    public SobolFactor(TunableParameter parameter, double min, double max) {
        this.parameter = Objects.requireNonNull(parameter, "parameter");
        if (!(max > min)) {
            throw new IllegalArgumentException("max must be > min for factor: " + parameter.name());
        }
        this.min = min;
        this.max = max;
    }

    /** Фактор на полном рекомендованном диапазоне параметра. */
    public static SobolFactor of(TunableParameter parameter) {
        return new SobolFactor(parameter, parameter.min(), parameter.max());
    }

    public String getName() { return parameter.name(); }
    public double getMin() { return min; }
    public double getMax() { return max; }

    public ScenarioParameters apply(ScenarioParameters base, double v) {
        return parameter.applyTo(base, v);
    }

    /** Перевод из [0..1] в [min..max]. */
    public double scaleFromUnit(double u) {
        if (u < 0.0) u = 0.0;
        if (u > 1.0) u = 1.0;
        return min + u * (max - min);
    }
}
