package energysim.config;

import java.util.Objects;
import java.util.function.Function;

/**
 * Описание параметра Tier-1: диапазон, единицы, значение по умолчанию
 * и способ применения к ScenarioParametersBuilder.
 */
public final class TunableParameter {

    private final TunableParamId id;
    private final Double defaultValue;
    private final double hardcodedValue;
    private final double min;
    private final double max;
    private final String unit;
    private final String description;
    private final ParameterApplier applier;
    private final Function<ScenarioParameters, Double> reader;

    /**
     * @param defaultValue   значение по умолчанию в ScenarioParameters (null - берётся из модели)
     * @param hardcodedValue значение модели по умолчанию
     */
    public TunableParameter(TunableParamId id,
                            Double defaultValue,
                            double hardcodedValue,
                            double min,
                            double max,
                            String unit,
                            String description,
                            ParameterApplier applier,
                            Function<ScenarioParameters, Double> reader) {
        this.id = Objects.requireNonNull(id, "id");
        if (min > max) {
            throw new IllegalArgumentException("min > max for " + id.key());
        }
        this.defaultValue = defaultValue;
        this.hardcodedValue = hardcodedValue;
        this.min = min;
        this.max = max;
        this.unit = unit;
        this.description = description;
        this.applier = Objects.requireNonNull(applier, "applier");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public TunableParamId id() {
        return id;
    }

    public String name() {
        return id.key();
    }

    public Double defaultValue() {
        return defaultValue;
    }

    public double hardcodedValue() {
        return hardcodedValue;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public String unit() {
        return unit;
    }

    public String description() {
        return description;
    }

    public ParameterApplier applier() {
        return applier;
    }

    /**
     * Значение в диапазоне [min, max] для u из [0,1].
     */
    public double scaleFromUnit(double u) {
        double uu = Math.max(0.0, Math.min(1.0, u));
        return min + (max - min) * uu;
    }

    public boolean inRange(double value) {
        return value >= min && value <= max;
    }

    Double read(ScenarioParameters p) {
        return reader.apply(p);
    }

    /**
     * Копия базовых параметров с изменённым значением этого параметра.
     */
    public ScenarioParameters applyTo(ScenarioParameters base, double value) {
        ScenarioParametersBuilder b = ScenarioParametersBuilder.from(base);
        applier.apply(b, value);
        return b.build();
    }
}
