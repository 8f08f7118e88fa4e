package energysim.config;

/**
 * Применяет числовое значение параметра к builder'у сценарных параметров.
 */
@FunctionalInterface
public interface ParameterApplier {
    void apply(ScenarioParametersBuilder b, double value);
}
