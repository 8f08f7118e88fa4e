package energysim.io;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.engine.SimulationEngine;
import energysim.engine.SimulationResult;
import energysim.engine.trace.TraceSession;

import java.util.Objects;

/**
 * Загруженный сценарий: параметры модели после наложения overrides
 * и параметры Tier-1.
 *
 * @param name        название
 * @param description описание (может быть пустым)
 * @param model       параметры модели с учётом overrides
 * @param parameters  параметры Tier-1
 */
public record Scenario(String name, String description, ModelParameters model, ScenarioParameters parameters) {

    public static final String DEFAULT_NAME = "Custom Scenario";

    public Scenario {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(parameters, "parameters");
    }

    /**
     * Сценарий по умолчанию: reference.conf без изменений.
     */
    public static Scenario defaults() {
        return new Scenario("Baseline", "", ModelParameters.defaults(), ScenarioParameters.defaults());
    }

    public Scenario withParameters(ScenarioParameters p) {
        return new Scenario(name, description, model, p);
    }

    public SimulationResult run() {
        return new SimulationEngine(model, parameters).run();
    }

    public SimulationResult run(TraceSession trace) {
        return new SimulationEngine(model, parameters).run(trace);
    }
}
