package energysim.cli;

import energysim.io.Scenario;
import energysim.io.ScenarioLoadException;
import energysim.io.ScenarioLoader;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Общая опция {@code --scenario} для подкоманд.
 */
public class ScenarioOptions {

    @Option(names = "--scenario", paramLabel = "PATH", description = "Scenario file (JSON or HOCON)")
    Path scenarioPath;

    /**
     * Сценарий из файла или базовый, если файл не задан.
     */
    public Scenario load() throws ScenarioLoadException {
        if (scenarioPath == null) {
            return Scenario.defaults();
        }
        return new ScenarioLoader().load(scenarioPath);
    }
}
