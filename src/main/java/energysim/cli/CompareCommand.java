package energysim.cli;

import energysim.io.Scenario;
import energysim.io.ScenarioComparison;
import energysim.io.ScenarioLoadException;
import energysim.io.ScenarioLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Прогон нескольких сценариев и сравнение с траекториями SSP.
 * Каталог в списке заменяется его файлами *.json в алфавитном порядке.
 */
@Command(
        name = "compare",
        mixinStandardHelpOptions = true,
        description = "Runs several scenario files and prints a comparison table."
)
public class CompareCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "Scenario files or directories")
    private List<Path> paths;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ScenarioLoader loader = new ScenarioLoader();
        List<Scenario> scenarios = new ArrayList<>();
        for (Path file : expand(paths)) {
            try {
                Scenario s = loader.load(file);
                // без явного имени берём имя файла
                if (Scenario.DEFAULT_NAME.equals(s.name())) {
                    s = new Scenario(baseName(file), s.description(), s.model(), s.parameters());
                }
                scenarios.add(s);
            } catch (ScenarioLoadException e) {
                err.println("Error loading scenario: " + e.getMessage());
                err.flush();
                return 1;
            }
        }

        ScenarioComparison.print(out, ScenarioComparison.compare(scenarios));
        return 0;
    }

    static List<Path> expand(List<Path> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path p : paths) {
            if (Files.isDirectory(p)) {
                try (Stream<Path> s = Files.list(p)) {
                    s.filter(f -> f.getFileName().toString().endsWith(".json"))
                            .sorted()
                            .forEach(files::add);
                }
            } else {
                files.add(p);
            }
        }
        return files;
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
