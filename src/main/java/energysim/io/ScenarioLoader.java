package energysim.io;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.config.ScenarioParametersBuilder;
import energysim.config.TunableParameter;
import energysim.config.TunableParameterPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Загрузка сценариев (JSON или HOCON).
 * <p>
 * Формат: {@code name}, {@code description}, {@code params} (параметры Tier-1 по имени),
 * {@code overrides} (блоки energy-model). Блоки overrides накладываются на reference.conf
 * рекурсивно: объекты сливаются, списки заменяются целиком.
 */
public final class ScenarioLoader {

    private static final Logger log = LoggerFactory.getLogger(ScenarioLoader.class);

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("name", "description", "params", "overrides");

    private final Config modelDefaults;

    public ScenarioLoader() {
        this(ModelParameters.defaultConfig());
    }

    /**
     * @param modelDefaults поддерево energy-model, на которое накладываются overrides
     */
    public ScenarioLoader(Config modelDefaults) {
        this.modelDefaults = modelDefaults;
    }

    public Scenario load(Path path) throws ScenarioLoadException {
        if (!Files.isRegularFile(path)) {
            throw new ScenarioLoadException("Scenario file not found: " + path);
        }
        Config c;
        try {
            c = ConfigFactory.parseFile(path.toFile(), ConfigParseOptions.defaults().setAllowMissing(false));
        } catch (ConfigException e) {
            throw new ScenarioLoadException("Malformed scenario file " + path + ": " + e.getMessage(), e);
        }
        log.debug("Loaded scenario file {}", path);
        return fromConfig(c);
    }

    /**
     * Разбор сценария из JSON-строки.
     */
    public Scenario parse(String json) throws ScenarioLoadException {
        Config c;
        try {
            c = ConfigFactory.parseString(json, ConfigParseOptions.defaults().setSyntax(ConfigSyntax.JSON));
        } catch (ConfigException e) {
            throw new ScenarioLoadException("Malformed scenario: " + e.getMessage(), e);
        }
        return fromConfig(c);
    }

    public Scenario fromConfig(Config c) throws ScenarioLoadException {
        for (String key : c.root().keySet()) {
            if (!TOP_LEVEL_KEYS.contains(key)) {
                log.warn("Ignoring unknown scenario key '{}'", key);
            }
        }
        String name = optionalString(c, "name", Scenario.DEFAULT_NAME);
        String description = optionalString(c, "description", "");
        ScenarioParameters params = readParams(c, ScenarioParametersBuilder.from(ScenarioParameters.defaults()));
        ModelParameters model = readOverrides(c);
        return new Scenario(name, description, model, params);
    }

    /**
     * Применение параметра Tier-1 по имени (например, из командной строки).
     */
    public static void applyParameter(ScenarioParametersBuilder b, String name, double value)
            throws ScenarioLoadException {
        TunableParameter p;
        try {
            p = TunableParameterPool.byName(name);
        } catch (IllegalArgumentException e) {
            throw new ScenarioLoadException("Unknown parameter: " + name, e);
        }
        if (!Double.isFinite(value)) {
            throw new ScenarioLoadException("Parameter " + name + " must be a finite number");
        }
        if (!p.inRange(value)) {
            log.warn("Parameter {}={} is outside the recommended range [{}, {}]", name, value, p.min(), p.max());
        }
        p.applier().apply(b, value);
    }

    // ===================== params =====================

    private ScenarioParameters readParams(Config c, ScenarioParametersBuilder b) throws ScenarioLoadException {
        if (!c.hasPath("params")) {
            return b.build();
        }
        Config params = objectAt(c, "params");
        for (Map.Entry<String, ConfigValue> e : params.root().entrySet()) {
            ConfigValue v = e.getValue();
            if (v.valueType() != ConfigValueType.NUMBER) {
                throw new ScenarioLoadException("Parameter " + e.getKey() + " must be numeric, got "
                        + v.valueType().name().toLowerCase());
            }
            applyParameter(b, e.getKey(), ((Number) v.unwrapped()).doubleValue());
        }
        return b.build();
    }

    // ===================== overrides =====================

    private ModelParameters readOverrides(Config c) throws ScenarioLoadException {
        if (!c.hasPath("overrides")) {
            return fromMerged(modelDefaults);
        }
        Config overrides = objectAt(c, "overrides");
        Set<String> sections = modelDefaults.root().keySet();
        for (String key : overrides.root().keySet()) {
            if (!sections.contains(key)) {
                throw new ScenarioLoadException("Unknown override section: " + key);
            }
            if (overrides.root().get(key).valueType() != ConfigValueType.OBJECT) {
                throw new ScenarioLoadException("Override section " + key + " must be an object");
            }
        }
        return fromMerged(overrides.withFallback(modelDefaults));
    }

    private static ModelParameters fromMerged(Config merged) throws ScenarioLoadException {
        try {
            return ModelParameters.fromConfig(merged);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ScenarioLoadException("Invalid overrides: " + e.getMessage(), e);
        }
    }

    // ===================== helpers =====================

    private static Config objectAt(Config c, String path) throws ScenarioLoadException {
        try {
            return c.getConfig(path);
        } catch (ConfigException.WrongType e) {
            throw new ScenarioLoadException("'" + path + "' must be an object", e);
        }
    }

    private static String optionalString(Config c, String path, String fallback) throws ScenarioLoadException {
        if (!c.hasPath(path)) {
            return fallback;
        }
        try {
            return c.getString(path);
        } catch (ConfigException.WrongType e) {
            throw new ScenarioLoadException("'" + path + "' must be a string", e);
        }
    }
}
