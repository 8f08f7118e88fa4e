package energysim.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import energysim.config.TunableParameter;
import energysim.config.TunableParameterPool;
import energysim.metrics.SeriesUnits;

import java.io.IOException;
import java.io.Writer;

/**
 * Схема параметров Tier-1 и справочник единиц выходных рядов для команды describe.
 * Для необязательных параметров default = null, фактическое значение модели в hardcoded.
 */
public final class ParameterSchemaWriter {

    private static final int TIER = 1;

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

    public ObjectNode schema() {
        ObjectNode root = mapper.createObjectNode();
        for (TunableParameter p : TunableParameterPool.all()) {
            ObjectNode n = root.putObject(p.name());
            n.put("type", "number");
            if (p.defaultValue() == null) {
                n.putNull("default");
            } else {
                n.put("default", p.defaultValue());
            }
            n.put("hardcoded", p.hardcodedValue());
            n.put("min", p.min());
            n.put("max", p.max());
            n.put("unit", p.unit());
            n.put("tier", TIER);
            n.put("description", p.description());
        }
        return root;
    }

    /**
     * Единица и описание каждого выходного ряда по ключу.
     */
    public ObjectNode units() {
        ObjectNode root = mapper.createObjectNode();
        for (SeriesUnits u : SeriesUnits.values()) {
            ObjectNode n = root.putObject(u.key());
            n.put("unit", u.unit());
            n.put("description", u.description());
        }
        return root;
    }

    public void write(Writer out) throws IOException {
        mapper.writeValue(out, schema());
        out.flush();
    }

    public void writeUnits(Writer out) throws IOException {
        mapper.writeValue(out, units());
        out.flush();
    }
}
