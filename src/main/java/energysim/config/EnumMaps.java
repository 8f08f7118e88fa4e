package energysim.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Неизменяемые копии EnumMap для записей параметров.
 */
final class EnumMaps {

    private EnumMaps() {
    }

    static <E extends Enum<E>, V> Map<E, V> copyOf(Class<E> type, Map<E, V> source) {
        EnumMap<E, V> copy = new EnumMap<>(type);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }

    static <E extends Enum<E>> double getOrZero(Map<E, Double> map, E key) {
        Double v = map.get(key);
        return v == null ? 0.0 : v;
    }
}
