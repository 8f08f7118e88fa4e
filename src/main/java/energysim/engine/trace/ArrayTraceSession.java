package energysim.engine.trace;

import energysim.engine.YearState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Трейс в памяти: состояния лет в порядке основного цикла,
 * до поправки на землепользование.
 */
public final class ArrayTraceSession implements TraceSession {

    private final List<YearState> records = new ArrayList<>();

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public void recordYear(YearState state) {
        records.add(state);
    }

    @Override
    public List<YearState> records() {
        return Collections.unmodifiableList(records);
    }
}
