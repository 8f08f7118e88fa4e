package energysim.engine.trace;

import energysim.engine.YearState;

import java.util.Collections;
import java.util.List;

public final class NoTraceSession implements TraceSession {

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public void recordYear(YearState state) {
        // no-op
    }

    @Override
    public List<YearState> records() {
        return Collections.emptyList();
    }
}
