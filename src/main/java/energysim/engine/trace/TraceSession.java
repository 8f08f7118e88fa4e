package energysim.engine.trace;

import energysim.engine.YearState;

import java.util.List;

/**
 * Сбор пошагового трейса основного цикла.
 */
public interface TraceSession {

    boolean enabled();

    void recordYear(YearState state);

    List<YearState> records();
}
