package energysim.sobol;

import energysim.config.TunableParamId;
import energysim.config.TunableParameterPool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class SobolConfig {

    private final int sobolN;
    private final List<SobolFactor> factors;

    public SobolConfig(int sobolN, List<SobolFactor> factors) {
        if (sobolN <= 0) throw new IllegalArgumentException("sobolN must be > 0");
        Objects.requireNonNull(factors, "factors");
        if (factors.isEmpty()) throw new IllegalArgumentException("factors must not be empty");

        this.sobolN = sobolN;
        this.factors = new ArrayList<>(factors);
    }

    /** Основной фабричный метод: выбираете только ids, диапазоны берём из пула. */
    public static SobolConfig fromIds(int sobolN, List<TunableParamId> ids) {
        Objects.requireNonNull(ids, "ids");
        if (ids.isEmpty()) throw new IllegalArgumentException("ids must not be empty");

        List<SobolFactor> factors = TunableParameterPool.of(ids).stream()
                .map(SobolFactor::of)
                .toList();
        return new SobolConfig(sobolN, factors);
    }

    public int getSobolN() { return sobolN; }

    public List<SobolFactor> getFactors() { return Collections.unmodifiableList(factors); }
    public int dim() { return factors.size(); }

    /** Число прогонов движка: N·(d + 2). */
    public int runCount() { return sobolN * (factors.size() + 2); }
}
