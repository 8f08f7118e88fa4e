package energysim.sobol;

import energysim.config.ScenarioParameters;

import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Точка выборки Saltelli: по одному значению на каждый фактор конфигурации,
 * в том же порядке, что и {@link SobolConfig#getFactors()}.
 */
public final class ParameterSet {

    private final List<SobolFactor> factors;
    private final double[] values;

    private ParameterSet(List<SobolFactor> factors, double[] values) {
        this.factors = factors;
        this.values = values;
    }

    /** Строка единичного куба -> физические значения факторов. */
    public static ParameterSet fromUnitRow(double[] u01, SobolConfig cfg) {
        List<SobolFactor> factors = cfg.getFactors();
        if (u01.length != factors.size()) {
            throw new IllegalArgumentException("Row has " + u01.length + " coordinates, expected " + factors.size());
        }
        double[] v = new double[u01.length];
        for (int j = 0; j < v.length; j++) {
            v[j] = factors.get(j).scaleFromUnit(u01[j]);
        }
        return new ParameterSet(factors, v);
    }

    public double value(int factorIndex) {
        return values[factorIndex];
    }

    public double[] values() {
        return Arrays.copyOf(values, values.length);
    }

    /** Накладывает значения факторов на базовые параметры сценария (base не меняется). */
    public ScenarioParameters applyTo(ScenarioParameters base) {
        ScenarioParameters p = base;
        for (int j = 0; j < values.length; j++) {
            p = factors.get(j).apply(p, values[j]);
        }
        return p;
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (int j = 0; j < values.length; j++) {
            sj.add(factors.get(j).getName() + "=" + values[j]);
        }
        return sj.toString();
    }
}
