package energysim.sobol;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.engine.SimulationEngine;
import energysim.engine.SimulationResult;
import org.apache.commons.math3.random.SobolSequenceGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Индексы Соболя первого порядка и полные индексы по схеме Saltelli (2010).
 * <p>
 * Матрицы A и B берутся из одной последовательности Соболя размерности 2d:
 * первые d координат образуют A, следующие d образуют B. Для каждого фактора j
 * строится матрица AB_j (A со столбцом j из B). Все N·(d+2) прогонов независимы
 * и выполняются на переданном пуле.
 */
public final class SobolAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SobolAnalyzer.class);

    private static final OutputMetric[] METRICS = OutputMetric.values();

    private final ExecutorService executor;

    public SobolAnalyzer(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public SobolResult run(ModelParameters model, ScenarioParameters base, SobolConfig cfg)
            throws InterruptedException, ExecutionException {

        final int N = cfg.getSobolN();
        final int d = cfg.dim();

        double[][][] ab = generateABBySobolSequence(N, d);
        double[][] A = ab[0];
        double[][] B = ab[1];

        log.info("Sobol: N={} d={} runs={}", N, d, cfg.runCount());

        List<Future<double[]>> fA = new ArrayList<>(N);
        List<Future<double[]>> fB = new ArrayList<>(N);
        List<List<Future<double[]>>> fAB = new ArrayList<>(d);

        for (int i = 0; i < N; i++) {
            fA.add(submit(model, ParameterSet.fromUnitRow(A[i], cfg).applyTo(base)));
            fB.add(submit(model, ParameterSet.fromUnitRow(B[i], cfg).applyTo(base)));
        }

        for (int j = 0; j < d; j++) {
            List<Future<double[]>> col = new ArrayList<>(N);
            for (int i = 0; i < N; i++) {
                double[] row = new double[d];
                System.arraycopy(A[i], 0, row, 0, d);
                row[j] = B[i][j];
                col.add(submit(model, ParameterSet.fromUnitRow(row, cfg).applyTo(base)));
            }
            fAB.add(col);
        }

        double[][] yA = collect(fA);
        double[][] yB = collect(fB);
        double[][][] yAB = new double[d][][];
        for (int j = 0; j < d; j++) {
            yAB[j] = collect(fAB.get(j));
        }

        Map<OutputMetric, double[]> s = new EnumMap<>(OutputMetric.class);
        Map<OutputMetric, double[]> st = new EnumMap<>(OutputMetric.class);
        for (int m = 0; m < METRICS.length; m++) {
            double[] sm = new double[d];
            double[] stm = new double[d];
            computeSobolIndicesSaltelli2010(yA, yB, yAB, d, m, sm, stm);
            s.put(METRICS[m], sm);
            st.put(METRICS[m], stm);
        }

        return new SobolResult(cfg, s, st);
    }

    private Future<double[]> submit(ModelParameters model, ScenarioParameters p) {
        return executor.submit(() -> evaluate(model, p));
    }

    static double[] evaluate(ModelParameters model, ScenarioParameters p) {
        SimulationResult r = new SimulationEngine(model, p).run();
        double[] out = new double[METRICS.length];
        for (int m = 0; m < METRICS.length; m++) {
            out[m] = METRICS[m].extract(r);
        }
        return out;
    }

    private static double[][] collect(List<Future<double[]>> futures)
            throws InterruptedException, ExecutionException {
        double[][] y = new double[futures.size()][];
        for (int i = 0; i < futures.size(); i++) {
            y[i] = futures.get(i).get();
        }
        return y;
    }

    static void computeSobolIndicesSaltelli2010(double[][] yA,
                                                double[][] yB,
                                                double[][][] yAB,
                                                int d,
                                                int metric,
                                                double[] S,
                                                double[] ST) {

        final int N = yA.length;

        double[] a = new double[N];
        double[] b = new double[N];

        for (int i = 0; i < N; i++) {
            a[i] = yA[i][metric];
            b[i] = yB[i][metric];
        }

        double[] yAll = concat(a, b);
        double meanY = mean(yAll);
        double varY = variancePopulation(yAll);

        if (log.isDebugEnabled()) {
            log.debug("Sobol metric={}: meanY={} varY={} A=[{}..{}] B=[{}..{}]",
                    METRICS[metric].key(), meanY, varY, min(a), max(a), min(b), max(b));
        }

        if (!(varY > 0.0) || Double.isNaN(varY) || Double.isInfinite(varY)) {
            log.warn("Sobol metric={}: zero output variance, indices undefined", METRICS[metric].key());
            Arrays.fill(S, Double.NaN);
            Arrays.fill(ST, Double.NaN);
            return;
        }

        int stLessThanS = 0;
        double sumS = 0.0;
        double sumST = 0.0;

        for (int j = 0; j < d; j++) {
            double sumFirst = 0.0;
            double sumSt = 0.0;

            for (int i = 0; i < N; i++) {
                double ab = yAB[j][i][metric];

                // S_j: E[f(B)·(f(AB_j) − f(A))]
                sumFirst += b[i] * (ab - a[i]);

                // ST_j (Jansen): E[(f(A) − f(AB_j))²] / 2
                double diff = a[i] - ab;
                sumSt += diff * diff;
            }

            double sj = (sumFirst / N) / varY;
            double stj = (sumSt / (2.0 * N)) / varY;

            S[j] = sj;
            ST[j] = stj;

            sumS += sj;
            sumST += stj;
            if (stj + 1e-12 < sj) stLessThanS++;
        }

        log.debug("Sobol metric={}: sumS={} sumST={} count(ST<S)={}/{}",
                METRICS[metric].key(), sumS, sumST, stLessThanS, d);
    }

    static double[][][] generateABBySobolSequence(int N, int d) {
        SobolSequenceGenerator sobol = new SobolSequenceGenerator(2 * d);

        double[][] A = new double[N][d];
        double[][] B = new double[N][d];

        for (int i = 0; i < N; i++) {
            double[] v = sobol.nextVector();
            System.arraycopy(v, 0, A[i], 0, d);
            System.arraycopy(v, d, B[i], 0, d);
        }
        return new double[][][] { A, B };
    }

    private static double[] concat(double[] a, double[] b) {
        double[] r = new double[a.length + b.length];
        System.arraycopy(a, 0, r, 0, a.length);
        System.arraycopy(b, 0, r, a.length, b.length);
        return r;
    }

    private static double mean(double[] x) {
        double s = 0.0;
        for (double v : x) s += v;
        return s / x.length;
    }

    private static double variancePopulation(double[] x) {
        double m = mean(x);
        double s = 0.0;
        for (double v : x) {
            double d = v - m;
            s += d * d;
        }
        return s / x.length;
    }

    private static double min(double[] x) {
        double m = Double.POSITIVE_INFINITY;
        for (double v : x) m = Math.min(m, v);
        return m;
    }

    private static double max(double[] x) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : x) m = Math.max(m, v);
        return m;
    }
}
