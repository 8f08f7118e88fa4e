package energysim.sweep;

import energysim.config.ModelParameters;
import energysim.config.ScenarioParameters;
import energysim.engine.SimulationEngine;
import energysim.metrics.ScenarioMetric;
import energysim.metrics.ScenarioMetrics;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Прогон точек сетки параметров на общем пуле потоков.
 * Каждая точка считается независимым экземпляром движка; результаты
 * возвращаются в порядке плана.
 */
public final class SweepRunner {

    private static final Logger log = LoggerFactory.getLogger(SweepRunner.class);

    private final ExecutorService executor;

    public SweepRunner(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public List<SweepOutcome> run(ModelParameters model, ScenarioParameters base, SweepPlan plan)
            throws InterruptedException, ExecutionException {

        List<ScenarioParameters> paramSets = plan.buildParamSets(base);
        log.info("Sweep {}: {} runs", plan, paramSets.size());

        List<Future<SweepOutcome>> futures = new ArrayList<>(paramSets.size());
        for (int k = 0; k < paramSets.size(); k++) {
            final int idx = k;
            final ScenarioParameters p = paramSets.get(k);
            futures.add(executor.submit(() ->
                    new SweepOutcome(idx, p, ScenarioMetrics.of(new SimulationEngine(model, p).run()))));
        }

        List<SweepOutcome> outcomes = new ArrayList<>(futures.size());
        for (Future<SweepOutcome> f : futures) {
            outcomes.add(f.get());
        }
        return outcomes;
    }

    /**
     * Описательная статистика показателя по точкам; ненаступившие события пропускаются.
     */
    public static DescriptiveStatistics statistics(List<SweepOutcome> outcomes, ScenarioMetric metric) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (SweepOutcome o : outcomes) {
            double v = o.value(metric);
            if (Double.isFinite(v)) {
                stats.addValue(v);
            }
        }
        return stats;
    }
}
