package energysim.engine.capacity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * История одного источника: по записи (installed, additions, retirements) на год.
 * Только добавление в конец.
 */
public final class SourceHistory {

    private final List<Double> installed = new ArrayList<>();
    private final List<Double> additions = new ArrayList<>();
    private final List<Double> retirements = new ArrayList<>();

    SourceHistory(double initialInstalled) {
        append(initialInstalled, 0.0, 0.0);
    }

    void append(double installedValue, double additionsValue, double retirementsValue) {
        installed.add(installedValue);
        additions.add(additionsValue);
        retirements.add(retirementsValue);
    }

    public int size() {
        return installed.size();
    }

    public double installed(int yearIndex) {
        return installed.get(yearIndex);
    }

    public double additions(int yearIndex) {
        return additions.get(yearIndex);
    }

    public double retirements(int yearIndex) {
        return retirements.get(yearIndex);
    }

    public double latestInstalled() {
        return installed.get(installed.size() - 1);
    }

    /**
     * Сумма вводов за годы 0..yearIndex включительно.
     */
    public double cumulativeAdditions(int yearIndex) {
        double sum = 0.0;
        for (int i = 0; i <= yearIndex && i < additions.size(); i++) {
            sum += additions.get(i);
        }
        return sum;
    }

    public List<Double> installedSeries() {
        return Collections.unmodifiableList(installed);
    }

    public List<Double> additionsSeries() {
        return Collections.unmodifiableList(additions);
    }

    public List<Double> retirementsSeries() {
        return Collections.unmodifiableList(retirements);
    }
}
