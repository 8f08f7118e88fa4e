package energysim.engine.demographics;

import energysim.config.SimulationConstants;

/**
 * Годовые ряды когорт одного региона или мира в целом.
 * <p>
 * Численности в людях, доли в долях единицы. Для глобального агрегата ряды
 * fertility, enrollmentRate и wagePremium не заполняются и остаются нулевыми.
 */
public final class CohortSeries {

    private final double[] population = new double[SimulationConstants.YEAR_COUNT];
    private final double[] young = new double[SimulationConstants.YEAR_COUNT];
    private final double[] working = new double[SimulationConstants.YEAR_COUNT];
    private final double[] old = new double[SimulationConstants.YEAR_COUNT];
    private final double[] dependency = new double[SimulationConstants.YEAR_COUNT];
    private final double[] fertility = new double[SimulationConstants.YEAR_COUNT];
    private final double[] workingCollege = new double[SimulationConstants.YEAR_COUNT];
    private final double[] workingNonCollege = new double[SimulationConstants.YEAR_COUNT];
    private final double[] oldCollege = new double[SimulationConstants.YEAR_COUNT];
    private final double[] oldNonCollege = new double[SimulationConstants.YEAR_COUNT];
    private final double[] collegeShare = new double[SimulationConstants.YEAR_COUNT];
    private final double[] enrollmentRate = new double[SimulationConstants.YEAR_COUNT];
    private final double[] wagePremium = new double[SimulationConstants.YEAR_COUNT];
    private final double[] effectiveWorkers = new double[SimulationConstants.YEAR_COUNT];

    CohortSeries() {
    }

    void recordCohorts(int i, double pop, double youngAbs, double workingAbs, double oldAbs) {
        population[i] = pop;
        young[i] = youngAbs;
        working[i] = workingAbs;
        old[i] = oldAbs;
        dependency[i] = workingAbs > 0 ? oldAbs / workingAbs : 0.0;
    }

    void recordEducation(int i, double wc, double wnc, double oc, double onc, double effective) {
        workingCollege[i] = wc;
        workingNonCollege[i] = wnc;
        oldCollege[i] = oc;
        oldNonCollege[i] = onc;
        collegeShare[i] = wc + wnc > 0 ? wc / (wc + wnc) : 0.0;
        effectiveWorkers[i] = effective;
    }

    void recordRates(int i, double tfr, double enrollment, double premium) {
        fertility[i] = tfr;
        enrollmentRate[i] = enrollment;
        wagePremium[i] = premium;
    }

    // --------- Getters ---------

    public double population(int i) {
        return population[i];
    }

    public double young(int i) {
        return young[i];
    }

    public double working(int i) {
        return working[i];
    }

    public double old(int i) {
        return old[i];
    }

    public double dependency(int i) {
        return dependency[i];
    }

    public double effectiveWorkers(int i) {
        return effectiveWorkers[i];
    }

    public double[] population() {
        return population.clone();
    }

    public double[] young() {
        return young.clone();
    }

    public double[] working() {
        return working.clone();
    }

    public double[] old() {
        return old.clone();
    }

    public double[] dependency() {
        return dependency.clone();
    }

    public double[] fertility() {
        return fertility.clone();
    }

    public double[] workingCollege() {
        return workingCollege.clone();
    }

    public double[] workingNonCollege() {
        return workingNonCollege.clone();
    }

    public double[] oldCollege() {
        return oldCollege.clone();
    }

    public double[] oldNonCollege() {
        return oldNonCollege.clone();
    }

    public double[] collegeShare() {
        return collegeShare.clone();
    }

    public double[] enrollmentRate() {
        return enrollmentRate.clone();
    }

    public double[] wagePremium() {
        return wagePremium.clone();
    }

    public double[] effectiveWorkers() {
        return effectiveWorkers.clone();
    }
}
