package energysim.engine.demand;

import energysim.config.SimulationConstants;

/**
 * Конечная энергия сектора по годам, TWh.
 */
public final class SectorSeries {

    private final double[] total = new double[SimulationConstants.YEAR_COUNT];
    private final double[] electric = new double[SimulationConstants.YEAR_COUNT];
    private final double[] nonElectric = new double[SimulationConstants.YEAR_COUNT];
    private final double[] electrificationRate = new double[SimulationConstants.YEAR_COUNT];

    SectorSeries() {
    }

    void record(int i, double totalTwh, double electricTwh, double nonElectricTwh, double rate) {
        total[i] = totalTwh;
        electric[i] = electricTwh;
        nonElectric[i] = nonElectricTwh;
        electrificationRate[i] = rate;
    }

    void add(int i, double totalTwh, double electricTwh, double nonElectricTwh) {
        total[i] += totalTwh;
        electric[i] += electricTwh;
        nonElectric[i] += nonElectricTwh;
    }

    void setElectrificationRate(int i, double rate) {
        electrificationRate[i] = rate;
    }

    public double total(int i) {
        return total[i];
    }

    public double electric(int i) {
        return electric[i];
    }

    public double nonElectric(int i) {
        return nonElectric[i];
    }

    public double electrificationRate(int i) {
        return electrificationRate[i];
    }

    public double[] total() {
        return total.clone();
    }

    public double[] electric() {
        return electric.clone();
    }

    public double[] nonElectric() {
        return nonElectric.clone();
    }

    public double[] electrificationRate() {
        return electrificationRate.clone();
    }
}
