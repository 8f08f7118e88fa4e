package energysim.sweep;

import energysim.config.ScenarioParameters;
import energysim.config.TunableParameter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Сетка параметров Tier-1 для перебора.
 * Для SWEEP_2 порядок точек: for p1 in grid1 { for p2 in grid2 { ... } }.
 */
public final class SweepPlan {

    private final SweepMode mode;
    private final TunableParameter param1;
    private final double[] grid1;
    private final TunableParameter param2;
    private final double[] grid2;

    private SweepPlan(SweepMode mode, TunableParameter param1, double[] grid1,
                      TunableParameter param2, double[] grid2) {
        this.mode = mode;
        this.param1 = param1;
        this.grid1 = grid1;
        this.param2 = param2;
        this.grid2 = grid2;
    }

    public static SweepPlan single() {
        return new SweepPlan(SweepMode.SINGLE, null, new double[0], null, new double[0]);
    }

    public static SweepPlan oneParameter(TunableParameter param, double[] grid) {
        Objects.requireNonNull(param, "param");
        checkGrid(grid, "grid");
        return new SweepPlan(SweepMode.SWEEP_1, param, grid.clone(), null, new double[0]);
    }

    public static SweepPlan twoParameters(TunableParameter param1, double[] grid1,
                                          TunableParameter param2, double[] grid2) {
        Objects.requireNonNull(param1, "param1");
        Objects.requireNonNull(param2, "param2");
        if (param1.id() == param2.id()) {
            throw new IllegalArgumentException("param1 and param2 must differ: " + param1.name());
        }
        checkGrid(grid1, "grid1");
        checkGrid(grid2, "grid2");
        return new SweepPlan(SweepMode.SWEEP_2, param1, grid1.clone(), param2, grid2.clone());
    }

    /**
     * Равномерная сетка из {@code steps} точек от from до to включительно.
     */
    public static double[] linspace(double from, double to, int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1");
        }
        if (steps == 1) {
            return new double[]{from};
        }
        double[] out = new double[steps];
        for (int i = 0; i < steps; i++) {
            out[i] = from + (to - from) * i / (steps - 1);
        }
        return out;
    }

    private static void checkGrid(double[] grid, String name) {
        Objects.requireNonNull(grid, name);
        if (grid.length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }

    /**
     * Наборы параметров в порядке точек сетки.
     */
    public List<ScenarioParameters> buildParamSets(ScenarioParameters base) {
        List<ScenarioParameters> sets = new ArrayList<>();
        if (mode == SweepMode.SINGLE) {
            sets.add(base);
            return sets;
        }
        if (mode == SweepMode.SWEEP_1) {
            for (double p1 : grid1) {
                sets.add(param1.applyTo(base, p1));
            }
            return sets;
        }
        // SWEEP_2
        for (double p1 : grid1) {
            ScenarioParameters withP1 = param1.applyTo(base, p1);
            for (double p2 : grid2) {
                sets.add(param2.applyTo(withP1, p2));
            }
        }
        return sets;
    }

    public int size() {
        return switch (mode) {
            case SINGLE -> 1;
            case SWEEP_1 -> grid1.length;
            case SWEEP_2 -> grid1.length * grid2.length;
        };
    }

    /**
     * Значение первого параметра в k-й точке.
     */
    public double value1(int k) {
        return mode == SweepMode.SWEEP_2 ? grid1[k / grid2.length] : grid1[k];
    }

    /**
     * Значение второго параметра в k-й точке (только SWEEP_2).
     */
    public double value2(int k) {
        if (mode != SweepMode.SWEEP_2) {
            throw new IllegalStateException("value2 is defined for SWEEP_2 only");
        }
        return grid2[k % grid2.length];
    }

    // --------- Getters ---------

    public SweepMode getMode() {
        return mode;
    }

    public TunableParameter getParam1() {
        return param1;
    }

    public double[] getGrid1() {
        return grid1.clone();
    }

    public TunableParameter getParam2() {
        return param2;
    }

    public double[] getGrid2() {
        return grid2.clone();
    }

    @Override
    public String toString() {
        return switch (mode) {
            case SINGLE -> "SINGLE";
            case SWEEP_1 -> "SWEEP_1 " + param1.name() + "=" + Arrays.toString(grid1);
            case SWEEP_2 -> "SWEEP_2 " + param1.name() + "=" + Arrays.toString(grid1)
                    + " x " + param2.name() + "=" + Arrays.toString(grid2);
        };
    }
}
