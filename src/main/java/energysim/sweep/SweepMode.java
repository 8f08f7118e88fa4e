package energysim.sweep;

/**
 * Режим перебора параметров: один прогон, сетка по одному или по двум параметрам.
 */
public enum SweepMode {
    SINGLE,
    SWEEP_1,
    SWEEP_2
}
