package energysim.engine.cost;

/**
 * Состояние истощения ископаемого ресурса.
 *
 * @param remaining оставшиеся запасы
 * @param eroei     текущий EROEI
 * @param netEnergy доля чистой энергии, 1 - 1/EROEI
 */
public record DepletionState(double remaining, double eroei, double netEnergy) {
}
