package energysim.engine.resources;

/**
 * Спрос на минерал за год, Mt.
 *
 * @param demand        чистый спрос после рециклинга
 * @param grossDemand   валовой спрос
 * @param recycled      покрыто рециклингом
 * @param intensity     множитель материалоёмкости (0–1)
 * @param recyclingRate доля рециклинга
 * @param cumulative    накопленный чистый спрос с 2025
 * @param reserveRatio  накопленный спрос / запасы; 0 для неограниченных запасов
 */
public record MineralDemand(double demand,
                            double grossDemand,
                            double recycled,
                            double intensity,
                            double recyclingRate,
                            double cumulative,
                            double reserveRatio) {
}
