package energysim.config;

/**
 * Профиль сектора конечного потребления.
 *
 * @param share2025 доля сектора в неэлектрической энергии
 */
public record SectorProfile(double share2025,
                            double electrification2025,
                            double electrificationTarget,
                            double electrificationSpeed) {
}
