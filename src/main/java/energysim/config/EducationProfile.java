package energysim.config;

/**
 * Параметры высшего образования региона.
 *
 * @param lifeExpectancyBonus   прибавка к ожидаемой продолжительности жизни выпускников, лет
 * @param lifeExpectancyPenalty снижение для остальных, лет
 */
public record EducationProfile(double enrollmentRate2025,
                               double enrollmentTarget,
                               double enrollmentGrowth,
                               double collegeShare2025,
                               double wagePremium2025,
                               double wagePremiumTarget,
                               double premiumDecay,
                               double lifeExpectancyBonus,
                               double lifeExpectancyPenalty) {
}
