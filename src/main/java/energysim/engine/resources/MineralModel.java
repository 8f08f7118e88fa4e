package energysim.engine.resources;

import energysim.config.MineralParams;
import energysim.config.ResourceParams;
import energysim.config.SourceType;

import java.util.Map;

/**
 * Спрос на минералы от прироста мощностей солнца, ветра, атома и накопителей.
 * <p>
 * Материалоёмкость падает с темпом обучения, умноженным на общий множитель;
 * рециклинг насыщается по мере роста запаса в обороте.
 */
public final class MineralModel {

    private final ResourceParams params;

    public MineralModel(ResourceParams params) {
        this.params = params;
    }

    public double intensityFactor(MineralParams mineral, int t) {
        double learningRate = mineral.learningRate() * params.mineralLearningMultiplier();
        return Math.pow(1 - learningRate, t);
    }

    public static double recyclingRate(MineralParams mineral, double stockInUse) {
        if (mineral.recyclingMax() <= 0) {
            return 0.0;
        }
        return mineral.recyclingBase()
                + (mineral.recyclingMax() - mineral.recyclingBase()) * (1 - Math.exp(-stockInUse / mineral.recyclingHalfway()));
    }

    /**
     * Спрос года по приросту мощностей.
     *
     * @param mineral        параметры минерала
     * @param additions      прирост: ГВт для генерации, ГВт·ч для накопителей
     * @param t              лет от 2025
     * @param cumulativeStock накопленный чистый спрос до этого года, Mt
     */
    public MineralDemand demand(MineralParams mineral, Map<SourceType, Double> additions, int t, double cumulativeStock) {
        double intensity = intensityFactor(mineral, t);
        double grossKg = (additions.getOrDefault(SourceType.SOLAR, 0.0) * 1000 * mineral.perMWSolar()
                + additions.getOrDefault(SourceType.WIND, 0.0) * 1000 * mineral.perMWWind()
                + additions.getOrDefault(SourceType.NUCLEAR, 0.0) * 1000 * mineral.perMWNuclear()
                + additions.getOrDefault(SourceType.BATTERY, 0.0) * mineral.perGWhBattery()) * intensity;
        double gross = grossKg / 1e9;

        double rate = recyclingRate(mineral, cumulativeStock);
        double recycled = gross * rate;
        double net = Math.max(0.0, gross - recycled);
        double cumulative = cumulativeStock + net;
        double reserveRatio = mineral.reserves() > 0 ? cumulative / mineral.reserves() : 0.0;
        return new MineralDemand(net, gross, recycled, intensity, rate, cumulative, reserveRatio);
    }
}
