package energysim.config;

import java.util.EnumMap;
import java.util.Map;

/**
 * Секторная структура конечной энергии и топливные миксы 2025/2100.
 */
public record FinalEnergyParams(Map<Sector, SectorProfile> sectors,
                                double minNonElectricShare,
                                double transitionYears,
                                Map<Sector, Map<Fuel, Double>> fuelMix2025,
                                Map<Sector, Map<Fuel, Double>> fuelMix2100,
                                Map<Fuel, Double> carbonIntensity,
                                Map<Fuel, Double> fuelPrices) {

    public FinalEnergyParams {
        sectors = EnumMaps.copyOf(Sector.class, sectors);
        fuelMix2025 = copyMix(fuelMix2025);
        fuelMix2100 = copyMix(fuelMix2100);
        carbonIntensity = EnumMaps.copyOf(Fuel.class, carbonIntensity);
        fuelPrices = EnumMaps.copyOf(Fuel.class, fuelPrices);
    }

    private static Map<Sector, Map<Fuel, Double>> copyMix(Map<Sector, Map<Fuel, Double>> mix) {
        Map<Sector, Map<Fuel, Double>> copy = new EnumMap<>(Sector.class);
        for (Sector s : Sector.values()) {
            copy.put(s, EnumMaps.copyOf(Fuel.class, mix == null ? null : mix.get(s)));
        }
        return EnumMaps.copyOf(Sector.class, copy);
    }

    public SectorProfile sector(Sector sector) {
        return sectors.get(sector);
    }

    public double fuelShare2025(Sector sector, Fuel fuel) {
        return EnumMaps.getOrZero(fuelMix2025.get(sector), fuel);
    }

    public double fuelShare2100(Sector sector, Fuel fuel) {
        return EnumMaps.getOrZero(fuelMix2100.get(sector), fuel);
    }

    public double carbonIntensity(Fuel fuel) {
        return EnumMaps.getOrZero(carbonIntensity, fuel);
    }

    public double fuelPrice(Fuel fuel) {
        return EnumMaps.getOrZero(fuelPrices, fuel);
    }
}
