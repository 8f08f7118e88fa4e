package energysim.engine.dispatch;

import energysim.config.DispatchParams;
import energysim.config.DispatchSource;
import energysim.config.EnergySource;
import energysim.config.ModelParameters;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.capacity.CapacitySnapshot;
import energysim.engine.cost.LcoeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merit-order dispatch: demand is allocated to sources in ascending LCOE order.
 * <p>
 * Each entry is capped by its deliverable generation and by a penetration ceiling.
 * Bare solar and solar+battery share one solar counter so the combined ceiling holds;
 * wind has its own ceiling. Nuclear, hydro, gas and coal are capped by capacity only.
 */
public final class MeritOrderDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MeritOrderDispatcher.class);

    private final DispatchParams params;
    private final Map<SourceType, EnergySource> sources;
    private final double storageHours;

    public MeritOrderDispatcher(ModelParameters p) {
        this(p.dispatch(), p.energySources(), p.cost().storageHours());
    }

    public MeritOrderDispatcher(DispatchParams params, Map<SourceType, EnergySource> sources, double storageHours) {
        this.params = params;
        this.sources = sources;
        this.storageHours = storageHours;
    }

    /**
     * Максимальная выработка позиции при данной мощности, TWh.
     */
    public double maxGeneration(DispatchSource source, CapacitySnapshot caps) {
        double gw = switch (source) {
            case NUCLEAR -> caps.installed(SourceType.NUCLEAR);
            case HYDRO -> caps.installed(SourceType.HYDRO);
            case SOLAR -> caps.installed(SourceType.SOLAR);
            case WIND -> caps.installed(SourceType.WIND);
            case GAS -> caps.installed(SourceType.GAS);
            case COAL -> caps.installed(SourceType.COAL);
            // solar that storage can firm: limited by the solar fleet share and by battery power
            case SOLAR_PLUS_BATTERY -> Math.min(
                    caps.installed(SourceType.SOLAR) * params.firmableSolarShare(),
                    caps.batteryPowerGw(storageHours) * params.batteryFirmingRatio());
        };
        return gw * params.capacityFactor(source) * SimulationConstants.HOURS_PER_YEAR / 1000.0;
    }

    public DispatchResult dispatch(double demandTwh, LcoeSet lcoe, CapacitySnapshot caps) {
        // ===== Merit order =====
        List<DispatchSource> order = new ArrayList<>(params.meritOrder());
        // List.sort is stable: equal LCOE keeps the configured order
        order.sort(Comparator.comparingDouble(lcoe::forDispatch));

        Map<DispatchSource, Double> generation = new EnumMap<>(DispatchSource.class);
        double remaining = demandTwh;
        double solarAllocated = 0.0;
        double windAllocated = 0.0;

        for (DispatchSource source : order) {
            if (remaining <= 0) {
                break;
            }
            double maxAllocation = maxGeneration(source, caps);

            if (source.isSolar()) {
                double totalSolarRoom = params.totalSolarMaxShare() * demandTwh - solarAllocated;
                if (source == DispatchSource.SOLAR) {
                    double bareRoom = params.bareSolarMaxShare() * demandTwh - solarAllocated;
                    maxAllocation = Math.min(maxAllocation, Math.min(bareRoom, totalSolarRoom));
                } else {
                    maxAllocation = Math.min(maxAllocation, totalSolarRoom);
                }
            } else if (source == DispatchSource.WIND) {
                maxAllocation = Math.min(maxAllocation, params.windMaxShare() * demandTwh - windAllocated);
            }

            double allocation = Math.min(remaining, Math.max(0.0, maxAllocation));
            if (allocation > 0) {
                generation.put(source, allocation);
                remaining -= allocation;
                if (source.isSolar()) {
                    solarAllocated += allocation;
                } else if (source == DispatchSource.WIND) {
                    windAllocated += allocation;
                }
            }
        }

        double shortfall = Math.max(0.0, remaining);
        if (shortfall > params.shortfallTolerance()) {
            log.warn("Dispatch shortfall: {} TWh unmet of {} TWh demand",
                    String.format("%.1f", shortfall), String.format("%.1f", demandTwh));
        }

        // ===== Grid intensity over dispatched energy =====
        double dispatched = demandTwh - shortfall;
        double emissionsKg = generation.getOrDefault(DispatchSource.GAS, 0.0) * sources.get(SourceType.GAS).carbonIntensity()
                + generation.getOrDefault(DispatchSource.COAL, 0.0) * sources.get(SourceType.COAL).carbonIntensity();
        double gridIntensity = dispatched > 0 ? emissionsKg / dispatched : 0.0;

        return new DispatchResult(demandTwh, generation, shortfall, gridIntensity);
    }
}
