package energysim.engine.capacity;

import energysim.config.CapacityParams;
import energysim.config.DispatchParams;
import energysim.config.DispatchSource;
import energysim.config.EnergySource;
import energysim.config.ModelParameters;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;

import java.util.Map;

/**
 * Годовой переход установленных мощностей.
 * <p>
 * Для растущих источников ввод ограничен тремя условиями: темпом роста цепочки поставок,
 * потолком полезной мощности при данном спросе и мощностью, доступной на инвестиции.
 * Снижающиеся источники (уголь) идут по траектории вывода без этих ограничений.
 * Газ и уголь (резерв) освобождены от потолка спроса и инвестиционного ограничения.
 */
public final class CapacityStateMachine {

    private final CapacityParams params;
    private final DispatchParams dispatch;
    private final Map<SourceType, EnergySource> sources;
    private final double storageHours;

    public CapacityStateMachine(ModelParameters p) {
        this(p.capacity(), p.dispatch(), p.energySources(), p.cost().storageHours());
    }

    public CapacityStateMachine(CapacityParams params,
                                DispatchParams dispatch,
                                Map<SourceType, EnergySource> sources,
                                double storageHours) {
        this.params = params;
        this.dispatch = dispatch;
        this.sources = sources;
        this.storageHours = storageHours;
    }

    /**
     * Мощность, сверх которой ввод не даёт дополнительной выработки, GW (battery: GWh).
     * D * penetrationLimit / (CF * 8760) * 1000.
     */
    public double maxUsefulCapacity(SourceType source, double demandTwh) {
        if (source.isDispatchableBackup()) {
            return Double.POSITIVE_INFINITY;
        }
        if (source == SourceType.BATTERY) {
            return usefulGw(demandTwh, params.penetrationLimit(SourceType.SOLAR), DispatchSource.SOLAR)
                    * params.batteryFirmingShare() * storageHours;
        }
        return usefulGw(demandTwh, params.penetrationLimit(source), dispatchSourceOf(source));
    }

    private double usefulGw(double demandTwh, double penetration, DispatchSource ds) {
        double cf = dispatch.capacityFactor(ds);
        return demandTwh * penetration / (cf * SimulationConstants.HOURS_PER_YEAR) * 1000.0;
    }

    private static DispatchSource dispatchSourceOf(SourceType source) {
        return switch (source) {
            case SOLAR -> DispatchSource.SOLAR;
            case WIND -> DispatchSource.WIND;
            case NUCLEAR -> DispatchSource.NUCLEAR;
            case HYDRO -> DispatchSource.HYDRO;
            case GAS -> DispatchSource.GAS;
            case COAL -> DispatchSource.COAL;
            case BATTERY -> throw new IllegalArgumentException("Battery has no own dispatch entry");
        };
    }

    /**
     * Доля чистой энергетики в инвестициях: 15% в 2025, линейно до 30% за 25 лет.
     */
    public double cleanEnergyShare(int yearIndex) {
        return params.cleanShare2025()
                + params.cleanShareIncrease() * Math.min(1.0, yearIndex / params.cleanShareRampYears());
    }

    /**
     * Мощность, которую можно построить на инвестиции года, GW (battery: GWh).
     *
     * @param investment инвестиции, $T
     */
    public double investmentCapacity(SourceType source, double investment, int yearIndex) {
        if (source.isDispatchableBackup()) {
            return Double.POSITIVE_INFINITY;
        }
        double budgetBn = investment * cleanEnergyShare(yearIndex) * 1000.0 * params.allocation(source);
        double capex = params.capex(source);
        if (params.capexLearningSources().contains(source)) {
            capex *= Math.pow(params.capexLearningFactor(), yearIndex);
        }
        return budgetBn / capex * 1000.0;
    }

    /**
     * Выбытие: 0 до достижения срока службы, затем installed[t-1] / lifetime.
     */
    public double retirement(CapacityState state, SourceType source, int yearIndex) {
        double lifetime = params.lifetime(source);
        if (lifetime <= 0 || yearIndex < lifetime) {
            return 0.0;
        }
        return state.installed(source, yearIndex - 1) / lifetime;
    }

    /**
     * Добавляет запись года yearIndex для всех источников.
     *
     * @param demandTwh  спрос, задающий потолок полезной мощности
     * @param investment инвестиции предыдущего года, $T
     */
    public void advance(CapacityState state, int yearIndex, double demandTwh, double investment) {
        if (state.size() != yearIndex) {
            throw new IllegalStateException("Capacity state has " + state.size()
                    + " years, cannot advance to index " + yearIndex);
        }
        for (SourceType source : SourceType.values()) {
            double prev = state.installed(source, yearIndex - 1);
            double retirement = retirement(state, source, yearIndex);
            double desired = prev * sources.get(source).growthRate();

            double additions;
            if (desired < 0) {
                // decline path: scheduled phase-out, growth caps do not apply
                additions = desired;
            } else {
                double growthCapped = Math.min(desired, prev * params.maxGrowthRate(source));
                double ceilingRoom = maxUsefulCapacity(source, demandTwh) - prev;
                double investmentRoom = investmentCapacity(source, investment, yearIndex);
                additions = Math.min(growthCapped, Math.min(Math.max(0.0, ceilingRoom), investmentRoom));
            }

            double installed = prev + additions - retirement;
            if (installed < 0) {
                // floor at zero; the excess counts as retirement so the balance identity holds
                retirement = prev + additions;
                installed = 0.0;
            }
            state.append(source, installed, additions, retirement);
        }
    }
}
