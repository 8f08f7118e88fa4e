package energysim.engine.cost;

import energysim.config.CostParams;
import energysim.config.EnergySource;
import energysim.config.ModelParameters;
import energysim.config.SimulationConstants;
import energysim.config.SourceType;
import energysim.engine.capacity.CapacityState;

import java.util.Map;

/**
 * Модели стоимости: кривые обучения (закон Райта) и истощение запасов (EROEI).
 */
public final class CostModel {

    private final CostParams params;
    private final Map<SourceType, EnergySource> sources;

    public CostModel(ModelParameters p) {
        this(p.cost(), p.energySources());
    }

    public CostModel(CostParams params, Map<SourceType, EnergySource> sources) {
        this.params = params;
        this.sources = sources;
    }

    /**
     * Закон Райта: cost0 * cumulative^(-alpha).
     * cumulative нормирован на мощность 2025 (= 1 в базовом году).
     */
    public static double learningCurve(double cost0, double cumulative, double alpha) {
        if (cumulative <= 0) {
            return cost0;
        }
        return cost0 * Math.pow(cumulative, -alpha);
    }

    /**
     * EROEI по мере истощения: eroei0 * (remaining/reserves)^beta, не ниже пола.
     */
    public DepletionState depletion(double reserves, double extracted, double eroei0) {
        double remaining = Math.max(reserves - extracted, params.minRemainingReserves());
        double eroei = Math.max(eroei0 * Math.pow(remaining / reserves, params.depletionExponent()), params.eroeiFloor());
        return new DepletionState(remaining, eroei, 1.0 - 1.0 / eroei);
    }

    /**
     * LCOE ископаемого источника: базовая стоимость, поднятая истощением, плюс углеродный сбор.
     */
    public static double fossilLcoe(EnergySource source, double eroei, double carbonPrice) {
        double base = source.cost0() * (source.eroei0() / eroei);
        return base + source.carbonIntensity() / 1000.0 * carbonPrice;
    }

    /**
     * LCOE СЭС с накопителем: батарея ($/kWh) амортизируется на срок службы с учётом КПД цикла.
     */
    public double solarPlusBatteryLcoe(double solarLcoe, double batteryCostPerKwh) {
        double storage = (batteryCostPerKwh * params.storageHours())
                / (SimulationConstants.DAYS_PER_YEAR * params.storageLifeYears() * params.roundTripEfficiency())
                * 1000.0;
        return solarLcoe + storage;
    }

    /**
     * Нормированная накопленная мощность: (C2025 + сумма вводов по year включительно) / C2025.
     */
    public double normalizedCumulative(CapacityState state, SourceType source, int yearIndex) {
        double c0 = sources.get(source).capacity2025();
        if (c0 <= 0) {
            return 0.0;
        }
        return (c0 + state.cumulativeAdditions(source, yearIndex)) / c0;
    }

    /**
     * LCOE всех источников за год.
     *
     * @param extraction накопленная добыча газа и угля на этот год
     */
    public LcoeSet lcoeForYear(CapacityState state, int yearIndex, ExtractionLedger extraction, double carbonPrice) {
        EnergySource solar = sources.get(SourceType.SOLAR);
        EnergySource wind = sources.get(SourceType.WIND);
        EnergySource battery = sources.get(SourceType.BATTERY);
        EnergySource nuclear = sources.get(SourceType.NUCLEAR);
        EnergySource gas = sources.get(SourceType.GAS);
        EnergySource coal = sources.get(SourceType.COAL);

        double solarLcoe = learningCurve(solar.cost0(), normalizedCumulative(state, SourceType.SOLAR, yearIndex), solar.alpha());
        double windLcoe = learningCurve(wind.cost0(), normalizedCumulative(state, SourceType.WIND, yearIndex), wind.alpha());
        double batteryCost = learningCurve(battery.cost0(), normalizedCumulative(state, SourceType.BATTERY, yearIndex), battery.alpha());
        double nuclearLcoe = learningCurve(nuclear.cost0(), normalizedCumulative(state, SourceType.NUCLEAR, yearIndex), nuclear.alpha());

        DepletionState gasDepletion = depletion(gas.reserves(), extraction.extracted(SourceType.GAS), gas.eroei0());
        DepletionState coalDepletion = depletion(coal.reserves(), extraction.extracted(SourceType.COAL), coal.eroei0());

        return new LcoeSet(
                solarLcoe,
                windLcoe,
                fossilLcoe(gas, gasDepletion.eroei(), carbonPrice),
                fossilLcoe(coal, coalDepletion.eroei(), carbonPrice),
                nuclearLcoe,
                sources.get(SourceType.HYDRO).cost0(),
                batteryCost,
                solarPlusBatteryLcoe(solarLcoe, batteryCost));
    }
}
