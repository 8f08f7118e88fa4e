package energysim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Полный набор параметров модели (immutable).
 * Строится один раз из конфигурации; сценарные изменения дают новую копию через with-методы.
 */
public record ModelParameters(Map<SourceType, EnergySource> energySources,
                              CostParams cost,
                              DispatchParams dispatch,
                              CapacityParams capacity,
                              ClimateParams climate,
                              CapitalParams capital,
                              ExpansionParams expansion,
                              EconomicParams economic,
                              DemandParams demand,
                              FinalEnergyParams finalEnergy,
                              PreEstimateParams preEstimate,
                              DemographicParams demographics,
                              ResourceParams resources) {

    /**
     * Корневой ключ параметров модели в HOCON.
     */
    public static final String ROOT_PATH = "energy-model";

    public ModelParameters {
        energySources = EnumMaps.copyOf(SourceType.class, energySources);
        for (SourceType s : SourceType.values()) {
            if (!energySources.containsKey(s)) {
                throw new IllegalArgumentException("energySources is missing " + s.key());
            }
        }
        Objects.requireNonNull(cost, "cost");
        Objects.requireNonNull(dispatch, "dispatch");
        Objects.requireNonNull(capacity, "capacity");
        Objects.requireNonNull(climate, "climate");
        Objects.requireNonNull(capital, "capital");
        Objects.requireNonNull(expansion, "expansion");
        Objects.requireNonNull(economic, "economic");
        Objects.requireNonNull(demand, "demand");
        Objects.requireNonNull(finalEnergy, "finalEnergy");
        Objects.requireNonNull(preEstimate, "preEstimate");
        Objects.requireNonNull(demographics, "demographics");
        Objects.requireNonNull(resources, "resources");
    }

    /**
     * Параметры по умолчанию из reference.conf.
     */
    public static ModelParameters defaults() {
        return fromConfig(defaultConfig());
    }

    /**
     * Поддерево energy-model из reference.conf.
     */
    public static Config defaultConfig() {
        return ConfigFactory.defaultReference().getConfig(ROOT_PATH);
    }

    /**
     * Чтение параметров из поддерева energy-model.
     *
     * @throws com.typesafe.config.ConfigException при отсутствии или неверном типе ключа
     */
    public static ModelParameters fromConfig(Config modelConfig) {
        return ModelParametersReader.read(modelConfig);
    }

    public EnergySource source(SourceType type) {
        return energySources.get(type);
    }

    // --------- Copy helpers ---------

    public ModelParameters withEnergySource(SourceType type, EnergySource source) {
        Map<SourceType, EnergySource> copy = new java.util.EnumMap<>(energySources);
        copy.put(type, source);
        return new ModelParameters(copy, cost, dispatch, capacity, climate, capital, expansion, economic,
                demand, finalEnergy, preEstimate, demographics, resources);
    }

    public ModelParameters withClimate(ClimateParams v) {
        return new ModelParameters(energySources, cost, dispatch, capacity, v, capital, expansion, economic,
                demand, finalEnergy, preEstimate, demographics, resources);
    }

    public ModelParameters withCapital(CapitalParams v) {
        return new ModelParameters(energySources, cost, dispatch, capacity, climate, v, expansion, economic,
                demand, finalEnergy, preEstimate, demographics, resources);
    }

    public ModelParameters withExpansion(ExpansionParams v) {
        return new ModelParameters(energySources, cost, dispatch, capacity, climate, capital, v, economic,
                demand, finalEnergy, preEstimate, demographics, resources);
    }

    public ModelParameters withDemand(DemandParams v) {
        return new ModelParameters(energySources, cost, dispatch, capacity, climate, capital, expansion, economic,
                v, finalEnergy, preEstimate, demographics, resources);
    }

    public ModelParameters withDemographics(DemographicParams v) {
        return new ModelParameters(energySources, cost, dispatch, capacity, climate, capital, expansion, economic,
                demand, finalEnergy, preEstimate, v, resources);
    }

    public ModelParameters withResources(ResourceParams v) {
        return new ModelParameters(energySources, cost, dispatch, capacity, climate, capital, expansion, economic,
                demand, finalEnergy, preEstimate, demographics, v);
    }
}
