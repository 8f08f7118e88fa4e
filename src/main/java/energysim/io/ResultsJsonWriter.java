package energysim.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import energysim.config.DispatchSource;
import energysim.config.Fuel;
import energysim.config.Mineral;
import energysim.config.Region;
import energysim.config.Sector;
import energysim.config.SourceType;
import energysim.config.TunableParameter;
import energysim.config.TunableParameterPool;
import energysim.engine.SimulationResult;
import energysim.engine.YearState;
import energysim.engine.capacity.CapacityState;
import energysim.engine.capacity.SourceHistory;
import energysim.engine.demand.DemandSeries;
import energysim.engine.demand.SectorSeries;
import energysim.engine.demographics.CohortSeries;
import energysim.engine.resources.CarbonFlux;
import energysim.engine.resources.FoodDemand;
import energysim.engine.resources.LandUse;
import energysim.engine.resources.MineralDemand;
import energysim.engine.resources.ResourceData;
import energysim.metrics.ScenarioMetric;
import energysim.metrics.ScenarioMetrics;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Полная выгрузка прогона в JSON: ряды по годам, сгруппированные по подсистемам,
 * и сводные показатели.
 */
public final class ResultsJsonWriter {

    private final ObjectMapper mapper;

    public ResultsJsonWriter() {
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    public void write(Writer out, String scenarioName, SimulationResult result, ScenarioMetrics metrics)
            throws IOException {
        mapper.writeValue(out, toTree(scenarioName, result, metrics));
        out.flush();
    }

    public ObjectNode toTree(String scenarioName, SimulationResult r, ScenarioMetrics metrics) {
        ObjectNode root = mapper.createObjectNode();
        root.put("scenario", scenarioName);
        root.set("params", params(r));
        ArrayNode years = root.putArray("years");
        for (int y : r.yearNumbers()) {
            years.add(y);
        }
        root.set("results", lcoe(r));
        root.set("dispatch", dispatch(r));
        root.set("capacityState", capacityState(r.getCapacity()));
        root.set("climate", climate(r));
        root.set("capital", capital(r));
        root.set("demand", demand(r));
        root.set("demographics", demographics(r));
        root.set("resources", resources(r.getResources()));
        root.set("metrics", metrics(metrics));
        return root;
    }

    // ===================== Разделы =====================

    private ObjectNode params(SimulationResult r) {
        ObjectNode n = mapper.createObjectNode();
        for (TunableParameter p : TunableParameterPool.all()) {
            Double v = r.getScenario().get(p.id());
            if (v == null) {
                n.putNull(p.name());
            } else {
                n.put(p.name(), v);
            }
        }
        return n;
    }

    private ObjectNode lcoe(SimulationResult r) {
        ObjectNode n = mapper.createObjectNode();
        for (DispatchSource s : DispatchSource.values()) {
            n.set(s.key(), array(r.lcoe(s)));
        }
        n.set("battery", array(r.batteryCost()));
        return n;
    }

    private ObjectNode dispatch(SimulationResult r) {
        ObjectNode n = mapper.createObjectNode();
        ObjectNode generation = n.putObject("generation");
        for (DispatchSource s : DispatchSource.values()) {
            generation.set(s.key(), array(r.generation(s)));
        }
        ObjectNode capacity = n.putObject("capacity");
        for (SourceType s : SourceType.values()) {
            capacity.set(s.key(), array(r.installedCapacity(s)));
        }
        n.set("shortfall", array(r.series(y -> y.dispatch().shortfall())));
        n.set("gridIntensity", array(r.gridIntensity()));
        n.set("adjustedDemand", array(r.adjustedDemand()));
        n.set("expansionMultiplier", array(r.series(y -> y.expansion().expansionMultiplier())));
        n.set("robotLoadTWh", array(r.series(y -> y.expansion().robotLoadTwh())));
        n.set("robotsPer1000", array(r.series(y -> y.expansion().robotsPer1000())));
        return n;
    }

    /**
     * Сырая история мощностей: installed / additions / retirements по источникам, GW (battery: GWh).
     */
    private ObjectNode capacityState(CapacityState state) {
        ObjectNode n = mapper.createObjectNode();
        for (SourceType s : SourceType.values()) {
            SourceHistory h = state.history(s);
            ObjectNode source = n.putObject(s.key());
            source.set("installed", array(h.installedSeries()));
            source.set("additions", array(h.additionsSeries()));
            source.set("retirements", array(h.retirementsSeries()));
        }
        return n;
    }

    private ObjectNode climate(SimulationResult r) {
        ObjectNode n = mapper.createObjectNode();
        n.set("emissions", array(r.emissions()));
        n.set("electricityEmissions", array(r.series(y -> y.emissions().electricity())));
        n.set("nonElectricEmissions", array(r.series(y -> y.emissions().nonElectricity())));
        n.set("landUseEmissions", array(r.series(y -> y.emissions().landUse())));
        n.set("cumulative", array(r.cumulativeEmissions()));
        n.set("co2ppm", array(r.series(YearState::co2ppm)));
        n.set("temperature", array(r.temperature()));
        n.set("globalDamages", array(r.globalDamagesPercent()));
        ObjectNode regional = n.putObject("regionalDamages");
        for (Region region : Region.values()) {
            regional.set(region.key(), array(r.regionalDamagesPercent(region)));
        }
        n.set("energyCost", array(r.series(y -> y.energyCost().total())));
        n.set("energyBurden", array(r.series(y -> y.energyBurden().burden())));
        n.set("burdenDamage", array(r.series(y -> y.energyBurden().damage())));
        return n;
    }

    private ObjectNode capital(SimulationResult r) {
        ObjectNode n = mapper.createObjectNode();
        n.set("stock", array(r.series(YearState::capital)));
        n.set("investment", array(r.series(YearState::investment)));
        n.set("savingsRate", array(r.series(y -> y.savings().global())));
        n.set("stability", array(r.series(YearState::stability)));
        n.set("interestRate", array(r.series(YearState::interestRate)));
        n.set("robotsDensity", array(r.series(YearState::robotsDensity)));
        n.set("kPerWorker", array(r.series(YearState::capitalPerWorker)));
        return n;
    }

    private ObjectNode demand(SimulationResult r) {
        ObjectNode n = mapper.createObjectNode();
        ObjectNode regions = n.putObject("regions");
        for (Map.Entry<Region, DemandSeries> e : r.getDemand().regions().entrySet()) {
            regions.set(e.getKey().key(), demandSeries(e.getValue()));
        }
        n.set("global", demandSeries(r.getDemand().global()));
        return n;
    }

    private ObjectNode demandSeries(DemandSeries d) {
        ObjectNode n = mapper.createObjectNode();
        n.set("gdp", array(d.gdp()));
        n.set("growthRate", array(d.growthRate()));
        n.set("energyIntensity", array(d.energyIntensity()));
        n.set("electricityDemand", array(d.electricityDemand()));
        n.set("electrificationRate", array(d.electrificationRate()));
        n.set("gdpPerWorking", array(d.gdpPerWorking()));
        n.set("electricityPerWorking", array(d.electricityPerWorking()));
        n.set("totalFinalEnergy", array(d.totalFinalEnergy()));
        n.set("nonElectricEnergy", array(d.nonElectricEnergy()));
        n.set("finalEnergyPerCapitaDay", array(d.finalEnergyPerCapitaDay()));
        ObjectNode sectors = n.putObject("sectors");
        for (Sector s : Sector.values()) {
            SectorSeries ss = d.sector(s);
            ObjectNode sn = sectors.putObject(s.key());
            sn.set("total", array(ss.total()));
            sn.set("electric", array(ss.electric()));
            sn.set("nonElectric", array(ss.nonElectric()));
            sn.set("electrificationRate", array(ss.electrificationRate()));
        }
        ObjectNode fuels = n.putObject("fuels");
        for (Fuel f : Fuel.values()) {
            fuels.set(f.key(), array(d.fuel(f)));
        }
        return n;
    }

    private ObjectNode demographics(SimulationResult r) {
        ObjectNode n = mapper.createObjectNode();
        ObjectNode regions = n.putObject("regions");
        for (Map.Entry<Region, CohortSeries> e : r.getDemographics().regions().entrySet()) {
            ObjectNode rn = cohortSeries(e.getValue());
            rn.set("fertility", array(e.getValue().fertility()));
            rn.set("enrollmentRate", array(e.getValue().enrollmentRate()));
            rn.set("wagePremium", array(e.getValue().wagePremium()));
            regions.set(e.getKey().key(), rn);
        }
        n.set("global", cohortSeries(r.getDemographics().global()));
        return n;
    }

    private ObjectNode cohortSeries(CohortSeries c) {
        ObjectNode n = mapper.createObjectNode();
        n.set("population", array(c.population()));
        n.set("young", array(c.young()));
        n.set("working", array(c.working()));
        n.set("old", array(c.old()));
        n.set("dependency", array(c.dependency()));
        n.set("workingCollege", array(c.workingCollege()));
        n.set("workingNonCollege", array(c.workingNonCollege()));
        n.set("collegeShare", array(c.collegeShare()));
        n.set("effectiveWorkers", array(c.effectiveWorkers()));
        return n;
    }

    private ObjectNode resources(ResourceData res) {
        ObjectNode n = mapper.createObjectNode();
        ObjectNode minerals = n.putObject("minerals");
        for (Mineral m : Mineral.values()) {
            ObjectNode mn = minerals.putObject(m.key());
            mn.set("demand", array(res.mineralSeries(m, MineralDemand::demand)));
            mn.set("grossDemand", array(res.mineralSeries(m, MineralDemand::grossDemand)));
            mn.set("recycled", array(res.mineralSeries(m, MineralDemand::recycled)));
            mn.set("intensity", array(res.mineralSeries(m, MineralDemand::intensity)));
            mn.set("recyclingRate", array(res.mineralSeries(m, MineralDemand::recyclingRate)));
            mn.set("cumulative", array(res.mineralSeries(m, MineralDemand::cumulative)));
            mn.set("reserveRatio", array(res.mineralSeries(m, MineralDemand::reserveRatio)));
        }
        ObjectNode food = n.putObject("food");
        food.set("caloriesPerCapita", array(res.foodSeries(FoodDemand::caloriesPerCapita)));
        food.set("totalCalories", array(res.foodSeries(FoodDemand::totalCalories)));
        food.set("proteinShare", array(res.foodSeries(FoodDemand::proteinShare)));
        food.set("grainEquivalent", array(res.foodSeries(FoodDemand::grainEquivalent)));
        food.set("glp1Adoption", array(res.foodSeries(FoodDemand::glp1Adoption)));
        food.set("glp1Effect", array(res.foodSeries(FoodDemand::glp1Effect)));
        ObjectNode land = n.putObject("land");
        land.set("farmland", array(res.landSeries(LandUse::farmland)));
        land.set("urban", array(res.landSeries(LandUse::urban)));
        land.set("forest", array(res.landSeries(LandUse::forest)));
        land.set("desert", array(res.landSeries(LandUse::desert)));
        land.set("yield", array(res.landSeries(LandUse::yield)));
        land.set("forestChange", array(res.landSeries(LandUse::forestChange)));
        ObjectNode carbon = n.putObject("carbon");
        carbon.set("sequestration", array(res.carbonSeries(CarbonFlux::sequestration)));
        carbon.set("deforestationEmissions", array(res.carbonSeries(CarbonFlux::deforestationEmissions)));
        carbon.set("decayEmissions", array(res.carbonSeries(CarbonFlux::decayEmissions)));
        carbon.set("netFlux", array(res.carbonSeries(CarbonFlux::netFlux)));
        carbon.set("cumulativeSequestration", array(res.cumulativeSequestration()));
        return n;
    }

    private ObjectNode metrics(ScenarioMetrics metrics) {
        ObjectNode n = mapper.createObjectNode();
        for (Map.Entry<ScenarioMetric, Double> e : metrics.asMap().entrySet()) {
            Double v = e.getValue();
            if (v == null || !Double.isFinite(v)) {
                n.putNull(e.getKey().key());
            } else if (e.getKey().kind() == ScenarioMetric.Kind.YEAR) {
                n.put(e.getKey().key(), v.intValue());
            } else {
                n.put(e.getKey().key(), v);
            }
        }
        return n;
    }

    private ArrayNode array(List<Double> values) {
        ArrayNode a = mapper.createArrayNode();
        for (Double v : values) {
            a.add(v);
        }
        return a;
    }

    private ArrayNode array(double[] values) {
        ArrayNode a = mapper.createArrayNode();
        for (double v : values) {
            if (Double.isFinite(v)) {
                a.add(v);
            } else {
                a.addNull();
            }
        }
        return a;
    }
}
