package energysim.metrics;

/**
 * Единицы измерения выходных рядов.
 */
public enum SeriesUnits {

    // ===== Энергия =====
    LCOE("lcoe", "$/MWh", "Levelized cost of energy"),
    BATTERY_COST("batteryCost", "$/kWh", "Battery storage cost"),
    ELECTRICITY_DEMAND("electricityDemand", "TWh", "Annual electricity demand"),
    ELECTRICITY_PER_WORKING("electricityPerWorking", "kWh/person", "Electricity per working-age adult"),
    ELECTRICITY_PER_CAPITA("electricityPerCapita", "kWh/person", "Electricity per capita"),
    GENERATION("generation", "TWh", "Electricity generation by source"),
    CAPACITY("capacity", "GW", "Installed capacity (battery in GWh)"),

    // ===== Экономика =====
    GDP("gdp", "$ trillions", "Regional GDP"),
    GDP_PER_WORKING("gdpPerWorking", "$/person", "GDP per working-age adult"),
    GDP_PER_CAPITA("gdpPerCapita", "$/person", "GDP per capita"),
    ENERGY_INTENSITY("energyIntensity", "MWh/$1000 GDP", "Energy intensity of economy"),
    ENERGY_COST("energyCost", "$ trillions", "Total energy expenditure"),
    ENERGY_BURDEN("energyBurden", "fraction", "Energy expenditure as a share of gross GDP"),

    // ===== Население =====
    POPULATION("population", "persons", "Absolute population count"),
    DEPENDENCY("dependency", "ratio", "Old-age dependency ratio (65+/20-64)"),
    FERTILITY("fertility", "TFR", "Total fertility rate (children per woman)"),
    COLLEGE_SHARE("collegeShare", "fraction", "Fraction of workers with college degree"),
    ENROLLMENT_RATE("enrollmentRate", "fraction", "Tertiary education enrollment rate"),
    WAGE_PREMIUM("wagePremium", "multiplier", "College wage premium"),
    EFFECTIVE_WORKERS("effectiveWorkers", "persons", "Productivity-weighted worker count"),

    // ===== Климат =====
    EMISSIONS("emissions", "Gt CO₂/year", "Annual CO₂ emissions"),
    CUMULATIVE("cumulative", "Gt CO₂", "Cumulative CO₂ since preindustrial"),
    GRID_INTENSITY("gridIntensity", "kg CO₂/MWh", "Grid carbon intensity"),
    TEMPERATURE("temperature", "°C", "Temperature above preindustrial"),
    CO2_PPM("co2ppm", "ppm", "Atmospheric CO₂ concentration"),
    DAMAGES("damages", "% GDP", "Climate damages as percent of GDP"),
    ELECTRIFICATION_RATE("electrificationRate", "fraction", "Electricity share of final energy"),

    // ===== Капитал =====
    CAPITAL_STOCK("capitalStock", "$ trillions", "Total capital stock"),
    INVESTMENT("investment", "$ trillions", "Annual investment"),
    SAVINGS_RATE("savingsRate", "fraction", "Aggregate savings rate (demographic-weighted)"),
    STABILITY("stability", "fraction", "Uncertainty premium from climate damages"),
    INTEREST_RATE("interestRate", "fraction", "Real interest rate"),
    ROBOTS_DENSITY("robotsDensity", "robots/1000 workers", "Robots per 1000 effective workers"),
    K_PER_WORKER("kPerWorker", "$K/person", "Capital per effective worker"),
    K_Y_RATIO("kYRatio", "ratio", "Capital-to-output ratio"),

    // ===== Расширение спроса =====
    EXPANSION_MULTIPLIER("expansionMultiplier", "multiplier", "Demand multiplier from cheap clean energy"),
    ROBOT_LOAD("robotLoad", "TWh", "Electricity load of robots"),
    ADJUSTED_DEMAND("adjustedDemand", "TWh", "Electricity demand after expansion and infrastructure ceiling"),

    // ===== Ресурсы =====
    MINERAL_DEMAND("mineralDemand", "Mt/year", "Annual mineral demand (net of recycling)"),
    MINERAL_CUMULATIVE("mineralCumulative", "Mt", "Cumulative mineral extraction"),
    MINERAL_INTENSITY("mineralIntensity", "fraction", "Intensity factor relative to 2025"),
    RESERVE_RATIO("reserveRatio", "fraction", "Cumulative demand / known reserves"),
    RECYCLING_RATE("recyclingRate", "fraction", "Recycling rate"),
    CALORIES_PER_CAPITA("caloriesPerCapita", "kcal/person/day", "Daily calorie consumption per capita"),
    TOTAL_CALORIES("totalCalories", "Pcal/year", "Global annual calorie demand"),
    PROTEIN_SHARE("proteinShare", "fraction", "Fraction of calories from protein"),
    GRAIN_EQUIVALENT("grainEquivalent", "Mt/year", "Grain equivalent demand (direct + feed)"),
    GLP1_ADOPTION("glp1Adoption", "fraction", "Population fraction using GLP-1 drugs"),
    GLP1_EFFECT("glp1Effect", "fraction", "Aggregate calorie reduction from GLP-1"),
    FARMLAND("farmland", "Mha", "Cropland area"),
    URBAN("urban", "Mha", "Urban land area"),
    FOREST("forest", "Mha", "Forest area"),
    DESERT("desert", "Mha", "Desert and barren land (residual of the land budget)"),
    YIELD("yield", "t/ha", "Crop yield"),
    FOREST_CHANGE("forestChange", "Mha/year", "Annual change in forest area"),
    SEQUESTRATION("sequestration", "Gt CO₂/year", "Forest carbon sequestration"),
    DEFORESTATION_EMISSIONS("deforestationEmissions", "Gt CO₂/year", "Immediate emissions from deforestation"),
    DECAY_EMISSIONS("decayEmissions", "Gt CO₂/year", "Emissions from the decay pool"),
    NET_FLUX("netFlux", "Gt CO₂/year", "Net land use carbon flux (positive = emissions)"),
    CUMULATIVE_SEQUESTRATION("cumulativeSequestration", "Gt CO₂", "Total carbon sequestered by forests"),

    // ===== Конечная энергия =====
    TOTAL_FINAL_ENERGY("totalFinalEnergy", "TWh", "Total final energy (electricity + non-electric)"),
    NON_ELECTRIC_ENERGY("nonElectricEnergy", "TWh", "Non-electric final energy"),
    FINAL_ENERGY_PER_CAPITA_DAY("finalEnergyPerCapitaDay", "kWh/person/day", "Final energy per capita per day"),
    SECTOR_TOTAL("sectorTotal", "TWh", "Sector total energy"),
    SECTOR_ELECTRIC("sectorElectric", "TWh", "Sector electricity consumption"),
    SECTOR_NON_ELECTRIC("sectorNonElectric", "TWh", "Sector non-electric energy"),
    SECTOR_ELECTRIFICATION_RATE("sectorElectrificationRate", "fraction", "Sector-specific electrification rate"),
    FUEL_DEMAND("fuelDemand", "TWh", "Fuel consumption by type");

    private final String key;
    private final String unit;
    private final String description;

    SeriesUnits(String key, String unit, String description) {
        this.key = key;
        this.unit = unit;
        this.description = description;
    }

    public String key() {
        return key;
    }

    public String unit() {
        return unit;
    }

    public String description() {
        return description;
    }

    public static SeriesUnits fromKey(String key) {
        for (SeriesUnits u : values()) {
            if (u.key.equals(key)) {
                return u;
            }
        }
        throw new IllegalArgumentException("Unknown series: " + key);
    }
}
