package energysim.metrics;

/**
 * Сводные показатели сценария. Показатели вида {@link Kind#YEAR} содержат
 * календарный год события и отсутствуют, если событие не наступило.
 */
public enum ScenarioMetric {

    // ===== Пересечения LCOE =====
    SOLAR_CROSSES_GAS("solarCrossesGas", Kind.YEAR),
    SOLAR_BATTERY_CROSSES_GAS("solarBatteryCrossesGas", Kind.YEAR),
    COAL_UNECONOMIC("coalUneconomic", Kind.YEAR),
    WIND_CROSSES_GAS("windCrossesGas", Kind.YEAR),

    // ===== Региональные пересечения =====
    CHINA_ELEC_CROSSES_OECD("chinaElecCrossesOECD", Kind.YEAR),
    EM_ELEC_CROSSES_CHINA("emElecCrossesChina", Kind.YEAR),
    CHINA_PER_CAP_ELEC_CROSSES_OECD("chinaPerCapElecCrossesOECD", Kind.YEAR),

    // ===== Углеродоёмкость сети =====
    GRID_BELOW_200("gridBelow200", Kind.YEAR),
    GRID_BELOW_100("gridBelow100", Kind.YEAR),
    GRID_BELOW_50("gridBelow50", Kind.YEAR),

    // ===== Климат =====
    PEAK_EMISSIONS_YEAR("peakEmissionsYear", Kind.YEAR),
    PEAK_EMISSIONS_GT("peakEmissionsGt", Kind.VALUE),
    WARMING_2100("warming2100", Kind.VALUE),
    DAMAGES_2075("damages2075", Kind.VALUE),
    DAMAGES_2100("damages2100", Kind.VALUE),
    GRID_INTENSITY_2025("gridIntensity2025", Kind.VALUE),
    GRID_INTENSITY_2050("gridIntensity2050", Kind.VALUE),
    GRID_INTENSITY_2100("gridIntensity2100", Kind.VALUE),
    EMISSIONS_2025("emissions2025", Kind.VALUE),
    EMISSIONS_2050("emissions2050", Kind.VALUE),
    EMISSIONS_2100("emissions2100", Kind.VALUE),

    // ===== Энергетическая нагрузка =====
    ENERGY_BURDEN_2025("energyBurden2025", Kind.VALUE),
    ENERGY_BURDEN_2050("energyBurden2050", Kind.VALUE),
    ENERGY_BURDEN_PEAK("energyBurdenPeak", Kind.VALUE),
    ENERGY_BURDEN_PEAK_YEAR("energyBurdenPeakYear", Kind.YEAR),
    ENERGY_COST_2025("energyCost2025", Kind.VALUE),
    ENERGY_COST_2050("energyCost2050", Kind.VALUE),

    // ===== Спрос =====
    ELEC_2025("elec2025", Kind.VALUE),
    ELEC_2050("elec2050", Kind.VALUE),
    ELEC_2100("elec2100", Kind.VALUE),
    ELECTRIFICATION_2050("electrification2050", Kind.VALUE),
    DEMAND_DOUBLING("demandDoubling", Kind.YEAR),
    ASIA_SHARE_2050("asiaShare2050", Kind.VALUE),
    ELEC_PER_CAPITA_2025("elecPerCapita2025", Kind.VALUE),
    ELEC_PER_CAPITA_2050("elecPerCapita2050", Kind.VALUE),
    ELEC_PER_CAPITA_2100("elecPerCapita2100", Kind.VALUE),
    ELEC_PER_CAPITA_2050_OECD("elecPerCapita2050_oecd", Kind.VALUE),
    ELEC_PER_CAPITA_2050_CHINA("elecPerCapita2050_china", Kind.VALUE),
    ELEC_PER_CAPITA_2050_EM("elecPerCapita2050_em", Kind.VALUE),
    ELEC_PER_CAPITA_2050_ROW("elecPerCapita2050_row", Kind.VALUE),

    // ===== Демография =====
    POP_PEAK_YEAR("popPeakYear", Kind.YEAR),
    POP_2100("pop2100", Kind.VALUE),
    DEPENDENCY_2075("dependency2075", Kind.VALUE),
    CHINA_COLLEGE_PEAK_YEAR("chinaCollegePeakYear", Kind.YEAR),
    COLLEGE_SHARE_2025("collegeShare2025", Kind.VALUE),
    COLLEGE_SHARE_2050("collegeShare2050", Kind.VALUE),
    COLLEGE_SHARE_2100("collegeShare2100", Kind.VALUE),
    CHINA_COLLEGE_SHARE_2025("chinaCollegeShare2025", Kind.VALUE),
    CHINA_COLLEGE_SHARE_2050("chinaCollegeShare2050", Kind.VALUE),

    // ===== Капитал =====
    K_Y_2025("kY2025", Kind.VALUE),
    K_Y_2050("kY2050", Kind.VALUE),
    INTEREST_RATE_2025("interestRate2025", Kind.VALUE),
    INTEREST_RATE_2050("interestRate2050", Kind.VALUE),
    ROBOTS_DENSITY_2025("robotsDensity2025", Kind.VALUE),
    ROBOTS_DENSITY_2050("robotsDensity2050", Kind.VALUE),
    ROBOTS_DENSITY_2100("robotsDensity2100", Kind.VALUE),
    SAVINGS_RATE_2025("savingsRate2025", Kind.VALUE),
    SAVINGS_RATE_2075("savingsRate2075", Kind.VALUE),
    CAPITAL_STOCK_2025("capitalStock2025", Kind.VALUE),
    CAPITAL_STOCK_2100("capitalStock2100", Kind.VALUE),
    K_PER_WORKER_2025("kPerWorker2025", Kind.VALUE),
    K_PER_WORKER_2100("kPerWorker2100", Kind.VALUE),

    // ===== Расширение спроса =====
    EXPANSION_MULTIPLIER_2050("expansionMultiplier2050", Kind.VALUE),
    EXPANSION_MULTIPLIER_2100("expansionMultiplier2100", Kind.VALUE),
    ROBOT_LOAD_TWH_2050("robotLoadTWh2050", Kind.VALUE),
    ROBOT_LOAD_TWH_2100("robotLoadTWh2100", Kind.VALUE),
    ADJUSTED_DEMAND_2050("adjustedDemand2050", Kind.VALUE),
    ADJUSTED_DEMAND_2100("adjustedDemand2100", Kind.VALUE),
    ROBOTS_PER_1000_2050("robotsPer10002050", Kind.VALUE),
    ROBOTS_PER_1000_2100("robotsPer10002100", Kind.VALUE),

    // ===== Конечная энергия =====
    FINAL_ENERGY_PER_CAPITA_DAY_2025("finalEnergyPerCapitaDay2025", Kind.VALUE),
    FINAL_ENERGY_PER_CAPITA_DAY_2050("finalEnergyPerCapitaDay2050", Kind.VALUE),
    FINAL_ENERGY_PER_CAPITA_DAY_2100("finalEnergyPerCapitaDay2100", Kind.VALUE),
    TOTAL_FINAL_ENERGY_2025("totalFinalEnergy2025", Kind.VALUE),
    TOTAL_FINAL_ENERGY_2050("totalFinalEnergy2050", Kind.VALUE),
    TOTAL_FINAL_ENERGY_2100("totalFinalEnergy2100", Kind.VALUE),
    NON_ELECTRIC_ENERGY_2050("nonElectricEnergy2050", Kind.VALUE),
    TRANSPORT_ELECTRIFICATION_2050("transportElectrification2050", Kind.VALUE),
    BUILDINGS_ELECTRIFICATION_2050("buildingsElectrification2050", Kind.VALUE),
    INDUSTRY_ELECTRIFICATION_2050("industryElectrification2050", Kind.VALUE),
    OIL_SHARE_OF_FINAL_2050("oilShareOfFinal2050", Kind.VALUE),
    GAS_SHARE_OF_FINAL_2050("gasShareOfFinal2050", Kind.VALUE),

    // ===== Минералы =====
    COPPER_PEAK_YEAR("copperPeakYear", Kind.YEAR),
    COPPER_PEAK_DEMAND("copperPeakDemand", Kind.VALUE),
    COPPER_CUMULATIVE_2050("copperCumulative2050", Kind.VALUE),
    COPPER_CUMULATIVE_2100("copperCumulative2100", Kind.VALUE),
    COPPER_RESERVE_RATIO_2050("copperReserveRatio2050", Kind.VALUE),
    COPPER_RESERVE_RATIO_2100("copperReserveRatio2100", Kind.VALUE),
    LITHIUM_PEAK_YEAR("lithiumPeakYear", Kind.YEAR),
    LITHIUM_PEAK_DEMAND("lithiumPeakDemand", Kind.VALUE),
    LITHIUM_CUMULATIVE_2050("lithiumCumulative2050", Kind.VALUE),
    LITHIUM_CUMULATIVE_2100("lithiumCumulative2100", Kind.VALUE),
    LITHIUM_RESERVE_RATIO_2050("lithiumReserveRatio2050", Kind.VALUE),
    LITHIUM_RESERVE_RATIO_2100("lithiumReserveRatio2100", Kind.VALUE),

    // ===== Продовольствие =====
    PROTEIN_SHARE_2050("proteinShare2050", Kind.VALUE),
    PROTEIN_SHARE_2100("proteinShare2100", Kind.VALUE),
    GLP1_EFFECT_2050("glp1Effect2050", Kind.VALUE),
    GRAIN_DEMAND_2050("grainDemand2050", Kind.VALUE),
    GRAIN_DEMAND_2100("grainDemand2100", Kind.VALUE),

    // ===== Земля =====
    FARMLAND_2025("farmland2025", Kind.VALUE),
    FARMLAND_2050("farmland2050", Kind.VALUE),
    FARMLAND_2100("farmland2100", Kind.VALUE),
    FARMLAND_CHANGE("farmlandChange", Kind.VALUE),
    URBAN_2050("urban2050", Kind.VALUE),
    FOREST_2100("forest2100", Kind.VALUE),
    FOREST_LOSS("forestLoss", Kind.VALUE),
    DESERT_2025("desert2025", Kind.VALUE),
    DESERT_2050("desert2050", Kind.VALUE),
    DESERT_2100("desert2100", Kind.VALUE),

    // ===== Углерод лесов =====
    NET_FLUX_2025("netFlux2025", Kind.VALUE),
    NET_FLUX_2050("netFlux2050", Kind.VALUE),
    NET_FLUX_2100("netFlux2100", Kind.VALUE),
    CUMULATIVE_SEQUESTRATION_2100("cumulativeSequestration2100", Kind.VALUE);

    public enum Kind {
        YEAR,
        VALUE
    }

    private final String key;
    private final Kind kind;

    ScenarioMetric(String key, Kind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public Kind kind() {
        return kind;
    }

    public static ScenarioMetric fromKey(String key) {
        for (ScenarioMetric m : values()) {
            if (m.key.equals(key)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + key);
    }
}
