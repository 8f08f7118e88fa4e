package energysim.io;

import energysim.config.DispatchSource;
import energysim.engine.SimulationResult;
import energysim.engine.YearState;
import energysim.engine.demographics.CohortSeries;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * Годовые ряды прогона в CSV (разделитель ',', десятичная точка).
 */
public final class ResultsCsvWriter {

    private static final String HEADER = String.join(",",
            "year",
            "population",
            "electricity_twh",
            "temperature_c",
            "emissions_gt",
            "dependency_ratio",
            "robots_per_1000",
            "solar_lcoe",
            "gas_lcoe");

    private ResultsCsvWriter() {}

    public static void write(PrintWriter out, SimulationResult result) {
        CohortSeries global = result.getDemographics().global();
        List<YearState> years = result.getYears();

        out.println(HEADER);
        for (int i = 0; i < years.size(); i++) {
            YearState y = years.get(i);
            out.println(String.format(Locale.ROOT, "%d,%.0f,%.1f,%.3f,%.2f,%.4f,%.2f,%.2f,%.2f",
                    y.year(),
                    global.population(i),
                    y.demandTwh(),
                    y.temperature(),
                    y.emissions().total(),
                    global.dependency(i),
                    y.robotsDensity(),
                    y.lcoe().forDispatch(DispatchSource.SOLAR),
                    y.lcoe().forDispatch(DispatchSource.GAS)));
        }
        out.flush();
    }
}
