package energysim.engine.demographics;

import energysim.config.DemographicParams;

/**
 * Источник демографической проекции 2025–2100.
 */
public interface DemographicsProvider {

    DemographicsData project(DemographicParams params);
}
