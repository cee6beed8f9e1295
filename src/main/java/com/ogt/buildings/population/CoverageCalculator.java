package com.ogt.buildings.population;

import com.ogt.buildings.config.BuildingExtractorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Clasificaciones por umbrales de política (configurables en {@code buildings.coverage}):
 * nivel de cobertura por edificios/habitante y clase de densidad por habitantes/km².
 */
@Component
@RequiredArgsConstructor
public class CoverageCalculator {

    private final BuildingExtractorProperties properties;

    public double buildingsPerCapita(long buildingCount, long population) {
        if (population <= 0) {
            throw new IllegalArgumentException("population must be positive");
        }
        return (double) buildingCount / population;
    }

    public String coverageLevel(double buildingsPerCapita) {
        BuildingExtractorProperties.Coverage c = properties.getCoverage();
        if (buildingsPerCapita < c.getVeryLowBelow()) return "very_low";
        if (buildingsPerCapita < c.getLowBelow()) return "low";
        if (buildingsPerCapita < c.getModerateBelow()) return "moderate";
        if (buildingsPerCapita < c.getHighBelow()) return "high";
        return "excellent";
    }

    public String densityClass(double densityPerKm2) {
        BuildingExtractorProperties.Coverage c = properties.getCoverage();
        if (densityPerKm2 < c.getSparseDensityBelow()) return "sparse";
        if (densityPerKm2 < c.getLowDensityBelow()) return "low";
        if (densityPerKm2 < c.getModerateDensityBelow()) return "moderate";
        if (densityPerKm2 < c.getHighDensityBelow()) return "high";
        return "very_high";
    }
}
