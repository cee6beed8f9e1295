package com.ogt.buildings.service;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.sourceconfig.GoogleSourceConfig;
import com.ogt.buildings.sourceconfig.OsmSourceConfig;
import com.ogt.buildings.sourceconfig.OvertureSourceConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BuildingStatsCalculatorTest {

    private final BuildingStatsCalculator calculator = new BuildingStatsCalculator(new AreaCalculator());

    @Test
    void emptyCollectionReportsNoBuildings() {
        Map<String, Object> stats = calculator.compute(BuildingFeatureCollection.empty(BuildingSource.OSM),
                OsmSourceConfig.builder().build());

        assertThat(stats)
                .containsEntry("building_count", 0)
                .containsEntry("total_area_m2", 0.0)
                .containsEntry("message", BuildingStatsCalculator.NO_BUILDINGS_FOUND)
                .containsEntry("source", "osm")
                .containsKey("config_used");
    }

    @Test
    void countsBuildingsAndMeasuresArea() {
        Map<String, Object> stats = calculator.compute(BuildingFixtures.buildings(BuildingSource.OVERTURE, 4),
                OvertureSourceConfig.builder().build());

        assertThat(stats).containsEntry("building_count", 4).containsEntry("with_height_count", 4L);
        // 4 huellas de 0.0001° (~10.4 m x 11.1 m)
        assertThat((Double) stats.get("total_area_m2")).isBetween(400.0, 500.0);
        // alturas 3.5, 4.5, 5.5, 6.5
        assertThat(stats).containsEntry("height_avg", 5.0);
    }

    @Test
    void googleStatsAverageConfidence() {
        BuildingFeatureCollection collection = new BuildingFeatureCollection(BuildingSource.GOOGLE, List.of(
                new BuildingFeature(BuildingFixtures.square(0, 0, 0.0001), Map.of("confidence", 0.8)),
                new BuildingFeature(BuildingFixtures.square(0.001, 0, 0.0001), Map.of("confidence", 0.9))));

        Map<String, Object> stats = calculator.compute(collection, GoogleSourceConfig.builder().build());

        assertThat(stats).containsEntry("confidence_avg", 0.85);
        assertThat(stats.get("config_used")).isEqualTo(Map.of("confidence_threshold", 0.7));
    }

    @Test
    void osmStatsBuildHistogramOfTypes() {
        BuildingFeatureCollection collection = new BuildingFeatureCollection(BuildingSource.OSM, List.of(
                new BuildingFeature(BuildingFixtures.square(0, 0, 0.0001), Map.of("building", "house")),
                new BuildingFeature(BuildingFixtures.square(0.001, 0, 0.0001), Map.of("building", "house")),
                new BuildingFeature(BuildingFixtures.square(0.002, 0, 0.0001), Map.of("building", "school"))));

        Map<String, Object> stats = calculator.compute(collection, OsmSourceConfig.builder().build());

        assertThat(stats.get("building_types")).isEqualTo(Map.of("house", 2L, "school", 1L));
    }
}
