package com.ogt.buildings.service;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.sourceconfig.SourceConfig;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/** Estadísticas por fuente: conteo, área total (m², proyección equivalente) y extras de cada fuente. */
@Component
@RequiredArgsConstructor
public class BuildingStatsCalculator {

    public static final String NO_BUILDINGS_FOUND = "No buildings found";

    private final AreaCalculator areaCalculator;

    public Map<String, Object> compute(BuildingFeatureCollection collection, SourceConfig config) {
        BuildingSource source = config.getSource();
        Map<String, Object> stats = new LinkedHashMap<>();

        if (collection == null || collection.isEmpty()) {
            stats.put("building_count", 0);
            stats.put("total_area_m2", 0.0);
            stats.put("message", NO_BUILDINGS_FOUND);
            stats.put("source", source.getId());
            stats.put("config_used", config.toMap());
            return stats;
        }

        List<Geometry> geometries = collection.getFeatures().stream().map(BuildingFeature::getGeometry).toList();
        stats.put("building_count", collection.size());
        stats.put("total_area_m2", round(areaCalculator.totalAreaSquareMeters(geometries), 2));
        stats.put("source", source.getId());
        stats.put("config_used", config.toMap());

        switch (source) {
            case GOOGLE -> average(collection, "confidence").ifPresent(avg -> stats.put("confidence_avg", round(avg, 4)));
            case OSM -> stats.put("building_types", histogram(collection, "building"));
            case OVERTURE -> {
                long withHeight = collection.getFeatures().stream()
                        .filter(f -> f.property("height") instanceof Number).count();
                stats.put("with_height_count", withHeight);
                average(collection, "height").ifPresent(avg -> stats.put("height_avg", round(avg, 2)));
            }
            case MICROSOFT -> {
                // sin extras
            }
        }
        return stats;
    }

    private OptionalDouble average(BuildingFeatureCollection collection, String property) {
        return collection.getFeatures().stream()
                .map(f -> f.property(property))
                .filter(Number.class::isInstance)
                .mapToDouble(v -> ((Number) v).doubleValue())
                .average();
    }

    private Map<String, Long> histogram(BuildingFeatureCollection collection, String property) {
        Map<String, Long> counts = new TreeMap<>();
        for (BuildingFeature feature : collection.getFeatures()) {
            Object value = feature.property(property);
            counts.merge(value == null ? "unknown" : value.toString(), 1L, Long::sum);
        }
        return counts;
    }

    static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
