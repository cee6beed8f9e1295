package com.ogt.buildings.sourceconfig;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.exception.ExportConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Valida el mapa de opciones de cada fuente contra su esquema y lo convierte
 * en la variante tipada de {@link SourceConfig}. Claves desconocidas se rechazan.
 */
@Component
@Slf4j
public class SourceConfigParser {

    private static final String CONFIDENCE_THRESHOLD = "confidence_threshold";
    private static final String REGION = "region";
    private static final String BUILDING_TYPES = "building_types";
    private static final String INCLUDE_HEIGHT = "include_height";
    private static final String MIN_AREA = "min_area";

    public SourceConfig parse(BuildingSource source, Map<String, Object> raw) {
        Map<String, Object> options = raw != null ? raw : Map.of();
        rejectUnknownKeys(source, options);

        return switch (source) {
            case GOOGLE -> GoogleSourceConfig.builder()
                    .confidenceThreshold(readNumber(source, options, CONFIDENCE_THRESHOLD,
                            0.0, 1.0, GoogleSourceConfig.DEFAULT_CONFIDENCE_THRESHOLD))
                    .build();
            case MICROSOFT -> MicrosoftSourceConfig.builder()
                    .region(readEnum(source, options, REGION, MicrosoftSourceConfig.REGIONS,
                            MicrosoftSourceConfig.GLOBAL))
                    .build();
            case OSM -> OsmSourceConfig.builder()
                    .buildingTypes(readStringList(source, options, BUILDING_TYPES,
                            OsmSourceConfig.DEFAULT_BUILDING_TYPES))
                    .build();
            case OVERTURE -> OvertureSourceConfig.builder()
                    .includeHeight(readBoolean(source, options, INCLUDE_HEIGHT, true))
                    .minArea(readNumber(source, options, MIN_AREA,
                            0.0, Double.MAX_VALUE, OvertureSourceConfig.DEFAULT_MIN_AREA))
                    .build();
        };
    }

    /**
     * Esquema publicado de las opciones de una fuente (tipo, límites, enum y default).
     */
    public Map<String, Object> describeSchema(BuildingSource source) {
        Map<String, Object> properties = new LinkedHashMap<>();
        switch (source) {
            case GOOGLE -> properties.put(CONFIDENCE_THRESHOLD, Map.of(
                    "type", "number", "minimum", 0.0, "maximum", 1.0,
                    "default", GoogleSourceConfig.DEFAULT_CONFIDENCE_THRESHOLD));
            case MICROSOFT -> properties.put(REGION, Map.of(
                    "type", "string", "enum", MicrosoftSourceConfig.REGIONS,
                    "default", MicrosoftSourceConfig.GLOBAL));
            case OSM -> properties.put(BUILDING_TYPES, Map.of(
                    "type", "array", "items", Map.of("type", "string"),
                    "default", OsmSourceConfig.DEFAULT_BUILDING_TYPES));
            case OVERTURE -> {
                properties.put(INCLUDE_HEIGHT, Map.of("type", "boolean", "default", true));
                properties.put(MIN_AREA, Map.of("type", "number", "minimum", 0,
                        "default", OvertureSourceConfig.DEFAULT_MIN_AREA));
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("additionalProperties", false);
        return schema;
    }

    private void rejectUnknownKeys(BuildingSource source, Map<String, Object> options) {
        Set<String> allowed = allowedKeys(source);
        Set<String> unknown = new TreeSet<>(options.keySet());
        unknown.removeAll(allowed);
        if (!unknown.isEmpty()) {
            throw new ExportConfigurationException(
                    "Unrecognized options for source " + source.getId() + ": " + unknown);
        }
    }

    private Set<String> allowedKeys(BuildingSource source) {
        return switch (source) {
            case GOOGLE -> Set.of(CONFIDENCE_THRESHOLD);
            case MICROSOFT -> Set.of(REGION);
            case OSM -> Set.of(BUILDING_TYPES);
            case OVERTURE -> Set.of(INCLUDE_HEIGHT, MIN_AREA);
        };
    }

    private double readNumber(BuildingSource source, Map<String, Object> options, String key,
                              double min, double max, double defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number number)) {
            throw invalid(source, key, "must be a number");
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || d < min || d > max) {
            throw invalid(source, key, "must be between " + min + " and " + max);
        }
        return d;
    }

    private String readEnum(BuildingSource source, Map<String, Object> options, String key,
                            List<String> allowed, String defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String s) || !allowed.contains(s)) {
            throw invalid(source, key, "must be one of " + allowed);
        }
        return s;
    }

    private boolean readBoolean(BuildingSource source, Map<String, Object> options, String key,
                                boolean defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean b)) {
            throw invalid(source, key, "must be a boolean");
        }
        return b;
    }

    private List<String> readStringList(BuildingSource source, Map<String, Object> options, String key,
                                        List<String> defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof List<?> list)) {
            throw invalid(source, key, "must be an array of strings");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String s) || s.isBlank()) {
                throw invalid(source, key, "must be an array of strings");
            }
            result.add(s);
        }
        return List.copyOf(result);
    }

    private ExportConfigurationException invalid(BuildingSource source, String key, String reason) {
        log.debug("Config inválida para {}: {} {}", source.getId(), key, reason);
        return new ExportConfigurationException(
                "Invalid option '" + key + "' for source " + source.getId() + ": " + reason);
    }
}
