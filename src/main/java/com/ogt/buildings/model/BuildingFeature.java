package com.ogt.buildings.model;

import lombok.Value;
import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Huella de edificio en WGS84 con sus atributos de origen. */
@Value
public class BuildingFeature {

    Geometry geometry;
    Map<String, Object> properties;

    public BuildingFeature(Geometry geometry, Map<String, Object> properties) {
        this.geometry = geometry;
        this.properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Object property(String name) {
        return properties.get(name);
    }
}
