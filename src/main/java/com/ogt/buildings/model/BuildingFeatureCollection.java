package com.ogt.buildings.model;

import com.ogt.buildings.entity.BuildingSource;
import lombok.Getter;

import java.util.List;

/**
 * Edificios extraídos de una fuente para una ejecución. Sólo vive en memoria;
 * lo que se persiste son sus artefactos derivados.
 */
@Getter
public class BuildingFeatureCollection {

    private final BuildingSource source;
    private final List<BuildingFeature> features;

    public BuildingFeatureCollection(BuildingSource source, List<BuildingFeature> features) {
        this.source = source;
        this.features = features == null ? List.of() : List.copyOf(features);
    }

    public static BuildingFeatureCollection empty(BuildingSource source) {
        return new BuildingFeatureCollection(source, List.of());
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public int size() {
        return features.size();
    }
}
