package com.ogt.buildings.model;

import com.ogt.buildings.entity.BuildingSource;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/** Resultado de extraer una fuente: datos, vacío explícito o error acotado a la fuente. */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionResult {

    private final BuildingSource source;
    private final BuildingFeatureCollection features;
    private final Map<String, Object> stats;
    private final String error;

    public static ExtractionResult success(BuildingSource source, BuildingFeatureCollection features,
                                           Map<String, Object> stats) {
        return new ExtractionResult(source, features, stats, null);
    }

    public static ExtractionResult empty(BuildingSource source, Map<String, Object> stats) {
        return new ExtractionResult(source, null, stats, null);
    }

    public static ExtractionResult failure(BuildingSource source, String error) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("building_count", 0);
        stats.put("source", source.getId());
        return new ExtractionResult(source, null, stats, error);
    }

    public boolean hasData() {
        return features != null && !features.isEmpty();
    }

    public boolean isFailed() {
        return error != null;
    }

    public long getBuildingCount() {
        return hasData() ? features.size() : 0;
    }

    public Map<String, Object> toResultMap() {
        Map<String, Object> map = new LinkedHashMap<>(stats);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }
}
