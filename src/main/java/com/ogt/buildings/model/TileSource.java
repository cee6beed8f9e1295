package com.ogt.buildings.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.nio.file.Path;

/**
 * Entrada del generador de tiles: un GeoJSON ya convertido o, si no existe,
 * la colección retenida en memoria (se serializa a GeoJSONSeq antes de teselar).
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class TileSource {

    private final Path geoJsonFile;
    private final BuildingFeatureCollection features;

    public static TileSource ofGeoJson(Path file) {
        return new TileSource(file, null);
    }

    public static TileSource ofFeatures(BuildingFeatureCollection features) {
        return new TileSource(null, features);
    }

    public boolean isFile() {
        return geoJsonFile != null;
    }
}
