package com.ogt.buildings.entity;

import com.ogt.buildings.exception.ExportConfigurationException;

import java.util.Arrays;
import java.util.Locale;

public enum OutputFormat {

    GEOPARQUET("geoparquet", ".parquet"),
    GEOJSON("geojson", ".geojson"),
    SHAPEFILE("shapefile", ".shp"),
    GEOPACKAGE("geopackage", ".gpkg"),
    // pseudo-formato: lo resuelve la etapa de tiles, no el conversor
    TILES("tiles", ".pmtiles");

    private final String id;
    private final String extension;

    OutputFormat(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    public String getId() {
        return id;
    }

    public String getExtension() {
        return extension;
    }

    public boolean isPseudoFormat() {
        return this == TILES;
    }

    public static OutputFormat fromId(String id) {
        if (id == null) {
            throw new ExportConfigurationException("Formato de salida no informado");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ExportConfigurationException("Unsupported output format: " + id));
    }
}
