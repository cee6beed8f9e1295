package com.ogt.buildings.entity;

import com.ogt.buildings.exception.ExportConfigurationException;

import java.util.Arrays;
import java.util.Locale;

public enum BuildingSource {

    GOOGLE("google", "Google Open Buildings"),
    MICROSOFT("microsoft", "Microsoft Building Footprints"),
    OSM("osm", "OpenStreetMap Buildings"),
    OVERTURE("overture", "Overture Buildings");

    private final String id;
    private final String label;

    BuildingSource(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public static BuildingSource fromId(String id) {
        if (id == null) {
            throw new ExportConfigurationException("Fuente no informada");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ExportConfigurationException("Unknown source: " + id));
    }
}
