package com.ogt.buildings.model;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.entity.OutputFormat;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Archivo(s) producidos al convertir una fuente a un formato. El shapefile lleva sidecars. */
@Value
@Builder
public class ConvertedArtifact {

    BuildingSource source;
    OutputFormat format;
    Path primaryFile;
    @Singular
    List<Path> companionFiles;
    long sizeBytes;
    int buildingCount;

    public List<Path> allFiles() {
        List<Path> files = new ArrayList<>();
        files.add(primaryFile);
        files.addAll(companionFiles);
        return files;
    }

    public Map<String, Object> toResultMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("format", format.getId());
        map.put("size_bytes", sizeBytes);
        map.put("building_count", buildingCount);
        return map;
    }
}
