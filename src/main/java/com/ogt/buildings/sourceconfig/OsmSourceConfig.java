package com.ogt.buildings.sourceconfig;

import com.ogt.buildings.entity.BuildingSource;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class OsmSourceConfig implements SourceConfig {

    public static final List<String> DEFAULT_BUILDING_TYPES =
            List.of("yes", "house", "apartments", "commercial", "industrial");

    @Builder.Default
    List<String> buildingTypes = DEFAULT_BUILDING_TYPES;

    public boolean accepts(String buildingTag) {
        return buildingTag != null && buildingTypes.contains(buildingTag);
    }

    @Override
    public BuildingSource getSource() {
        return BuildingSource.OSM;
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of("building_types", buildingTypes);
    }
}
