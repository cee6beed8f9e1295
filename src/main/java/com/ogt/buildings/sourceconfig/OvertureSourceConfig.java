package com.ogt.buildings.sourceconfig;

import com.ogt.buildings.entity.BuildingSource;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class OvertureSourceConfig implements SourceConfig {

    public static final double DEFAULT_MIN_AREA = 10;

    @Builder.Default
    boolean includeHeight = true;

    // m²
    @Builder.Default
    double minArea = DEFAULT_MIN_AREA;

    @Override
    public BuildingSource getSource() {
        return BuildingSource.OVERTURE;
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of("include_height", includeHeight, "min_area", minArea);
    }
}
