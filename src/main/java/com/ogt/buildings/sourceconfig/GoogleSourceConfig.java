package com.ogt.buildings.sourceconfig;

import com.ogt.buildings.entity.BuildingSource;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GoogleSourceConfig implements SourceConfig {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    @Builder.Default
    double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

    @Override
    public BuildingSource getSource() {
        return BuildingSource.GOOGLE;
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of("confidence_threshold", confidenceThreshold);
    }
}
