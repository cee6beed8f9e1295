package com.ogt.buildings.sourceconfig;

import com.ogt.buildings.entity.BuildingSource;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class MicrosoftSourceConfig implements SourceConfig {

    public static final List<String> REGIONS = List.of("us", "canada", "africa", "australia", "global");
    public static final String GLOBAL = "global";

    @Builder.Default
    String region = GLOBAL;

    public boolean isGlobal() {
        return GLOBAL.equals(region);
    }

    @Override
    public BuildingSource getSource() {
        return BuildingSource.MICROSOFT;
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of("region", region);
    }
}
