package com.ogt.buildings.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class PopulationStats {

    long populationEstimate;
    Double areaKm2;
    Double densityPerKm2;
    String densityClass;
    String source;
    String method;
    int year;
    String taskId;

    public Map<String, Object> toResultMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("population_estimate", populationEstimate);
        if (areaKm2 != null) map.put("area_km2", areaKm2);
        if (densityPerKm2 != null) map.put("density_per_km2", densityPerKm2);
        if (densityClass != null) map.put("density_class", densityClass);
        map.put("source", source);
        map.put("method", method);
        map.put("year", year);
        if (taskId != null) map.put("task_id", taskId);
        return map;
    }
}
