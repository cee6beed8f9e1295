package com.ogt.buildings.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
public class RunStatisticsDTO {
    private UUID runId;
    private String exportName;
    private String status;
    private long buildingCount;
    private long fileSize;
    private Long durationSeconds;
    private Map<String, Object> sources;
    private Map<String, Object> files;
    private Map<String, Object> population;
    private boolean tilesGenerated;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Map<String, Object> areaOfInterest; // GeoJSON
    private List<String> outputFormats;
}
