package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.dto.ExportRequest;
import com.ogt.buildings.dto.RunStatisticsDTO;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.entity.Export;
import com.ogt.buildings.entity.ExportRun;
import com.ogt.buildings.entity.ExportRunStatus;
import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.exception.BusinessException;
import com.ogt.buildings.exception.ExportConfigurationException;
import com.ogt.buildings.exception.ResourceNotFoundException;
import com.ogt.buildings.format.FormatConversionService;
import com.ogt.buildings.queue.JobQueue;
import com.ogt.buildings.queue.JobType;
import com.ogt.buildings.repository.ExportRepository;
import com.ogt.buildings.repository.ExportRunRepository;
import com.ogt.buildings.sourceconfig.SourceConfigParser;
import com.ogt.buildings.storage.ArtifactStorage;
import com.ogt.buildings.util.GeoJSONHelper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lado de envío: alta de exportaciones, creación y encolado de runs, re-ejecución
 * y consultas. Toda la configuración se valida aquí, antes de cualquier extracción.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ExportRunService {

    private final ExportRepository exportRepository;
    private final ExportRunRepository runRepository;
    private final AoiValidationService aoiValidationService;
    private final SourceConfigParser sourceConfigParser;
    private final FormatConversionService conversionService;
    private final ArtifactStorage storage;
    private final JobQueue jobQueue;
    private final BuildingExtractorProperties properties;
    private final Clock clock;

    // ============================================================
    // EXPORTS
    // ============================================================

    public Export createExport(@Valid ExportRequest request) {
        // 1. Área de interés
        Polygon aoi = aoiValidationService.requireValid(parseAoi(request.getAreaOfInterest()));

        // 2. Fuentes y formatos (fallo rápido)
        List<BuildingSource> sources = parseSources(request.getSources());
        List<OutputFormat> formats = parseFormats(request.getOutputFormats());
        conversionService.validateFormats(formats);

        // 3. Configuración por fuente
        Map<String, Map<String, Object>> sourceConfig = validateSourceConfig(sources, request.getSourceConfig());

        Export export = Export.builder()
                .name(request.getName())
                .description(request.getDescription())
                .areaOfInterest(aoi)
                .sources(sources)
                .outputFormats(formats)
                .sourceConfig(sourceConfig)
                .isPublic(Boolean.TRUE.equals(request.getIsPublic()))
                .ownerId(request.getOwnerId())
                .ownerEmail(request.getOwnerEmail())
                .ownerEmailVerified(Boolean.TRUE.equals(request.getOwnerEmailVerified()))
                .emailNotifications(Boolean.TRUE.equals(request.getEmailNotifications()))
                .build();

        export = exportRepository.save(export);
        log.info("✅ Export creado: {} '{}' fuentes={} formatos={}", export.getId(), export.getName(),
                sources, formats);
        return export;
    }

    public Export getExport(UUID exportId) {
        return exportRepository.findById(exportId)
                .orElseThrow(() -> new ResourceNotFoundException("Export not found: " + exportId));
    }

    // ============================================================
    // RUNS
    // ============================================================

    public ExportRun createRun(UUID exportId) {
        Export export = getExport(exportId);
        if (runRepository.existsByExportIdAndStatusIn(exportId, ExportRunStatus.IN_FLIGHT)) {
            throw new BusinessException("Export " + exportId + " already has a run in progress");
        }
        ExportRun run = runRepository.save(ExportRun.builder()
                .export(export)
                .status(ExportRunStatus.PENDING)
                .build());
        log.info("Run {} creado para export {}", run.getId(), exportId);
        return run;
    }

    public ExportRun startRun(UUID runId) {
        ExportRun run = getRun(runId);
        if (run.getStatus() != ExportRunStatus.PENDING) {
            throw new BusinessException("Run " + runId + " cannot be started from status " + run.getStatus().getId());
        }
        UUID exportId = run.getExport().getId();
        if (runRepository.existsByExportIdAndStatusIn(exportId,
                EnumSet.of(ExportRunStatus.QUEUED, ExportRunStatus.PROCESSING))) {
            throw new BusinessException("Export " + exportId + " already has a run queued or processing");
        }

        run.markQueued();
        run = runRepository.save(run);
        enqueue(run, properties.getQueue().getStartDelay());
        return run;
    }

    /** Nueva ejecución de la misma configuración; el Export no se modifica. */
    public ExportRun rerunExport(UUID exportId) {
        Export export = getExport(exportId);
        ExportRun run = runRepository.save(ExportRun.builder()
                .export(export)
                .status(ExportRunStatus.QUEUED)
                .build());
        enqueue(run, properties.getQueue().getStartDelay());
        return run;
    }

    public ExportRun getRun(UUID runId) {
        return runRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("ExportRun not found: " + runId));
    }

    public List<ExportRun> listRuns(UUID exportId) {
        return runRepository.findByExportIdOrderByCreatedAtDesc(exportId);
    }

    public RunStatisticsDTO getRunStatistics(UUID runId) {
        ExportRun run = getRun(runId);
        Export export = run.getExport();
        Map<String, Object> results = run.getResults() != null ? run.getResults() : Map.of();
        Duration duration = run.getDuration();

        return RunStatisticsDTO.builder()
                .runId(run.getId())
                .exportName(export.getName())
                .status(run.getStatus().getId())
                .buildingCount(run.getBuildingCount())
                .fileSize(run.getOutputFile() != null ? storage.sizeOf(run.getOutputFile()) : 0L)
                .durationSeconds(duration != null ? duration.toSeconds() : null)
                .sources(asMap(results.get("sources")))
                .files(asMap(results.get("files")))
                .population(asMap(results.get("population")))
                .tilesGenerated(Boolean.TRUE.equals(results.get("tiles_generated")))
                .errorMessage(run.getErrorMessage())
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .areaOfInterest(aoiAsGeoJson(export))
                .outputFormats(export.getOutputFormats().stream().map(OutputFormat::getId).toList())
                .build();
    }

    // ============================================================
    // CONSULTAS AUXILIARES
    // ============================================================

    public Map<String, Object> describeSourceSchema(String sourceId) {
        BuildingSource source = BuildingSource.fromId(sourceId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("source", source.getId());
        result.put("name", source.getLabel());
        result.put("config_schema", sourceConfigParser.describeSchema(source));
        return result;
    }

    public Map<String, Object> validateAoi(Object geoJson) {
        return aoiValidationService.validateGeoJson(geoJson);
    }

    // ============================================================
    // HELPERS
    // ============================================================

    /**
     * Programa el procesamiento del run. Si la cola rechaza el job, el run se cierra como FAILED
     * para que no bloquee nuevas ejecuciones del mismo export.
     */
    private void enqueue(ExportRun run, Duration delay) {
        String taskId;
        try {
            taskId = jobQueue.schedule(JobType.PROCESS_EXPORT, run.getId(), delay);
        } catch (RuntimeException e) {
            log.error("❌ No se pudo encolar el run {}", run.getId(), e);
            run.markFailed(LocalDateTime.now(clock), "Could not schedule run: " + e.getMessage());
            runRepository.save(run);
            throw new BusinessException("Run " + run.getId() + " could not be queued: " + e.getMessage(), e);
        }
        runRepository.updateTaskId(run.getId(), taskId);
        run.setTaskId(taskId);
        log.info("🚀 Run encolado: {} export={} task={}", run.getId(), run.getExport().getId(), taskId);
    }

    private Geometry parseAoi(Map<String, Object> geoJson) {
        if (geoJson == null) {
            throw new ExportConfigurationException("Invalid area of interest: missing geometry");
        }
        try {
            return GeoJSONHelper.geoJsonToGeometry(geoJson);
        } catch (Exception e) {
            throw new ExportConfigurationException("Invalid area of interest: " + e.getMessage());
        }
    }

    private List<BuildingSource> parseSources(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new ExportConfigurationException("At least one source is required");
        }
        List<BuildingSource> sources = new ArrayList<>();
        for (String id : ids) {
            BuildingSource source = BuildingSource.fromId(id);
            if (sources.contains(source)) {
                throw new ExportConfigurationException("Duplicate source: " + source.getId());
            }
            sources.add(source);
        }
        return sources;
    }

    private List<OutputFormat> parseFormats(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new ExportConfigurationException("At least one output format is required");
        }
        List<OutputFormat> formats = new ArrayList<>();
        for (String id : ids) {
            OutputFormat format = OutputFormat.fromId(id);
            if (!formats.contains(format)) {
                formats.add(format);
            }
        }
        return formats;
    }

    private Map<String, Map<String, Object>> validateSourceConfig(List<BuildingSource> sources,
                                                                  Map<String, Map<String, Object>> raw) {
        Map<String, Map<String, Object>> validated = new HashMap<>();
        if (raw != null) {
            for (Map.Entry<String, Map<String, Object>> entry : raw.entrySet()) {
                BuildingSource source = BuildingSource.fromId(entry.getKey());
                if (!sources.contains(source)) {
                    throw new ExportConfigurationException("Configuration given for unselected source: " + source.getId());
                }
                Map<String, Object> options = entry.getValue() != null ? entry.getValue() : Map.of();
                sourceConfigParser.parse(source, options);
                validated.put(source.getId(), new HashMap<>(options));
            }
        }
        return validated;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    private Map<String, Object> aoiAsGeoJson(Export export) {
        try {
            return GeoJSONHelper.geometryToGeoJson(export.getAreaOfInterest());
        } catch (Exception e) {
            log.warn("⚠️ No se pudo serializar el AOI del export {}: {}", export.getId(), e.getMessage());
            return null;
        }
    }
}
