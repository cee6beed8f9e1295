package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.entity.Export;
import com.ogt.buildings.entity.ExportRun;
import com.ogt.buildings.entity.ExportRunStatus;
import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.exception.ResourceNotFoundException;
import com.ogt.buildings.exception.TileGenerationException;
import com.ogt.buildings.format.FormatConversionService;
import com.ogt.buildings.model.ConversionResult;
import com.ogt.buildings.model.ConvertedArtifact;
import com.ogt.buildings.model.ExtractionResult;
import com.ogt.buildings.model.PopulationStats;
import com.ogt.buildings.model.TileSource;
import com.ogt.buildings.population.CoverageCalculator;
import com.ogt.buildings.population.PopulationEstimator;
import com.ogt.buildings.queue.JobQueue;
import com.ogt.buildings.queue.JobType;
import com.ogt.buildings.repository.ExportRunRepository;
import com.ogt.buildings.storage.ArtifactStorage;
import com.ogt.buildings.tiles.TippecanoeTileBuilder;
import com.ogt.buildings.util.RunWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Orquesta una ejecución completa: extracción por fuente, conversión, población,
 * tiles, empaquetado y cierre del run. Los fallos de cada etapa quedan en el
 * payload de resultados; sólo un fallo de orquestación deja el run en FAILED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportRunCoordinator {

    public static final String NO_BUILDINGS_MESSAGE = "No buildings found in the specified area";

    private final ExportRunRepository runRepository;
    private final BuildingExtractionService extractionService;
    private final FormatConversionService conversionService;
    private final PopulationEstimator populationEstimator;
    private final CoverageCalculator coverageCalculator;
    private final TippecanoeTileBuilder tileBuilder;
    private final ResultPackager packager;
    private final ArtifactStorage storage;
    private final RunWorkspace workspace;
    private final JobQueue jobQueue;
    private final BuildingExtractorProperties properties;
    private final Clock clock;

    /**
     * Procesa un run en estado QUEUED.
     *
     * @return false si el run no existe o ya no estaba en cola (entrega duplicada)
     */
    public boolean processRun(UUID runId) {
        log.info("▶️ Procesando run {}", runId);

        // 1. Reclamar el run (QUEUED -> PROCESSING de forma atómica)
        int claimed = runRepository.claimForProcessing(runId, EnumSet.of(ExportRunStatus.QUEUED),
                ExportRunStatus.PROCESSING, now());
        if (claimed == 0) {
            String current = runRepository.findById(runId)
                    .map(r -> r.getStatus().getId())
                    .orElse("inexistente");
            log.warn("⚠️ Run {} no se procesa: estado actual {}", runId, current);
            return false;
        }

        ExportRun run = null;
        Path runDir = null;
        try {
            run = runRepository.findById(runId)
                    .orElseThrow(() -> new ResourceNotFoundException("ExportRun not found: " + runId));
            Export export = run.getExport();
            runDir = workspace.createRunDirectory(runId);

            // 2. Ejecutar las etapas
            Map<String, Object> results = execute(run, export, runDir);

            // 3. Finalizar
            run.markCompleted(now(), results);
            runRepository.save(run);
            log.info("✅ Run {} completado: {} edificios, archivo={}", runId, results.get("building_count"),
                    run.getOutputFile());

            // 4. Notificación diferida (fuera del camino crítico)
            scheduleNotification(run, export);
            return true;

        } catch (Exception e) {
            log.error("❌ Error procesando run {}", runId, e);
            handleExportError(run, runId, e);
            return true;
        } finally {
            if (runDir != null) {
                RunWorkspace.deleteRecursively(runDir);
            }
        }
    }

    private Map<String, Object> execute(ExportRun run, Export export, Path runDir) throws IOException {
        Map<String, Object> results = new LinkedHashMap<>();
        Map<String, Object> sourceResults = new LinkedHashMap<>();
        Map<String, Object> fileResults = new LinkedHashMap<>();
        results.put("building_count", 0L);
        results.put("sources", sourceResults);
        results.put("files", fileResults);

        // ========== EXTRACCIÓN ==========
        List<ExtractionResult> extractions = extractionService.extractAll(
                export.getAreaOfInterest(), export.getSources(), export::configFor);

        long totalBuildings = 0;
        for (ExtractionResult extraction : extractions) {
            sourceResults.put(extraction.getSource().getId(), extraction.toResultMap());
            totalBuildings += extraction.getBuildingCount();
        }
        results.put("building_count", totalBuildings);

        if (totalBuildings == 0) {
            log.info("Run {} sin edificios en el área", run.getId());
            results.put("message", NO_BUILDINGS_MESSAGE);
            return results;
        }

        // ========== CONVERSIÓN ==========
        List<ConvertedArtifact> artifacts = new ArrayList<>();
        for (ExtractionResult extraction : extractions) {
            if (!extraction.hasData()) continue;
            for (OutputFormat format : export.getOutputFormats()) {
                if (format.isPseudoFormat()) continue;
                ConversionResult conversion = conversionService.convert(extraction.getFeatures(), format, runDir);
                fileResults.put(FormatConversionService.baseName(extraction.getSource(), format),
                        conversion.toResultMap());
                if (conversion.isSuccess()) {
                    artifacts.add(conversion.getArtifact());
                }
            }
        }

        // ========== POBLACIÓN (best-effort) ==========
        enrichWithPopulation(export, extractions, results, sourceResults);

        // ========== TILES (best-effort) ==========
        Path tilesFile = buildTiles(run.getId(), extractions, artifacts, runDir, results);

        // ========== EMPAQUETADO ==========
        if (artifacts.isEmpty() && tilesFile == null) {
            results.put("message", "No output files were generated");
            return results;
        }
        Path archive = packager.packageResults(artifacts, tilesFile, export.getName(), run.getCreatedAt(), runDir);
        run.setOutputFile(storage.storeArchive(archive, run.getCreatedAt().toLocalDate()));
        if (tilesFile != null) {
            run.setTilesFile(storage.storeTiles(tilesFile, run.getId()));
        }
        return results;
    }

    private void enrichWithPopulation(Export export, List<ExtractionResult> extractions,
                                      Map<String, Object> results, Map<String, Object> sourceResults) {
        PopulationStats population;
        try {
            population = populationEstimator.estimate(export.getAreaOfInterest());
        } catch (RuntimeException e) {
            log.warn("⚠️ Estimación de población falló: {}", e.getMessage());
            return;
        }
        if (population == null) {
            return;
        }
        results.put("population", population.toResultMap());

        if (population.getPopulationEstimate() <= 0) {
            return;
        }
        for (ExtractionResult extraction : extractions) {
            @SuppressWarnings("unchecked")
            Map<String, Object> stats = (Map<String, Object>) sourceResults.get(extraction.getSource().getId());
            double perCapita = coverageCalculator.buildingsPerCapita(extraction.getBuildingCount(),
                    population.getPopulationEstimate());
            stats.put("buildings_per_capita", Math.round(perCapita * 10_000d) / 10_000d);
            stats.put("coverage_level", coverageCalculator.coverageLevel(perCapita));
        }
    }

    private Path buildTiles(UUID runId, List<ExtractionResult> extractions, List<ConvertedArtifact> artifacts,
                            Path runDir, Map<String, Object> results) {
        if (!tileBuilder.isAvailable()) {
            log.info("tippecanoe no disponible, se omiten los tiles");
            results.put("tiles_generated", false);
            return null;
        }

        List<TileSource> inputs = new ArrayList<>();
        for (ExtractionResult extraction : extractions) {
            if (!extraction.hasData()) continue;
            inputs.add(geoJsonArtifact(extraction.getSource(), artifacts)
                    .map(a -> TileSource.ofGeoJson(a.getPrimaryFile()))
                    .orElseGet(() -> TileSource.ofFeatures(extraction.getFeatures())));
        }

        try {
            Path tiles = tileBuilder.build(inputs, runId, runDir);
            results.put("tiles_generated", true);
            return tiles;
        } catch (TileGenerationException e) {
            log.warn("⚠️ Generación de tiles falló para run {}: {}", runId, e.getMessage());
            results.put("tiles_generated", false);
            results.put("tiles_error", e.getMessage());
            return null;
        }
    }

    private Optional<ConvertedArtifact> geoJsonArtifact(BuildingSource source, List<ConvertedArtifact> artifacts) {
        return artifacts.stream()
                .filter(a -> a.getSource() == source && a.getFormat() == OutputFormat.GEOJSON)
                .findFirst();
    }

    private void scheduleNotification(ExportRun run, Export export) {
        if (!properties.getNotification().isEnabled() || !export.wantsCompletionEmail()) {
            return;
        }
        try {
            jobQueue.schedule(JobType.SEND_COMPLETION_EMAIL, run.getId(), properties.getQueue().getNotificationDelay());
        } catch (RuntimeException e) {
            log.warn("⚠️ No se pudo programar la notificación del run {}: {}", run.getId(), e.getMessage());
        }
    }

    private void handleExportError(ExportRun run, UUID runId, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        try {
            // Si el cierre falló a mitad de camino, se relee el estado persistido
            ExportRun target = run != null && run.getStatus() == ExportRunStatus.PROCESSING
                    ? run
                    : runRepository.findById(runId).orElse(null);
            if (target != null && target.getStatus().isTerminal()) {
                log.warn("⚠️ Run {} ya estaba en estado terminal {}", runId, target.getStatus());
                return;
            }
            // Los archivos guardados sólo los conoce la copia en memoria si el cierre no llegó a persistirse
            if (run != null) {
                discardStoredFiles(run);
            }
            if (target == null) {
                return;
            }
            discardStoredFiles(target);
            target.markFailed(now(), message);
            runRepository.save(target);
        } catch (RuntimeException persistError) {
            log.error("❌ No se pudo marcar como fallido el run {}", runId, persistError);
        }
    }

    private void discardStoredFiles(ExportRun run) {
        if (run.getOutputFile() != null) {
            storage.delete(run.getOutputFile());
            run.setOutputFile(null);
        }
        if (run.getTilesFile() != null) {
            storage.delete(run.getTilesFile());
            run.setTilesFile(null);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
