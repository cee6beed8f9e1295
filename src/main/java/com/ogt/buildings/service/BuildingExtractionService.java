package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.config.ExecutorConfig;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ExtractionResult;
import com.ogt.buildings.provider.BuildingDataProvider;
import com.ogt.buildings.provider.BuildingDataProviderRegistry;
import com.ogt.buildings.provider.ProviderRequest;
import com.ogt.buildings.sourceconfig.SourceConfig;
import com.ogt.buildings.sourceconfig.SourceConfigParser;
import com.ogt.buildings.util.GeoJSONHelper;
import com.ogt.buildings.util.RunWorkspace;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Polygon;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Extracción de edificios por fuente. Un error de una fuente queda acotado a ella;
 * las fuentes de una ejecución se extraen en paralelo y el resultado conserva el orden configurado.
 */
@Service
@Slf4j
public class BuildingExtractionService {

    private final BuildingDataProviderRegistry providers;
    private final SourceConfigParser configParser;
    private final BuildingStatsCalculator statsCalculator;
    private final RunWorkspace workspace;
    private final ExecutorService executor;
    private final Duration sourceTimeout;

    public BuildingExtractionService(BuildingDataProviderRegistry providers,
                                     SourceConfigParser configParser,
                                     BuildingStatsCalculator statsCalculator,
                                     RunWorkspace workspace,
                                     @Qualifier(ExecutorConfig.EXTRACTION_EXECUTOR) ExecutorService executor,
                                     BuildingExtractorProperties properties) {
        this.providers = providers;
        this.configParser = configParser;
        this.statsCalculator = statsCalculator;
        this.workspace = workspace;
        this.executor = executor;
        this.sourceTimeout = properties.getExtraction().getSourceTimeout();
    }

    /**
     * Extrae una fuente de forma síncrona. Nunca lanza por fallos del proveedor:
     * devuelve datos, un vacío explícito o un error de la fuente.
     */
    public ExtractionResult extract(Polygon aoi, BuildingSource source, Map<String, Object> rawConfig) {
        log.info("▶️ Extrayendo {} ...", source.getId());
        Path workDir = null;
        try {
            // 1. Configuración tipada
            SourceConfig config = configParser.parse(source, rawConfig);

            // 2. Directorio temporal con el AOI
            workDir = workspace.createExtractionDirectory(source.getId());
            writeAoi(aoi, workDir.resolve("aoi.geojson"));

            // 3. Proveedor
            BuildingDataProvider provider = providers.get(source);
            BuildingFeatureCollection features = provider.fetch(ProviderRequest.builder()
                    .areaOfInterest(aoi)
                    .config(config)
                    .workDir(workDir)
                    .build());

            // 4. Estadísticas
            Map<String, Object> stats = statsCalculator.compute(features, config);
            if (features == null || features.isEmpty()) {
                log.info("✅ {}: sin edificios en el AOI", source.getId());
                return ExtractionResult.empty(source, stats);
            }
            log.info("✅ {}: {} edificios", source.getId(), features.size());
            return ExtractionResult.success(source, features, stats);

        } catch (Exception e) {
            log.warn("⚠️ Extracción de {} falló: {}", source.getId(), e.getMessage());
            return ExtractionResult.failure(source, errorText(e));
        } finally {
            RunWorkspace.deleteRecursively(workDir);
        }
    }

    /**
     * Extrae todas las fuentes en paralelo, cada una con su timeout. Un fallo o timeout
     * no cancela a las demás.
     */
    public List<ExtractionResult> extractAll(Polygon aoi, List<BuildingSource> sources,
                                             Function<BuildingSource, Map<String, Object>> configLookup) {
        Map<BuildingSource, Future<ExtractionResult>> pending = new LinkedHashMap<>();
        for (BuildingSource source : sources) {
            Map<String, Object> rawConfig = configLookup.apply(source);
            pending.put(source, executor.submit(() -> extract(aoi, source, rawConfig)));
        }

        long deadline = System.nanoTime() + sourceTimeout.toNanos();
        List<ExtractionResult> results = new ArrayList<>();
        for (Map.Entry<BuildingSource, Future<ExtractionResult>> entry : pending.entrySet()) {
            results.add(await(entry.getKey(), entry.getValue(), deadline));
        }
        return results;
    }

    private ExtractionResult await(BuildingSource source, Future<ExtractionResult> future, long deadline) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⚠️ Extracción de {} superó el timeout de {}", source.getId(), sourceTimeout);
            return ExtractionResult.failure(source, "Extraction timed out after " + sourceTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("⚠️ Extracción de {} falló: {}", source.getId(), cause.getMessage());
            return ExtractionResult.failure(source, errorText(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Extracción interrumpida para " + source.getId(), e);
        }
    }

    private void writeAoi(Polygon aoi, Path file) throws IOException {
        String feature = "{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\",\"geometry\":"
                + GeoJSONHelper.geometryToJson(aoi) + ",\"properties\":{}}]}";
        Files.writeString(file, feature, StandardCharsets.UTF_8);
    }

    private static String errorText(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
