package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.entity.ExportRun;
import com.ogt.buildings.repository.ExportRunRepository;
import com.ogt.buildings.storage.ArtifactStorage;
import com.ogt.buildings.util.RunWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Stream;

/**
 * Limpieza diaria: runs privados fuera del período de retención (con sus archivos)
 * y directorios temporales de runs que quedaron huérfanos.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportCleanupTask {

    private final ExportRunRepository runRepository;
    private final ArtifactStorage storage;
    private final RunWorkspace workspace;
    private final BuildingExtractorProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${buildings.storage.cleanup-cron:0 30 3 * * *}")
    public void cleanup() {
        int[] runs = cleanupOldRuns();
        int scratch = cleanupScratchDirectories();
        log.info("🧹 Limpieza completada: {} runs y {} archivos borrados, {} directorios temporales",
                runs[0], runs[1], scratch);
    }

    /** @return {runs borrados, archivos borrados} */
    int[] cleanupOldRuns() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getStorage().getRetentionDays());
        List<ExportRun> oldRuns = runRepository.findPrivateRunsCreatedBefore(cutoff);

        int deletedRuns = 0;
        int deletedFiles = 0;
        for (ExportRun run : oldRuns) {
            if (storage.delete(run.getOutputFile())) deletedFiles++;
            if (storage.delete(run.getTilesFile())) deletedFiles++;
            runRepository.delete(run);
            deletedRuns++;
        }
        return new int[]{deletedRuns, deletedFiles};
    }

    int cleanupScratchDirectories() {
        Path root = workspace.getRoot();
        if (!Files.isDirectory(root)) {
            return 0;
        }
        Instant cutoff = Instant.now(clock).minus(properties.getStorage().getScratchMaxAge());

        int deleted = 0;
        try (Stream<Path> entries = Files.list(root)) {
            for (Path dir : entries.filter(Files::isDirectory).filter(this::isRunScoped).toList()) {
                try {
                    if (Files.getLastModifiedTime(dir).toInstant().isBefore(cutoff)
                            && RunWorkspace.deleteRecursively(dir)) {
                        deleted++;
                    }
                } catch (IOException e) {
                    log.warn("⚠️ No se pudo inspeccionar {}", dir, e);
                }
            }
        } catch (IOException e) {
            log.error("❌ No se pudo listar el directorio temporal {}", root, e);
        }
        return deleted;
    }

    private boolean isRunScoped(Path dir) {
        String name = dir.getFileName().toString();
        return name.startsWith(RunWorkspace.RUN_PREFIX) || name.startsWith(RunWorkspace.EXTRACTION_PREFIX);
    }
}
