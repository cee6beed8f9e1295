package com.ogt.buildings.util;

import com.ogt.buildings.config.BuildingExtractorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Directorios temporales del pipeline bajo {@code buildings.storage.scratch-dir}.
 * Cada ejecución y cada extracción tiene el suyo y se borra en todos los caminos de salida.
 */
@Component
@Slf4j
public class RunWorkspace {

    public static final String RUN_PREFIX = "run-";
    public static final String EXTRACTION_PREFIX = "extract-";

    private final Path root;

    public RunWorkspace(BuildingExtractorProperties properties) {
        this.root = Path.of(properties.getStorage().getScratchDir());
    }

    public Path getRoot() {
        return root;
    }

    public Path createRunDirectory(UUID runId) {
        return create(root.resolve(RUN_PREFIX + runId));
    }

    public Path createExtractionDirectory(String sourceId) {
        return create(root.resolve(EXTRACTION_PREFIX + sourceId + "-" + UUID.randomUUID()));
    }

    private Path create(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo crear el directorio temporal " + dir, e);
        }
    }

    /** Borrado recursivo best-effort: los fallos se registran, nunca se propagan. */
    public static boolean deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return true;
        }
        boolean[] ok = {true};
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    ok[0] = false;
                    log.warn("⚠️ No se pudo borrar {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("⚠️ No se pudo recorrer {} para limpiarlo: {}", dir, e.getMessage());
            return false;
        }
        return ok[0];
    }
}
