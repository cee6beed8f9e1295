package com.ogt.buildings.storage;

import com.ogt.buildings.config.BuildingExtractorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

@Component
@Slf4j
public class FileSystemArtifactStorage implements ArtifactStorage {

    private static final DateTimeFormatter DATE_DIRS = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private static final int MAX_NAME_ATTEMPTS = 1_000;

    private final Path mediaRoot;

    public FileSystemArtifactStorage(BuildingExtractorProperties properties) {
        this.mediaRoot = Path.of(properties.getStorage().getMediaRoot()).toAbsolutePath().normalize();
    }

    /**
     * Nunca pisa un archivo existente: si el nombre ya está ocupado (dos runs creados en el
     * mismo segundo) se agrega un sufijo {@code _1}, {@code _2}, ... antes de la extensión.
     */
    @Override
    public String storeArchive(Path archive, LocalDate date) {
        String directory = "exports/" + DATE_DIRS.format(date) + "/";
        String fileName = archive.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
            String candidate = attempt == 0 ? fileName : stem + "_" + attempt + extension;
            String relative = directory + candidate;
            if (moveIfAbsent(archive, relative)) {
                return relative;
            }
        }
        throw new IllegalStateException("Sin nombre libre para " + fileName + " en " + directory);
    }

    @Override
    public String storeTiles(Path tiles, UUID runId) {
        return move(tiles, "tiles/" + runId + ".pmtiles");
    }

    @Override
    public Path resolve(String storedPath) {
        Path resolved = mediaRoot.resolve(storedPath).normalize();
        if (!resolved.startsWith(mediaRoot)) {
            throw new IllegalArgumentException("Ruta fuera del almacenamiento: " + storedPath);
        }
        return resolved;
    }

    @Override
    public long sizeOf(String storedPath) {
        try {
            Path file = resolve(storedPath);
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean delete(String storedPath) {
        if (storedPath == null || storedPath.isBlank()) return false;
        try {
            return Files.deleteIfExists(resolve(storedPath));
        } catch (IOException e) {
            log.warn("⚠️ No se pudo borrar {}: {}", storedPath, e.getMessage());
            return false;
        }
    }

    private boolean moveIfAbsent(Path source, String relative) {
        Path target = resolve(relative);
        try {
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo crear " + target.getParent(), e);
        }
        try {
            Files.move(source, target);
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo guardar " + source + " en " + target, e);
        }
        log.info("💾 Artefacto guardado: {}", relative);
        return true;
    }

    private String move(Path source, String relative) {
        Path target = resolve(relative);
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo guardar " + source + " en " + target, e);
        }
        log.info("💾 Artefacto guardado: {}", relative);
        return relative;
    }
}
