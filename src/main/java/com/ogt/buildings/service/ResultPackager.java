package com.ogt.buildings.service;

import com.ogt.buildings.model.ConvertedArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Empaqueta los artefactos de una ejecución en un ZIP (deflate). Miembros:
 * {@code <fuente>_<formato><ext>} por artefacto y {@code vector_tiles.pmtiles} si hay tiles.
 */
@Component
@Slf4j
public class ResultPackager {

    public static final String TILES_MEMBER = "vector_tiles.pmtiles";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public static String archiveName(String exportName, LocalDateTime createdAt) {
        String safe = exportName == null ? "export" : exportName.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
        if (safe.isEmpty()) safe = "export";
        return safe + "_" + STAMP.format(createdAt) + ".zip";
    }

    /**
     * @param tilesFile puede ser null: el miembro de tiles se omite
     * @throws IllegalArgumentException si no hay nada que empaquetar
     */
    public Path packageResults(List<ConvertedArtifact> artifacts, Path tilesFile, String exportName,
                               LocalDateTime createdAt, Path targetDir) throws IOException {
        boolean hasTiles = tilesFile != null && Files.exists(tilesFile);
        if (artifacts.isEmpty() && !hasTiles) {
            throw new IllegalArgumentException("Nothing to package");
        }

        Path archive = targetDir.resolve(archiveName(exportName, createdAt));
        Set<String> members = new HashSet<>();
        try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(archive)))) {
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            for (ConvertedArtifact artifact : artifacts) {
                String base = artifact.getSource().getId() + "_" + artifact.getFormat().getId();
                for (Path file : artifact.allFiles()) {
                    addEntry(zip, members, base + extensionOf(file), file);
                }
            }
            if (hasTiles) {
                addEntry(zip, members, TILES_MEMBER, tilesFile);
            }
        }
        log.info("📦 Archivo generado: {} ({} miembros, {} bytes)", archive.getFileName(), members.size(), Files.size(archive));
        return archive;
    }

    private void addEntry(ZipOutputStream zip, Set<String> members, String name, Path file) throws IOException {
        if (!members.add(name)) {
            throw new IllegalStateException("Miembro duplicado en el archivo: " + name);
        }
        ZipEntry entry = new ZipEntry(name);
        entry.setMethod(ZipEntry.DEFLATED);
        zip.putNextEntry(entry);
        Files.copy(file, zip);
        zip.closeEntry();
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : "";
    }
}
