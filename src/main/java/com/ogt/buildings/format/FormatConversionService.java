package com.ogt.buildings.format;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.exception.ExportConfigurationException;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ConversionResult;
import com.ogt.buildings.model.ConvertedArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Conversión de una colección a un formato de salida. Los errores quedan acotados al
 * par (fuente, formato); sólo un formato desconocido se trata como error de configuración.
 */
@Service
@Slf4j
public class FormatConversionService {

    private final Map<OutputFormat, FormatWriter> writers = new EnumMap<>(OutputFormat.class);

    public FormatConversionService(List<FormatWriter> available) {
        available.forEach(w -> writers.put(w.getFormat(), w));
    }

    public static String baseName(BuildingSource source, OutputFormat format) {
        return source.getId() + "_" + format.getId();
    }

    /** Falla rápido, antes de extraer, si algún formato no tiene motor. */
    public void validateFormats(Collection<OutputFormat> formats) {
        for (OutputFormat format : formats) {
            if (!format.isPseudoFormat() && !writers.containsKey(format)) {
                throw new ExportConfigurationException("Unsupported output format: " + format.getId());
            }
        }
    }

    public ConversionResult convert(BuildingFeatureCollection features, OutputFormat format, Path directory) {
        if (format.isPseudoFormat()) {
            throw new ExportConfigurationException("Format " + format.getId() + " is not converted per source");
        }
        FormatWriter writer = writers.get(format);
        if (writer == null) {
            throw new ExportConfigurationException("Unsupported output format: " + format.getId());
        }
        if (features == null || features.isEmpty()) {
            return ConversionResult.nothingToSave();
        }

        String baseName = baseName(features.getSource(), format);
        try {
            Files.createDirectories(directory);
            ConvertedArtifact artifact = writer.write(features, directory, baseName);
            log.info("✅ {} -> {} ({} edificios, {} bytes)", features.getSource().getId(), format.getId(),
                    artifact.getBuildingCount(), artifact.getSizeBytes());
            return ConversionResult.converted(artifact);
        } catch (IOException | RuntimeException e) {
            log.warn("⚠️ Conversión {} a {} falló: {}", features.getSource().getId(), format.getId(), e.getMessage());
            deletePartialFiles(directory, baseName);
            return ConversionResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void deletePartialFiles(Path directory, String baseName) {
        if (!Files.isDirectory(directory)) return;
        try (DirectoryStream<Path> partial = Files.newDirectoryStream(directory, baseName + ".*")) {
            for (Path file : partial) {
                Files.deleteIfExists(file);
            }
        } catch (IOException e) {
            log.warn("⚠️ No se pudieron borrar archivos parciales de {}: {}", baseName, e.getMessage());
        }
    }
}
