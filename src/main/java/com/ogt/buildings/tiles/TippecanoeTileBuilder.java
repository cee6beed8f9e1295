package com.ogt.buildings.tiles;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.exception.TileGenerationException;
import com.ogt.buildings.format.GeoJsonFormatWriter;
import com.ogt.buildings.model.TileSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Genera un único PMTiles con todas las fuentes en una misma capa invocando tippecanoe
 * como subproceso. La salida del proceso va a un log propio, nunca a los streams del worker.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TippecanoeTileBuilder {

    private static final int LOG_TAIL_LINES = 20;

    private final BuildingExtractorProperties properties;
    private final GeoJsonFormatWriter geoJsonWriter;

    /** Versión de tippecanoe si el ejecutable responde a {@code --version}. */
    public Optional<String> probe() {
        BuildingExtractorProperties.Tiles tiles = properties.getTiles();
        Path output = null;
        try {
            output = Files.createTempFile("tippecanoe-probe", ".log");
            Process process = new ProcessBuilder(tiles.getExecutable(), "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!process.waitFor(tiles.getProbeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("⚠️ tippecanoe --version no respondió en {}", tiles.getProbeTimeout());
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                return Optional.empty();
            }
            return Optional.of(Files.readString(output, StandardCharsets.UTF_8).trim());
        } catch (IOException e) {
            log.debug("tippecanoe no disponible: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            if (output != null) {
                output.toFile().delete();
            }
        }
    }

    public boolean isAvailable() {
        return properties.getTiles().isEnabled() && probe().isPresent();
    }

    /**
     * Genera {@code <runId>.pmtiles} en {@code workDir}.
     *
     * @throws TileGenerationException si tippecanoe falla, excede el timeout o no deja el archivo
     */
    public Path build(List<TileSource> inputs, UUID runId, Path workDir) {
        if (inputs == null || inputs.isEmpty()) {
            throw new TileGenerationException("No inputs for tile generation");
        }
        BuildingExtractorProperties.Tiles tiles = properties.getTiles();
        Path output = workDir.resolve(runId + ".pmtiles");
        Path logFile = workDir.resolve("tippecanoe.log");

        try {
            // 1. Entradas: GeoJSON ya convertido o GeoJSONSeq de las features en memoria
            List<String> inputPaths = new ArrayList<>();
            int seq = 0;
            for (TileSource input : inputs) {
                if (input.isFile()) {
                    inputPaths.add(input.getGeoJsonFile().toAbsolutePath().toString());
                } else {
                    Path staged = workDir.resolve("tiles-input-" + (seq++) + ".geojsonl");
                    geoJsonWriter.writeSequence(input.getFeatures(), staged);
                    inputPaths.add(staged.toAbsolutePath().toString());
                }
            }

            // 2. Comando
            List<String> command = new ArrayList<>(List.of(
                    tiles.getExecutable(),
                    "--output", output.toAbsolutePath().toString(),
                    "--layer", tiles.getLayerName(),
                    "--minimum-zoom", String.valueOf(tiles.getMinZoom()),
                    "--maximum-zoom", String.valueOf(tiles.getMaxZoom()),
                    "--drop-densest-as-needed",
                    "--extend-zooms-if-still-dropping",
                    "--force"));
            command.addAll(tiles.getExtraArgs());
            command.addAll(inputPaths);
            log.info("🚀 Ejecutando tippecanoe con {} entrada(s)", inputPaths.size());
            log.debug("Comando: {}", command);

            // 3. Ejecutar con timeout
            Process process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
            if (!process.waitFor(tiles.getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TileGenerationException("tippecanoe timed out after " + tiles.getTimeout().toSeconds() + "s");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new TileGenerationException("tippecanoe exited with code " + exitCode + ": " + tail(logFile));
            }
            if (!Files.exists(output)) {
                throw new TileGenerationException("tippecanoe did not produce " + output.getFileName());
            }

            log.info("✅ Tiles generados: {} ({} bytes)", output.getFileName(), Files.size(output));
            return output;

        } catch (IOException e) {
            throw new TileGenerationException("tippecanoe could not be run: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TileGenerationException("tippecanoe interrupted", e);
        }
    }

    private String tail(Path logFile) {
        try {
            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            return String.join("\n", lines.subList(Math.max(0, lines.size() - LOG_TAIL_LINES), lines.size()));
        } catch (IOException e) {
            return "(sin log: " + e.getMessage() + ")";
        }
    }
}
