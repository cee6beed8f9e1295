package com.ogt.buildings.tiles;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.exception.TileGenerationException;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.format.GeoJsonFormatWriter;
import com.ogt.buildings.model.TileSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Usa scripts de shell que imitan a tippecanoe. */
@DisabledOnOs(OS.WINDOWS)
class TippecanoeTileBuilderTest {

    private static final String FAKE_TIPPECANOE = """
            #!/bin/sh
            if [ "$1" = "--version" ]; then
              echo "tippecanoe v2.53.0"
              exit 0
            fi
            out=""
            while [ $# -gt 0 ]; do
              if [ "$1" = "--output" ]; then out="$2"; fi
              shift
            done
            printf 'pmtiles' > "$out"
            """;

    private static final String FAILING_TIPPECANOE = """
            #!/bin/sh
            echo "line one"
            echo "Unexpected end of file"
            exit 3
            """;

    @TempDir
    Path dir;

    private BuildingExtractorProperties properties;
    private TippecanoeTileBuilder builder;
    private Path workDir;

    @BeforeEach
    void setUp() throws IOException {
        properties = new BuildingExtractorProperties();
        builder = new TippecanoeTileBuilder(properties, new GeoJsonFormatWriter());
        workDir = Files.createDirectories(dir.resolve("run"));
    }

    @Test
    void probeReportsVersionOfWorkingExecutable() throws IOException {
        properties.getTiles().setExecutable(script("tippecanoe", FAKE_TIPPECANOE));

        assertThat(builder.probe()).contains("tippecanoe v2.53.0");
        assertThat(builder.isAvailable()).isTrue();
    }

    @Test
    void missingExecutableIsUnavailable() {
        properties.getTiles().setExecutable(dir.resolve("does-not-exist").toString());

        assertThat(builder.probe()).isEmpty();
        assertThat(builder.isAvailable()).isFalse();
    }

    @Test
    void disabledTilesAreUnavailableEvenWithExecutable() throws IOException {
        properties.getTiles().setExecutable(script("tippecanoe", FAKE_TIPPECANOE));
        properties.getTiles().setEnabled(false);

        assertThat(builder.isAvailable()).isFalse();
    }

    @Test
    void buildsPmtilesFromFilesAndInMemoryFeatures() throws IOException {
        properties.getTiles().setExecutable(script("tippecanoe", FAKE_TIPPECANOE));
        Path geoJson = Files.writeString(workDir.resolve("osm_geojson.geojson"),
                "{\"type\":\"FeatureCollection\",\"features\":[]}");
        UUID runId = UUID.randomUUID();

        Path tiles = builder.build(List.of(
                TileSource.ofGeoJson(geoJson),
                TileSource.ofFeatures(BuildingFixtures.buildings(BuildingSource.MICROSOFT, 3))), runId, workDir);

        assertThat(tiles).isEqualTo(workDir.resolve(runId + ".pmtiles"));
        assertThat(Files.readString(tiles)).isEqualTo("pmtiles");
        assertThat(Files.readAllLines(workDir.resolve("tiles-input-0.geojsonl"))).hasSize(3);
    }

    @Test
    void nonZeroExitCarriesLogTail() throws IOException {
        properties.getTiles().setExecutable(script("tippecanoe-broken", FAILING_TIPPECANOE));

        assertThatThrownBy(() -> builder.build(
                List.of(TileSource.ofFeatures(BuildingFixtures.buildings(BuildingSource.OSM, 1))),
                UUID.randomUUID(), workDir))
                .isInstanceOf(TileGenerationException.class)
                .hasMessageContaining("exited with code 3")
                .hasMessageContaining("Unexpected end of file");
    }

    @Test
    void rejectsEmptyInputs() {
        assertThatThrownBy(() -> builder.build(List.of(), UUID.randomUUID(), workDir))
                .isInstanceOf(TileGenerationException.class);
    }

    private String script(String name, String body) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, body);
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file.toAbsolutePath().toString();
    }
}
