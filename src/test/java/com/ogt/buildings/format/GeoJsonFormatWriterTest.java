package com.ogt.buildings.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.model.ConvertedArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeoJsonFormatWriterTest {

    @TempDir
    Path dir;

    private final GeoJsonFormatWriter writer = new GeoJsonFormatWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesFeatureCollectionWithProperties() throws IOException {
        ConvertedArtifact artifact = writer.write(BuildingFixtures.buildings(BuildingSource.OSM, 10), dir, "osm_geojson");

        assertThat(artifact.getPrimaryFile()).hasFileName("osm_geojson.geojson");
        assertThat(artifact.getFormat()).isEqualTo(OutputFormat.GEOJSON);
        assertThat(artifact.getBuildingCount()).isEqualTo(10);
        assertThat(artifact.getSizeBytes()).isEqualTo(Files.size(artifact.getPrimaryFile()));

        JsonNode root = mapper.readTree(artifact.getPrimaryFile().toFile());
        assertThat(root.path("type").asText()).isEqualTo("FeatureCollection");
        assertThat(root.path("features")).hasSize(10);
        JsonNode first = root.path("features").get(0);
        assertThat(first.path("geometry").path("type").asText()).isEqualTo("Polygon");
        assertThat(first.path("geometry").has("crs")).isFalse();
        assertThat(first.path("properties").path("id").asText()).isEqualTo("b-0");
        assertThat(first.path("properties").path("verified").asBoolean()).isTrue();
    }

    @Test
    void writesOneFeaturePerLineForSequences() throws IOException {
        Path file = writer.writeSequence(BuildingFixtures.buildings(BuildingSource.OSM, 3), dir.resolve("seq.geojsonl"));

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        for (String line : lines) {
            assertThat(mapper.readTree(line).path("type").asText()).isEqualTo("Feature");
        }
    }
}
