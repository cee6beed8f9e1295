package com.ogt.buildings.service;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.format.GeoJsonFormatWriter;
import com.ogt.buildings.format.ShapefileFormatWriter;
import com.ogt.buildings.model.ConvertedArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultPackagerTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2024, 3, 5, 14, 7, 9);

    @TempDir
    Path dir;

    private final ResultPackager packager = new ResultPackager();

    @Test
    void archiveNameIsSanitizedAndTimestamped() {
        assertThat(ResultPackager.archiveName("Vitória / centro", CREATED)).isEqualTo("Vit_ria_centro_20240305_140709.zip");
        assertThat(ResultPackager.archiveName("   ", CREATED)).isEqualTo("export_20240305_140709.zip");
    }

    @Test
    void packagesEveryArtifactFileAndTiles() throws IOException {
        ConvertedArtifact geoJson = new GeoJsonFormatWriter()
                .write(BuildingFixtures.buildings(BuildingSource.OSM, 2), dir, "osm_geojson");
        ConvertedArtifact shapefile = new ShapefileFormatWriter(Clock.systemUTC())
                .write(BuildingFixtures.buildings(BuildingSource.GOOGLE, 2), dir, "google_shapefile");
        Path tiles = Files.writeString(dir.resolve("run.pmtiles"), "tiles");

        Path archive = packager.packageResults(List.of(geoJson, shapefile), tiles, "Centro", CREATED, dir);

        assertThat(archive).hasFileName("Centro_20240305_140709.zip");
        assertThat(members(archive)).containsExactlyInAnyOrder(
                "osm_geojson.geojson",
                "google_shapefile.shp", "google_shapefile.shx", "google_shapefile.dbf",
                "google_shapefile.prj", "google_shapefile.cpg",
                ResultPackager.TILES_MEMBER);
    }

    @Test
    void omitsTilesWhenFileIsMissing() throws IOException {
        ConvertedArtifact geoJson = new GeoJsonFormatWriter()
                .write(BuildingFixtures.buildings(BuildingSource.OSM, 1), dir, "osm_geojson");

        Path archive = packager.packageResults(List.of(geoJson), dir.resolve("missing.pmtiles"), "x", CREATED, dir);

        assertThat(members(archive)).containsExactly("osm_geojson.geojson");
    }

    @Test
    void packagesTilesOnly() throws IOException {
        Path tiles = Files.writeString(dir.resolve("run.pmtiles"), "tiles");

        Path archive = packager.packageResults(List.of(), tiles, "x", CREATED, dir);

        assertThat(members(archive)).containsExactly(ResultPackager.TILES_MEMBER);
    }

    @Test
    void refusesEmptyPackages() {
        assertThatThrownBy(() -> packager.packageResults(List.of(), null, "x", CREATED, dir))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDuplicateMembers() throws IOException {
        ConvertedArtifact geoJson = new GeoJsonFormatWriter()
                .write(BuildingFixtures.buildings(BuildingSource.OSM, 1), dir, "osm_geojson");

        assertThatThrownBy(() -> packager.packageResults(List.of(geoJson, geoJson), null, "x", CREATED, dir))
                .isInstanceOf(IllegalStateException.class);
    }

    private List<String> members(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            for (ZipEntry entry : Collections.list(zip.entries())) {
                assertThat(entry.getMethod()).isEqualTo(ZipEntry.DEFLATED);
                names.add(entry.getName());
            }
        }
        return names;
    }
}
