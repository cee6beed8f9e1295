package com.ogt.buildings.format;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ConvertedArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShapefileFormatWriterTest {

    @TempDir
    Path dir;

    private final ShapefileFormatWriter writer = new ShapefileFormatWriter(
            Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void writesAllSidecarsWithMatchingRecordCounts() throws IOException {
        ConvertedArtifact artifact = writer.write(BuildingFixtures.buildings(BuildingSource.GOOGLE, 6), dir,
                "google_shapefile");

        assertThat(artifact.allFiles()).extracting(p -> p.getFileName().toString())
                .containsExactly("google_shapefile.shp", "google_shapefile.shx", "google_shapefile.dbf",
                        "google_shapefile.prj", "google_shapefile.cpg");

        byte[] shp = Files.readAllBytes(dir.resolve("google_shapefile.shp"));
        ByteBuffer header = ByteBuffer.wrap(shp);
        assertThat(header.order(ByteOrder.BIG_ENDIAN).getInt(0)).isEqualTo(9994);
        assertThat(header.getInt(24) * 2).isEqualTo(shp.length);
        assertThat(header.order(ByteOrder.LITTLE_ENDIAN).getInt(32)).isEqualTo(5);

        assertThat(Files.size(dir.resolve("google_shapefile.shx"))).isEqualTo(100 + 8 * 6);

        byte[] dbf = Files.readAllBytes(dir.resolve("google_shapefile.dbf"));
        assertThat(ByteBuffer.wrap(dbf).order(ByteOrder.LITTLE_ENDIAN).getInt(4)).isEqualTo(6);

        assertThat(Files.readString(dir.resolve("google_shapefile.prj"))).startsWith("GEOGCS[\"GCS_WGS_1984\"");
        assertThat(Files.readString(dir.resolve("google_shapefile.cpg"))).isEqualTo("UTF-8");
    }

    @Test
    void truncatesLongFieldNamesToTenCharactersWithoutCollisions() throws IOException {
        BuildingFeatureCollection collection = new BuildingFeatureCollection(BuildingSource.GOOGLE, List.of(
                new BuildingFeature(BuildingFixtures.square(0, 0, 0.0001), Map.of(
                        "area_in_meters", 12.5,
                        "area_in_meters_rounded", 13))));

        writer.write(collection, dir, "google_shapefile");

        byte[] dbf = Files.readAllBytes(dir.resolve("google_shapefile.dbf"));
        int headerLength = ByteBuffer.wrap(dbf).order(ByteOrder.LITTLE_ENDIAN).getShort(8);
        int fieldCount = (headerLength - 33) / 32;
        List<String> names = new java.util.ArrayList<>();
        for (int i = 0; i < fieldCount; i++) {
            int offset = 32 + i * 32;
            int end = offset;
            while (end < offset + 11 && dbf[end] != 0) end++;
            names.add(new String(dbf, offset, end - offset, StandardCharsets.US_ASCII));
        }

        assertThat(names).hasSize(3).doesNotHaveDuplicates();
        assertThat(names).allSatisfy(name -> assertThat(name.length()).isLessThanOrEqualTo(10));
        assertThat(names.get(0)).isEqualTo("fid");
    }

    @Test
    void storesFullRangeIntegersAndClockDate() throws IOException {
        long id = -9_223_372_036_854_775_807L;
        BuildingFeatureCollection collection = new BuildingFeatureCollection(BuildingSource.OSM, List.of(
                new BuildingFeature(BuildingFixtures.square(0, 0, 0.0001), Map.of("osm_id", id))));

        writer.write(collection, dir, "osm_shapefile");

        byte[] dbf = Files.readAllBytes(dir.resolve("osm_shapefile.dbf"));
        assertThat(new byte[] {dbf[1], dbf[2], dbf[3]}).containsExactly(124, 6, 1);

        // descriptores: fid en 32, osm_id en 64
        assertThat(dbf[64 + 11]).isEqualTo((byte) 'N');
        assertThat(dbf[64 + 16] & 0xFF).isEqualTo(20);

        int headerLength = ByteBuffer.wrap(dbf).order(ByteOrder.LITTLE_ENDIAN).getShort(8);
        int osmIdOffset = headerLength + 1 + 10;
        String stored = new String(dbf, osmIdOffset, 20, StandardCharsets.US_ASCII);
        assertThat(stored).isEqualTo(String.valueOf(id));
    }
}
