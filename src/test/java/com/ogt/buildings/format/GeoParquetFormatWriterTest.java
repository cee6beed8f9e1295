package com.ogt.buildings.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.model.ConvertedArtifact;
import com.ogt.buildings.util.LocalParquetInputFile;
import com.ogt.buildings.util.ParquetGroups;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBReader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeoParquetFormatWriterTest {

    @TempDir
    Path dir;

    private final GeoParquetFormatWriter writer = new GeoParquetFormatWriter();

    @Test
    void writesWkbRowsWithTypedColumnsAndGeoMetadata() throws Exception {
        ConvertedArtifact artifact = writer.write(BuildingFixtures.buildings(BuildingSource.MICROSOFT, 5), dir,
                "microsoft_geoparquet");

        assertThat(artifact.getPrimaryFile()).hasFileName("microsoft_geoparquet.parquet");

        List<Geometry> geometries = new ArrayList<>();
        List<Double> heights = new ArrayList<>();
        long rows = ParquetGroups.forEach(artifact.getPrimaryFile(), group -> {
            try {
                geometries.add(new WKBReader().read(group.getBinary("geometry", 0).getBytes()));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            heights.add(ParquetGroups.number(group, "height"));
        });

        assertThat(rows).isEqualTo(5);
        assertThat(geometries).allSatisfy(g -> assertThat(g.getGeometryType()).isEqualTo("Polygon"));
        assertThat(heights).containsExactly(3.5, 4.5, 5.5, 6.5, 7.5);

        try (ParquetFileReader reader = ParquetFileReader.open(new LocalParquetInputFile(artifact.getPrimaryFile()))) {
            MessageType schema = ParquetGroups.schemaOf(reader);
            assertThat(schema.getType("levels").asPrimitiveType().getPrimitiveTypeName()).isEqualTo(PrimitiveTypeName.INT64);
            assertThat(schema.getType("verified").asPrimitiveType().getPrimitiveTypeName()).isEqualTo(PrimitiveTypeName.BOOLEAN);

            JsonNode geo = new ObjectMapper().readTree(
                    reader.getFooter().getFileMetaData().getKeyValueMetaData().get("geo"));
            assertThat(geo.path("primary_column").asText()).isEqualTo("geometry");
            assertThat(geo.path("columns").path("geometry").path("encoding").asText()).isEqualTo("WKB");
            assertThat(geo.path("columns").path("geometry").path("bbox")).hasSize(4);
        }
    }
}
