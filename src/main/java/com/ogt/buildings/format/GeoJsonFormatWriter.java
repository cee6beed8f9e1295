package com.ogt.buildings.format;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ConvertedArtifact;
import com.ogt.buildings.util.GeoJSONHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * GeoJSON (RFC 7946) escrito en streaming con Jackson; la geometría la serializa JTS.
 * También genera GeoJSONSeq (una Feature por línea) para alimentar a tippecanoe.
 */
@Component
@Slf4j
public class GeoJsonFormatWriter implements FormatWriter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.GEOJSON;
    }

    @Override
    public ConvertedArtifact write(BuildingFeatureCollection features, Path directory, String baseName) throws IOException {
        Path file = directory.resolve(baseName + OutputFormat.GEOJSON.getExtension());

        try (OutputStream out = Files.newOutputStream(file);
             JsonGenerator gen = objectMapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            gen.writeStartObject();
            gen.writeStringField("type", "FeatureCollection");
            gen.writeArrayFieldStart("features");
            for (BuildingFeature feature : features.getFeatures()) {
                writeFeature(gen, feature);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }

        return ConvertedArtifact.builder()
                .source(features.getSource())
                .format(OutputFormat.GEOJSON)
                .primaryFile(file)
                .sizeBytes(Files.size(file))
                .buildingCount(features.size())
                .build();
    }

    /** Una Feature por línea (GeoJSONSeq / geojsonl). */
    public Path writeSequence(BuildingFeatureCollection features, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            for (BuildingFeature feature : features.getFeatures()) {
                // el generador no puede cerrar el stream compartido entre líneas
                JsonGenerator gen = objectMapper.getFactory().createGenerator(out, JsonEncoding.UTF8);
                gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
                writeFeature(gen, feature);
                gen.close();
                out.write('\n');
            }
        }
        return file;
    }

    private void writeFeature(JsonGenerator gen, BuildingFeature feature) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", "Feature");
        gen.writeFieldName("geometry");
        gen.writeRawValue(GeoJSONHelper.geometryToJson(feature.getGeometry()));
        gen.writeFieldName("properties");
        objectMapper.writeValue(gen, feature.getProperties());
        gen.writeEndObject();
    }
}
