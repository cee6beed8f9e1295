package com.ogt.buildings.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ConvertedArtifact;
import lombok.extern.slf4j.Slf4j;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Types;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.io.WKBWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * GeoParquet 1.0: columna {@code geometry} en WKB más una columna por atributo,
 * con los metadatos {@code geo} en el pie del archivo.
 */
@Component
@Slf4j
public class GeoParquetFormatWriter implements FormatWriter {

    static final String GEOMETRY_COLUMN = "geometry";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.GEOPARQUET;
    }

    @Override
    public ConvertedArtifact write(BuildingFeatureCollection features, Path directory, String baseName) throws IOException {
        Path file = directory.resolve(baseName + OutputFormat.GEOPARQUET.getExtension());
        AttributeSchema attributes = AttributeSchema.of(features);
        MessageType schema = buildSchema(attributes);

        SimpleGroupFactory groups = new SimpleGroupFactory(schema);
        WKBWriter wkbWriter = new WKBWriter();
        Envelope bbox = new Envelope();
        TreeSet<String> geometryTypes = new TreeSet<>();

        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalOutputFile(file))
                .withType(schema)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .withExtraMetaData(Map.of("geo", geoMetadata(features, bbox, geometryTypes)))
                .build()) {
            for (BuildingFeature feature : features.getFeatures()) {
                Group row = groups.newGroup();
                row.add(GEOMETRY_COLUMN, Binary.fromConstantByteArray(wkbWriter.write(feature.getGeometry())));
                for (AttributeSchema.Column column : attributes.getColumns()) {
                    addValue(row, column, feature.property(column.getName()));
                }
                writer.write(row);
            }
        }

        return ConvertedArtifact.builder()
                .source(features.getSource())
                .format(OutputFormat.GEOPARQUET)
                .primaryFile(file)
                .sizeBytes(Files.size(file))
                .buildingCount(features.size())
                .build();
    }

    private MessageType buildSchema(AttributeSchema attributes) {
        Types.MessageTypeBuilder builder = Types.buildMessage();
        builder.addField(Types.required(PrimitiveTypeName.BINARY).named(GEOMETRY_COLUMN));
        for (AttributeSchema.Column column : attributes.getColumns()) {
            switch (column.getType()) {
                case INTEGER -> builder.addField(Types.optional(PrimitiveTypeName.INT64).named(column.getName()));
                case REAL -> builder.addField(Types.optional(PrimitiveTypeName.DOUBLE).named(column.getName()));
                case BOOLEAN -> builder.addField(Types.optional(PrimitiveTypeName.BOOLEAN).named(column.getName()));
                case TEXT -> builder.addField(Types.optional(PrimitiveTypeName.BINARY)
                        .as(LogicalTypeAnnotation.stringType()).named(column.getName()));
            }
        }
        return builder.named("buildings");
    }

    private void addValue(Group row, AttributeSchema.Column column, Object value) {
        if (value == null) return; // optional: ausencia = null
        String name = column.getName();
        switch (column.getType()) {
            case INTEGER -> {
                Long v = AttributeSchema.asLong(value);
                if (v != null) row.add(name, v);
            }
            case REAL -> {
                Double v = AttributeSchema.asDouble(value);
                if (v != null) row.add(name, v);
            }
            case BOOLEAN -> {
                Boolean v = AttributeSchema.asBoolean(value);
                if (v != null) row.add(name, v);
            }
            case TEXT -> row.add(name, AttributeSchema.asText(value));
        }
    }

    private String geoMetadata(BuildingFeatureCollection features, Envelope bbox, TreeSet<String> geometryTypes)
            throws JsonProcessingException {
        for (BuildingFeature feature : features.getFeatures()) {
            bbox.expandToInclude(feature.getGeometry().getEnvelopeInternal());
            geometryTypes.add(feature.getGeometry().getGeometryType());
        }

        Map<String, Object> column = new LinkedHashMap<>();
        column.put("encoding", "WKB");
        column.put("geometry_types", List.copyOf(geometryTypes));
        column.put("bbox", List.of(bbox.getMinX(), bbox.getMinY(), bbox.getMaxX(), bbox.getMaxY()));

        Map<String, Object> geo = new LinkedHashMap<>();
        geo.put("version", "1.0.0");
        geo.put("primary_column", GEOMETRY_COLUMN);
        geo.put("columns", Map.of(GEOMETRY_COLUMN, column));
        return objectMapper.writeValueAsString(geo);
    }
}
