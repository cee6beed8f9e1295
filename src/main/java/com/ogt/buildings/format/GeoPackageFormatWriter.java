package com.ogt.buildings.format;

import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.exception.FormatConversionException;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ConvertedArtifact;
import com.ogt.buildings.util.GeoJSONHelper;
import lombok.extern.slf4j.Slf4j;
import mil.nga.geopackage.BoundingBox;
import mil.nga.geopackage.GeoPackage;
import mil.nga.geopackage.GeoPackageManager;
import mil.nga.geopackage.db.GeoPackageDataType;
import mil.nga.geopackage.db.TableColumnKey;
import mil.nga.geopackage.features.columns.GeometryColumns;
import mil.nga.geopackage.features.user.FeatureColumn;
import mil.nga.geopackage.features.user.FeatureDao;
import mil.nga.geopackage.features.user.FeatureRow;
import mil.nga.geopackage.features.user.FeatureTableMetadata;
import mil.nga.geopackage.geom.GeoPackageGeometryData;
import mil.nga.geopackage.srs.SpatialReferenceSystem;
import mil.nga.sf.GeometryType;
import mil.nga.sf.wkb.GeometryReader;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.io.WKBWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** GeoPackage con una tabla de features {@code buildings} en EPSG:4326 (NGA GeoPackage). */
@Component
@Slf4j
public class GeoPackageFormatWriter implements FormatWriter {

    static final String TABLE_NAME = "buildings";
    static final String GEOMETRY_COLUMN = "geom";
    static final String ID_COLUMN = "fid";

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.GEOPACKAGE;
    }

    @Override
    public ConvertedArtifact write(BuildingFeatureCollection features, Path directory, String baseName) throws IOException {
        Path file = directory.resolve(baseName + OutputFormat.GEOPACKAGE.getExtension());
        Files.deleteIfExists(file);
        AttributeSchema attributes = AttributeSchema.of(features);

        GeoPackageManager.create(file.toFile());
        GeoPackage geoPackage = GeoPackageManager.open(file.toFile());
        try {
            // 1. SRS y tabla de features
            SpatialReferenceSystem srs = geoPackage.getSpatialReferenceSystemDao()
                    .getOrCreateCode("EPSG", GeoJSONHelper.WGS84_SRID);
            geoPackage.createGeometryColumnsTable();

            GeometryColumns geometryColumns = new GeometryColumns();
            geometryColumns.setId(new TableColumnKey(TABLE_NAME, GEOMETRY_COLUMN));
            geometryColumns.setGeometryType(GeometryType.GEOMETRY);
            geometryColumns.setZ((byte) 0);
            geometryColumns.setM((byte) 0);
            geometryColumns.setSrs(srs);

            Map<AttributeSchema.Column, String> columnNames = columnNames(attributes);
            List<FeatureColumn> columns = new ArrayList<>();
            columnNames.forEach((column, name) -> columns.add(FeatureColumn.createColumn(name, dataType(column.getType()))));
            geoPackage.createFeatureTable(FeatureTableMetadata.create(geometryColumns, ID_COLUMN, columns,
                    boundingBox(features)));

            // 2. Filas en una sola transacción
            FeatureDao dao = geoPackage.getFeatureDao(geometryColumns);
            WKBWriter wkbWriter = new WKBWriter();
            geoPackage.beginTransaction();
            boolean committed = false;
            try {
                for (BuildingFeature feature : features.getFeatures()) {
                    FeatureRow row = dao.newRow();
                    GeoPackageGeometryData geometryData = new GeoPackageGeometryData(srs.getSrsId());
                    geometryData.setGeometry(GeometryReader.readGeometry(wkbWriter.write(feature.getGeometry())));
                    row.setGeometry(geometryData);
                    columnNames.forEach((column, name) ->
                            row.setValue(name, convert(column, feature.property(column.getName()))));
                    dao.create(row);
                }
                geoPackage.endTransaction(true);
                committed = true;
            } finally {
                if (!committed) {
                    geoPackage.endTransaction(false);
                }
            }
        } catch (SQLException e) {
            throw new FormatConversionException("No se pudo escribir la tabla GeoPackage: " + e.getMessage(), e);
        } finally {
            geoPackage.close();
        }

        return ConvertedArtifact.builder()
                .source(features.getSource())
                .format(OutputFormat.GEOPACKAGE)
                .primaryFile(file)
                .sizeBytes(Files.size(file))
                .buildingCount(features.size())
                .build();
    }

    /**
     * Nombre SQL de cada atributo. SQLite compara nombres sin distinguir mayúsculas, así que un
     * atributo que choca con la clave, la geometría u otro atributo recibe un sufijo numérico.
     */
    static Map<AttributeSchema.Column, String> columnNames(AttributeSchema attributes) {
        Set<String> used = new HashSet<>(Set.of(ID_COLUMN, GEOMETRY_COLUMN));
        Map<AttributeSchema.Column, String> names = new LinkedHashMap<>();
        for (AttributeSchema.Column column : attributes.getColumns()) {
            String candidate = column.getName();
            int suffix = 1;
            while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
                candidate = column.getName() + suffix++;
            }
            names.put(column, candidate);
        }
        return names;
    }

    private BoundingBox boundingBox(BuildingFeatureCollection features) {
        Envelope envelope = new Envelope();
        features.getFeatures().forEach(f -> envelope.expandToInclude(f.getGeometry().getEnvelopeInternal()));
        return new BoundingBox(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
    }

    private GeoPackageDataType dataType(AttributeSchema.ColumnType type) {
        return switch (type) {
            case INTEGER -> GeoPackageDataType.INTEGER;
            case REAL -> GeoPackageDataType.DOUBLE;
            case BOOLEAN -> GeoPackageDataType.BOOLEAN;
            case TEXT -> GeoPackageDataType.TEXT;
        };
    }

    private Object convert(AttributeSchema.Column column, Object value) {
        return switch (column.getType()) {
            case INTEGER -> AttributeSchema.asLong(value);
            case REAL -> AttributeSchema.asDouble(value);
            case BOOLEAN -> AttributeSchema.asBoolean(value);
            case TEXT -> AttributeSchema.asText(value);
        };
    }
}
