package com.ogt.buildings.provider;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.exception.BuildingProviderException;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.service.AreaCalculator;
import com.ogt.buildings.sourceconfig.OvertureSourceConfig;
import com.ogt.buildings.util.GeoJSONHelper;
import com.ogt.buildings.util.ParquetGroups;
import lombok.extern.slf4j.Slf4j;
import org.apache.parquet.example.data.Group;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Overture Maps (tema buildings/building) leído de una copia local en GeoParquet.
 * Pre-filtro por la columna {@code bbox}; la geometría viene en WKB.
 */
@Component
@Slf4j
public class OvertureBuildingsProvider implements BuildingDataProvider {

    private final BuildingExtractorProperties.Providers.Overture settings;
    private final AreaCalculator areaCalculator;

    public OvertureBuildingsProvider(BuildingExtractorProperties properties, AreaCalculator areaCalculator) {
        this.settings = properties.getProviders().getOverture();
        this.areaCalculator = areaCalculator;
    }

    @Override
    public BuildingSource getSource() {
        return BuildingSource.OVERTURE;
    }

    @Override
    public BuildingFeatureCollection fetch(ProviderRequest request) {
        OvertureSourceConfig config = request.configAs(OvertureSourceConfig.class);
        Polygon aoi = request.getAreaOfInterest();
        Path dataDir = Path.of(settings.getDataDir());
        if (!Files.isDirectory(dataDir)) {
            throw new BuildingProviderException("Directorio de Overture no encontrado: " + dataDir.toAbsolutePath());
        }

        Envelope envelope = aoi.getEnvelopeInternal();
        PreparedGeometry preparedAoi = PreparedGeometryFactory.prepare(aoi);
        AreaCalculator.EqualAreaProjection projection = areaCalculator.projectorFor(envelope);
        WKBReader wkbReader = new WKBReader(GeoJSONHelper.wgs84Factory());
        List<BuildingFeature> features = new ArrayList<>();
        int[] belowMinArea = {0};

        for (Path file : partitions(dataDir)) {
            try {
                ParquetGroups.forEach(file, row -> {
                    if (!bboxIntersects(row, envelope)) return;

                    Geometry geometry = readGeometry(wkbReader, row);
                    if (geometry == null || !preparedAoi.intersects(geometry)) return;
                    if (projection.area(geometry) < config.getMinArea()) {
                        belowMinArea[0]++;
                        return;
                    }

                    Map<String, Object> props = new LinkedHashMap<>();
                    if (ParquetGroups.has(row, "id")) props.put("id", row.getString("id", 0));
                    if (config.isIncludeHeight() && ParquetGroups.has(row, "height")) {
                        props.put("height", ParquetGroups.number(row, "height"));
                    }
                    features.add(new BuildingFeature(geometry, props));
                });
            } catch (IOException e) {
                throw new BuildingProviderException("Partición de Overture ilegible (" + file.getFileName() + "): "
                        + e.getMessage(), e);
            }
        }

        log.info("Overture: {} edificios ({} bajo min_area {} m²)", features.size(), belowMinArea[0], config.getMinArea());
        return new BuildingFeatureCollection(BuildingSource.OVERTURE, features);
    }

    private List<Path> partitions(Path dataDir) {
        try (Stream<Path> files = Files.walk(dataDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".parquet"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new BuildingProviderException("No se pudo listar " + dataDir + ": " + e.getMessage(), e);
        }
    }

    private boolean bboxIntersects(Group row, Envelope envelope) {
        if (!ParquetGroups.has(row, "bbox")) {
            return true; // sin bbox se decide con la geometría
        }
        Group bbox = row.getGroup("bbox", 0);
        Envelope rowEnvelope = new Envelope(
                ParquetGroups.number(bbox, "xmin"), ParquetGroups.number(bbox, "xmax"),
                ParquetGroups.number(bbox, "ymin"), ParquetGroups.number(bbox, "ymax"));
        return rowEnvelope.intersects(envelope);
    }

    private Geometry readGeometry(WKBReader reader, Group row) {
        if (!ParquetGroups.has(row, "geometry")) return null;
        try {
            Geometry geometry = reader.read(row.getBinary("geometry", 0).getBytes());
            geometry.setSRID(GeoJSONHelper.WGS84_SRID);
            return geometry;
        } catch (ParseException e) {
            throw new BuildingProviderException("WKB inválido en Overture: " + e.getMessage(), e);
        }
    }
}
