package com.ogt.buildings.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.config.HttpClientConfig;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.exception.BuildingProviderException;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.sourceconfig.GoogleSourceConfig;
import com.ogt.buildings.util.GeoJSONHelper;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Google Open Buildings v3. El índice {@code tiles.geojson} define celdas S2 de nivel 4
 * ({@code tile_id}); cada celda es un CSV gzip con la huella en WKT y su confianza.
 */
@Component
@Slf4j
public class GoogleOpenBuildingsProvider implements BuildingDataProvider {

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema TILE_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final RestClient restClient;
    private final BuildingExtractorProperties.Providers.Google settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GoogleOpenBuildingsProvider(@Qualifier(HttpClientConfig.GOOGLE) RestClient restClient,
                                       BuildingExtractorProperties properties) {
        this.restClient = restClient;
        this.settings = properties.getProviders().getGoogle();
    }

    @Override
    public BuildingSource getSource() {
        return BuildingSource.GOOGLE;
    }

    @Override
    public BuildingFeatureCollection fetch(ProviderRequest request) {
        GoogleSourceConfig config = request.configAs(GoogleSourceConfig.class);
        Polygon aoi = request.getAreaOfInterest();
        Path workDir = request.getWorkDir();

        // 1. Celdas S2 que tocan el AOI
        Path index = FileDownloader.download(restClient, settings.getTilesIndexUrl(), workDir.resolve("tiles.geojson"));
        List<String> tileIds = selectTiles(index, aoi);
        log.info("Google: {} celdas S2 intersectan el AOI", tileIds.size());

        // 2. Descargar y filtrar por AOI y confianza
        PreparedGeometry preparedAoi = PreparedGeometryFactory.prepare(aoi);
        List<BuildingFeature> features = new ArrayList<>();
        for (String tileId : tileIds) {
            String url = String.format(settings.getTileUrlTemplate(), tileId);
            Path tile = FileDownloader.download(restClient, url, workDir.resolve(tileId + "_buildings.csv.gz"));
            readTile(tile, preparedAoi, aoi.getEnvelopeInternal(), config.getConfidenceThreshold(), features);
        }

        log.info("Google: {} edificios con confianza >= {}", features.size(), config.getConfidenceThreshold());
        return new BuildingFeatureCollection(BuildingSource.GOOGLE, features);
    }

    List<String> selectTiles(Path index, Polygon aoi) {
        List<String> tileIds = new ArrayList<>();
        try {
            JsonNode root = objectMapper.readTree(index.toFile());
            for (JsonNode feature : root.path("features")) {
                Geometry cell = GeoJSONHelper.readGeometry(feature.path("geometry").toString());
                if (cell != null && cell.intersects(aoi)) {
                    tileIds.add(feature.path("properties").path("tile_id").asText());
                }
            }
        } catch (IOException | ParseException e) {
            throw new BuildingProviderException("Índice de celdas de Google ilegible: " + e.getMessage(), e);
        }
        return tileIds;
    }

    private void readTile(Path file, PreparedGeometry aoi, Envelope envelope, double threshold,
                          List<BuildingFeature> sink) {
        WKTReader wktReader = new WKTReader(GeoJSONHelper.wgs84Factory());
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file));
             MappingIterator<Map<String, String>> rows = CSV.readerFor(Map.class).with(TILE_SCHEMA).readValues(in)) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                double confidence = Double.parseDouble(row.get("confidence"));
                if (confidence < threshold) continue;

                // Descarte rápido por centroide antes de parsear el WKT
                double lat = Double.parseDouble(row.get("latitude"));
                double lon = Double.parseDouble(row.get("longitude"));
                if (!envelope.intersects(lon, lat)) continue;

                Geometry geometry = wktReader.read(row.get("geometry"));
                geometry.setSRID(GeoJSONHelper.WGS84_SRID);
                if (!aoi.intersects(geometry)) continue;

                Map<String, Object> props = new LinkedHashMap<>();
                props.put("confidence", confidence);
                props.put("area_in_meters", Double.parseDouble(row.get("area_in_meters")));
                props.put("full_plus_code", row.get("full_plus_code"));
                sink.add(new BuildingFeature(geometry, props));
            }
        } catch (IOException | ParseException | NumberFormatException e) {
            throw new BuildingProviderException("Celda de Google ilegible (" + file.getFileName() + "): "
                    + e.getMessage(), e);
        }
    }
}
