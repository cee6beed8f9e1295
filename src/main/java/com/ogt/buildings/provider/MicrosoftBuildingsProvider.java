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
import com.ogt.buildings.sourceconfig.MicrosoftSourceConfig;
import com.ogt.buildings.util.GeoJSONHelper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * Microsoft Global ML Building Footprints. El índice {@code dataset-links.csv}
 * (Location, QuadKey, Url) se cruza con los quadkeys que cubren el AOI; cada
 * partición es GeoJSON por líneas comprimido con gzip.
 */
@Component
@Slf4j
public class MicrosoftBuildingsProvider implements BuildingDataProvider {

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema INDEX_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final RestClient restClient;
    private final BuildingExtractorProperties.Providers.Microsoft settings;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public MicrosoftBuildingsProvider(@Qualifier(HttpClientConfig.MICROSOFT) RestClient restClient,
                                      BuildingExtractorProperties properties) {
        this.restClient = restClient;
        this.settings = properties.getProviders().getMicrosoft();
    }

    @Override
    public BuildingSource getSource() {
        return BuildingSource.MICROSOFT;
    }

    @Override
    public BuildingFeatureCollection fetch(ProviderRequest request) {
        MicrosoftSourceConfig config = request.configAs(MicrosoftSourceConfig.class);
        Polygon aoi = request.getAreaOfInterest();
        Path workDir = request.getWorkDir();

        // 1. Particiones que cubren el AOI
        Set<String> quadKeys = QuadKeys.covering(aoi.getEnvelopeInternal(), settings.getQuadKeyZoom());
        Path index = FileDownloader.download(restClient, settings.getDatasetLinksUrl(), workDir.resolve("dataset-links.csv"));
        List<DatasetLink> links = selectLinks(index, quadKeys, config);
        log.info("Microsoft: {} particiones para quadkeys {} (región {})", links.size(), quadKeys, config.getRegion());

        // 2. Descargar y filtrar cada partición
        PreparedGeometry preparedAoi = PreparedGeometryFactory.prepare(aoi);
        List<BuildingFeature> features = new ArrayList<>();
        int part = 0;
        for (DatasetLink link : links) {
            Path tile = FileDownloader.download(restClient, link.getUrl(), workDir.resolve("ms-" + (part++) + ".geojsonl.gz"));
            readPartition(tile, preparedAoi, features);
        }

        log.info("Microsoft: {} edificios dentro del AOI", features.size());
        return new BuildingFeatureCollection(BuildingSource.MICROSOFT, features);
    }

    List<DatasetLink> selectLinks(Path index, Set<String> quadKeys, MicrosoftSourceConfig config) {
        List<String> locations = config.isGlobal() ? List.of() : settings.getRegions().get(config.getRegion());
        if (!config.isGlobal() && (locations == null || locations.isEmpty())) {
            throw new BuildingProviderException("Región sin ubicaciones configuradas: " + config.getRegion());
        }

        List<DatasetLink> links = new ArrayList<>();
        try (InputStream in = Files.newInputStream(index);
             MappingIterator<Map<String, String>> rows = CSV.readerFor(Map.class).with(INDEX_SCHEMA).readValues(in)) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                String quadKey = row.get("QuadKey");
                String location = row.get("Location");
                if (quadKey == null || !quadKeys.contains(quadKey)) continue;
                if (!locations.isEmpty() && !locations.contains(location)) continue;
                links.add(new DatasetLink(location, quadKey, row.get("Url")));
            }
        } catch (IOException e) {
            throw new BuildingProviderException("Índice dataset-links ilegible: " + e.getMessage(), e);
        }
        return links;
    }

    private void readPartition(Path file, PreparedGeometry aoi, List<BuildingFeature> sink) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(file)), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                JsonNode feature = objectMapper.readTree(line);
                Geometry geometry = GeoJSONHelper.readGeometry(feature.path("geometry").toString());
                if (geometry == null || !aoi.intersects(geometry)) continue;

                Map<String, Object> props = new LinkedHashMap<>();
                JsonNode properties = feature.path("properties");
                // -1 significa "sin dato" en el dataset
                double height = properties.path("height").asDouble(-1);
                double confidence = properties.path("confidence").asDouble(-1);
                if (height >= 0) props.put("height", height);
                if (confidence >= 0) props.put("confidence", confidence);
                sink.add(new BuildingFeature(geometry, props));
            }
        } catch (IOException | ParseException e) {
            throw new BuildingProviderException("Partición de Microsoft ilegible (" + file.getFileName() + "): "
                    + e.getMessage(), e);
        }
    }

    @Value
    static class DatasetLink {
        String location;
        String quadKey;
        String url;
    }
}
