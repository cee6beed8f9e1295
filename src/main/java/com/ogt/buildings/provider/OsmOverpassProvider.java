package com.ogt.buildings.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.config.HttpClientConfig;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.exception.BuildingProviderException;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.sourceconfig.OsmSourceConfig;
import com.ogt.buildings.util.GeoJSONHelper;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Edificios de OpenStreetMap vía Overpass API: ways con tag {@code building}
 * dentro del polígono del AOI, filtrados por la lista de tipos permitidos.
 */
@Component
@Slf4j
public class OsmOverpassProvider implements BuildingDataProvider {

    private final RestClient restClient;
    private final BuildingExtractorProperties.Providers.Osm settings;

    public OsmOverpassProvider(@Qualifier(HttpClientConfig.OVERPASS) RestClient restClient,
                               BuildingExtractorProperties properties) {
        this.restClient = restClient;
        this.settings = properties.getProviders().getOsm();
    }

    @Override
    public BuildingSource getSource() {
        return BuildingSource.OSM;
    }

    @Override
    public BuildingFeatureCollection fetch(ProviderRequest request) {
        OsmSourceConfig config = request.configAs(OsmSourceConfig.class);
        Polygon aoi = request.getAreaOfInterest();

        // 1. Consulta Overpass
        String query = buildQuery(aoi);
        JsonNode response = execute(query);

        // 2. Construir huellas
        GeometryFactory gf = GeoJSONHelper.wgs84Factory();
        PreparedGeometry preparedAoi = PreparedGeometryFactory.prepare(aoi);
        List<BuildingFeature> features = new ArrayList<>();
        int skippedByType = 0;

        for (JsonNode element : response.path("elements")) {
            if (!"way".equals(element.path("type").asText())) continue;

            JsonNode tags = element.path("tags");
            String buildingType = tags.path("building").asText(null);
            if (!config.accepts(buildingType)) {
                skippedByType++;
                continue;
            }

            Polygon footprint = toPolygon(gf, element.path("geometry"));
            if (footprint == null || !preparedAoi.intersects(footprint)) continue;

            Map<String, Object> props = new LinkedHashMap<>();
            props.put("osm_id", element.path("id").asLong());
            props.put("building", buildingType);
            if (tags.hasNonNull("building:levels")) props.put("levels", tags.get("building:levels").asText());
            if (tags.hasNonNull("height")) props.put("height", tags.get("height").asText());
            if (tags.hasNonNull("name")) props.put("name", tags.get("name").asText());
            features.add(new BuildingFeature(footprint, props));
        }

        log.info("OSM: {} edificios ({} descartados por tipo)", features.size(), skippedByType);
        return new BuildingFeatureCollection(BuildingSource.OSM, features);
    }

    String buildQuery(Polygon aoi) {
        StringBuilder poly = new StringBuilder();
        Coordinate[] ring = aoi.getExteriorRing().getCoordinates();
        // El último vértice repite el primero; Overpass cierra el anillo solo
        for (int i = 0; i < ring.length - 1; i++) {
            if (i > 0) poly.append(' ');
            poly.append(String.format(Locale.ROOT, "%.7f %.7f", ring[i].y, ring[i].x));
        }
        return String.format(Locale.ROOT,
                "[out:json][timeout:%d];way[\"building\"](poly:\"%s\");out geom;",
                settings.getQueryTimeoutSeconds(), poly);
    }

    private JsonNode execute(String query) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("data", query);
        try {
            JsonNode body = restClient.post()
                    .uri(settings.getOverpassUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
            if (body == null) {
                throw new BuildingProviderException("Respuesta vacía de Overpass");
            }
            return body;
        } catch (RestClientException e) {
            throw new BuildingProviderException("Error consultando Overpass: " + e.getMessage(), e);
        }
    }

    private Polygon toPolygon(GeometryFactory gf, JsonNode geometry) {
        if (!geometry.isArray() || geometry.size() < 4) return null;
        Coordinate[] coords = new Coordinate[geometry.size()];
        for (int i = 0; i < geometry.size(); i++) {
            JsonNode node = geometry.get(i);
            coords[i] = new Coordinate(node.path("lon").asDouble(), node.path("lat").asDouble());
        }
        if (!coords[0].equals2D(coords[coords.length - 1])) {
            return null; // way abierto: no es un contorno de edificio
        }
        Polygon polygon = gf.createPolygon(coords);
        return polygon.isValid() ? polygon : null;
    }
}
