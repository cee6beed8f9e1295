package com.ogt.buildings.population;

import com.fasterxml.jackson.databind.JsonNode;
import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.config.HttpClientConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.HashMap;
import java.util.Map;

/** Cliente HTTP de la API de estadísticas de WorldPop ({@code /services/stats} y {@code /tasks/{id}}). */
@Component
@Slf4j
public class WorldPopClient {

    private final RestClient restClient;
    private final RestClient pollClient;
    private final BuildingExtractorProperties.Population settings;

    public WorldPopClient(@Qualifier(HttpClientConfig.WORLDPOP) RestClient restClient,
                          @Qualifier(HttpClientConfig.WORLDPOP_POLL) RestClient pollClient,
                          BuildingExtractorProperties properties) {
        this.restClient = restClient;
        this.pollClient = pollClient;
        this.settings = properties.getPopulation();
    }

    /**
     * Pide la población total dentro del GeoJSON. La respuesta puede traer el resultado
     * ({@code status=finished}) o un handle de tarea asíncrona ({@code status=created}).
     */
    public JsonNode requestStats(String featureCollectionGeoJson) {
        boolean withKey = settings.getApiKey() != null && !settings.getApiKey().isBlank();
        Map<String, Object> vars = new HashMap<>();
        vars.put("dataset", settings.getDataset());
        vars.put("year", settings.getYear());
        vars.put("geojson", featureCollectionGeoJson);
        vars.put("key", settings.getApiKey());

        log.debug("WorldPop stats (key: {})", withKey ? "sí" : "no");
        return restClient.get()
                .uri(builder -> {
                    builder.path("/services/stats")
                            .queryParam("dataset", "{dataset}")
                            .queryParam("year", "{year}")
                            .queryParam("geojson", "{geojson}")
                            .queryParam("runasync", "false");
                    if (withKey) {
                        builder.queryParam("key", "{key}");
                    }
                    return builder.build(vars);
                })
                .retrieve()
                .body(JsonNode.class);
    }

    public JsonNode getTask(String taskId) {
        return pollClient.get()
                .uri("/tasks/{taskId}", taskId)
                .retrieve()
                .body(JsonNode.class);
    }
}
