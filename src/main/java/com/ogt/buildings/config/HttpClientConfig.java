package com.ogt.buildings.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Clientes HTTP de los colaboradores externos, cada uno con sus propios timeouts
 * (prefijo {@code buildings.providers.*} y {@code buildings.population.*}).
 */
@Configuration
public class HttpClientConfig {

    public static final String OVERPASS = "overpassRestClient";
    public static final String MICROSOFT = "microsoftBuildingsRestClient";
    public static final String GOOGLE = "googleBuildingsRestClient";
    public static final String WORLDPOP = "worldPopRestClient";
    public static final String WORLDPOP_POLL = "worldPopPollRestClient";

    @Bean(OVERPASS)
    public RestClient overpassRestClient(RestClient.Builder builder, BuildingExtractorProperties props) {
        var osm = props.getProviders().getOsm();
        return builder.clone()
                .requestFactory(requestFactory(osm.getConnectTimeout(), osm.getReadTimeout()))
                .build();
    }

    @Bean(MICROSOFT)
    public RestClient microsoftBuildingsRestClient(RestClient.Builder builder, BuildingExtractorProperties props) {
        var microsoft = props.getProviders().getMicrosoft();
        return builder.clone()
                .requestFactory(requestFactory(microsoft.getConnectTimeout(), microsoft.getReadTimeout()))
                .build();
    }

    @Bean(GOOGLE)
    public RestClient googleBuildingsRestClient(RestClient.Builder builder, BuildingExtractorProperties props) {
        var google = props.getProviders().getGoogle();
        return builder.clone()
                .requestFactory(requestFactory(google.getConnectTimeout(), google.getReadTimeout()))
                .build();
    }

    @Bean(WORLDPOP)
    public RestClient worldPopRestClient(RestClient.Builder builder, BuildingExtractorProperties props) {
        var population = props.getPopulation();
        return builder.clone()
                .baseUrl(population.getBaseUrl())
                .requestFactory(requestFactory(population.getConnectTimeout(), population.getReadTimeout()))
                .build();
    }

    // Las consultas de estado de tareas asíncronas usan un timeout más corto
    @Bean(WORLDPOP_POLL)
    public RestClient worldPopPollRestClient(RestClient.Builder builder, BuildingExtractorProperties props) {
        var population = props.getPopulation();
        return builder.clone()
                .baseUrl(population.getBaseUrl())
                .requestFactory(requestFactory(population.getConnectTimeout(), population.getPollReadTimeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connect);
        requestFactory.setReadTimeout(read);
        return requestFactory;
    }
}
