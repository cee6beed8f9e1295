package com.ogt.buildings.population;

import com.fasterxml.jackson.databind.JsonNode;
import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.model.PopulationStats;
import com.ogt.buildings.service.AreaCalculator;
import com.ogt.buildings.util.GeoJSONHelper;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Polygon;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Estimación de población (WorldPop) para el AOI. Best-effort: cualquier fallo
 * (red, respuesta mal formada, sondeo agotado) devuelve {@code null}.
 */
@Service
@Slf4j
public class PopulationEstimator {

    static final String SOURCE = "worldpop";

    private final WorldPopClient client;
    private final AreaCalculator areaCalculator;
    private final CoverageCalculator coverageCalculator;
    private final BuildingExtractorProperties.Population settings;
    private Sleeper sleeper = new ThreadWaitSleeper();

    public PopulationEstimator(WorldPopClient client, AreaCalculator areaCalculator,
                               CoverageCalculator coverageCalculator, BuildingExtractorProperties properties) {
        this.client = client;
        this.areaCalculator = areaCalculator;
        this.coverageCalculator = coverageCalculator;
        this.settings = properties.getPopulation();
    }

    void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public PopulationStats estimate(Polygon aoi) {
        if (!settings.isEnabled()) {
            log.info("Estimación de población deshabilitada");
            return null;
        }
        try {
            // 1. Consulta inicial (síncrona si el servicio puede)
            JsonNode response = client.requestStats(featureCollection(aoi));
            if (response == null) {
                log.warn("⚠️ WorldPop devolvió una respuesta vacía");
                return null;
            }
            String status = response.path("status").asText("");
            log.info("WorldPop respondió status={}", status);

            Long population = null;
            String method = "worldpop_api_" + settings.getYear();
            String taskId = null;

            if ("finished".equals(status)) {
                population = totalPopulation(response);
            } else if ("created".equals(status) && response.hasNonNull("taskid")) {
                // 2. Tarea asíncrona: sondeo con backoff exponencial
                taskId = response.get("taskid").asText();
                method = "worldpop_api_async_" + settings.getYear();
                population = pollTask(taskId);
            } else if (response.hasNonNull("error")) {
                log.warn("⚠️ WorldPop error: {}", response.get("error").asText());
            }

            if (population == null || population <= 0) {
                log.info("WorldPop sin datos de población para el AOI");
                return null;
            }

            // 3. Densidad sobre área equivalente
            double areaKm2 = areaCalculator.areaSquareKilometers(aoi);
            Double density = areaKm2 > 0 ? round(population / areaKm2, 1) : null;
            PopulationStats stats = PopulationStats.builder()
                    .populationEstimate(population)
                    .areaKm2(round(areaKm2, 2))
                    .densityPerKm2(density)
                    .densityClass(density != null ? coverageCalculator.densityClass(density) : null)
                    .source(SOURCE)
                    .method(method)
                    .year(settings.getYear())
                    .taskId(taskId)
                    .build();
            log.info("✅ Población estimada: {} habitantes ({} hab/km²)", population, density);
            return stats;

        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("⚠️ WorldPop falló: {}", e.getMessage());
            return null;
        }
    }

    private Long pollTask(String taskId) {
        RetryTemplate retryTemplate = pollRetryTemplate();
        // La primera consulta también espera el intervalo inicial
        try {
            sleeper.sleep(settings.getPollInitialBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }

        return retryTemplate.execute((RetryCallback<Long, RuntimeException>) context -> {
            JsonNode task = client.getTask(taskId);
            String status = task == null ? "" : task.path("status").asText("");
            if ("finished".equals(status)) {
                log.info("WorldPop tarea {} terminada (intento {})", taskId, context.getRetryCount() + 1);
                return totalPopulation(task);
            }
            JsonNode error = task == null ? null : task.get("error");
            if (error != null && !error.isNull() && !(error.isBoolean() && !error.asBoolean())) {
                String detail = error.isTextual() ? error.asText() : task.path("error_message").asText("unknown error");
                throw new TaskFailedException("WorldPop task " + taskId + " failed: " + detail);
            }
            throw new TaskPendingException("WorldPop task " + taskId + " status=" + status);
        }, context -> {
            Throwable last = context.getLastThrowable();
            log.warn("⚠️ Sondeo de WorldPop abandonado tras {} intentos: {}", context.getRetryCount(),
                    last != null ? last.getMessage() : "sin detalle");
            return null;
        });
    }

    private RetryTemplate pollRetryTemplate() {
        long secondInterval = (long) (settings.getPollInitialBackoff().toMillis() * settings.getPollMultiplier());
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(Math.max(1, secondInterval));
        backOff.setMultiplier(settings.getPollMultiplier());
        backOff.setMaxInterval(Long.MAX_VALUE / 4);
        backOff.setSleeper(sleeper);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setBackOffPolicy(backOff);
        Map<Class<? extends Throwable>, Boolean> retryable =
                Map.of(TaskPendingException.class, true, RestClientException.class, true);
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(settings.getPollMaxAttempts(), retryable));
        return retryTemplate;
    }

    private Long totalPopulation(JsonNode response) {
        JsonNode total = response.path("data").path("total_population");
        if (!total.isNumber()) {
            throw new IllegalArgumentException("Respuesta de WorldPop sin data.total_population");
        }
        return Math.round(total.asDouble());
    }

    private String featureCollection(Polygon aoi) {
        return "{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\",\"properties\":{},\"geometry\":"
                + GeoJSONHelper.geometryToJson(aoi) + "}]}";
    }

    private static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    static class TaskPendingException extends RuntimeException {
        TaskPendingException(String message) {
            super(message);
        }
    }

    static class TaskFailedException extends RuntimeException {
        TaskFailedException(String message) {
            super(message);
        }
    }
}
