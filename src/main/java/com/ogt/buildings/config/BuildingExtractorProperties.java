package com.ogt.buildings.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuración explícita del pipeline de exportación (prefijo {@code buildings}).
 * Credenciales, timeouts y rutas de herramientas se inyectan desde aquí a cada componente.
 */
@Component
@ConfigurationProperties(prefix = "buildings")
@Data
public class BuildingExtractorProperties {

    private Storage storage = new Storage();
    private Extraction extraction = new Extraction();
    private Providers providers = new Providers();
    private Population population = new Population();
    private Coverage coverage = new Coverage();
    private Tiles tiles = new Tiles();
    private Queue queue = new Queue();
    private Notification notification = new Notification();

    @Data
    public static class Storage {
        private String mediaRoot = "media";
        private String scratchDir = System.getProperty("java.io.tmpdir") + "/ogt-buildings";
        private int retentionDays = 30;
        private Duration scratchMaxAge = Duration.ofDays(1);
        private String cleanupCron = "0 30 3 * * *";
    }

    @Data
    public static class Extraction {
        private Duration sourceTimeout = Duration.ofMinutes(10);
        private int threads = 4;
        private double maxAoiAreaKm2 = 10_000;
    }

    @Data
    public static class Providers {
        private Osm osm = new Osm();
        private Microsoft microsoft = new Microsoft();
        private Google google = new Google();
        private Overture overture = new Overture();

        @Data
        public static class Osm {
            private String overpassUrl = "https://overpass-api.de/api/interpreter";
            private int queryTimeoutSeconds = 180;
            private Duration connectTimeout = Duration.ofSeconds(10);
            private Duration readTimeout = Duration.ofMinutes(4);
        }

        @Data
        public static class Microsoft {
            private String datasetLinksUrl = "https://minedbuildings.z5.web.core.windows.net/global-buildings/dataset-links.csv";
            private int quadKeyZoom = 9;
            private Duration connectTimeout = Duration.ofSeconds(10);
            private Duration readTimeout = Duration.ofMinutes(5);
            // region -> valores de la columna Location del índice
            private Map<String, List<String>> regions = new HashMap<>();
        }

        @Data
        public static class Google {
            private String tilesIndexUrl = "https://openbuildings-public-dot-gweb-research.uw.r.appspot.com/public/tiles.geojson";
            private String tileUrlTemplate = "https://storage.googleapis.com/open-buildings-data/v3/polygons_s2_level_4_gzip/%s_buildings.csv.gz";
            private Duration connectTimeout = Duration.ofSeconds(10);
            private Duration readTimeout = Duration.ofMinutes(10);
        }

        @Data
        public static class Overture {
            private String dataDir = "data/overture/theme=buildings/type=building";
        }
    }

    @Data
    public static class Population {
        private boolean enabled = true;
        private String baseUrl = "https://api.worldpop.org/v1";
        private String dataset = "wpgppop";
        private int year = 2020;
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(35);
        private Duration pollReadTimeout = Duration.ofSeconds(10);
        private int pollMaxAttempts = 5;
        private Duration pollInitialBackoff = Duration.ofSeconds(1);
        private double pollMultiplier = 2.0;
    }

    @Data
    public static class Coverage {
        // buildings per capita
        private double veryLowBelow = 0.1;
        private double lowBelow = 0.2;
        private double moderateBelow = 0.4;
        private double highBelow = 0.6;
        // habitantes por km²
        private double sparseDensityBelow = 100;
        private double lowDensityBelow = 500;
        private double moderateDensityBelow = 1_500;
        private double highDensityBelow = 5_000;
    }

    @Data
    public static class Tiles {
        private boolean enabled = true;
        private String executable = "tippecanoe";
        private String layerName = "buildings";
        private int minZoom = 5;
        private int maxZoom = 18;
        private Duration timeout = Duration.ofMinutes(30);
        private Duration probeTimeout = Duration.ofSeconds(10);
        private List<String> extraArgs = new ArrayList<>();
    }

    @Data
    public static class Queue {
        private Duration startDelay = Duration.ofSeconds(1);
        private Duration notificationDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Notification {
        private boolean enabled = true;
        private String from = "noreply@localhost";
        private String siteName = "Building Extractor";
        private String siteUrl = "http://localhost:8080";
    }
}
