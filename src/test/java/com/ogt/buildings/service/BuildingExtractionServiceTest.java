package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.exception.BuildingProviderException;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ExtractionResult;
import com.ogt.buildings.provider.BuildingDataProvider;
import com.ogt.buildings.provider.BuildingDataProviderRegistry;
import com.ogt.buildings.provider.ProviderRequest;
import com.ogt.buildings.sourceconfig.SourceConfigParser;
import com.ogt.buildings.util.RunWorkspace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class BuildingExtractionServiceTest {

    @TempDir
    Path scratch;

    private final List<Path> seenWorkDirs = new ArrayList<>();
    private final CountDownLatch never = new CountDownLatch(1);
    private ExecutorService executor;
    private BuildingExtractionService service;

    @BeforeEach
    void setUp() {
        BuildingExtractorProperties properties = new BuildingExtractorProperties();
        properties.getStorage().setScratchDir(scratch.toString());
        properties.getExtraction().setSourceTimeout(Duration.ofMillis(500));

        BuildingDataProviderRegistry registry = new BuildingDataProviderRegistry(List.of(
                provider(BuildingSource.GOOGLE, request -> {
                    throw new BuildingProviderException("Google tiles unavailable");
                }),
                provider(BuildingSource.MICROSOFT, request -> BuildingFixtures.buildings(BuildingSource.MICROSOFT, 5)),
                provider(BuildingSource.OSM, request -> BuildingFeatureCollection.empty(BuildingSource.OSM)),
                provider(BuildingSource.OVERTURE, request -> {
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return BuildingFeatureCollection.empty(BuildingSource.OVERTURE);
                })));

        executor = Executors.newFixedThreadPool(4);
        service = new BuildingExtractionService(registry, new SourceConfigParser(),
                new BuildingStatsCalculator(new AreaCalculator()), new RunWorkspace(properties), executor, properties);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        never.countDown();
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void successfulExtractionCarriesFeaturesAndStats() {
        ExtractionResult result = service.extract(BuildingFixtures.smallAoi(), BuildingSource.MICROSOFT, Map.of());

        assertThat(result.hasData()).isTrue();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.getBuildingCount()).isEqualTo(5);
        assertThat(result.toResultMap())
                .containsEntry("building_count", 5)
                .containsEntry("source", "microsoft")
                .containsEntry("config_used", Map.of("region", "global"));
    }

    @Test
    void emptyResultIsNotAnError() {
        ExtractionResult result = service.extract(BuildingFixtures.smallAoi(), BuildingSource.OSM, null);

        assertThat(result.isFailed()).isFalse();
        assertThat(result.hasData()).isFalse();
        assertThat(result.toResultMap())
                .containsEntry("building_count", 0)
                .containsEntry("message", BuildingStatsCalculator.NO_BUILDINGS_FOUND);
    }

    @Test
    void providerErrorStaysScopedToItsSource() {
        List<ExtractionResult> results = service.extractAll(BuildingFixtures.smallAoi(),
                List.of(BuildingSource.GOOGLE, BuildingSource.MICROSOFT), source -> Map.of());

        assertThat(results).extracting(ExtractionResult::getSource)
                .containsExactly(BuildingSource.GOOGLE, BuildingSource.MICROSOFT);
        assertThat(results.get(0).isFailed()).isTrue();
        assertThat(results.get(0).toResultMap())
                .containsEntry("error", "Google tiles unavailable")
                .containsEntry("building_count", 0);
        assertThat(results.get(1).getBuildingCount()).isEqualTo(5);
    }

    @Test
    void invalidConfigFailsTheSourceWithoutCallingTheProvider() {
        ExtractionResult result = service.extract(BuildingFixtures.smallAoi(), BuildingSource.MICROSOFT,
                Map.of("region", "mars"));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getError()).contains("region");
        assertThat(seenWorkDirs).isEmpty();
    }

    @Test
    void slowSourceTimesOutWithoutCancellingSiblings() {
        List<ExtractionResult> results = service.extractAll(BuildingFixtures.smallAoi(),
                List.of(BuildingSource.OVERTURE, BuildingSource.MICROSOFT), source -> Map.of());

        assertThat(results.get(0).isFailed()).isTrue();
        assertThat(results.get(0).getError()).startsWith("Extraction timed out");
        assertThat(results.get(1).getBuildingCount()).isEqualTo(5);
    }

    @Test
    void scratchDirectoryIsRemovedOnEveryPath() throws IOException {
        service.extract(BuildingFixtures.smallAoi(), BuildingSource.MICROSOFT, Map.of());
        service.extract(BuildingFixtures.smallAoi(), BuildingSource.GOOGLE, Map.of());

        assertThat(seenWorkDirs).hasSize(2);
        assertThat(seenWorkDirs).allSatisfy(dir -> assertThat(dir).doesNotExist());
        try (Stream<Path> left = Files.list(scratch)) {
            assertThat(left).isEmpty();
        }
    }

    private BuildingDataProvider provider(BuildingSource source,
                                          Function<ProviderRequest, BuildingFeatureCollection> behaviour) {
        return new BuildingDataProvider() {
            @Override
            public BuildingSource getSource() {
                return source;
            }

            @Override
            public BuildingFeatureCollection fetch(ProviderRequest request) {
                synchronized (seenWorkDirs) {
                    seenWorkDirs.add(request.getWorkDir());
                }
                assertThat(request.getWorkDir().resolve("aoi.geojson")).exists();
                return behaviour.apply(request);
            }
        };
    }
}
