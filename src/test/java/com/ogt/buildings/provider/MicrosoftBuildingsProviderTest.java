package com.ogt.buildings.provider;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.exception.BuildingProviderException;
import com.ogt.buildings.fixture.BuildingFixtures;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.sourceconfig.MicrosoftSourceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MicrosoftBuildingsProviderTest {

    private static final String INDEX_URL = "https://ms.test/dataset-links.csv";

    @TempDir
    Path workDir;

    private BuildingExtractorProperties properties;
    private MockRestServiceServer server;
    private MicrosoftBuildingsProvider provider;
    private String quadKey;

    @BeforeEach
    void setUp() {
        properties = new BuildingExtractorProperties();
        properties.getProviders().getMicrosoft().setDatasetLinksUrl(INDEX_URL);
        properties.getProviders().getMicrosoft().setRegions(Map.of("us", List.of("UnitedStates")));

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new MicrosoftBuildingsProvider(builder.build(), properties);

        Set<String> covering = QuadKeys.covering(BuildingFixtures.smallAoi().getEnvelopeInternal(), 9);
        assertThat(covering).hasSize(1);
        quadKey = covering.iterator().next();
    }

    @Test
    void downloadsMatchingPartitionsAndKeepsFeaturesInsideTheArea() throws IOException {
        server.expect(requestTo(INDEX_URL)).andRespond(withSuccess(indexCsv(), MediaType.TEXT_PLAIN));
        server.expect(requestTo("https://ms.test/brazil.csv.gz"))
                .andRespond(withSuccess(gzip(
                        feature(-40.299, -20.299, 6.5, 0.9) + "\n"
                                + feature(-40.295, -20.295, -1, -1) + "\n"
                                + feature(-41.5, -21.5, 3, 0.8) + "\n"), MediaType.APPLICATION_OCTET_STREAM));

        BuildingFeatureCollection result = provider.fetch(ProviderRequest.builder()
                .areaOfInterest(BuildingFixtures.smallAoi())
                .config(MicrosoftSourceConfig.builder().build())
                .workDir(workDir)
                .build());

        server.verify();
        assertThat(result.size()).isEqualTo(2);
        assertThat(result.getFeatures().get(0).getProperties()).containsEntry("height", 6.5).containsEntry("confidence", 0.9);
        // -1 = sin dato
        assertThat(result.getFeatures().get(1).getProperties()).isEmpty();
    }

    @Test
    void regionFiltersIndexByLocation() throws IOException {
        Path index = workDir.resolve("index.csv");
        Files.write(index, indexCsv());

        List<MicrosoftBuildingsProvider.DatasetLink> global = provider.selectLinks(index, Set.of(quadKey),
                MicrosoftSourceConfig.builder().build());
        List<MicrosoftBuildingsProvider.DatasetLink> us = provider.selectLinks(index, Set.of(quadKey),
                MicrosoftSourceConfig.builder().region("us").build());

        assertThat(global).extracting(MicrosoftBuildingsProvider.DatasetLink::getLocation)
                .containsExactly("Brazil", "UnitedStates");
        assertThat(us).extracting(MicrosoftBuildingsProvider.DatasetLink::getUrl)
                .containsExactly("https://ms.test/us.csv.gz");
    }

    @Test
    void regionWithoutConfiguredLocationsIsAProviderError() throws IOException {
        Path index = workDir.resolve("index.csv");
        Files.write(index, indexCsv());

        assertThatThrownBy(() -> provider.selectLinks(index, Set.of(quadKey),
                MicrosoftSourceConfig.builder().region("africa").build()))
                .isInstanceOf(BuildingProviderException.class)
                .hasMessageContaining("africa");
    }

    private byte[] indexCsv() {
        return ("Location,QuadKey,Url,Size\n"
                + "Brazil," + quadKey + ",https://ms.test/brazil.csv.gz,1MB\n"
                + "UnitedStates," + quadKey + ",https://ms.test/us.csv.gz,1MB\n"
                + "Brazil,000000000,https://ms.test/elsewhere.csv.gz,1MB\n").getBytes(StandardCharsets.UTF_8);
    }

    private static String feature(double lon, double lat, double height, double confidence) {
        double d = 0.0001;
        return ("{\"type\":\"Feature\",\"properties\":{\"height\":%s,\"confidence\":%s},"
                + "\"geometry\":{\"type\":\"Polygon\",\"coordinates\":[[[%s,%s],[%s,%s],[%s,%s],[%s,%s],[%s,%s]]]}}")
                .formatted(height, confidence, lon, lat, lon + d, lat, lon + d, lat + d, lon, lat + d, lon, lat);
    }

    private static byte[] gzip(String content) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(bytes)) {
            gz.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return bytes.toByteArray();
    }
}
