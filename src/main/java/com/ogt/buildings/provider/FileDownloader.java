package com.ogt.buildings.provider;

import com.ogt.buildings.exception.BuildingProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Descarga por streaming a un archivo del directorio de trabajo (los tiles de
 * Microsoft y Google pesan decenas de MB, no se cargan en memoria).
 */
@Slf4j
final class FileDownloader {

    private FileDownloader() {}

    static Path download(RestClient client, String url, Path target) {
        log.debug("Descargando {} -> {}", url, target);
        try {
            return client.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isError()) {
                            throw new BuildingProviderException(
                                    "Descarga fallida (" + response.getStatusCode().value() + "): " + url);
                        }
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return target;
                    });
        } catch (RestClientException e) {
            throw new BuildingProviderException("Error descargando " + url + ": " + e.getMessage(), e);
        }
    }
}
