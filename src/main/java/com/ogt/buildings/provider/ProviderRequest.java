package com.ogt.buildings.provider;

import com.ogt.buildings.exception.BuildingProviderException;
import com.ogt.buildings.sourceconfig.SourceConfig;
import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Polygon;

import java.nio.file.Path;

@Value
@Builder
public class ProviderRequest {

    Polygon areaOfInterest;
    SourceConfig config;
    // Directorio temporal de la extracción; lo borra el extractor al terminar
    Path workDir;

    public <T extends SourceConfig> T configAs(Class<T> type) {
        if (!type.isInstance(config)) {
            throw new BuildingProviderException("Configuración inesperada para " + type.getSimpleName()
                    + ": " + (config == null ? "null" : config.getClass().getSimpleName()));
        }
        return type.cast(config);
    }
}
