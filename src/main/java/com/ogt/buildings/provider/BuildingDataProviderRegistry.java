package com.ogt.buildings.provider;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.exception.BuildingProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class BuildingDataProviderRegistry {

    private final Map<BuildingSource, BuildingDataProvider> providers = new EnumMap<>(BuildingSource.class);

    public BuildingDataProviderRegistry(List<BuildingDataProvider> available) {
        for (BuildingDataProvider provider : available) {
            BuildingDataProvider previous = providers.put(provider.getSource(), provider);
            if (previous != null) {
                throw new IllegalStateException("Proveedor duplicado para " + provider.getSource().getId());
            }
        }
        log.info("🚀 Proveedores de edificios registrados: {}", providers.keySet());
    }

    public BuildingDataProvider get(BuildingSource source) {
        BuildingDataProvider provider = providers.get(source);
        if (provider == null) {
            throw new BuildingProviderException("No provider registered for source: " + source.getId());
        }
        return provider;
    }
}
