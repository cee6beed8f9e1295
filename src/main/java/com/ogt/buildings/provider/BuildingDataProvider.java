package com.ogt.buildings.provider;

import com.ogt.buildings.entity.BuildingSource;
import com.ogt.buildings.model.BuildingFeatureCollection;

/**
 * Acceso a un proveedor externo de huellas de edificios (uno por fuente).
 * Puede ser lento (red o disco) y lanzar {@code BuildingProviderException}.
 */
public interface BuildingDataProvider {

    BuildingSource getSource();

    BuildingFeatureCollection fetch(ProviderRequest request);
}
