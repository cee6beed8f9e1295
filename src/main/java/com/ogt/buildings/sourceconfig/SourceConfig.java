package com.ogt.buildings.sourceconfig;

import com.ogt.buildings.entity.BuildingSource;

import java.util.Map;

/**
 * Configuración tipada de una fuente. Cada fuente tiene su propia forma,
 * validada al construirse en {@link SourceConfigParser}.
 */
public interface SourceConfig {

    BuildingSource getSource();

    /** Configuración efectiva (con defaults) tal como se registra en {@code config_used}. */
    Map<String, Object> toMap();
}
