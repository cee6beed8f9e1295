package com.ogt.buildings.exception;

/**
 * Configuración inválida (fuente, formato, config de fuente o AOI).
 * Se lanza antes de iniciar cualquier extracción.
 */
public class ExportConfigurationException extends BusinessException {

    public ExportConfigurationException(String message) {
        super(message);
    }
}
