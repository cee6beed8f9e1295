package com.ogt.buildings.queue;

import java.time.Duration;
import java.util.UUID;

/**
 * Contrato de la cola de trabajos: "enviar trabajo, recibir ejecución". Cada mensaje
 * se entrega a un único worker.
 */
public interface JobQueue {

    /**
     * Programa un trabajo para una ejecución, opcionalmente con retraso.
     *
     * @return handle opaco de la tarea, para trazabilidad
     */
    String schedule(JobType type, UUID runId, Duration delay);
}
