package com.ogt.buildings.worker;

import com.ogt.buildings.config.RabbitMQConfig;
import com.ogt.buildings.queue.JobMessage;
import com.ogt.buildings.service.ExportRunCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExportRunWorker {

    private final ExportRunCoordinator coordinator;

    @RabbitListener(queues = RabbitMQConfig.EXPORT_QUEUE)
    public void processExport(JobMessage message) {
        log.info("▶️ ExportRunWorker recibió: run={} task={}", message.getRunId(), message.getTaskId());
        try {
            if (message.getRunId() == null) {
                throw new IllegalArgumentException("Mensaje sin runId: " + message);
            }
            coordinator.processRun(message.getRunId());
        } catch (Exception e) {
            // Nunca se relanza: un run fallido no debe quedar reencolándose
            log.error("❌ Error no controlado procesando {}", message, e);
        }
    }
}
