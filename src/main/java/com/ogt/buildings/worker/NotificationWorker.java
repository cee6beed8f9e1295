package com.ogt.buildings.worker;

import com.ogt.buildings.config.RabbitMQConfig;
import com.ogt.buildings.queue.JobMessage;
import com.ogt.buildings.service.ExportNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationWorker {

    private final ExportNotificationService notificationService;

    @RabbitListener(queues = RabbitMQConfig.NOTIFICATION_QUEUE)
    public void sendNotification(JobMessage message) {
        log.info("▶️ NotificationWorker recibió: run={}", message.getRunId());
        try {
            notificationService.sendCompletionEmail(message.getRunId());
        } catch (Exception e) {
            log.error("❌ Error enviando notificación de {}", message.getRunId(), e);
        }
    }
}
