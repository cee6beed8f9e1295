package com.ogt.buildings.queue;

import com.ogt.buildings.config.RabbitMQConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Cola sobre RabbitMQ. El retraso se implementa con una cola de espera por tipo:
 * el mensaje expira (TTL por mensaje) y se re-enruta por dead-letter a la cola de trabajo.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RabbitJobQueue implements JobQueue {

    private final RabbitTemplate rabbitTemplate;

    @Override
    public String schedule(JobType type, UUID runId, Duration delay) {
        String taskId = UUID.randomUUID().toString();
        boolean delayed = delay != null && !delay.isNegative() && !delay.isZero();
        String routingKey = delayed ? type.getDelayRoutingKey() : type.getRoutingKey();

        rabbitTemplate.convertAndSend(RabbitMQConfig.EXCHANGE_NAME, routingKey,
                new JobMessage(taskId, type, runId), message -> {
                    message.getMessageProperties().setMessageId(taskId);
                    if (delayed) {
                        message.getMessageProperties().setExpiration(String.valueOf(delay.toMillis()));
                    }
                    return message;
                });

        log.info("🚀 {} encolado para run {} (task {}, delay {})", type, runId, taskId, delayed ? delay : "0s");
        return taskId;
    }
}
