package com.ogt.buildings.queue;

import com.ogt.buildings.config.RabbitMQConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessagePostProcessor;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RabbitJobQueueTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private RabbitJobQueue jobQueue;

    private final UUID runId = UUID.randomUUID();

    @Test
    void immediateJobGoesToWorkQueue() {
        String taskId = jobQueue.schedule(JobType.PROCESS_EXPORT, runId, Duration.ZERO);

        ArgumentCaptor<JobMessage> payload = ArgumentCaptor.forClass(JobMessage.class);
        ArgumentCaptor<MessagePostProcessor> postProcessor = ArgumentCaptor.forClass(MessagePostProcessor.class);
        verify(rabbitTemplate).convertAndSend(eq(RabbitMQConfig.EXCHANGE_NAME), eq("buildings.export.queue"),
                payload.capture(), postProcessor.capture());

        assertThat(payload.getValue().getRunId()).isEqualTo(runId);
        assertThat(payload.getValue().getTaskId()).isEqualTo(taskId);
        assertThat(payload.getValue().getType()).isEqualTo(JobType.PROCESS_EXPORT);

        Message message = postProcessor.getValue().postProcessMessage(new Message(new byte[0], new MessageProperties()));
        assertThat(message.getMessageProperties().getMessageId()).isEqualTo(taskId);
        assertThat(message.getMessageProperties().getExpiration()).isNull();
    }

    @Test
    void delayedJobWaitsInDelayQueueWithTtl() {
        jobQueue.schedule(JobType.SEND_COMPLETION_EMAIL, runId, Duration.ofSeconds(30));

        ArgumentCaptor<MessagePostProcessor> postProcessor = ArgumentCaptor.forClass(MessagePostProcessor.class);
        verify(rabbitTemplate).convertAndSend(eq(RabbitMQConfig.EXCHANGE_NAME), eq("buildings.notification.delay"),
                any(JobMessage.class), postProcessor.capture());

        Message message = postProcessor.getValue().postProcessMessage(new Message(new byte[0], new MessageProperties()));
        assertThat(message.getMessageProperties().getExpiration()).isEqualTo("30000");
    }

    @Test
    void delayQueueNamesDeriveFromWorkQueues() {
        assertThat(JobType.PROCESS_EXPORT.getDelayQueueName()).isEqualTo("buildings.export.delay");
        assertThat(JobType.SEND_COMPLETION_EMAIL.getQueueName()).isEqualTo(RabbitMQConfig.NOTIFICATION_QUEUE);
    }
}
