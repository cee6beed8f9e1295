package com.ogt.buildings.config;

import com.ogt.buildings.queue.JobType;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class RabbitMQConfig {

    // ========== BUILDINGS EXCHANGE ==========
    public static final String EXCHANGE_NAME = "ogt.buildings.events";
    public static final String EXPORT_QUEUE = "buildings.export.queue";
    public static final String NOTIFICATION_QUEUE = "buildings.notification.queue";

    @Bean
    public TopicExchange buildingsExchange() {
        return ExchangeBuilder.topicExchange(EXCHANGE_NAME)
                .durable(true)
                .build();
    }

    // ========== COLAS DE TRABAJO ==========
    @Bean
    public Declarables jobQueues(TopicExchange buildingsExchange) {
        List<Declarable> declarables = new ArrayList<>();
        for (JobType type : JobType.values()) {
            Queue work = QueueBuilder.durable(type.getQueueName()).build();

            // Cola de espera: sin consumidores, expira y vuelve por dead-letter a la de trabajo
            Queue delay = QueueBuilder.durable(type.getDelayQueueName())
                    .deadLetterExchange(EXCHANGE_NAME)
                    .deadLetterRoutingKey(type.getRoutingKey())
                    .build();

            declarables.add(work);
            declarables.add(delay);
            declarables.add(BindingBuilder.bind(work).to(buildingsExchange).with(type.getRoutingKey()));
            declarables.add(BindingBuilder.bind(delay).to(buildingsExchange).with(type.getDelayRoutingKey()));
        }
        return new Declarables(declarables);
    }

    // ========== JSON MESSAGE CONVERTER ==========
    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    // ========== RABBIT TEMPLATE CON JSON CONVERTER ==========
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(jsonMessageConverter());
        return template;
    }
}
