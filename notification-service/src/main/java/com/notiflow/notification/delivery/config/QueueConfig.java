package com.notiflow.notification.delivery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notiflow.notification.common.amqp.NotificationQueueTopology;
import com.notiflow.notification.common.amqp.RabbitConnector;
import com.notiflow.notification.common.codec.JsonMessageCodec;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.queue.BatchConsumerSettings;
import com.notiflow.notification.common.queue.LoggedQueueConsumer;
import com.notiflow.notification.common.queue.LoggedQueueProducer;
import com.notiflow.notification.common.queue.LoggingQueueErrorHandler;
import com.notiflow.notification.common.queue.ProducerSettings;
import com.notiflow.notification.common.queue.QueueConsumer;
import com.notiflow.notification.common.queue.QueueProducer;
import com.notiflow.notification.common.queue.RabbitBatchConsumer;
import com.notiflow.notification.common.queue.RabbitProducer;
import com.notiflow.notification.delivery.service.DeliveryService;
import com.notiflow.notification.delivery.usecase.CheckHealthUseCase;
import com.notiflow.notification.delivery.usecase.HandleIncomingNotificationsUseCase;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Wires the producer and the batch consumer of the main queue. Both open their own
 * connections from the client factory that Spring Boot configured from {@code spring.rabbitmq.*}.
 */
@Configuration
public class QueueConfig {

    @Bean
    public RabbitConnector rabbitConnector(CachingConnectionFactory connectionFactory) {
        return new RabbitConnector(connectionFactory.getRabbitConnectionFactory());
    }

    @Bean
    public JsonMessageCodec<Notification> notificationCodec(ObjectMapper objectMapper) {
        return new JsonMessageCodec<>(objectMapper, Notification.class);
    }

    @Bean
    public QueueProducer<Notification> notificationProducer(RabbitConnector connector,
                                                            JsonMessageCodec<Notification> codec,
                                                            QueueProperties properties) {
        ProducerSettings settings = ProducerSettings.builder()
            .queue(properties.getName())
            .connectionName("notification-producer")
            .publishTimeoutMs(properties.getPublishTimeoutMs())
            .healthcheckTimeoutMs(properties.getHealthcheckTimeoutMs())
            .build();
        return new LoggedQueueProducer<>(new RabbitProducer<>(connector, codec, settings), "notification-producer");
    }

    @Bean
    public QueueConsumer notificationBatchConsumer(RabbitConnector connector,
                                                   JsonMessageCodec<Notification> codec,
                                                   DeliveryService deliveryService,
                                                   QueueProperties properties) {
        BatchConsumerSettings settings = BatchConsumerSettings.builder()
            .queue(properties.getName())
            .connectionName("notification-batch-consumer")
            .maxBatchSize(properties.getMaxBatchSize())
            .batchFlushTimeoutMs(properties.getBatchFlushTimeoutMs())
            .flushTimeoutMs(properties.getFlushTimeoutMs())
            .healthcheckTimeoutMs(properties.getHealthcheckTimeoutMs())
            .build();
        RabbitBatchConsumer<Notification> consumer = new RabbitBatchConsumer<>(
            connector, codec, deliveryService::send, settings,
            new LoggingQueueErrorHandler("notification-batch-consumer"));
        return new LoggedQueueConsumer(consumer, "notification-batch-consumer");
    }

    @Bean
    @ConditionalOnProperty(prefix = "notification.queue", name = "declare-topology", havingValue = "true")
    public Declarables notificationQueueTopology() {
        return NotificationQueueTopology.declarables();
    }

    @Bean
    public HandleIncomingNotificationsUseCase handleIncomingNotificationsUseCase(
            QueueProducer<Notification> producer,
            DeliveryService deliveryService,
            Supplier<String> notificationIdGenerator,
            Clock clock) {
        return new HandleIncomingNotificationsUseCase(producer, deliveryService, notificationIdGenerator, clock);
    }

    @Bean
    public CheckHealthUseCase checkHealthUseCase(DeliveryService deliveryService,
                                                 QueueProducer<Notification> producer,
                                                 QueueConsumer batchConsumer,
                                                 @Qualifier("healthCheckExecutor") ExecutorService healthCheckExecutor,
                                                 DeliveryProperties deliveryProperties) {
        return new CheckHealthUseCase(deliveryService, producer, batchConsumer, healthCheckExecutor,
            Duration.ofMillis(deliveryProperties.getHealthcheckTimeoutMs()));
    }
}
