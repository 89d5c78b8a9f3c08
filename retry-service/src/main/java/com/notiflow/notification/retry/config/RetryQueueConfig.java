package com.notiflow.notification.retry.config;

import com.notiflow.notification.common.amqp.NotificationQueueTopology;
import com.notiflow.notification.common.amqp.RabbitConnector;
import com.notiflow.notification.common.queue.LoggedQueueConsumer;
import com.notiflow.notification.common.queue.LoggingQueueErrorHandler;
import com.notiflow.notification.common.queue.QueueConsumer;
import com.notiflow.notification.common.queue.RabbitRetryConsumer;
import com.notiflow.notification.common.queue.RetryConsumerSettings;
import com.notiflow.notification.common.retry.RetryQueuePolicy;
import com.notiflow.notification.retry.policy.MeteredRetryQueuePolicy;
import com.notiflow.notification.retry.policy.StaticRetryQueuePolicy;
import com.notiflow.notification.retry.usecase.CheckHealthUseCase;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetryQueueConfig {

    @Bean
    public RabbitConnector rabbitConnector(CachingConnectionFactory connectionFactory) {
        return new RabbitConnector(connectionFactory.getRabbitConnectionFactory());
    }

    @Bean
    public RetryQueuePolicy retryQueuePolicy(MeterRegistry meterRegistry) {
        return new MeteredRetryQueuePolicy(StaticRetryQueuePolicy.defaultPolicy(), meterRegistry);
    }

    @Bean
    public QueueConsumer retryConsumer(RabbitConnector connector,
                                       RetryQueuePolicy retryQueuePolicy,
                                       RetryConsumerProperties properties) {
        RetryConsumerSettings settings = RetryConsumerSettings.builder()
            .queue(properties.getQueue())
            .connectionName("retry-consumer")
            .prefetchCount(properties.getPrefetchCount())
            .publishTimeoutMs(properties.getPublishTimeoutMs())
            .healthcheckTimeoutMs(properties.getHealthcheckTimeoutMs())
            .build();
        RabbitRetryConsumer consumer = new RabbitRetryConsumer(
            connector, retryQueuePolicy, settings, new LoggingQueueErrorHandler("retry-consumer"));
        return new LoggedQueueConsumer(consumer, "retry-consumer");
    }

    @Bean
    @ConditionalOnProperty(prefix = "retry.consumer", name = "declare-topology", havingValue = "true")
    public Declarables notificationQueueTopology() {
        return NotificationQueueTopology.declarables();
    }

    @Bean
    public CheckHealthUseCase checkHealthUseCase(QueueConsumer retryConsumer) {
        return new CheckHealthUseCase(retryConsumer);
    }
}
