package com.notiflow.notification.delivery.usecase;

import com.notiflow.notification.common.health.HealthChecks;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.queue.QueueConsumer;
import com.notiflow.notification.common.queue.QueueProducer;
import com.notiflow.notification.delivery.service.DeliveryService;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Checks channels, the producer's broker and the consumer's broker concurrently, giving up
 * after {@code timeout}. The executor must not be the delivery pool.
 */
public class CheckHealthUseCase {

    private final DeliveryService deliveryService;
    private final QueueProducer<Notification> producer;
    private final QueueConsumer batchConsumer;
    private final Executor executor;
    private final Duration timeout;

    public CheckHealthUseCase(DeliveryService deliveryService,
                              QueueProducer<Notification> producer,
                              QueueConsumer batchConsumer,
                              Executor executor,
                              Duration timeout) {
        this.deliveryService = deliveryService;
        this.producer = producer;
        this.batchConsumer = batchConsumer;
        this.executor = executor;
        this.timeout = timeout;
    }

    public void checkHealth() {
        HealthChecks.runAll(List.of(
            deliveryService::checkHealth,
            producer::checkHealth,
            batchConsumer::checkHealth
        ), executor, timeout);
    }
}
