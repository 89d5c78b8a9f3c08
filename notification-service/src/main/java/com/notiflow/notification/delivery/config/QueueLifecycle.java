package com.notiflow.notification.delivery.config;

import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.queue.QueueConsumer;
import com.notiflow.notification.common.queue.QueueProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the producer before the consumer so that nothing is consumed before retries can
 * be published, and stops them in reverse order. The consumer drains its buffer on stop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "notification.queue", name = "auto-startup", havingValue = "true", matchIfMissing = true)
public class QueueLifecycle implements SmartLifecycle {

    private final QueueProducer<Notification> producer;
    private final QueueConsumer batchConsumer;

    private volatile boolean running;

    @Override
    public void start() {
        producer.start();
        try {
            batchConsumer.start();
        } catch (RuntimeException e) {
            producer.shutdown();
            throw e;
        }
        running = true;
        log.info("Notification queue components started");
    }

    @Override
    public void stop() {
        try {
            batchConsumer.shutdown();
        } finally {
            producer.shutdown();
            running = false;
        }
        log.info("Notification queue components stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
