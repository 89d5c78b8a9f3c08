package com.notiflow.notification.common.queue;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs lifecycle and health events of a wrapped consumer with their duration.
 */
@Slf4j
public class LoggedQueueConsumer implements QueueConsumer {

    private final QueueConsumer delegate;
    private final String name;

    public LoggedQueueConsumer(QueueConsumer delegate, String name) {
        this.delegate = delegate;
        this.name = name;
    }

    @Override
    public void start() {
        long startedAt = System.currentTimeMillis();
        try {
            delegate.start();
            log.debug("Consumer {} started in {}ms", name, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.error("Failed to start consumer {} after {}ms", name, System.currentTimeMillis() - startedAt, e);
            throw e;
        }
    }

    @Override
    public void shutdown() {
        long startedAt = System.currentTimeMillis();
        try {
            delegate.shutdown();
            log.debug("Consumer {} stopped in {}ms", name, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.warn("Error stopping consumer {} after {}ms", name, System.currentTimeMillis() - startedAt, e);
            throw e;
        }
    }

    @Override
    public void checkHealth() {
        long startedAt = System.currentTimeMillis();
        try {
            delegate.checkHealth();
            log.debug("Consumer {} is healthy ({}ms)", name, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.error("Consumer {} is unavailable ({}ms): {}", name, System.currentTimeMillis() - startedAt, e.getMessage());
            throw e;
        }
    }
}
