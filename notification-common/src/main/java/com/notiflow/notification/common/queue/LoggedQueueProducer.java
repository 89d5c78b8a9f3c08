package com.notiflow.notification.common.queue;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class LoggedQueueProducer<T> implements QueueProducer<T> {

    private final QueueProducer<T> delegate;
    private final String name;

    public LoggedQueueProducer(QueueProducer<T> delegate, String name) {
        this.delegate = delegate;
        this.name = name;
    }

    @Override
    public void start() {
        long startedAt = System.currentTimeMillis();
        try {
            delegate.start();
            log.debug("Producer {} started in {}ms", name, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.error("Failed to start producer {} after {}ms", name, System.currentTimeMillis() - startedAt, e);
            throw e;
        }
    }

    @Override
    public void publish(List<T> items) {
        long startedAt = System.currentTimeMillis();
        int count = items == null ? 0 : items.size();
        try {
            delegate.publish(items);
            log.info("Published {} messages via {} in {}ms", count, name, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} messages via {} after {}ms",
                count, name, System.currentTimeMillis() - startedAt, e);
            throw e;
        }
    }

    @Override
    public void shutdown() {
        long startedAt = System.currentTimeMillis();
        try {
            delegate.shutdown();
            log.debug("Producer {} stopped in {}ms", name, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.warn("Error stopping producer {} after {}ms", name, System.currentTimeMillis() - startedAt, e);
            throw e;
        }
    }

    @Override
    public void checkHealth() {
        long startedAt = System.currentTimeMillis();
        try {
            delegate.checkHealth();
            log.debug("Producer {} is healthy ({}ms)", name, System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.error("Producer {} is unavailable ({}ms): {}", name, System.currentTimeMillis() - startedAt, e.getMessage());
            throw e;
        }
    }
}
