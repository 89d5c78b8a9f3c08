package com.notiflow.notification.common.queue;

/**
 * Broker consumer with an explicit lifecycle.
 *
 * <p>{@link #start()} and {@link #shutdown()} are idempotent and mutually exclusive: a call
 * made while the other is in progress, or while already in the requested state, is a no-op.
 */
public interface QueueConsumer {

    void start();

    void shutdown();

    /**
     * Verifies the broker is reachable using a throwaway connection.
     */
    void checkHealth();
}
