package com.notiflow.notification.common.queue;

import java.util.List;

/**
 * Publishes items onto a queue.
 *
 * @param <T> payload type
 */
public interface QueueProducer<T> {

    void start();

    /**
     * Publishes all items or fails as a whole. On failure the caller must treat the entire
     * list as unpublished; no partial result is reported.
     *
     * @throws com.notiflow.notification.common.exception.QueueNotStartedException if not started
     * @throws com.notiflow.notification.common.exception.QueueOperationException on timeout or broker error
     */
    void publish(List<T> items);

    void shutdown();

    void checkHealth();
}
