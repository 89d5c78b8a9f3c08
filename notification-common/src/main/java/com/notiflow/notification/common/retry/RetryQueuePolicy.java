package com.notiflow.notification.common.retry;

/**
 * Maps a retry attempt to the queue the message must be republished to.
 *
 * Implementations must be pure, total and deterministic: every attempt count, including
 * counts far beyond the configured ceiling, maps to a queue, and no I/O happens here.
 * Exhausting the attempts is not an error; it routes to the terminal dead-letter queue.
 */
public interface RetryQueuePolicy {

    /**
     * Resolve the destination queue for a retry attempt.
     *
     * @param attemptCount 1-based attempt number (the incremented {@code x-retry-count})
     * @return queue name
     */
    String getRetryQueue(int attemptCount);
}
