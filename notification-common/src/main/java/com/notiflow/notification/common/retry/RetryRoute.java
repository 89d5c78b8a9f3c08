package com.notiflow.notification.common.retry;

/**
 * One row of a retry routing table: attempts up to and including {@code maxAttempt}
 * go to {@code queue}.
 */
public record RetryRoute(int maxAttempt, String queue) {

    public RetryRoute {
        if (maxAttempt < 1) {
            throw new IllegalArgumentException("maxAttempt must be positive: " + maxAttempt);
        }
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
    }
}
