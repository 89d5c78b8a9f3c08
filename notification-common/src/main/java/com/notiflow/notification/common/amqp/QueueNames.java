package com.notiflow.notification.common.amqp;

/**
 * Queue names of the delivery pipeline. All queues live on the default exchange.
 */
public final class QueueNames {

    /** Primary intake, consumed in batches by the notification service. */
    public static final String NOTIFICATIONS = "notifications";
    /** Dead-letter target of {@link #NOTIFICATIONS}, consumed by the retry service. */
    public static final String RETRY_ROUTER = "notifications.retry.router";
    public static final String RETRY_ROUTER_DLQ = "notifications.retry.router.dlq";
    public static final String RETRY_30M = "notifications.retry.30m";
    public static final String RETRY_2H = "notifications.retry.2h";
    /** Terminal queue, nothing consumes it automatically. */
    public static final String DLQ = "notifications.dlq";

    private QueueNames() {
    }
}
