package com.notiflow.notification.common.amqp;

import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import java.time.Duration;

/**
 * Broker topology of the retry pipeline.
 *
 * <pre>
 * notifications --nack--> notifications.retry.router --(retry service)--> retry.30m | retry.2h | dlq
 * retry.30m / retry.2h --ttl--> notifications
 * notifications.retry.router --nack--> notifications.retry.router.dlq
 * </pre>
 *
 * Normally provisioned once at deployment. Services register these declarables only when
 * topology declaration is switched on in their configuration.
 */
public final class NotificationQueueTopology {

    public static final Duration SHORT_DELAY = Duration.ofMinutes(30);
    public static final Duration LONG_DELAY = Duration.ofHours(2);

    private static final String DEFAULT_EXCHANGE = "";

    private NotificationQueueTopology() {
    }

    public static Declarables declarables() {
        Queue routerDlq = QueueBuilder.durable(QueueNames.RETRY_ROUTER_DLQ).build();
        Queue dlq = QueueBuilder.durable(QueueNames.DLQ).build();

        Queue longDelay = QueueBuilder.durable(QueueNames.RETRY_2H)
            .deadLetterExchange(DEFAULT_EXCHANGE)
            .deadLetterRoutingKey(QueueNames.NOTIFICATIONS)
            .ttl((int) LONG_DELAY.toMillis())
            .build();

        Queue shortDelay = QueueBuilder.durable(QueueNames.RETRY_30M)
            .deadLetterExchange(DEFAULT_EXCHANGE)
            .deadLetterRoutingKey(QueueNames.NOTIFICATIONS)
            .ttl((int) SHORT_DELAY.toMillis())
            .build();

        Queue router = QueueBuilder.durable(QueueNames.RETRY_ROUTER)
            .deadLetterExchange(DEFAULT_EXCHANGE)
            .deadLetterRoutingKey(QueueNames.RETRY_ROUTER_DLQ)
            .build();

        Queue main = QueueBuilder.durable(QueueNames.NOTIFICATIONS)
            .deadLetterExchange(DEFAULT_EXCHANGE)
            .deadLetterRoutingKey(QueueNames.RETRY_ROUTER)
            .build();

        return new Declarables(routerDlq, dlq, longDelay, shortDelay, router, main);
    }
}
