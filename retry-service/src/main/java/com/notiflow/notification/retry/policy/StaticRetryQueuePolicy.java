package com.notiflow.notification.retry.policy;

import com.notiflow.notification.common.amqp.QueueNames;
import com.notiflow.notification.common.retry.RetryQueuePolicy;
import com.notiflow.notification.common.retry.RetryRoute;

import java.util.List;

/**
 * Fixed routing table: each route covers attempts up to its {@code maxAttempt}, everything
 * past the last route goes to the terminal queue.
 *
 * <pre>
 *   attempt &lt;= 1  -&gt; notifications.retry.30m
 *   attempt  = 2  -&gt; notifications.retry.2h
 *   otherwise     -&gt; notifications.dlq
 * </pre>
 */
public class StaticRetryQueuePolicy implements RetryQueuePolicy {

    private final List<RetryRoute> routes;
    private final String terminalQueue;

    public StaticRetryQueuePolicy(List<RetryRoute> routes, String terminalQueue) {
        if (terminalQueue == null || terminalQueue.isBlank()) {
            throw new IllegalArgumentException("terminalQueue must not be blank");
        }
        for (int i = 1; i < routes.size(); i++) {
            if (routes.get(i).maxAttempt() <= routes.get(i - 1).maxAttempt()) {
                throw new IllegalArgumentException("Routes must be ordered by strictly increasing maxAttempt");
            }
        }
        this.routes = List.copyOf(routes);
        this.terminalQueue = terminalQueue;
    }

    public static StaticRetryQueuePolicy defaultPolicy() {
        return new StaticRetryQueuePolicy(
            List.of(new RetryRoute(1, QueueNames.RETRY_30M), new RetryRoute(2, QueueNames.RETRY_2H)),
            QueueNames.DLQ);
    }

    @Override
    public String getRetryQueue(int attemptCount) {
        for (RetryRoute route : routes) {
            if (attemptCount <= route.maxAttempt()) {
                return route.queue();
            }
        }
        return terminalQueue;
    }

    public int getMaxAttempts() {
        return routes.isEmpty() ? 0 : routes.get(routes.size() - 1).maxAttempt();
    }
}
