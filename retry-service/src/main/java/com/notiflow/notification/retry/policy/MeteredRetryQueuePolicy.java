package com.notiflow.notification.retry.policy;

import com.notiflow.notification.common.retry.RetryQueuePolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class MeteredRetryQueuePolicy implements RetryQueuePolicy {

    static final String ROUTED_METRIC = "notifications.retry.routed";

    private final RetryQueuePolicy delegate;
    private final MeterRegistry meterRegistry;

    public MeteredRetryQueuePolicy(RetryQueuePolicy delegate, MeterRegistry meterRegistry) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String getRetryQueue(int attemptCount) {
        String queue = delegate.getRetryQueue(attemptCount);
        Counter.builder(ROUTED_METRIC)
            .description("Messages routed by the retry policy")
            .tag("queue", queue)
            .register(meterRegistry)
            .increment();
        return queue;
    }
}
