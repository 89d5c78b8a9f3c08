package com.notiflow.notification.common.queue;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RetryConsumerSettings {

    String queue;

    @Builder.Default
    String connectionName = "retry-consumer";

    @Builder.Default
    int prefetchCount = 50;

    @Builder.Default
    long publishTimeoutMs = 5_000;

    @Builder.Default
    int healthcheckTimeoutMs = 5_000;
}
