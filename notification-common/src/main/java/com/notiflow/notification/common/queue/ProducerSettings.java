package com.notiflow.notification.common.queue;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProducerSettings {

    String queue;

    @Builder.Default
    String connectionName = "producer";

    /** Bound for publishing a whole list and receiving the broker's confirms. */
    @Builder.Default
    long publishTimeoutMs = 5_000;

    @Builder.Default
    int healthcheckTimeoutMs = 5_000;
}
