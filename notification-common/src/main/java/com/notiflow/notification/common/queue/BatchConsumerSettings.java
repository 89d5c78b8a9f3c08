package com.notiflow.notification.common.queue;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchConsumerSettings {

    String queue;

    @Builder.Default
    String connectionName = "batch-consumer";

    /** Buffer size that triggers a flush; also the prefetch advertised to the broker. */
    @Builder.Default
    int maxBatchSize = 1000;

    /** Interval of the periodic flush of a non-empty buffer. */
    @Builder.Default
    long batchFlushTimeoutMs = 60_000;

    /** Upper bound for one flush: handler invocation plus all acks and nacks. */
    @Builder.Default
    long flushTimeoutMs = 30_000;

    @Builder.Default
    int healthcheckTimeoutMs = 5_000;
}
