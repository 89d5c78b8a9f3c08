package com.notiflow.notification.delivery.config;

import com.notiflow.notification.common.amqp.QueueNames;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Maps to:
 * notification:
 *   queue:
 *     name: notifications
 *     max-batch-size: 1000
 *     batch-flush-timeout-ms: 60000
 */
@Configuration
@ConfigurationProperties(prefix = "notification.queue")
@Validated
@Data
public class QueueProperties {

    @NotBlank
    private String name = QueueNames.NOTIFICATIONS;

    /**
     * Flush as soon as this many messages are buffered. Also the channel prefetch.
     */
    @Min(1)
    private int maxBatchSize = 1000;

    /**
     * Flush whatever is buffered at this interval.
     */
    @Min(1)
    private long batchFlushTimeoutMs = 60000;

    /**
     * Upper bound for processing one batch; unsettled messages are nacked after it.
     */
    @Min(1)
    private long flushTimeoutMs = 30000;

    @Min(1)
    private int publishTimeoutMs = 5000;

    @Min(1)
    private int healthcheckTimeoutMs = 5000;

    /**
     * Declare the queue topology on startup. Off by default; production topology is
     * owned by the broker setup.
     */
    private boolean declareTopology = false;

    /**
     * Start the producer and the batch consumer with the application context.
     */
    private boolean autoStartup = true;
}
