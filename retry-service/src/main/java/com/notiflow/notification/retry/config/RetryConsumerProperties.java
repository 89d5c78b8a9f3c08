package com.notiflow.notification.retry.config;

import com.notiflow.notification.common.amqp.QueueNames;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Maps to:
 * retry:
 *   consumer:
 *     queue: notifications.retry.router
 *     publish-timeout-ms: 5000
 */
@Configuration
@ConfigurationProperties(prefix = "retry.consumer")
@Validated
@Data
public class RetryConsumerProperties {

    @NotBlank
    @Size(min = 3, max = 256)
    private String queue = QueueNames.RETRY_ROUTER;

    /**
     * Unacked deliveries held by the consumer at once.
     */
    @Min(1)
    private int prefetchCount = 50;

    /**
     * How long to wait for the broker to confirm a republish before nacking the original.
     */
    @Min(1)
    private int publishTimeoutMs = 5000;

    @Min(1)
    private int healthcheckTimeoutMs = 5000;

    private boolean declareTopology = false;

    private boolean autoStartup = true;
}
