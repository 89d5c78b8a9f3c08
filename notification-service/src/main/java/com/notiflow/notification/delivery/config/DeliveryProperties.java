package com.notiflow.notification.delivery.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "notification.delivery")
@Validated
@Data
public class DeliveryProperties {

    /**
     * Worker threads delivering the notifications of one batch concurrently.
     */
    @Min(1)
    private int parallelism = 16;

    /**
     * Deadline for one round of health checks (channels, producer and consumer together).
     */
    @Min(1)
    private long healthcheckTimeoutMs = 10000;
}
