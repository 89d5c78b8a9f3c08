package com.notiflow.notification.delivery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "notification.channels.email")
@Validated
@Data
public class EmailChannelProperties {

    private boolean enabled = false;

    @ToString.Exclude
    private String apiKey;

    private String fromEmail;

    private String fromName;

    private String subject = "Notification";

    @Min(1)
    private long sendTimeoutMs = 10000;

    @Min(1)
    private long healthcheckTimeoutMs = 5000;

    @AssertTrue(message = "api-key and from-email are required when the email channel is enabled")
    public boolean isConfigured() {
        return !enabled || (StringUtils.hasText(apiKey) && StringUtils.hasText(fromEmail));
    }
}
