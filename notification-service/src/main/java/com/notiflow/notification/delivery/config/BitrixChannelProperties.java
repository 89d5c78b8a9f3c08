package com.notiflow.notification.delivery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * Bitrix24 incoming webhook: requests go to {@code {base-url}/rest/{user-id}/{auth-token}/...}.
 */
@Configuration
@ConfigurationProperties(prefix = "notification.channels.bitrix")
@Validated
@Data
public class BitrixChannelProperties {

    private boolean enabled = false;

    private String baseUrl;

    private String userId;

    @ToString.Exclude
    private String authToken;

    @Min(1)
    private long sendTimeoutMs = 10000;

    @Min(1)
    private long healthcheckTimeoutMs = 5000;

    @AssertTrue(message = "base-url, user-id and auth-token are required when the Bitrix channel is enabled")
    public boolean isConfigured() {
        return !enabled
            || (StringUtils.hasText(baseUrl) && StringUtils.hasText(userId) && StringUtils.hasText(authToken));
    }
}
