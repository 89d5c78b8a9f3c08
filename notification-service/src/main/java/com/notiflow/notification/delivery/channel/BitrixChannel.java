package com.notiflow.notification.delivery.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.notiflow.notification.common.model.BitrixContact;
import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.Contact;
import com.notiflow.notification.delivery.config.BitrixChannelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Personal notifications in Bitrix24 via the {@code im.notify.personal.add} REST method,
 * authenticated with an incoming webhook ({@code /rest/{userId}/{authToken}/}).
 */
@Slf4j
public class BitrixChannel implements NotificationChannel {

    private static final String NOTIFY_PATH = "/rest/{userId}/{authToken}/im.notify.personal.add.json";

    private final WebClient webClient;
    private final BitrixChannelProperties properties;

    public BitrixChannel(WebClient webClient, BitrixChannelProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.BITRIX;
    }

    @Override
    public void send(Contact contact, String message) {
        if (!(contact instanceof BitrixContact bitrixContact)) {
            throw new ChannelDeliveryException(ChannelType.BITRIX,
                "Invalid recipient: expected Bitrix user id, got " + (contact == null ? "null" : contact.getType().getValue()));
        }

        JsonNode response;
        try {
            response = webClient.post()
                .uri(builder -> builder.path(NOTIFY_PATH)
                    .queryParam("user_id", "{recipient}")
                    .queryParam("message", "{message}")
                    .build(Map.of(
                        "userId", properties.getUserId(),
                        "authToken", properties.getAuthToken(),
                        "recipient", bitrixContact.value(),
                        "message", message)))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(properties.getSendTimeoutMs()))
                .block();
        } catch (WebClientResponseException e) {
            throw new ChannelDeliveryException(ChannelType.BITRIX,
                "Bitrix responded with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new ChannelDeliveryException(ChannelType.BITRIX, "Failed to send notification via Bitrix", e);
        }

        if (!isAccepted(response)) {
            throw new ChannelDeliveryException(ChannelType.BITRIX,
                "Bitrix returned a successful status but the operation failed");
        }
        log.debug("Bitrix notification sent to user {}", bitrixContact.value());
    }

    @Override
    public boolean isHealthCheckable() {
        return true;
    }

    @Override
    public void checkHealth() {
        try {
            webClient.get()
                .uri("/")
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofMillis(properties.getHealthcheckTimeoutMs()))
                .block();
        } catch (RuntimeException e) {
            throw new ChannelDeliveryException(ChannelType.BITRIX, "Bitrix is unavailable", e);
        }
    }

    private static boolean isAccepted(JsonNode response) {
        if (response == null) {
            return false;
        }
        JsonNode result = response.get("result");
        if (result == null || result.isNull()) {
            return false;
        }
        if (result.isBoolean()) {
            return result.asBoolean();
        }
        if (result.isNumber()) {
            return result.asLong() != 0;
        }
        return !result.asText().isEmpty();
    }
}
