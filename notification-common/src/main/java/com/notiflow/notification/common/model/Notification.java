package com.notiflow.notification.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Outgoing notification as it travels on the main and retry queues.
 *
 * <p>Immutable once enriched at ingress. {@code strategy} may be null on the wire,
 * in which case {@link DeliveryStrategy#DEFAULT} applies.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Notification(
    String id,
    Instant createdAt,
    List<Contact> contacts,
    String message,
    DeliveryStrategy strategy,
    @JsonProperty("isImmediate") boolean immediate,
    Subject subject
) {

    public Notification {
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
    }

    public DeliveryStrategy effectiveStrategy() {
        return strategy != null ? strategy : DeliveryStrategy.DEFAULT;
    }
}
