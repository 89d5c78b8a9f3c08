package com.notiflow.notification.delivery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.notiflow.notification.common.model.Contact;
import com.notiflow.notification.common.model.DeliveryStrategy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A notification as submitted by a caller, before id, timestamp and subject are assigned.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IncomingNotification {

    @NotEmpty(message = "At least one contact is required")
    private List<@NotNull(message = "Contact must not be null") Contact> contacts;

    @NotBlank(message = "Message is required")
    private String message;

    private DeliveryStrategy strategy;

    @JsonProperty("isImmediate")
    private boolean immediate;
}
