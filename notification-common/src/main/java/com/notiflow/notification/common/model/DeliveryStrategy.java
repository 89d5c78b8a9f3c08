package com.notiflow.notification.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a notification is fanned out over its contacts and the configured channels.
 *
 * <ul>
 *   <li>SEND_TO_FIRST_AVAILABLE: stop at the first channel that accepts the message</li>
 *   <li>SEND_TO_ALL_AVAILABLE: try every supporting channel of every contact</li>
 * </ul>
 */
public enum DeliveryStrategy {
    SEND_TO_FIRST_AVAILABLE("sendToFirstAvailable"),
    SEND_TO_ALL_AVAILABLE("sendToAllAvailable");

    public static final DeliveryStrategy DEFAULT = SEND_TO_FIRST_AVAILABLE;

    private final String value;

    DeliveryStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DeliveryStrategy fromValue(String value) {
        for (DeliveryStrategy strategy : values()) {
            if (strategy.value.equals(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown delivery strategy: " + value);
    }
}
