package com.notiflow.notification.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery channel discriminant. Doubles as the contact type on the wire.
 */
public enum ChannelType {
    EMAIL("email"),
    BITRIX("bitrix");

    private final String value;

    ChannelType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ChannelType fromValue(String value) {
        for (ChannelType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown channel type: " + value);
    }
}
