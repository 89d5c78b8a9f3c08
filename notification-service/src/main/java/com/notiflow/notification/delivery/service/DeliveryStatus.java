package com.notiflow.notification.delivery.service;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryStatus {
    SUCCESS("success"),
    FAILURE("failure");

    private final String value;

    DeliveryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
