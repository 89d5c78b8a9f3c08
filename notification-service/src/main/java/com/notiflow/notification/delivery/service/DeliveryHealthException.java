package com.notiflow.notification.delivery.service;

public class DeliveryHealthException extends RuntimeException {

    public DeliveryHealthException(String message) {
        super(message);
    }

    public DeliveryHealthException(String message, Throwable cause) {
        super(message, cause);
    }
}
