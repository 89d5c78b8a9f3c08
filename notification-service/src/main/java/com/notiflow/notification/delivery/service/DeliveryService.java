package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.model.Notification;

import java.util.List;

public interface DeliveryService {

    /**
     * Delivers every notification with its own strategy. Never throws for a single bad
     * notification; the returned list has one result per input, in input order.
     */
    List<DeliveryResult> send(List<Notification> notifications);

    /**
     * @throws DeliveryHealthException if no channel can be checked or any check fails
     */
    void checkHealth();
}
