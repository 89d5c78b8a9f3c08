package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.model.Notification;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class LoggedDeliveryService implements DeliveryService {

    private final DeliveryService delegate;

    public LoggedDeliveryService(DeliveryService delegate) {
        this.delegate = delegate;
    }

    @Override
    public List<DeliveryResult> send(List<Notification> notifications) {
        long startedAt = System.currentTimeMillis();
        List<DeliveryResult> results = delegate.send(notifications);
        long durationMs = System.currentTimeMillis() - startedAt;

        List<String> successfulIds = new ArrayList<>();
        List<String> failedIds = new ArrayList<>();
        List<String> warningIds = new ArrayList<>();
        for (DeliveryResult result : results) {
            String id = result.notification().id();
            if (result.isSuccess()) {
                successfulIds.add(id);
            } else {
                failedIds.add(id);
            }
            if (!result.warnings().isEmpty()) {
                warningIds.add(id);
            }
        }

        if (!failedIds.isEmpty()) {
            log.error("Failed to deliver {} of {} notifications in {}ms: failed={}, withWarnings={}",
                failedIds.size(), results.size(), durationMs, failedIds, warningIds);
        } else if (!warningIds.isEmpty()) {
            log.warn("Delivered {} notifications with warnings in {}ms: withWarnings={}",
                successfulIds.size(), durationMs, warningIds);
        } else {
            log.info("Delivered {} notifications in {}ms", successfulIds.size(), durationMs);
        }
        return results;
    }

    @Override
    public void checkHealth() {
        long startedAt = System.currentTimeMillis();
        try {
            delegate.checkHealth();
            log.debug("Delivery service is healthy ({}ms)", System.currentTimeMillis() - startedAt);
        } catch (RuntimeException e) {
            log.error("Delivery service is not ready ({}ms)", System.currentTimeMillis() - startedAt, e);
            throw e;
        }
    }
}
