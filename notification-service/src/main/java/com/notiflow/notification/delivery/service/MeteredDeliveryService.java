package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.model.Notification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;

/**
 * Counts every delivery result, tagged by outcome and by the notification's attributes.
 */
public class MeteredDeliveryService implements DeliveryService {

    static final String PROCESSED_METRIC = "notifications.processed";
    static final String DURATION_METRIC = "notifications.delivery.duration";
    static final String UNKNOWN_SUBJECT = "unknown";

    private final DeliveryService delegate;
    private final MeterRegistry meterRegistry;
    private final Timer sendTimer;

    public MeteredDeliveryService(DeliveryService delegate, MeterRegistry meterRegistry) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;
        this.sendTimer = Timer.builder(DURATION_METRIC)
            .description("Time taken to deliver one batch of notifications")
            .register(meterRegistry);
    }

    @Override
    public List<DeliveryResult> send(List<Notification> notifications) {
        List<DeliveryResult> results = sendTimer.record(() -> delegate.send(notifications));
        for (DeliveryResult result : results) {
            record(result);
        }
        return results;
    }

    @Override
    public void checkHealth() {
        delegate.checkHealth();
    }

    private void record(DeliveryResult result) {
        Notification notification = result.notification();
        String subject = notification.subject() != null && notification.subject().id() != null
            ? notification.subject().id()
            : UNKNOWN_SUBJECT;

        // subject ids are only known at runtime, the registry deduplicates by name and tags
        Counter.builder(PROCESSED_METRIC)
            .description("Notifications processed by the delivery service")
            .tag("status", result.status().getValue())
            .tag("subject", subject)
            .tag("strategy", notification.effectiveStrategy().getValue())
            .tag("immediate", String.valueOf(notification.immediate()))
            .register(meterRegistry)
            .increment();
    }
}
