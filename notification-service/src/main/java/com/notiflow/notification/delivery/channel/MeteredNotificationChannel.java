package com.notiflow.notification.delivery.channel;

import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.Contact;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Records send latency and outcome per channel. Health checks pass through untouched.
 */
public class MeteredNotificationChannel implements NotificationChannel {

    static final String SEND_DURATION_METRIC = "notifications.channel.send.duration";
    static final String PROCESSED_METRIC = "notifications.processed.by.channel";

    private static final String SUCCESS = "success";
    private static final String FAILURE = "failure";

    private final NotificationChannel delegate;
    private final Timer successTimer;
    private final Timer failureTimer;
    private final Counter successCounter;
    private final Counter failureCounter;

    public MeteredNotificationChannel(NotificationChannel delegate, MeterRegistry meterRegistry) {
        this.delegate = delegate;
        String channel = delegate.getType().getValue();
        this.successTimer = timer(meterRegistry, channel, SUCCESS);
        this.failureTimer = timer(meterRegistry, channel, FAILURE);
        this.successCounter = counter(meterRegistry, channel, SUCCESS);
        this.failureCounter = counter(meterRegistry, channel, FAILURE);
    }

    @Override
    public ChannelType getType() {
        return delegate.getType();
    }

    @Override
    public boolean supports(Contact contact) {
        return delegate.supports(contact);
    }

    @Override
    public void send(Contact contact, String message) {
        long start = System.nanoTime();
        try {
            delegate.send(contact, message);
        } catch (RuntimeException e) {
            failureTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            failureCounter.increment();
            throw e;
        }
        successTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        successCounter.increment();
    }

    @Override
    public boolean isHealthCheckable() {
        return delegate.isHealthCheckable();
    }

    @Override
    public void checkHealth() {
        delegate.checkHealth();
    }

    private static Timer timer(MeterRegistry registry, String channel, String status) {
        return Timer.builder(SEND_DURATION_METRIC)
            .description("Time taken by one channel send")
            .tag("channel", channel)
            .tag("status", status)
            .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String channel, String status) {
        return Counter.builder(PROCESSED_METRIC)
            .description("Sends attempted per channel")
            .tag("channel", channel)
            .tag("status", status)
            .register(registry);
    }
}
