package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.health.HealthChecks;
import com.notiflow.notification.common.model.DeliveryStrategy;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.delivery.channel.NotificationChannel;
import com.notiflow.notification.delivery.service.strategy.DeliveryStrategyHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs the notifications of one call concurrently, each through the strategy it asks for.
 *
 * <p>{@link #send(List)} waits interruptibly: an interrupted caller cancels the deliveries
 * that have not started yet and gets an exception instead of results. Channel health checks
 * run on their own executor so they never queue behind deliveries.
 */
@Slf4j
public class DefaultDeliveryService implements DeliveryService {

    private final List<NotificationChannel> channels;
    private final Map<DeliveryStrategy, DeliveryStrategyHandler> strategies;
    private final Executor executor;
    private final Executor healthCheckExecutor;
    private final Duration healthCheckTimeout;

    public DefaultDeliveryService(List<NotificationChannel> channels,
                                  List<DeliveryStrategyHandler> strategyHandlers,
                                  Executor executor,
                                  Executor healthCheckExecutor,
                                  Duration healthCheckTimeout) {
        if (channels == null || channels.isEmpty()) {
            throw new IllegalArgumentException("No channels configured for the delivery service");
        }
        this.channels = List.copyOf(channels);
        this.strategies = new EnumMap<>(DeliveryStrategy.class);
        for (DeliveryStrategyHandler handler : strategyHandlers) {
            strategies.put(handler.getStrategy(), handler);
        }
        for (DeliveryStrategy strategy : DeliveryStrategy.values()) {
            if (!strategies.containsKey(strategy)) {
                throw new IllegalArgumentException("No handler registered for strategy " + strategy.getValue());
            }
        }
        this.executor = executor;
        this.healthCheckExecutor = healthCheckExecutor;
        this.healthCheckTimeout = healthCheckTimeout;
    }

    @Override
    public List<DeliveryResult> send(List<Notification> notifications) {
        List<CompletableFuture<DeliveryResult>> running = new ArrayList<>(notifications.size());
        for (Notification notification : notifications) {
            running.add(CompletableFuture.supplyAsync(() -> process(notification), executor));
        }

        List<DeliveryResult> results = new ArrayList<>(running.size());
        try {
            for (CompletableFuture<DeliveryResult> future : running) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.forEach(future -> future.cancel(true));
            throw new IllegalStateException("Interrupted while delivering " + notifications.size() + " notifications", e);
        } catch (ExecutionException e) {
            running.forEach(future -> future.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Delivery task failed", e.getCause());
        }
        return results;
    }

    @Override
    public void checkHealth() {
        List<Runnable> checks = new ArrayList<>();
        for (NotificationChannel channel : channels) {
            if (channel.isHealthCheckable()) {
                checks.add(channel::checkHealth);
            }
        }
        if (checks.isEmpty()) {
            throw new DeliveryHealthException("No channel provides a health check");
        }

        try {
            HealthChecks.runAll(checks, healthCheckExecutor, healthCheckTimeout);
        } catch (RuntimeException e) {
            throw new DeliveryHealthException("Some channels are not ready", e);
        }
    }

    private DeliveryResult process(Notification notification) {
        try {
            return strategies.get(notification.effectiveStrategy()).deliver(notification, channels);
        } catch (RuntimeException e) {
            log.debug("Strategy failed for notification {}", notification.id(), e);
            return DeliveryResult.failure(notification, e, List.of());
        }
    }
}
