package com.notiflow.notification.delivery.config;

import com.notiflow.notification.delivery.channel.MeteredNotificationChannel;
import com.notiflow.notification.delivery.channel.NotificationChannel;
import com.notiflow.notification.delivery.service.DefaultDeliveryService;
import com.notiflow.notification.delivery.service.DeliveryService;
import com.notiflow.notification.delivery.service.LoggedDeliveryService;
import com.notiflow.notification.delivery.service.MeteredDeliveryService;
import com.notiflow.notification.delivery.service.strategy.SendToAllAvailableStrategy;
import com.notiflow.notification.delivery.service.strategy.SendToFirstAvailableStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

@Configuration
public class DeliveryConfig {

    /**
     * Runs one task per notification of a batch.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(DeliveryProperties properties) {
        return Executors.newFixedThreadPool(properties.getParallelism(), daemonThreads("delivery-"));
    }

    /**
     * Blocking SDK calls that are time-boxed by the caller.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService channelIoExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("channel-io-"));
    }

    /**
     * Health checks only. Unbounded so nested checks never wait for a free thread.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("health-check-"));
    }

    @Bean
    public DeliveryService deliveryService(ObjectProvider<NotificationChannel> channels,
                                           @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
                                           @Qualifier("healthCheckExecutor") ExecutorService healthCheckExecutor,
                                           DeliveryProperties properties,
                                           MeterRegistry meterRegistry) {
        DeliveryService core = new DefaultDeliveryService(
            channels.orderedStream()
                .map(channel -> (NotificationChannel) new MeteredNotificationChannel(channel, meterRegistry))
                .toList(),
            List.of(new SendToFirstAvailableStrategy(), new SendToAllAvailableStrategy()),
            deliveryExecutor,
            healthCheckExecutor,
            Duration.ofMillis(properties.getHealthcheckTimeoutMs()));
        return new LoggedDeliveryService(new MeteredDeliveryService(core, meterRegistry));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Supplier<String> notificationIdGenerator() {
        return () -> UUID.randomUUID().toString();
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
