package com.notiflow.notification.delivery.usecase;

import com.notiflow.notification.common.exception.BrokerUnavailableException;
import com.notiflow.notification.common.exception.HealthCheckTimeoutException;
import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.queue.QueueConsumer;
import com.notiflow.notification.common.queue.QueueProducer;
import com.notiflow.notification.delivery.channel.StubChannel;
import com.notiflow.notification.delivery.service.DefaultDeliveryService;
import com.notiflow.notification.delivery.service.DeliveryService;
import com.notiflow.notification.delivery.service.strategy.SendToAllAvailableStrategy;
import com.notiflow.notification.delivery.service.strategy.SendToFirstAvailableStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CheckHealthUseCaseTest {

    @Mock
    private DeliveryService deliveryService;

    @Mock
    private QueueProducer<Notification> producer;

    @Mock
    private QueueConsumer batchConsumer;

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testCheckHealth_ChecksEveryComponent() {
        new CheckHealthUseCase(deliveryService, producer, batchConsumer, executor, TIMEOUT).checkHealth();

        verify(deliveryService).checkHealth();
        verify(producer).checkHealth();
        verify(batchConsumer).checkHealth();
    }

    @Test
    void testCheckHealth_WhenBrokerUnavailable_Throws() {
        doThrow(new BrokerUnavailableException("RabbitMQ is unavailable", null)).when(producer).checkHealth();

        assertThrows(BrokerUnavailableException.class,
            () -> new CheckHealthUseCase(deliveryService, producer, batchConsumer, executor, TIMEOUT).checkHealth());
    }

    @Test
    void testCheckHealth_WhenCalledConcurrently_AllCallsComplete() throws Exception {
        ExecutorService deliveryPool = Executors.newFixedThreadPool(2);
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            DeliveryService realDelivery = new DefaultDeliveryService(
                List.of(StubChannel.working(ChannelType.EMAIL)),
                List.of(new SendToFirstAvailableStrategy(), new SendToAllAvailableStrategy()),
                deliveryPool, executor, TIMEOUT);
            CheckHealthUseCase useCase = new CheckHealthUseCase(realDelivery, producer, batchConsumer, executor, TIMEOUT);
            CountDownLatch done = new CountDownLatch(2);

            callers.execute(() -> {
                useCase.checkHealth();
                done.countDown();
            });
            callers.execute(() -> {
                useCase.checkHealth();
                done.countDown();
            });

            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            deliveryPool.shutdownNow();
            callers.shutdownNow();
        }
    }

    @Test
    void testCheckHealth_WhenComponentHangs_FailsAtDeadline() {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> release.await(10, TimeUnit.SECONDS)).when(batchConsumer).checkHealth();
        CheckHealthUseCase useCase = new CheckHealthUseCase(
            deliveryService, producer, batchConsumer, executor, Duration.ofMillis(200));

        assertThrows(HealthCheckTimeoutException.class, useCase::checkHealth);
        release.countDown();
    }
}
