package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.model.DeliveryStrategy;
import com.notiflow.notification.common.model.EmailContact;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.model.Subject;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MeteredDeliveryServiceTest {

    @Mock
    private DeliveryService delegate;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void testSend_CountsEachResultWithItsTags() {
        Notification fromCrm = Notification.builder()
            .id("n1")
            .contacts(List.of(new EmailContact("a@b.c")))
            .message("hi")
            .strategy(DeliveryStrategy.SEND_TO_ALL_AVAILABLE)
            .immediate(true)
            .subject(new Subject("crm", "CRM"))
            .build();
        Notification anonymous = Notification.builder()
            .id("n2")
            .contacts(List.of(new EmailContact("a@b.c")))
            .message("hi")
            .build();
        List<DeliveryResult> results = List.of(
            DeliveryResult.success(fromCrm, List.of(), List.of()),
            DeliveryResult.failure(anonymous, new IllegalStateException("no channel"), List.of()));
        when(delegate.send(anyList())).thenReturn(results);

        List<DeliveryResult> returned = new MeteredDeliveryService(delegate, registry).send(List.of(fromCrm, anonymous));

        assertSame(results, returned);
        Counter success = registry.get("notifications.processed")
            .tags("status", "success", "subject", "crm", "strategy", "sendToAllAvailable", "immediate", "true")
            .counter();
        assertEquals(1.0, success.count());
        Counter failure = registry.get("notifications.processed")
            .tags("status", "failure", "subject", "unknown", "strategy", "sendToFirstAvailable", "immediate", "false")
            .counter();
        assertEquals(1.0, failure.count());
        assertEquals(1, registry.get("notifications.delivery.duration").timer().count());
    }

    @Test
    void testCheckHealth_DelegatesWithoutRecording() {
        new MeteredDeliveryService(delegate, registry).checkHealth();

        verify(delegate).checkHealth();
        assertNull(registry.find("notifications.processed").counter());
    }
}
