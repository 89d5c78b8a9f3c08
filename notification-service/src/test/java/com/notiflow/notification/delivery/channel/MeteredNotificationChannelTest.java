package com.notiflow.notification.delivery.channel;

import com.notiflow.notification.common.model.BitrixContact;
import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.EmailContact;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MeteredNotificationChannelTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void testSend_WhenDelegateSucceeds_RecordsSuccessForItsChannel() {
        StubChannel email = StubChannel.working(ChannelType.EMAIL);
        MeteredNotificationChannel channel = new MeteredNotificationChannel(email, registry);

        channel.send(new EmailContact("a@example.com"), "hello");

        assertEquals(1, email.getSent().size());
        assertEquals(1, registry.get("notifications.channel.send.duration")
            .tags("channel", "email", "status", "success").timer().count());
        assertEquals(1.0, registry.get("notifications.processed.by.channel")
            .tags("channel", "email", "status", "success").counter().count());
        assertEquals(0.0, registry.get("notifications.processed.by.channel")
            .tags("channel", "email", "status", "failure").counter().count());
    }

    @Test
    void testSend_WhenDelegateFails_RecordsFailureAndRethrows() {
        MeteredNotificationChannel channel =
            new MeteredNotificationChannel(StubChannel.failing(ChannelType.BITRIX), registry);

        ChannelDeliveryException e = assertThrows(ChannelDeliveryException.class,
            () -> channel.send(new BitrixContact(7), "hello"));

        assertEquals(ChannelType.BITRIX, e.getChannel());
        assertEquals(1, registry.get("notifications.channel.send.duration")
            .tags("channel", "bitrix", "status", "failure").timer().count());
        assertEquals(1.0, registry.get("notifications.processed.by.channel")
            .tags("channel", "bitrix", "status", "failure").counter().count());
    }

    @Test
    void testWrapper_KeepsTypeSupportAndHealthOfDelegate() {
        StubChannel unhealthy = StubChannel.unhealthy(ChannelType.EMAIL);
        MeteredNotificationChannel channel = new MeteredNotificationChannel(unhealthy, registry);

        assertEquals(ChannelType.EMAIL, channel.getType());
        assertTrue(channel.supports(new EmailContact("a@example.com")));
        assertFalse(channel.supports(new BitrixContact(1)));
        assertTrue(channel.isHealthCheckable());
        assertThrows(ChannelDeliveryException.class, channel::checkHealth);
        assertFalse(new MeteredNotificationChannel(StubChannel.withoutHealthCheck(ChannelType.BITRIX), registry)
            .isHealthCheckable());
    }
}
