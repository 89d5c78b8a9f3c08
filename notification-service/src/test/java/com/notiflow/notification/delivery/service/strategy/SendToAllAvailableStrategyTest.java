package com.notiflow.notification.delivery.service.strategy;

import com.notiflow.notification.common.model.BitrixContact;
import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.EmailContact;
import com.notiflow.notification.delivery.channel.StubChannel;
import com.notiflow.notification.delivery.service.DeliveryDetail;
import com.notiflow.notification.delivery.service.DeliveryResult;
import com.notiflow.notification.delivery.service.DeliveryStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.notiflow.notification.delivery.service.strategy.SendToFirstAvailableStrategyTest.notification;
import static org.junit.jupiter.api.Assertions.*;

class SendToAllAvailableStrategyTest {

    private final SendToAllAvailableStrategy strategy = new SendToAllAvailableStrategy();

    @Test
    void testDeliver_TriesEveryContactOnEverySupportingChannel() {
        StubChannel email = StubChannel.working(ChannelType.EMAIL);
        StubChannel bitrix = StubChannel.working(ChannelType.BITRIX);

        DeliveryResult result = strategy.deliver(
            notification(new EmailContact("a@example.com"), new BitrixContact(1), new EmailContact("b@example.com")),
            List.of(email, bitrix));

        assertEquals(DeliveryStatus.SUCCESS, result.status());
        assertEquals(3, result.details().size());
        assertEquals(List.of(new EmailContact("a@example.com"), new EmailContact("b@example.com")), email.getSent());
        assertEquals(List.of(new BitrixContact(1)), bitrix.getSent());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testDeliver_WhenSomeAttemptsFail_SucceedsWithWarnings() {
        StubChannel email = StubChannel.failing(ChannelType.EMAIL);
        StubChannel bitrix = StubChannel.working(ChannelType.BITRIX);

        DeliveryResult result = strategy.deliver(
            notification(new EmailContact("a@example.com"), new BitrixContact(1)), List.of(email, bitrix));

        assertTrue(result.isSuccess());
        assertEquals(List.of(new DeliveryDetail(new BitrixContact(1), ChannelType.BITRIX)), result.details());
        assertEquals(1, result.warnings().size());
        assertEquals(ChannelType.EMAIL, result.warnings().get(0).channel());
    }

    @Test
    void testDeliver_WhenNoAttemptSucceeds_FailsWithAllWarnings() {
        StubChannel email = StubChannel.failing(ChannelType.EMAIL);

        DeliveryResult result = strategy.deliver(
            notification(new EmailContact("a@example.com"), new BitrixContact(1)), List.of(email));

        assertEquals(DeliveryStatus.FAILURE, result.status());
        assertEquals(2, result.warnings().size());
        assertNotNull(result.error());
    }
}
