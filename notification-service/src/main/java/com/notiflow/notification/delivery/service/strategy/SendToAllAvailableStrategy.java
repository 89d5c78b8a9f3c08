package com.notiflow.notification.delivery.service.strategy;

import com.notiflow.notification.common.model.Contact;
import com.notiflow.notification.common.model.DeliveryStrategy;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.delivery.channel.NotificationChannel;
import com.notiflow.notification.delivery.service.DeliveryDetail;
import com.notiflow.notification.delivery.service.DeliveryResult;
import com.notiflow.notification.delivery.service.DeliveryWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Tries every supporting channel of every contact. Succeeds if at least one attempt did.
 */
public class SendToAllAvailableStrategy implements DeliveryStrategyHandler {

    @Override
    public DeliveryStrategy getStrategy() {
        return DeliveryStrategy.SEND_TO_ALL_AVAILABLE;
    }

    @Override
    public DeliveryResult deliver(Notification notification, List<NotificationChannel> channels) {
        List<DeliveryWarning> warnings = new ArrayList<>();
        List<DeliveryDetail> delivered = new ArrayList<>();

        for (Contact contact : notification.contacts()) {
            List<NotificationChannel> supported = DeliveryStrategyHandler.supporting(contact, channels);
            if (supported.isEmpty()) {
                warnings.add(DeliveryWarning.noChannel(contact));
                continue;
            }

            for (NotificationChannel channel : supported) {
                try {
                    channel.send(contact, notification.message());
                    delivered.add(new DeliveryDetail(contact, channel.getType()));
                } catch (RuntimeException e) {
                    warnings.add(DeliveryWarning.channelFailed(contact, channel.getType(), e));
                }
            }
        }

        if (delivered.isEmpty()) {
            return DeliveryResult.failure(notification,
                new IllegalStateException(SendToFirstAvailableStrategy.ALL_FAILED_MESSAGE), warnings);
        }
        return DeliveryResult.success(notification, delivered, warnings);
    }
}
