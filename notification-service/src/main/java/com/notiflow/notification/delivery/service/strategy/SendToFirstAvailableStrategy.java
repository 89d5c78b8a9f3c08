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
 * Walks contacts in order and, for each, its supporting channels in order. Stops at the
 * first channel that accepts the message.
 */
public class SendToFirstAvailableStrategy implements DeliveryStrategyHandler {

    static final String ALL_FAILED_MESSAGE = "Failed to deliver notification through any available channel";

    @Override
    public DeliveryStrategy getStrategy() {
        return DeliveryStrategy.SEND_TO_FIRST_AVAILABLE;
    }

    @Override
    public DeliveryResult deliver(Notification notification, List<NotificationChannel> channels) {
        List<DeliveryWarning> warnings = new ArrayList<>();

        for (Contact contact : notification.contacts()) {
            List<NotificationChannel> supported = DeliveryStrategyHandler.supporting(contact, channels);
            if (supported.isEmpty()) {
                warnings.add(DeliveryWarning.noChannel(contact));
                continue;
            }

            for (NotificationChannel channel : supported) {
                try {
                    channel.send(contact, notification.message());
                    return DeliveryResult.success(notification,
                        List.of(new DeliveryDetail(contact, channel.getType())), warnings);
                } catch (RuntimeException e) {
                    warnings.add(DeliveryWarning.channelFailed(contact, channel.getType(), e));
                }
            }
        }

        return DeliveryResult.failure(notification, new IllegalStateException(ALL_FAILED_MESSAGE), warnings);
    }
}
