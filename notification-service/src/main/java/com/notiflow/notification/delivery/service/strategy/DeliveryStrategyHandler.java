package com.notiflow.notification.delivery.service.strategy;

import com.notiflow.notification.common.model.Contact;
import com.notiflow.notification.common.model.DeliveryStrategy;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.delivery.channel.NotificationChannel;
import com.notiflow.notification.delivery.service.DeliveryResult;

import java.util.List;

public interface DeliveryStrategyHandler {

    DeliveryStrategy getStrategy();

    DeliveryResult deliver(Notification notification, List<NotificationChannel> channels);

    static List<NotificationChannel> supporting(Contact contact, List<NotificationChannel> channels) {
        return channels.stream().filter(channel -> channel.supports(contact)).toList();
    }
}
