package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.Contact;

/**
 * One successful (contact, channel) pair.
 */
public record DeliveryDetail(Contact contact, ChannelType channel) {
}
