package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.Contact;

/**
 * A non-fatal problem met while delivering: a contact with no supporting channel, or one
 * failed channel attempt. {@code channel} and {@code cause} are null for the former.
 */
public record DeliveryWarning(String message, ChannelType contactType, ChannelType channel, Throwable cause) {

    public static DeliveryWarning noChannel(Contact contact) {
        return new DeliveryWarning("No available channel for contact " + contact, contact.getType(), null, null);
    }

    public static DeliveryWarning channelFailed(Contact contact, ChannelType channel, Throwable cause) {
        return new DeliveryWarning("Failed to send via channel " + channel.getValue(), contact.getType(), channel, cause);
    }
}
