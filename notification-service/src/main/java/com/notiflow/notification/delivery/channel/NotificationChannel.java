package com.notiflow.notification.delivery.channel;

import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.Contact;

/**
 * Delivery endpoint for one contact type.
 *
 * Implementation guidelines:
 * - Bound every network call by a timeout
 * - Normalize every transport error into {@link ChannelDeliveryException}
 * - Never log credentials
 */
public interface NotificationChannel {

    ChannelType getType();

    default boolean supports(Contact contact) {
        return contact != null && contact.isOfType(getType());
    }

    /**
     * Send a message to one contact.
     *
     * @throws ChannelDeliveryException if the contact has the wrong type or the transport failed
     */
    void send(Contact contact, String message);

    /**
     * Whether {@link #checkHealth()} is implemented.
     */
    default boolean isHealthCheckable() {
        return false;
    }

    default void checkHealth() {
        throw new UnsupportedOperationException(getType().getValue() + " channel has no health check");
    }
}
