package com.notiflow.notification.delivery.channel;

import com.notiflow.notification.common.model.ChannelType;
import lombok.Getter;

/**
 * A channel could not deliver, or is unreachable. Wraps the transport-specific cause.
 */
@Getter
public class ChannelDeliveryException extends RuntimeException {

    private final ChannelType channel;

    public ChannelDeliveryException(ChannelType channel, String message) {
        super(message);
        this.channel = channel;
    }

    public ChannelDeliveryException(ChannelType channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
