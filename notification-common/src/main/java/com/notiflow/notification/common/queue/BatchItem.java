package com.notiflow.notification.common.queue;

import com.rabbitmq.client.Channel;
import lombok.Getter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decoded payload paired with the delivery it came from. Settles at most once: whichever
 * of ack or nack runs first wins, later calls are ignored.
 */
public class BatchItem<T> {

    @Getter
    private final T item;
    @Getter
    private final long deliveryTag;
    private final Channel channel;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    public BatchItem(T item, Channel channel, long deliveryTag) {
        this.item = item;
        this.channel = channel;
        this.deliveryTag = deliveryTag;
    }

    public void ack() throws IOException {
        if (settled.compareAndSet(false, true)) {
            channel.basicAck(deliveryTag, false);
        }
    }

    /**
     * Rejects without requeue so the broker dead-letters the message.
     */
    public void nack() throws IOException {
        if (settled.compareAndSet(false, true)) {
            channel.basicNack(deliveryTag, false, false);
        }
    }

    public boolean isSettled() {
        return settled.get();
    }
}
