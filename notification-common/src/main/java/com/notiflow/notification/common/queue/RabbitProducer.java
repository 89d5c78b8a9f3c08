package com.notiflow.notification.common.queue;

import com.notiflow.notification.common.amqp.AmqpConnectionHelper;
import com.notiflow.notification.common.amqp.RabbitConnector;
import com.notiflow.notification.common.amqp.RetryHeaders;
import com.notiflow.notification.common.codec.JsonMessageCodec;
import com.notiflow.notification.common.exception.QueueNotStartedException;
import com.notiflow.notification.common.exception.QueueOperationException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Publishes JSON payloads to one queue over a dedicated connection.
 *
 * <p>The channel runs in publisher-confirm mode: {@link #publish(List)} returns only after
 * the broker confirmed every message of the call, within {@code publishTimeoutMs}.
 * Every message starts its life with {@code x-retry-count: 0}.
 */
@Slf4j
public class RabbitProducer<T> implements QueueProducer<T> {

    private static final String DEFAULT_EXCHANGE = "";

    private final RabbitConnector connector;
    private final JsonMessageCodec<T> codec;
    private final ProducerSettings settings;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Object publishLock = new Object();

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile boolean shuttingDown;

    public RabbitProducer(RabbitConnector connector, JsonMessageCodec<T> codec, ProducerSettings settings) {
        this.connector = connector;
        this.codec = codec;
        this.settings = settings;
    }

    @Override
    public void start() {
        if (!lifecycleLock.tryLock()) {
            return;
        }
        try {
            if (channel != null) {
                return;
            }
            Connection conn = connector.open(settings.getConnectionName());
            try {
                Channel ch = conn.createChannel();
                ch.confirmSelect();
                connection = conn;
                channel = ch;
            } catch (IOException | RuntimeException e) {
                AmqpConnectionHelper.closeAfterFailure(conn, e);
                throw e;
            }
            log.info("Producer connected, publishing to queue {}", settings.getQueue());
        } catch (IOException | TimeoutException e) {
            throw new QueueOperationException("Failed to start producer for queue " + settings.getQueue(), e);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void publish(List<T> items) {
        if (shuttingDown) {
            throw new QueueNotStartedException("Producer is shutting down");
        }
        Channel ch = channel;
        if (ch == null) {
            throw new QueueNotStartedException("Producer is not started");
        }
        if (items == null || items.isEmpty()) {
            return;
        }

        List<byte[]> bodies = new ArrayList<>(items.size());
        try {
            for (T item : items) {
                bodies.add(codec.encode(item));
            }
        } catch (IllegalArgumentException e) {
            throw new QueueOperationException("Failed to encode a message for queue " + settings.getQueue(), e);
        }

        synchronized (publishLock) {
            try {
                for (byte[] body : bodies) {
                    ch.basicPublish(DEFAULT_EXCHANGE, settings.getQueue(), initialProperties(), body);
                }
                if (!ch.waitForConfirms(settings.getPublishTimeoutMs())) {
                    throw new QueueOperationException(
                        "Broker rejected messages published to queue " + settings.getQueue());
                }
            } catch (TimeoutException e) {
                throw new QueueOperationException(
                    "Timed out publishing " + items.size() + " messages to queue " + settings.getQueue(), e);
            } catch (IOException e) {
                throw new QueueOperationException("Failed to publish to queue " + settings.getQueue(), e);
            } catch (ShutdownSignalException e) {
                // AlreadyClosedException included: the channel closed under us, e.g. a concurrent shutdown
                throw new QueueOperationException("Channel to queue " + settings.getQueue() + " was closed", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new QueueOperationException("Interrupted while publishing to queue " + settings.getQueue(), e);
            }
        }
    }

    @Override
    public void shutdown() {
        if (!lifecycleLock.tryLock()) {
            log.debug("Shutdown of producer for queue {} skipped, another lifecycle call is in progress",
                settings.getQueue());
            return;
        }
        try {
            if (channel == null) {
                return;
            }
            shuttingDown = true;
            try {
                AmqpConnectionHelper.close(channel);
                AmqpConnectionHelper.close(connection);
            } finally {
                channel = null;
                connection = null;
                shuttingDown = false;
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void checkHealth() {
        AmqpConnectionHelper.checkReachable(connector, settings.getConnectionName(), settings.getHealthcheckTimeoutMs());
    }

    private AMQP.BasicProperties initialProperties() {
        Map<String, Object> headers = new HashMap<>();
        headers.put(RetryHeaders.RETRY_COUNT, 0);
        return AmqpConnectionHelper.persistentJson(headers);
    }
}
