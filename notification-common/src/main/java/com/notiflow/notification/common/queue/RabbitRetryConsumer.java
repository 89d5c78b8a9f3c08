package com.notiflow.notification.common.queue;

import com.notiflow.notification.common.amqp.AmqpConnectionHelper;
import com.notiflow.notification.common.amqp.RabbitConnector;
import com.notiflow.notification.common.amqp.RetryHeaders;
import com.notiflow.notification.common.exception.QueueOperationException;
import com.notiflow.notification.common.retry.RetryQueuePolicy;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consumes the retry-router queue and moves every message one hop along the backoff chain.
 *
 * <p>For each delivery the {@value RetryHeaders#RETRY_COUNT} header is incremented by one,
 * the {@link RetryQueuePolicy} picks the destination, and the original body is republished
 * there unchanged. The original is acked only after the broker confirmed the republish.
 * On any failure it is nacked without requeue and the broker's own dead-letter binding
 * takes over.
 */
@Slf4j
public class RabbitRetryConsumer implements QueueConsumer {

    static final long SHUTDOWN_POLL_INTERVAL_MS = 100;

    private static final String DEFAULT_EXCHANGE = "";

    private final RabbitConnector connector;
    private final RetryQueuePolicy retryQueuePolicy;
    private final RetryConsumerSettings settings;
    private final QueueErrorHandler errorHandler;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile AtomicBoolean cancelled = new AtomicBoolean(true);
    private volatile boolean shuttingDown;

    public RabbitRetryConsumer(RabbitConnector connector,
                               RetryQueuePolicy retryQueuePolicy,
                               RetryConsumerSettings settings,
                               QueueErrorHandler errorHandler) {
        this.connector = connector;
        this.retryQueuePolicy = retryQueuePolicy;
        this.settings = settings;
        this.errorHandler = errorHandler;
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
            openAndConsume();
            log.info("Retry consumer started on queue {}", settings.getQueue());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void shutdown() {
        if (!lifecycleLock.tryLock()) {
            log.debug("Shutdown of retry consumer on queue {} skipped, another lifecycle call is in progress",
                settings.getQueue());
            return;
        }
        try {
            if (channel == null) {
                return;
            }
            shuttingDown = true;
            try {
                cancelled.set(true);
                awaitInFlight();
                AmqpConnectionHelper.close(channel);
                AmqpConnectionHelper.close(connection);
            } finally {
                channel = null;
                connection = null;
                shuttingDown = false;
            }
            log.info("Retry consumer on queue {} stopped", settings.getQueue());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void checkHealth() {
        AmqpConnectionHelper.checkReachable(connector, settings.getConnectionName(), settings.getHealthcheckTimeoutMs());
    }

    void onDelivery(Channel deliveryChannel, long deliveryTag, AMQP.BasicProperties properties,
                    byte[] body, AtomicBoolean signal) {
        if (signal.get() || shuttingDown) {
            return;
        }
        inFlight.incrementAndGet();
        try {
            if (body == null || body.length == 0) {
                log.warn("Dropping retry message {} with empty body", deliveryTag);
                deliveryChannel.basicAck(deliveryTag, false);
                return;
            }

            Map<String, Object> headers = properties != null && properties.getHeaders() != null
                ? new HashMap<>(properties.getHeaders())
                : new HashMap<>();
            int nextRetryCount = RetryHeaders.retryCount(headers) + 1;
            String targetQueue = retryQueuePolicy.getRetryQueue(nextRetryCount);
            headers.put(RetryHeaders.RETRY_COUNT, nextRetryCount);

            republish(deliveryChannel, targetQueue, properties, headers, body);
            deliveryChannel.basicAck(deliveryTag, false);
            log.debug("Routed message {} to {} (attempt {})", deliveryTag, targetQueue, nextRetryCount);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            errorHandler.onError(e);
            reject(deliveryChannel, deliveryTag);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void republish(Channel deliveryChannel, String targetQueue, AMQP.BasicProperties original,
                           Map<String, Object> headers, byte[] body)
            throws IOException, InterruptedException, TimeoutException {
        AMQP.BasicProperties.Builder builder = original != null
            ? original.builder()
            : new AMQP.BasicProperties.Builder().contentType(AmqpConnectionHelper.JSON_CONTENT_TYPE);
        AMQP.BasicProperties properties = builder
            .headers(headers)
            .deliveryMode(AmqpConnectionHelper.PERSISTENT)
            .build();

        deliveryChannel.basicPublish(DEFAULT_EXCHANGE, targetQueue, properties, body);
        if (!deliveryChannel.waitForConfirms(settings.getPublishTimeoutMs())) {
            throw new QueueOperationException("Broker rejected republish to queue " + targetQueue);
        }
    }

    private void reject(Channel deliveryChannel, long deliveryTag) {
        try {
            deliveryChannel.basicNack(deliveryTag, false, false);
        } catch (IOException | RuntimeException nackError) {
            errorHandler.onError(nackError);
        }
    }

    private void openAndConsume() {
        AtomicBoolean signal = new AtomicBoolean(false);
        Connection conn = null;
        try {
            conn = connector.open(settings.getConnectionName());
            Channel ch = conn.createChannel();
            ch.confirmSelect();
            ch.basicQos(settings.getPrefetchCount());
            ch.queueDeclarePassive(settings.getQueue());

            connection = conn;
            channel = ch;
            cancelled = signal;

            ch.basicConsume(settings.getQueue(), false, new DefaultConsumer(ch) {
                @Override
                public void handleDelivery(String consumerTag, Envelope envelope,
                                           AMQP.BasicProperties properties, byte[] body) {
                    onDelivery(getChannel(), envelope.getDeliveryTag(), properties, body, signal);
                }
            });
        } catch (IOException | TimeoutException | RuntimeException e) {
            signal.set(true);
            channel = null;
            connection = null;
            if (conn != null) {
                AmqpConnectionHelper.closeAfterFailure(conn, e);
            }
            throw new QueueOperationException("Failed to start retry consumer for queue " + settings.getQueue(), e);
        }
    }

    private void awaitInFlight() {
        long deadline = System.currentTimeMillis() + settings.getPublishTimeoutMs() + SHUTDOWN_POLL_INTERVAL_MS;
        try {
            while (inFlight.get() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(SHUTDOWN_POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueOperationException("Interrupted while waiting for in-flight retries", e);
        }
    }
}
