package com.notiflow.notification.common.amqp;

import com.notiflow.notification.common.exception.BrokerUnavailableException;
import com.notiflow.notification.common.exception.QueueOperationException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Shared connection lifecycle helpers for producers and consumers.
 *
 * <p>Centralizes message properties, health probing and close handling so every queue
 * component behaves the same way on the wire and during shutdown.
 */
@Slf4j
public final class AmqpConnectionHelper {

    public static final int PERSISTENT = 2;
    public static final String JSON_CONTENT_TYPE = "application/json";

    private AmqpConnectionHelper() {
        // Utility class - prevent instantiation
    }

    /**
     * Properties for a persistent JSON message carrying the given headers.
     */
    public static AMQP.BasicProperties persistentJson(Map<String, Object> headers) {
        return new AMQP.BasicProperties.Builder()
            .contentType(JSON_CONTENT_TYPE)
            .deliveryMode(PERSISTENT)
            .headers(headers)
            .build();
    }

    /**
     * Opens a throwaway connection and closes it again. Reports reachability only; the
     * caller's live connection and channel are never touched.
     *
     * @throws BrokerUnavailableException if the broker cannot be reached within the timeout
     */
    public static void checkReachable(RabbitConnector connector, String connectionName, int timeoutMs) {
        Connection checkConnection = null;
        try {
            checkConnection = connector.openHealthCheckConnection(connectionName + "-healthcheck", timeoutMs);
        } catch (IOException | TimeoutException | RuntimeException e) {
            throw new BrokerUnavailableException("RabbitMQ is unavailable", e);
        } finally {
            if (checkConnection != null) {
                closeHealthCheckConnection(checkConnection);
            }
        }
    }

    public static void close(Channel channel) {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (AlreadyClosedException e) {
            log.debug("Channel already closed: {}", e.getMessage());
        } catch (IOException | TimeoutException e) {
            throw new QueueOperationException("Failed to close channel", e);
        }
    }

    public static void close(Connection connection) {
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (AlreadyClosedException e) {
            log.debug("Connection already closed: {}", e.getMessage());
        } catch (IOException e) {
            throw new QueueOperationException("Failed to close connection", e);
        }
    }

    /**
     * Closes a connection whose setup failed, attaching any close error to {@code cause}.
     */
    public static void closeAfterFailure(Connection connection, Exception cause) {
        try {
            connection.close();
        } catch (IOException | RuntimeException closeError) {
            cause.addSuppressed(closeError);
        }
    }

    private static void closeHealthCheckConnection(Connection checkConnection) {
        try {
            checkConnection.close();
        } catch (IOException | AlreadyClosedException e) {
            log.warn("Failed to close health check connection: {}", e.getMessage());
        }
    }
}
