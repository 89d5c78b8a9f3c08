package com.notiflow.notification.common.amqp;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens dedicated broker connections. Every producer and consumer owns the connection it
 * opens here; nothing is shared between components.
 */
public class RabbitConnector {

    private final ConnectionFactory connectionFactory;

    public RabbitConnector(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    public Connection open(String connectionName) throws IOException, TimeoutException {
        return connectionFactory.newConnection(connectionName);
    }

    /**
     * Opens a short-lived connection whose TCP connect and AMQP handshake are both bounded
     * by {@code timeoutMs}. Used by health checks only.
     */
    public Connection openHealthCheckConnection(String connectionName, int timeoutMs) throws IOException, TimeoutException {
        ConnectionFactory checkFactory = connectionFactory.clone();
        checkFactory.setConnectionTimeout(timeoutMs);
        checkFactory.setHandshakeTimeout(timeoutMs);
        checkFactory.setAutomaticRecoveryEnabled(false);
        return checkFactory.newConnection(connectionName);
    }
}
