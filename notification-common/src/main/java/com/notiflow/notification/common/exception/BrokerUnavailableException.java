package com.notiflow.notification.common.exception;

/**
 * Thrown by health checks when a throwaway connection to the broker cannot be opened
 * within the configured timeout.
 */
public class BrokerUnavailableException extends RuntimeException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
