package com.notiflow.notification.common.exception;

/**
 * Broker operation failed: publish not confirmed in time, broker nack, or channel I/O error.
 */
public class QueueOperationException extends RuntimeException {

    public QueueOperationException(String message) {
        super(message);
    }

    public QueueOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
