package com.notiflow.notification.common.exception;

/**
 * Payload could not be parsed. Such messages are rejected without requeue.
 */
public class MessageDecodingException extends RuntimeException {

    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
