package com.notiflow.notification.common.exception;

/**
 * Thrown when a group of health checks did not report back before its deadline.
 */
public class HealthCheckTimeoutException extends RuntimeException {

    public HealthCheckTimeoutException(String message) {
        super(message);
    }

    public HealthCheckTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
