package com.notiflow.notification.common.exception;

public class QueueNotStartedException extends IllegalStateException {

    public QueueNotStartedException(String message) {
        super(message);
    }
}
