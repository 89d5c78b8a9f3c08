package com.notiflow.notification.common.queue;

/**
 * Receives errors that consumers contain locally instead of propagating.
 */
@FunctionalInterface
public interface QueueErrorHandler {

    void onError(Throwable error);
}
