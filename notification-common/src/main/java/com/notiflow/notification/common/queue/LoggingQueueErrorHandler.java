package com.notiflow.notification.common.queue;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingQueueErrorHandler implements QueueErrorHandler {

    private final String component;

    public LoggingQueueErrorHandler(String component) {
        this.component = component;
    }

    @Override
    public void onError(Throwable error) {
        log.error("Error in {}: {}", component, error.getMessage(), error);
    }
}
