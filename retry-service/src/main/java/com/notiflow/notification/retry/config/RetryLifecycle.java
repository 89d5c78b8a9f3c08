package com.notiflow.notification.retry.config;

import com.notiflow.notification.common.queue.QueueConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "retry.consumer", name = "auto-startup", havingValue = "true", matchIfMissing = true)
public class RetryLifecycle implements SmartLifecycle {

    private final QueueConsumer retryConsumer;

    private volatile boolean running;

    @Override
    public void start() {
        retryConsumer.start();
        running = true;
        log.info("Retry consumer lifecycle started");
    }

    @Override
    public void stop() {
        try {
            retryConsumer.shutdown();
        } finally {
            running = false;
        }
        log.info("Retry consumer lifecycle stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
