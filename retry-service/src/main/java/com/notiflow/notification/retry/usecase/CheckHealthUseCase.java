package com.notiflow.notification.retry.usecase;

import com.notiflow.notification.common.queue.QueueConsumer;

public class CheckHealthUseCase {

    private final QueueConsumer retryConsumer;

    public CheckHealthUseCase(QueueConsumer retryConsumer) {
        this.retryConsumer = retryConsumer;
    }

    public void checkHealth() {
        retryConsumer.checkHealth();
    }
}
