package com.notiflow.notification.common.queue;

import com.notiflow.notification.common.amqp.AmqpConnectionHelper;
import com.notiflow.notification.common.amqp.RabbitConnector;
import com.notiflow.notification.common.codec.JsonMessageCodec;
import com.notiflow.notification.common.exception.MessageDecodingException;
import com.notiflow.notification.common.exception.QueueOperationException;
import com.notiflow.notification.common.result.MessageResult;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drains a queue in batches and settles every message according to the handler's result.
 *
 * <p>Deliveries are decoded and appended to an in-memory buffer. The buffer is flushed when
 * it reaches {@code maxBatchSize} and, independently, every {@code batchFlushTimeoutMs}
 * while it is non-empty. Only one flush runs at a time; a trigger arriving during a flush
 * is a no-op and the buffer keeps filling until the next trigger.
 *
 * <p>Per item: success is acked, failure is nacked without requeue so the broker
 * dead-letters it into the retry pipeline. The prefetch equals {@code maxBatchSize}, so at
 * most one batch worth of messages is ever unacknowledged.
 *
 * <p>A flush owns the {@code flushing} flag until its handler call has returned, even when the
 * flush timed out and its items were already nacked. Handler calls therefore never overlap.
 *
 * @param <T> payload type
 */
@Slf4j
public class RabbitBatchConsumer<T> implements QueueConsumer {

    static final long SHUTDOWN_POLL_INTERVAL_MS = 100;

    private final RabbitConnector connector;
    private final JsonMessageCodec<T> codec;
    private final BatchHandler<T> handler;
    private final BatchConsumerSettings settings;
    private final QueueErrorHandler errorHandler;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Object bufferLock = new Object();
    private final AtomicBoolean flushing = new AtomicBoolean(false);

    private List<BatchItem<T>> buffer = new ArrayList<>();

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile AtomicBoolean cancelled = new AtomicBoolean(true);
    private volatile boolean shuttingDown;
    private ScheduledExecutorService flushTimer;
    private ExecutorService flushExecutor;

    public RabbitBatchConsumer(RabbitConnector connector,
                               JsonMessageCodec<T> codec,
                               BatchHandler<T> handler,
                               BatchConsumerSettings settings,
                               QueueErrorHandler errorHandler) {
        this.connector = connector;
        this.codec = codec;
        this.handler = handler;
        this.settings = settings;
        this.errorHandler = errorHandler;
    }

    @Override
    public void start() {
        if (!lifecycleLock.tryLock()) {
            return;
        }
        try {
            if (channel != null) {
                return;
            }
            openAndConsume();
            log.info("Batch consumer started on queue {} (maxBatchSize={}, flushInterval={}ms)",
                settings.getQueue(), settings.getMaxBatchSize(), settings.getBatchFlushTimeoutMs());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void shutdown() {
        if (!lifecycleLock.tryLock()) {
            log.debug("Shutdown of batch consumer on queue {} skipped, another lifecycle call is in progress",
                settings.getQueue());
            return;
        }
        try {
            if (channel == null) {
                return;
            }
            shuttingDown = true;
            try {
                cancelled.set(true);
                stopFlushTimer();
                if (acquireFlushing()) {
                    flushAcquired();
                } else {
                    log.warn("A timed-out batch on queue {} is still running; {} buffered messages are left for redelivery",
                        settings.getQueue(), getBufferedCount());
                }
                flushExecutor.shutdown();
                AmqpConnectionHelper.close(channel);
                AmqpConnectionHelper.close(connection);
            } finally {
                channel = null;
                connection = null;
                // anything still buffered was never settled; the broker requeues it on channel close
                synchronized (bufferLock) {
                    buffer = new ArrayList<>();
                }
                shuttingDown = false;
            }
            log.info("Batch consumer on queue {} stopped", settings.getQueue());
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void checkHealth() {
        AmqpConnectionHelper.checkReachable(connector, settings.getConnectionName(), settings.getHealthcheckTimeoutMs());
    }

    public int getBufferedCount() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    /**
     * Swaps out the buffer and processes it. No-op if another flush is running or nothing
     * is buffered.
     */
    void flush() {
        if (!flushing.compareAndSet(false, true)) {
            return;
        }
        flushAcquired();
    }

    /**
     * Caller holds {@code flushing}. It is released here when there is nothing to do,
     * otherwise by the task that runs the handler.
     */
    private void flushAcquired() {
        List<BatchItem<T>> batch;
        synchronized (bufferLock) {
            if (buffer.isEmpty()) {
                flushing.set(false);
                return;
            }
            batch = buffer;
            buffer = new ArrayList<>();
        }
        processWithTimeout(batch);
    }

    void onDelivery(Channel deliveryChannel, long deliveryTag, byte[] body, AtomicBoolean signal) {
        try {
            if (signal.get() || shuttingDown) {
                // left unacked on purpose, the broker redelivers it
                return;
            }

            T item;
            try {
                item = codec.decode(body);
            } catch (MessageDecodingException e) {
                log.warn("Rejecting undecodable message {} from queue {}: {}",
                    deliveryTag, settings.getQueue(), e.getMessage());
                deliveryChannel.basicNack(deliveryTag, false, false);
                return;
            }

            boolean full;
            synchronized (bufferLock) {
                buffer.add(new BatchItem<>(item, deliveryChannel, deliveryTag));
                full = buffer.size() >= settings.getMaxBatchSize();
            }
            if (full) {
                flush();
            }
        } catch (IOException | RuntimeException e) {
            errorHandler.onError(e);
        }
    }

    private void openAndConsume() {
        AtomicBoolean signal = new AtomicBoolean(false);
        Connection conn = null;
        try {
            conn = connector.open(settings.getConnectionName());
            Channel ch = conn.createChannel();
            ch.basicQos(settings.getMaxBatchSize());
            ch.queueDeclarePassive(settings.getQueue());

            connection = conn;
            channel = ch;
            cancelled = signal;
            startFlushing(signal);

            ch.basicConsume(settings.getQueue(), false, new DefaultConsumer(ch) {
                @Override
                public void handleDelivery(String consumerTag, Envelope envelope,
                                           AMQP.BasicProperties properties, byte[] body) {
                    onDelivery(getChannel(), envelope.getDeliveryTag(), body, signal);
                }
            });
        } catch (IOException | TimeoutException | RuntimeException e) {
            signal.set(true);
            stopFlushing();
            channel = null;
            connection = null;
            if (conn != null) {
                AmqpConnectionHelper.closeAfterFailure(conn, e);
            }
            throw new QueueOperationException("Failed to start batch consumer for queue " + settings.getQueue(), e);
        }
    }

    private void startFlushing(AtomicBoolean signal) {
        flushExecutor = Executors.newCachedThreadPool(threadFactory(settings.getConnectionName() + "-flush-"));
        flushTimer = Executors.newSingleThreadScheduledExecutor(threadFactory(settings.getConnectionName() + "-timer-"));
        long interval = settings.getBatchFlushTimeoutMs();
        flushTimer.scheduleAtFixedRate(() -> onFlushTimer(signal), interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopFlushing() {
        if (flushTimer != null) {
            flushTimer.shutdown();
        }
        if (flushExecutor != null) {
            flushExecutor.shutdown();
        }
    }

    private void onFlushTimer(AtomicBoolean signal) {
        // an exception escaping here would cancel the periodic task
        try {
            if (!signal.get() && getBufferedCount() > 0) {
                flush();
            }
        } catch (RuntimeException e) {
            errorHandler.onError(e);
        }
    }

    private void processWithTimeout(List<BatchItem<T>> batch) {
        // whoever flips this first decides who releases the flag: the task, or the
        // canceller when the task never got to run
        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<?> future;
        try {
            future = flushExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    processBatch(batch);
                } finally {
                    flushing.set(false);
                }
                return null;
            });
        } catch (RejectedExecutionException e) {
            flushing.set(false);
            failBatch(batch, e);
            return;
        }

        try {
            future.get(settings.getFlushTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel(future, claimed);
            failBatch(batch, new QueueOperationException(
                "Timed out processing a batch of " + batch.size() + " messages from queue " + settings.getQueue(), e));
        } catch (ExecutionException e) {
            failBatch(batch, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(future, claimed);
            failBatch(batch, e);
        }
    }

    private void cancel(Future<?> future, AtomicBoolean claimed) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            flushing.set(false);
        }
    }

    private void processBatch(List<BatchItem<T>> batch) throws IOException {
        int size = batch.size();
        boolean[] succeeded = new boolean[size];
        try {
            List<T> items = new ArrayList<>(size);
            for (BatchItem<T> batchItem : batch) {
                items.add(batchItem.getItem());
            }
            List<? extends MessageResult> results = handler.handle(items);
            if (results == null || results.size() != size) {
                throw new IllegalStateException("Handler returned " + (results == null ? "no" : results.size())
                    + " results for a batch of " + size);
            }
            for (int i = 0; i < size; i++) {
                MessageResult result = results.get(i);
                succeeded[i] = result != null && result.isSuccess();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueOperationException("Interrupted while handling batch", e);
        } catch (Exception e) {
            errorHandler.onError(e);
            // whole batch counts as failed, succeeded[] stays all false
        }

        for (int i = 0; i < size; i++) {
            if (succeeded[i]) {
                batch.get(i).ack();
            } else {
                batch.get(i).nack();
            }
        }
    }

    private void failBatch(List<BatchItem<T>> batch, Throwable cause) {
        errorHandler.onError(cause);
        for (BatchItem<T> item : batch) {
            if (item.isSettled()) {
                continue;
            }
            try {
                item.nack();
            } catch (IOException | RuntimeException nackError) {
                errorHandler.onError(nackError);
            }
        }
    }

    private void stopFlushTimer() {
        flushTimer.shutdown();
        try {
            // a tick may be inside flush(), which is bounded by the flush timeout
            if (!flushTimer.awaitTermination(settings.getFlushTimeoutMs() + SHUTDOWN_POLL_INTERVAL_MS,
                    TimeUnit.MILLISECONDS)) {
                log.warn("Flush timer of queue {} did not stop in time", settings.getQueue());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueOperationException("Interrupted while stopping the flush timer", e);
        }
    }

    /**
     * Takes the {@code flushing} flag for the final drain, waiting for a running flush.
     *
     * @return false if the flag was still held when the wait ran out
     */
    private boolean acquireFlushing() {
        long deadline = System.currentTimeMillis() + settings.getFlushTimeoutMs() + SHUTDOWN_POLL_INTERVAL_MS;
        try {
            while (!flushing.compareAndSet(false, true)) {
                if (System.currentTimeMillis() >= deadline) {
                    return false;
                }
                Thread.sleep(SHUTDOWN_POLL_INTERVAL_MS);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueOperationException("Interrupted while waiting for the running flush", e);
        }
    }

    private static CustomizableThreadFactory threadFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
