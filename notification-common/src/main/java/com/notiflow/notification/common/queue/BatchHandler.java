package com.notiflow.notification.common.queue;

import com.notiflow.notification.common.result.MessageResult;

import java.util.List;

/**
 * Processes one flushed batch.
 *
 * <p>Must return exactly one result per item, in input order. A different number of
 * results, or any exception, fails the whole batch.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface BatchHandler<T> {

    List<? extends MessageResult> handle(List<T> items) throws Exception;
}
