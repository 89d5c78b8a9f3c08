package com.notiflow.notification.common.amqp;

import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Queue;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NotificationQueueTopologyTest {

    private final Map<String, Queue> queues = NotificationQueueTopology.declarables()
        .getDeclarablesByType(Queue.class).stream()
        .collect(Collectors.toMap(Queue::getName, Function.identity()));

    @Test
    void testDeclarables_ContainsAllPipelineQueues() {
        assertEquals(6, queues.size());
        queues.values().forEach(queue -> assertTrue(queue.isDurable(), queue.getName()));
    }

    @Test
    void testMainQueue_DeadLettersIntoRetryRouter() {
        Map<String, Object> args = queues.get(QueueNames.NOTIFICATIONS).getArguments();
        assertEquals("", args.get("x-dead-letter-exchange"));
        assertEquals(QueueNames.RETRY_ROUTER, args.get("x-dead-letter-routing-key"));
    }

    @Test
    void testDelayQueues_ExpireBackIntoMainQueue() {
        Map<String, Object> shortDelay = queues.get(QueueNames.RETRY_30M).getArguments();
        assertEquals(1_800_000, shortDelay.get("x-message-ttl"));
        assertEquals(QueueNames.NOTIFICATIONS, shortDelay.get("x-dead-letter-routing-key"));

        Map<String, Object> longDelay = queues.get(QueueNames.RETRY_2H).getArguments();
        assertEquals(7_200_000, longDelay.get("x-message-ttl"));
        assertEquals(QueueNames.NOTIFICATIONS, longDelay.get("x-dead-letter-routing-key"));
    }

    @Test
    void testRouterQueue_DeadLettersIntoItsOwnDlq() {
        assertEquals(QueueNames.RETRY_ROUTER_DLQ,
            queues.get(QueueNames.RETRY_ROUTER).getArguments().get("x-dead-letter-routing-key"));
        assertTrue(queues.get(QueueNames.DLQ).getArguments().isEmpty());
    }
}
