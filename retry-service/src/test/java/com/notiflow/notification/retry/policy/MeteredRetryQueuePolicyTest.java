package com.notiflow.notification.retry.policy;

import com.notiflow.notification.common.amqp.QueueNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MeteredRetryQueuePolicyTest {

    @Test
    void testGetRetryQueue_CountsRoutingPerDestination() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MeteredRetryQueuePolicy policy = new MeteredRetryQueuePolicy(StaticRetryQueuePolicy.defaultPolicy(), registry);

        assertEquals(QueueNames.RETRY_30M, policy.getRetryQueue(1));
        assertEquals(QueueNames.DLQ, policy.getRetryQueue(3));
        assertEquals(QueueNames.DLQ, policy.getRetryQueue(4));

        assertEquals(1.0, registry.get("notifications.retry.routed").tag("queue", QueueNames.RETRY_30M).counter().count());
        assertEquals(2.0, registry.get("notifications.retry.routed").tag("queue", QueueNames.DLQ).counter().count());
        assertNull(registry.find("notifications.retry.routed").tag("queue", QueueNames.RETRY_2H).counter());
    }
}
