package com.notiflow.notification.delivery.usecase;

import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.model.Subject;
import com.notiflow.notification.common.queue.QueueProducer;
import com.notiflow.notification.delivery.dto.IncomingNotification;
import com.notiflow.notification.delivery.service.DeliveryResult;
import com.notiflow.notification.delivery.service.DeliveryService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Ingress entry point. Assigns id, timestamp and subject to each incoming notification,
 * queues the deferred ones and delivers the immediate ones right away. An immediate
 * notification that could not be delivered is queued so that it enters the retry
 * pipeline like any other.
 */
@Slf4j
public class HandleIncomingNotificationsUseCase {

    private final QueueProducer<Notification> producer;
    private final DeliveryService deliveryService;
    private final Supplier<String> idGenerator;
    private final Clock clock;

    public HandleIncomingNotificationsUseCase(QueueProducer<Notification> producer,
                                              DeliveryService deliveryService,
                                              Supplier<String> idGenerator,
                                              Clock clock) {
        this.producer = producer;
        this.deliveryService = deliveryService;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * @param subject originator, may be null
     * @return the enriched notifications, in input order
     */
    public List<Notification> handle(List<IncomingNotification> incoming, Subject subject) {
        List<Notification> notifications = new ArrayList<>(incoming.size());
        List<Notification> immediate = new ArrayList<>();
        List<Notification> deferred = new ArrayList<>();

        for (IncomingNotification item : incoming) {
            Notification notification = enrich(item, subject);
            notifications.add(notification);
            if (notification.immediate()) {
                immediate.add(notification);
            } else {
                deferred.add(notification);
            }
        }

        if (!deferred.isEmpty()) {
            producer.publish(deferred);
        }
        if (!immediate.isEmpty()) {
            sendImmediate(immediate);
        }
        return notifications;
    }

    private void sendImmediate(List<Notification> immediate) {
        List<Notification> failed = new ArrayList<>();
        for (DeliveryResult result : deliveryService.send(immediate)) {
            if (!result.isSuccess()) {
                failed.add(result.notification());
            }
        }
        if (!failed.isEmpty()) {
            log.info("Queueing {} immediate notifications that could not be delivered", failed.size());
            producer.publish(failed);
        }
    }

    private Notification enrich(IncomingNotification incoming, Subject subject) {
        return Notification.builder()
            .id(idGenerator.get())
            .createdAt(clock.instant())
            .contacts(incoming.getContacts())
            .message(incoming.getMessage())
            .strategy(incoming.getStrategy())
            .immediate(incoming.isImmediate())
            .subject(subject)
            .build();
    }
}
