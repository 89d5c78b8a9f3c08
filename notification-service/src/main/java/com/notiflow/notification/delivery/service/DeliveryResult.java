package com.notiflow.notification.delivery.service;

import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.result.MessageResult;

import java.util.List;

/**
 * Outcome of one delivery attempt for one notification. {@code warnings} is always present;
 * {@code error} is set only on failure.
 */
public record DeliveryResult(
    DeliveryStatus status,
    Notification notification,
    List<DeliveryDetail> details,
    List<DeliveryWarning> warnings,
    Throwable error
) implements MessageResult {

    public DeliveryResult {
        details = details == null ? List.of() : List.copyOf(details);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static DeliveryResult success(Notification notification, List<DeliveryDetail> details,
                                         List<DeliveryWarning> warnings) {
        return new DeliveryResult(DeliveryStatus.SUCCESS, notification, details, warnings, null);
    }

    public static DeliveryResult failure(Notification notification, Throwable error, List<DeliveryWarning> warnings) {
        return new DeliveryResult(DeliveryStatus.FAILURE, notification, List.of(), warnings, error);
    }

    @Override
    public boolean isSuccess() {
        return status == DeliveryStatus.SUCCESS;
    }

    @Override
    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }
}
