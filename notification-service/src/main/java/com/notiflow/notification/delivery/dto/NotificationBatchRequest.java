package com.notiflow.notification.delivery.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationBatchRequest {

    @NotEmpty(message = "Notifications list cannot be empty")
    @Valid
    private List<IncomingNotification> notifications;
}
