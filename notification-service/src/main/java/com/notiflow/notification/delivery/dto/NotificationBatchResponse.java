package com.notiflow.notification.delivery.dto;

import com.notiflow.notification.common.model.Notification;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationBatchResponse {
    private Integer totalAccepted;
    private List<Notification> notifications;
}
