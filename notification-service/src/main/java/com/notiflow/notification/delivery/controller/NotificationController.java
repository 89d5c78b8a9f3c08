package com.notiflow.notification.delivery.controller;

import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.model.Subject;
import com.notiflow.notification.delivery.dto.NotificationBatchRequest;
import com.notiflow.notification.delivery.dto.NotificationBatchResponse;
import com.notiflow.notification.delivery.usecase.HandleIncomingNotificationsUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final HandleIncomingNotificationsUseCase handleIncomingNotifications;

    @PostMapping
    public ResponseEntity<NotificationBatchResponse> submit(
            @RequestHeader(value = "X-Subject-Id", required = false) String subjectId,
            @RequestHeader(value = "X-Subject-Name", required = false) String subjectName,
            @Valid @RequestBody NotificationBatchRequest request) {

        Subject subject = subjectId != null && !subjectId.isBlank() ? new Subject(subjectId, subjectName) : null;
        List<Notification> accepted = handleIncomingNotifications.handle(request.getNotifications(), subject);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new NotificationBatchResponse(accepted.size(), accepted));
    }
}
