package com.notiflow.notification.delivery.controller;

import com.notiflow.notification.common.exception.QueueOperationException;
import com.notiflow.notification.common.model.EmailContact;
import com.notiflow.notification.common.model.Notification;
import com.notiflow.notification.common.model.Subject;
import com.notiflow.notification.delivery.dto.IncomingNotification;
import com.notiflow.notification.delivery.usecase.HandleIncomingNotificationsUseCase;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(NotificationController.class)
class NotificationControllerTest {

    private static final String BODY = """
        {
          "notifications": [
            {
              "contacts": [{"type": "email", "value": "ops@example.com"}, {"type": "bitrix", "value": 42}],
              "message": "Disk almost full",
              "strategy": "sendToAllAvailable",
              "isImmediate": true
            }
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HandleIncomingNotificationsUseCase handleIncomingNotifications;

    @Test
    void testSubmit_Success_ReturnsAcceptedWithEnrichedNotifications() throws Exception {
        Notification enriched = Notification.builder()
            .id("n-1")
            .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
            .contacts(List.of(new EmailContact("ops@example.com")))
            .message("Disk almost full")
            .immediate(true)
            .subject(new Subject("crm", "CRM"))
            .build();
        when(handleIncomingNotifications.handle(anyList(), any())).thenReturn(List.of(enriched));

        mockMvc.perform(post("/api/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Subject-Id", "crm")
                .header("X-Subject-Name", "CRM")
                .content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.totalAccepted").value(1))
                .andExpect(jsonPath("$.notifications[0].id").value("n-1"))
                .andExpect(jsonPath("$.notifications[0].isImmediate").value(true))
                .andExpect(jsonPath("$.notifications[0].contacts[0].type").value("email"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<IncomingNotification>> captor = ArgumentCaptor.forClass(List.class);
        verify(handleIncomingNotifications).handle(captor.capture(), eq(new Subject("crm", "CRM")));
        IncomingNotification incoming = captor.getValue().get(0);
        assertEquals(2, incoming.getContacts().size());
        assertTrue(incoming.isImmediate());
    }

    @Test
    void testSubmit_WithoutSubjectHeaders_PassesNoSubject() throws Exception {
        when(handleIncomingNotifications.handle(anyList(), isNull())).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
                .andExpect(status().isAccepted());

        verify(handleIncomingNotifications).handle(anyList(), isNull());
    }

    @Test
    void testSubmit_EmptyNotifications_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notifications\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(handleIncomingNotifications);
    }

    @Test
    void testSubmit_MissingMessage_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notifications\": [{\"contacts\": [{\"type\": \"bitrix\", \"value\": 1}]}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors['notifications[0].message']").value("Message is required"));
    }

    @Test
    void testSubmit_UnknownContactType_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notifications\": [{\"contacts\": [{\"type\": \"sms\", \"value\": \"1\"}], \"message\": \"x\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));
    }

    @Test
    void testSubmit_WhenQueueUnavailable_ReturnsServiceUnavailable() throws Exception {
        when(handleIncomingNotifications.handle(anyList(), any()))
            .thenThrow(new QueueOperationException("Failed to publish to queue notifications"));

        mockMvc.perform(post("/api/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("QUEUE_UNAVAILABLE"));
    }
}
