package com.notiflow.notification.delivery.channel;

import com.notiflow.notification.common.model.BitrixContact;
import com.notiflow.notification.common.model.EmailContact;
import com.notiflow.notification.delivery.config.EmailChannelProperties;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailChannelTest {

    @Mock
    private SendGrid sendGrid;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private EmailChannel channel;

    @BeforeEach
    void setUp() {
        EmailChannelProperties properties = new EmailChannelProperties();
        properties.setEnabled(true);
        properties.setApiKey("SG.test");
        properties.setFromEmail("noreply@example.com");
        properties.setFromName("Notifications");
        properties.setSendTimeoutMs(300);
        channel = new EmailChannel(sendGrid, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testSend_PostsMailToSendGrid() throws Exception {
        when(sendGrid.api(any(Request.class))).thenReturn(new Response(202, "", Map.of()));

        channel.send(new EmailContact("ops@example.com"), "Disk almost full");

        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(sendGrid).api(captor.capture());
        Request request = captor.getValue();
        assertEquals(Method.POST, request.getMethod());
        assertEquals("mail/send", request.getEndpoint());
        assertTrue(request.getBody().contains("ops@example.com"));
        assertTrue(request.getBody().contains("Disk almost full"));
        assertTrue(request.getBody().contains("noreply@example.com"));
    }

    @Test
    void testSend_WhenSendGridRejects_Throws() throws Exception {
        when(sendGrid.api(any(Request.class))).thenReturn(new Response(400, "{\"errors\":[]}", Map.of()));

        ChannelDeliveryException e = assertThrows(ChannelDeliveryException.class,
            () -> channel.send(new EmailContact("ops@example.com"), "hi"));
        assertTrue(e.getMessage().contains("400"));
    }

    @Test
    void testSend_WhenSendGridUnreachable_Throws() throws Exception {
        when(sendGrid.api(any(Request.class))).thenThrow(new IOException("connection reset"));

        ChannelDeliveryException e = assertThrows(ChannelDeliveryException.class,
            () -> channel.send(new EmailContact("ops@example.com"), "hi"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testSend_WhenSendGridHangs_TimesOut() throws Exception {
        when(sendGrid.api(any(Request.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new Response(202, "", Map.of());
        });

        long startedAt = System.currentTimeMillis();
        assertThrows(ChannelDeliveryException.class, () -> channel.send(new EmailContact("ops@example.com"), "hi"));
        assertTrue(System.currentTimeMillis() - startedAt < 3_000);
    }

    @Test
    void testSend_WithBitrixContact_IsRejected() {
        assertThrows(ChannelDeliveryException.class, () -> channel.send(new BitrixContact(1), "hi"));
        verifyNoInteractions(sendGrid);
    }

    @Test
    void testCheckHealth_WhenApiKeyAccepted_Passes() throws Exception {
        when(sendGrid.api(any(Request.class))).thenReturn(new Response(200, "{\"scopes\":[]}", Map.of()));

        assertDoesNotThrow(channel::checkHealth);
    }

    @Test
    void testCheckHealth_WhenApiKeyRejected_Throws() throws Exception {
        when(sendGrid.api(any(Request.class))).thenReturn(new Response(401, "", Map.of()));

        assertThrows(ChannelDeliveryException.class, channel::checkHealth);
    }
}
