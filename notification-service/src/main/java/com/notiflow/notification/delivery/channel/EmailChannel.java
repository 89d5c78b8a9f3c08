package com.notiflow.notification.delivery.channel;

import com.notiflow.notification.common.model.ChannelType;
import com.notiflow.notification.common.model.Contact;
import com.notiflow.notification.common.model.EmailContact;
import com.notiflow.notification.delivery.config.EmailChannelProperties;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Email delivery through the SendGrid v3 API.
 */
@Slf4j
public class EmailChannel implements NotificationChannel {

    private final SendGrid sendGrid;
    private final EmailChannelProperties properties;
    private final ExecutorService executor;

    public EmailChannel(SendGrid sendGrid, EmailChannelProperties properties, ExecutorService executor) {
        this.sendGrid = sendGrid;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(Contact contact, String message) {
        if (!(contact instanceof EmailContact emailContact)) {
            throw new ChannelDeliveryException(ChannelType.EMAIL,
                "Invalid recipient: expected email, got " + (contact == null ? "null" : contact.getType().getValue()));
        }

        Mail mail = new Mail(
            new Email(properties.getFromEmail(), properties.getFromName()),
            properties.getSubject(),
            new Email(emailContact.value()),
            new Content("text/plain", message)
        );

        Response response;
        try {
            Request request = new Request();
            request.setMethod(Method.POST);
            request.setEndpoint("mail/send");
            request.setBody(mail.build());
            response = callWithTimeout(() -> sendGrid.api(request), properties.getSendTimeoutMs());
        } catch (IOException e) {
            throw new ChannelDeliveryException(ChannelType.EMAIL, "Failed to send email via SendGrid", e);
        }

        if (!isSuccessful(response)) {
            throw new ChannelDeliveryException(ChannelType.EMAIL, String.format(
                "SendGrid API error: Status %d - %s", response.getStatusCode(),
                response.getBody() != null ? response.getBody() : "No response body"));
        }
        log.debug("Email sent to {} with status code {}", emailContact.value(), response.getStatusCode());
    }

    @Override
    public boolean isHealthCheckable() {
        return true;
    }

    /**
     * Verifies that SendGrid answers and accepts the API key.
     */
    @Override
    public void checkHealth() {
        Response response;
        try {
            Request request = new Request();
            request.setMethod(Method.GET);
            request.setEndpoint("scopes");
            response = callWithTimeout(() -> sendGrid.api(request), properties.getHealthcheckTimeoutMs());
        } catch (IOException e) {
            throw new ChannelDeliveryException(ChannelType.EMAIL, "SendGrid is unavailable", e);
        }
        if (!isSuccessful(response)) {
            throw new ChannelDeliveryException(ChannelType.EMAIL,
                "SendGrid health check failed with status " + response.getStatusCode());
        }
    }

    private Response callWithTimeout(Callable<Response> call, long timeoutMs) throws IOException {
        Future<Response> future = executor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IOException("SendGrid did not respond within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            throw new IOException("SendGrid request failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IOException("Interrupted while waiting for SendGrid", e);
        }
    }

    private static boolean isSuccessful(Response response) {
        return response != null && response.getStatusCode() >= 200 && response.getStatusCode() < 300;
    }
}
