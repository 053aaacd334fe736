package com.dbmaster.notification;

import com.dbmaster.model.NotificationChannel;
import com.dbmaster.model.NotificationPriority;
import com.dbmaster.model.NotificationRequest;
import com.dbmaster.model.NotificationType;
import com.dbmaster.model.WebhookConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookNotificationSenderTest {

    private static final Instant NOW = Instant.parse("2024-01-15T09:00:00Z");
    private static final DeliveryTarget TARGET = new DeliveryTarget("u1", List.of(), List.of());

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private WebhookNotificationSender sender;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
        sender = new WebhookNotificationSender(httpClient, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC), 2_000);
    }

    private static NotificationRequest request(WebhookConfig config) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scheduledQueryId", "sq-1");
        data.put("executionId", "ex-1");
        data.put("results", List.of(Map.of("ID", 1)));
        return NotificationRequest.builder()
                .type(NotificationType.QUERY_EXECUTION_ALERT)
                .title("Alert: nightly")
                .message("Alert triggered")
                .priority(NotificationPriority.HIGH)
                .webhookConfig(config)
                .data(data)
                .build();
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void postsJsonWithCustomHeaders() throws Exception {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Api-Key", "k-123");
        WebhookConfig config = WebhookConfig.builder().url("https://hooks.example.com/alerts").headers(headers).build();

        sender.send(request(config), TARGET);

        HttpRequest sent = sentRequest();
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.uri().toString()).isEqualTo("https://hooks.example.com/alerts");
        assertThat(sent.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(sent.headers().firstValue("X-Api-Key")).contains("k-123");
        assertThat(sent.timeout()).hasValueSatisfying(t -> assertThat(t.toMillis()).isEqualTo(2_000L));
    }

    @Test
    void putUsesPutMethod() throws Exception {
        sender.send(request(WebhookConfig.builder().url("https://hooks.example.com/a").method("put").build()), TARGET);

        assertThat(sentRequest().method()).isEqualTo("PUT");
    }

    @Test
    void getSendsPayloadAsQueryParameters() throws Exception {
        sender.send(request(WebhookConfig.builder().url("https://hooks.example.com/a?token=x").method("GET")
                .includeResults(true).build()), TARGET);

        HttpRequest sent = sentRequest();
        String uri = sent.uri().toString();
        assertThat(sent.method()).isEqualTo("GET");
        assertThat(uri).startsWith("https://hooks.example.com/a?token=x&type=QUERY_EXECUTION_ALERT");
        assertThat(uri).contains("title=Alert%3A+nightly", "scheduledQueryId=sq-1", "timestamp=" + NOW.toEpochMilli());
        assertThat(uri).doesNotContain("data=");
    }

    @Test
    void errorStatusIsADeliveryFailure() {
        when(response.statusCode()).thenReturn(502);

        assertThatThrownBy(() -> sender.send(request(WebhookConfig.builder().url("https://hooks.example.com/a").build()), TARGET))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasMessageContaining("502");
    }

    @Test
    @SuppressWarnings("unchecked")
    void ioErrorIsADeliveryFailure() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> sender.send(request(WebhookConfig.builder().url("https://hooks.example.com/a").build()), TARGET))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasMessageContaining("connection reset");
    }

    @Test
    void missingUrlIsADeliveryFailure() {
        assertThatThrownBy(() -> sender.send(request(WebhookConfig.builder().build()), TARGET))
                .isInstanceOf(NotificationDeliveryException.class);
    }

    @Test
    void payloadIncludesDataOnlyWhenRequested() {
        NotificationRequest request = request(WebhookConfig.builder().url("https://hooks.example.com/a").build());

        Map<String, Object> withoutData = sender.buildPayload(request, false);
        Map<String, Object> withData = sender.buildPayload(request, true);

        assertThat(withoutData).containsKeys("type", "title", "message", "priority", "scheduledQueryId", "executionId", "timestamp")
                .doesNotContainKey("data");
        assertThat(withoutData).containsEntry("executionId", "ex-1").containsEntry("timestamp", NOW.toEpochMilli());
        assertThat(withData).containsKey("data");
    }

    @Test
    void handlesWebhookChannel() {
        assertThat(sender.channel()).isEqualTo(NotificationChannel.WEBHOOK);
    }
}
