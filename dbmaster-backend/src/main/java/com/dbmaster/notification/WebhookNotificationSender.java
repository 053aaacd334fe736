package com.dbmaster.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.dbmaster.model.NotificationChannel;
import com.dbmaster.model.NotificationRequest;
import com.dbmaster.model.WebhookConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Delivers notifications to a user-configured webhook. GET sends the payload as query parameters,
 * POST and PUT as a JSON body. The {@code data} block is only included when
 * {@link WebhookConfig#isIncludeResults()} is set.
 */
@Slf4j
@Component
public class WebhookNotificationSender implements NotificationSender {
    static final int DEFAULT_TIMEOUT_MS = 10_000;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int timeoutMs;

    @Autowired
    public WebhookNotificationSender(ObjectMapper objectMapper, Clock clock, Environment environment) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(DEFAULT_TIMEOUT_MS)).build(),
                objectMapper,
                clock,
                environment.getProperty("dbmaster.notification.webhook-timeout-ms", Integer.class, DEFAULT_TIMEOUT_MS));
    }

    public WebhookNotificationSender(HttpClient httpClient, ObjectMapper objectMapper, Clock clock, int timeoutMs) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WEBHOOK;
    }

    @Override
    public void send(NotificationRequest request, DeliveryTarget target) throws NotificationDeliveryException {
        WebhookConfig config = request.getWebhookConfig();
        if (config == null || config.getUrl() == null || config.getUrl().isBlank()) {
            throw new NotificationDeliveryException("Webhook configuration missing");
        }

        Map<String, Object> payload = buildPayload(request, config.isIncludeResults());
        String method = config.getMethod() != null ? config.getMethod().trim().toUpperCase(Locale.ROOT) : "POST";

        HttpRequest.Builder builder;
        try {
            if ("GET".equals(method)) {
                builder = HttpRequest.newBuilder()
                        .uri(URI.create(withQuery(config.getUrl(), payload)))
                        .GET();
            } else {
                String json = objectMapper.writeValueAsString(payload);
                HttpRequest.BodyPublisher body = HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8);
                builder = HttpRequest.newBuilder()
                        .uri(URI.create(config.getUrl()))
                        .header("Content-Type", "application/json")
                        .method("PUT".equals(method) ? "PUT" : "POST", body);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new NotificationDeliveryException("Invalid webhook request: " + e.getMessage(), e);
        }

        builder.timeout(Duration.ofMillis(timeoutMs));
        if (config.getHeaders() != null) {
            config.getHeaders().forEach(builder::header);
        }

        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new NotificationDeliveryException("Webhook returned HTTP " + response.statusCode());
            }
            log.info("Webhook notification sent: owner_id={}, status_code={}", target.ownerId(), response.statusCode());
        } catch (IOException e) {
            throw new NotificationDeliveryException("Webhook call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("Webhook call interrupted", e);
        }
    }

    Map<String, Object> buildPayload(NotificationRequest request, boolean includeResults) {
        Map<String, Object> data = request.getData() != null ? request.getData() : Map.of();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", request.getType());
        payload.put("title", request.getTitle());
        payload.put("message", request.getMessage());
        payload.put("priority", request.getPriority());
        payload.put("scheduledQueryId", data.get("scheduledQueryId"));
        payload.put("executionId", data.get("executionId"));
        payload.put("timestamp", clock.millis());
        if (includeResults && !data.isEmpty()) {
            payload.put("data", data);
        }
        return payload;
    }

    private static String withQuery(String url, Map<String, Object> payload) {
        StringJoiner query = new StringJoiner("&");
        payload.forEach((k, v) -> {
            if (v != null && !"data".equals(k)) {
                query.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(String.valueOf(v), StandardCharsets.UTF_8));
            }
        });
        if (query.length() == 0) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + query;
    }
}
