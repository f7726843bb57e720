package io.caretaker.core.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.caretaker.core.config.model.SlackConfig;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slack channel. With a webhook URL configured the message goes to the incoming webhook;
 * otherwise it is posted through {@code chat.postMessage} using the bot token.
 */
public final class SlackNotificationSink implements NotificationSink {
    private static final Logger LOG = LoggerFactory.getLogger(SlackNotificationSink.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final SlackConfig config;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public SlackNotificationSink(SlackConfig config, OkHttpClient client, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public SendResult send(String message) {
        if (!config.configured()) {
            LOG.info("Slack is not configured; skipping notification");
            return SendResult.skipped();
        }
        String text = message == null ? "" : message;
        try {
            return config.hasWebhook() ? postWebhook(text) : postMessage(text);
        } catch (IOException e) {
            LOG.warn("Slack request failed: {}", e.getMessage());
            return SendResult.failed("request_failed: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Slack send failed", e);
            return SendResult.failed(e.getMessage());
        }
    }

    private SendResult postMessage(String text) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", config.channel());
        payload.put("text", text);

        Request request = new Request.Builder()
            .url(trimTrailingSlash(config.apiBase()) + "/chat.postMessage")
            .addHeader("Authorization", "Bearer " + config.botToken())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();

        try (Response response = client.newCall(request).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                LOG.warn("Slack API returned HTTP {}", response.code());
                return SendResult.failed("http_" + response.code());
            }
            JsonNode body = raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
            if (body.path("ok").asBoolean(false)) {
                LOG.debug("Slack message delivered to #{}", config.channel());
                return SendResult.sent();
            }
            String error = body.path("error").asText("unknown_error");
            if ("channel_not_found".equals(error)) {
                LOG.warn("Slack channel '{}' not found; invite the bot or fix the channel name", config.channel());
            } else if ("missing_scope".equals(error)) {
                LOG.warn("Slack token lacks a required scope: {}", body.path("needed").asText("n/a"));
            } else {
                LOG.warn("Slack API error: {}", error);
            }
            return SendResult.failed(error);
        }
    }

    private SendResult postWebhook(String text) throws IOException {
        Request request = new Request.Builder()
            .url(config.webhookUrl())
            .post(RequestBody.create(mapper.writeValueAsString(Map.of("text", text)), JSON))
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return SendResult.sent();
            }
            String raw = response.body() == null ? "" : response.body().string();
            LOG.warn("Slack webhook returned HTTP {}: {}", response.code(), raw);
            return SendResult.failed(raw.isBlank() ? "http_" + response.code() : raw.trim());
        }
    }

    private String trimTrailingSlash(String base) {
        if (base == null || base.isBlank()) {
            return "https://slack.com/api";
        }
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
