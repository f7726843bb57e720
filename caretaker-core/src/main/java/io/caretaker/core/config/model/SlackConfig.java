package io.caretaker.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackConfig(
    @JsonAlias({"bot_token"}) String botToken,
    @JsonAlias({"channel"}) String channel,
    @JsonAlias({"webhook_url"}) String webhookUrl,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static SlackConfig defaults() {
        return new SlackConfig("", "ai-reports", "", "https://slack.com/api", 10);
    }

    public boolean configured() {
        return hasWebhook() || (botToken != null && !botToken.isBlank());
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public SlackConfig with(String token, String channelName, String webhook) {
        return new SlackConfig(token, channelName, webhook, apiBase, timeoutSeconds);
    }
}
