package io.caretaker.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedbackConfig(
    @JsonAlias({"database_url"}) String databaseUrl,
    @JsonAlias({"feedback_threshold"}) double threshold,
    @JsonAlias({"interval_minutes"}) int intervalMinutes
) {

    public static FeedbackConfig defaults() {
        return new FeedbackConfig("", 0.3, 60 * 24);
    }

    public boolean configured() {
        return databaseUrl != null && !databaseUrl.isBlank();
    }

    public FeedbackConfig withDatabaseUrl(String value) {
        return new FeedbackConfig(value, threshold, intervalMinutes);
    }
}
