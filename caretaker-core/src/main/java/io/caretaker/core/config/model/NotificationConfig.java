package io.caretaker.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationConfig(SlackConfig slack) {

    public static NotificationConfig defaults() {
        return new NotificationConfig(SlackConfig.defaults());
    }
}
