package io.caretaker.core.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.caretaker.core.config.model.NotificationConfig;
import io.caretaker.core.config.model.SlackConfig;
import java.time.Duration;
import okhttp3.OkHttpClient;

public final class NotificationSinks {

    private NotificationSinks() {
    }

    public static NotificationSink fromConfig(NotificationConfig config, ObjectMapper mapper) {
        SlackConfig slack = config == null ? null : config.slack();
        if (slack == null || !slack.configured()) {
            return new DisabledNotificationSink("no notification channel configured");
        }
        OkHttpClient client = new OkHttpClient.Builder()
            .callTimeout(Duration.ofSeconds(Math.max(1, slack.timeoutSeconds())))
            .build();
        return new SlackNotificationSink(slack, client, mapper);
    }

    /**
     * Calls {@code sink.send}, converting anything an implementation throws into a failed result.
     */
    public static SendResult sendQuietly(NotificationSink sink, String message) {
        try {
            SendResult result = sink.send(message);
            return result == null ? SendResult.failed("sink returned no result") : result;
        } catch (RuntimeException e) {
            return SendResult.failed(e.getMessage());
        }
    }
}
