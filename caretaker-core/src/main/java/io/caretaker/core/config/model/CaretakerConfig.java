package io.caretaker.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CaretakerConfig(
    SchedulerConfig scheduler,
    BackupConfig backup,
    MonitorConfig monitor,
    FeedbackConfig feedback,
    NotificationConfig notification
) {

    public static CaretakerConfig defaults() {
        return new CaretakerConfig(
            SchedulerConfig.defaults(),
            BackupConfig.defaults(),
            MonitorConfig.defaults(),
            FeedbackConfig.defaults(),
            NotificationConfig.defaults()
        );
    }

    public CaretakerConfig withBackup(BackupConfig value) {
        return new CaretakerConfig(scheduler, value, monitor, feedback, notification);
    }

    public CaretakerConfig withFeedback(FeedbackConfig value) {
        return new CaretakerConfig(scheduler, backup, monitor, value, notification);
    }

    public CaretakerConfig withNotification(NotificationConfig value) {
        return new CaretakerConfig(scheduler, backup, monitor, feedback, value);
    }
}
