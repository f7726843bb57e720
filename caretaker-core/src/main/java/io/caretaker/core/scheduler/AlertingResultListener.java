package io.caretaker.core.scheduler;

import io.caretaker.core.model.Status;
import io.caretaker.core.notify.NotificationSink;
import io.caretaker.core.notify.NotificationSinks;
import io.caretaker.core.notify.SendResult;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards failed job executions to the notification sink.
 */
public final class AlertingResultListener implements JobResultListener {
    private static final Logger LOG = LoggerFactory.getLogger(AlertingResultListener.class);

    private final NotificationSink sink;

    public AlertingResultListener(NotificationSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    @Override
    public void onResult(Job job, JobResult result, Instant startedAt) {
        if (result.status() != Status.ERROR) {
            return;
        }
        String message = "*Scheduled job failed*\n"
            + "- Job: " + job.name() + "\n"
            + "- Error: " + result.errorMessage() + "\n"
            + "- Started: " + startedAt;
        SendResult sent = NotificationSinks.sendQuietly(sink, message);
        if (!sent.ok()) {
            LOG.warn("Could not alert failure of job {}: {}", job.name(), sent.error());
        }
    }
}
