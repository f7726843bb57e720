package io.caretaker.core.history;

import io.caretaker.core.scheduler.Job;
import io.caretaker.core.scheduler.JobResult;
import io.caretaker.core.scheduler.JobResultListener;
import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HistoryRecordingListener implements JobResultListener {
    private static final Logger LOG = LoggerFactory.getLogger(HistoryRecordingListener.class);

    private final JobHistoryService history;

    public HistoryRecordingListener(JobHistoryService history) {
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    @Override
    public void onResult(Job job, JobResult result, Instant startedAt) {
        try {
            history.record(job.name(), result, startedAt);
        } catch (IOException e) {
            LOG.warn("Could not record run of job '{}': {}", job.name(), e.getMessage());
        }
    }
}
