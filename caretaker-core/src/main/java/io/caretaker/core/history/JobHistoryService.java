package io.caretaker.core.history;

import io.caretaker.core.scheduler.JobResult;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of job executions, bounded to the most recent {@value #MAX_RECORDS} runs.
 */
public final class JobHistoryService {
    static final int MAX_RECORDS = 5_000;

    private final JobHistoryStore store;
    private final Clock clock;

    public JobHistoryService(JobHistoryStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized JobRunRecord record(String jobName, JobResult result, Instant startedAt) throws IOException {
        Objects.requireNonNull(result, "result must not be null");
        List<JobRunRecord> all = new ArrayList<>(store.load());
        JobRunRecord entry = new JobRunRecord(
            UUID.randomUUID().toString(),
            jobName,
            result.status(),
            result.detail(),
            startedAt,
            clock.instant()
        );
        all.add(entry);
        if (all.size() > MAX_RECORDS) {
            all = new ArrayList<>(all.subList(all.size() - MAX_RECORDS, all.size()));
        }
        store.save(all);
        return entry;
    }

    /**
     * @return up to {@code limit} records, newest first
     */
    public synchronized List<JobRunRecord> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(JobRunRecord::startedAt).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized List<JobRunRecord> recent(String jobName, int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .filter(r -> r.jobName().equals(jobName))
            .sorted(Comparator.comparing(JobRunRecord::startedAt).reversed())
            .limit(safe)
            .toList();
    }
}
