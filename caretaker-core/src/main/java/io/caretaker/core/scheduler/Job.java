package io.caretaker.core.scheduler;

import java.time.Instant;
import java.util.Objects;

/**
 * A registered job. Only {@link JobScheduler} changes the scheduling fields.
 */
public final class Job {
    private final String name;
    private final Trigger trigger;
    private final JobHandler handler;
    private Instant nextRun;
    private Instant lastRun;
    private JobResult lastResult;

    Job(String name, Trigger trigger, JobHandler handler, Instant nextRun) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.nextRun = Objects.requireNonNull(nextRun, "nextRun must not be null");
    }

    public String name() {
        return name;
    }

    public Trigger trigger() {
        return trigger;
    }

    JobHandler handler() {
        return handler;
    }

    public Instant nextRun() {
        return nextRun;
    }

    public Instant lastRun() {
        return lastRun;
    }

    public JobResult lastResult() {
        return lastResult;
    }

    boolean isDue(Instant now) {
        return !nextRun.isAfter(now);
    }

    void completed(Instant startedAt, JobResult result, Instant next) {
        this.lastRun = startedAt;
        this.lastResult = result;
        this.nextRun = next;
    }
}
