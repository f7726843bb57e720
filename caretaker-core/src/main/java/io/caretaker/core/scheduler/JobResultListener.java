package io.caretaker.core.scheduler;

import java.time.Instant;

@FunctionalInterface
public interface JobResultListener {

    void onResult(Job job, JobResult result, Instant startedAt);
}
