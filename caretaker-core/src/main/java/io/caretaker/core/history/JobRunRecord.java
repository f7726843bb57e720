package io.caretaker.core.history;

import io.caretaker.core.model.Status;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record JobRunRecord(
    String id,
    String jobName,
    Status status,
    Map<String, Object> detail,
    Instant startedAt,
    Instant finishedAt
) {
    public JobRunRecord {
        id = id == null ? "" : id.trim();
        jobName = jobName == null ? "" : jobName.trim();
        status = status == null ? Status.ERROR : status;
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
        startedAt = startedAt == null ? Instant.EPOCH : startedAt;
        finishedAt = finishedAt == null ? startedAt : finishedAt;
    }
}
