package io.caretaker.core.scheduler;

import io.caretaker.core.model.Status;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record JobResult(Status status, Map<String, Object> detail, Instant timestamp) {

    public JobResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static JobResult ok(Map<String, Object> detail, Instant timestamp) {
        return new JobResult(Status.OK, detail, timestamp);
    }

    public static JobResult warning(Map<String, Object> detail, Instant timestamp) {
        return new JobResult(Status.WARNING, detail, timestamp);
    }

    public static JobResult error(String message, Instant timestamp) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("error", message == null ? "unknown error" : message);
        return new JobResult(Status.ERROR, detail, timestamp);
    }

    public String errorMessage() {
        Object value = detail.get("error");
        return value == null ? "" : String.valueOf(value);
    }
}
