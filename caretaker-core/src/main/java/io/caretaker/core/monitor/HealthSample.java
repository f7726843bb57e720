package io.caretaker.core.monitor;

import io.caretaker.core.model.Status;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * One measurement of CPU, memory and disk pressure. Metric fields are {@code NaN} when
 * {@code status} is {@link Status#ERROR}.
 */
public record HealthSample(
    double cpuPct,
    double memPct,
    double diskPct,
    List<String> alerts,
    Status status,
    String error,
    Instant checkedAt
) {

    public HealthSample {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    static HealthSample failed(String error, Instant checkedAt) {
        return new HealthSample(Double.NaN, Double.NaN, Double.NaN, List.of(), Status.ERROR, error, checkedAt);
    }

    public String summary() {
        if (status == Status.ERROR) {
            return "ERROR - " + error;
        }
        return String.format(Locale.ROOT, "CPU:%.1f%% | MEM:%.1f%% | DISK:%.1f%%", cpuPct, memPct, diskPct);
    }
}
