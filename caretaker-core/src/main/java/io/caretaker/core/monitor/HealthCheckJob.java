package io.caretaker.core.monitor;

import io.caretaker.core.model.Status;
import io.caretaker.core.scheduler.JobHandler;
import io.caretaker.core.scheduler.JobResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class HealthCheckJob implements JobHandler {
    private final HealthMonitor monitor;
    private final Thresholds thresholds;

    public HealthCheckJob(HealthMonitor monitor, Thresholds thresholds) {
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    @Override
    public JobResult run() {
        HealthSample sample = monitor.check(thresholds);
        Map<String, Object> detail = new LinkedHashMap<>();
        if (sample.status() == Status.ERROR) {
            detail.put("error", sample.error());
        } else {
            detail.put("cpu", sample.cpuPct());
            detail.put("memory", sample.memPct());
            detail.put("disk", sample.diskPct());
            detail.put("alerts", sample.alerts());
        }
        return new JobResult(sample.status(), detail, sample.checkedAt());
    }
}
