package io.caretaker.core.monitor;

import io.caretaker.core.model.Status;
import io.caretaker.core.notify.NotificationSink;
import io.caretaker.core.notify.NotificationSinks;
import io.caretaker.core.notify.SendResult;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples resource pressure and compares it to thresholds. {@link #check(Thresholds)} never
 * throws for measurement problems; they are reported as {@link Status#ERROR}.
 */
public final class HealthMonitor {
    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ResourceProbe probe;
    private final NotificationSink sink;
    private final Path diskPath;
    private final Duration cpuWindow;
    private final Clock clock;

    public HealthMonitor(ResourceProbe probe, NotificationSink sink, Path diskPath, Duration cpuWindow, Clock clock) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.diskPath = diskPath == null ? defaultDiskPath() : diskPath;
        this.cpuWindow = cpuWindow == null ? Duration.ofSeconds(1) : cpuWindow;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static Path defaultDiskPath() {
        Path root = Path.of("").toAbsolutePath().getRoot();
        return root == null ? Path.of("/") : root;
    }

    public HealthSample check(Thresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        double cpu;
        double mem;
        double disk;
        try {
            cpu = probe.cpuPercent(cpuWindow);
            mem = probe.memoryPercent();
            disk = probe.diskPercent(diskPath);
        } catch (MeasurementException e) {
            LOG.error("Resource measurement failed: {}", e.getMessage());
            return HealthSample.failed(e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while sampling resources", e);
            return HealthSample.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), clock.instant());
        }

        LOG.info("CPU:{}% | MEM:{}% | DISK:{}%", format(cpu), format(mem), format(disk));

        List<String> alerts = new ArrayList<>();
        if (cpu > thresholds.cpu()) {
            alerts.add("CPU: " + format(cpu) + "% (threshold: " + format(thresholds.cpu()) + "%)");
        }
        if (mem > thresholds.mem()) {
            alerts.add("Memory: " + format(mem) + "% (threshold: " + format(thresholds.mem()) + "%)");
        }
        if (disk > thresholds.disk()) {
            alerts.add("Disk: " + format(disk) + "% (threshold: " + format(thresholds.disk()) + "%)");
        }

        HealthSample sample = new HealthSample(
            cpu,
            mem,
            disk,
            alerts,
            alerts.isEmpty() ? Status.OK : Status.WARNING,
            null,
            clock.instant()
        );
        if (!alerts.isEmpty()) {
            LOG.warn("Resource thresholds exceeded: {}", String.join(", ", alerts));
            alert(sample);
        }
        return sample;
    }

    private void alert(HealthSample sample) {
        StringBuilder message = new StringBuilder("*Server resource warning*\n");
        for (String alert : sample.alerts()) {
            message.append("  - ").append(alert).append('\n');
        }
        message.append("- Time: ").append(TIME_FORMAT.format(sample.checkedAt().atZone(zone())));

        SendResult result = NotificationSinks.sendQuietly(sink, message.toString());
        if (!result.ok()) {
            LOG.error("Failed to send resource alert via {}: {}", sink.name(), result.error());
        }
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
