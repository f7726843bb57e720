package io.caretaker.core.monitor;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Reads utilization from the JVM's platform MXBean, {@code /proc/meminfo} where available and
 * the {@link FileStore} of the monitored path.
 */
public final class SystemResourceProbe implements ResourceProbe {
    private static final Path MEMINFO = Path.of("/proc/meminfo");

    private final com.sun.management.OperatingSystemMXBean os;

    public SystemResourceProbe() {
        OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        this.os = bean instanceof com.sun.management.OperatingSystemMXBean sun ? sun : null;
    }

    @Override
    public double cpuPercent(Duration window) throws MeasurementException {
        requireBean();
        // first reading only primes the counters
        os.getCpuLoad();
        try {
            Thread.sleep(Math.max(1L, window.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MeasurementException("CPU sampling interrupted", e);
        }
        double load = os.getCpuLoad();
        if (load < 0 || Double.isNaN(load)) {
            throw new MeasurementException("CPU load is not available on this platform");
        }
        return clamp(load * 100.0);
    }

    @Override
    public double memoryPercent() throws MeasurementException {
        Double fromProc = readMemAvailablePercent();
        if (fromProc != null) {
            return fromProc;
        }
        requireBean();
        long total = os.getTotalMemorySize();
        long free = os.getFreeMemorySize();
        if (total <= 0) {
            throw new MeasurementException("total memory size is not available");
        }
        return clamp((total - free) * 100.0 / total);
    }

    @Override
    public double diskPercent(Path path) throws MeasurementException {
        try {
            FileStore store = Files.getFileStore(path);
            long total = store.getTotalSpace();
            long used = total - store.getUnallocatedSpace();
            long usable = store.getUsableSpace();
            long denominator = used + usable;
            if (total <= 0 || denominator <= 0) {
                throw new MeasurementException("file store for " + path + " reports no capacity");
            }
            return clamp(used * 100.0 / denominator);
        } catch (IOException e) {
            throw new MeasurementException("cannot read disk usage for " + path + ": " + e.getMessage(), e);
        }
    }

    private Double readMemAvailablePercent() {
        if (!Files.isReadable(MEMINFO)) {
            return null;
        }
        try {
            List<String> lines = Files.readAllLines(MEMINFO);
            long total = -1;
            long available = -1;
            for (String line : lines) {
                if (line.startsWith("MemTotal:")) {
                    total = parseKb(line);
                } else if (line.startsWith("MemAvailable:")) {
                    available = parseKb(line);
                }
            }
            if (total <= 0 || available < 0) {
                return null;
            }
            return clamp((total - available) * 100.0 / total);
        } catch (IOException | NumberFormatException e) {
            return null;
        }
    }

    private long parseKb(String line) {
        String[] parts = line.trim().split("\\s+");
        return Long.parseLong(parts[1]);
    }

    private void requireBean() throws MeasurementException {
        if (os == null) {
            throw new MeasurementException("platform OperatingSystemMXBean is not available");
        }
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
