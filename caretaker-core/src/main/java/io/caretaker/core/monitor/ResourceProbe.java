package io.caretaker.core.monitor;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Source of utilization figures, each expressed as a percentage in {@code [0, 100]}.
 */
public interface ResourceProbe {

    /**
     * Blocks for {@code window} and returns the average system CPU load over it.
     */
    double cpuPercent(Duration window) throws MeasurementException;

    double memoryPercent() throws MeasurementException;

    double diskPercent(Path path) throws MeasurementException;
}
