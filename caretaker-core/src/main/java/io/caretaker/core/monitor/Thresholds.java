package io.caretaker.core.monitor;

import io.caretaker.core.config.model.MonitorConfig;

public record Thresholds(double cpu, double mem, double disk) {

    public static Thresholds defaults() {
        return new Thresholds(85, 90, 90);
    }

    public static Thresholds from(MonitorConfig config) {
        return new Thresholds(config.cpuThreshold(), config.memThreshold(), config.diskThreshold());
    }
}
