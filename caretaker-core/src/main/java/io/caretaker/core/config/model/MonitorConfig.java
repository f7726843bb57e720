package io.caretaker.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MonitorConfig(
    @JsonAlias({"interval_minutes", "monitor_interval_minutes"}) int intervalMinutes,
    @JsonAlias({"cpu_threshold"}) double cpuThreshold,
    @JsonAlias({"mem_threshold"}) double memThreshold,
    @JsonAlias({"disk_threshold"}) double diskThreshold,
    @JsonAlias({"disk_path"}) String diskPath,
    @JsonAlias({"cpu_sample_millis"}) int cpuSampleMillis
) {

    public static MonitorConfig defaults() {
        return new MonitorConfig(30, 85, 90, 90, "", 1000);
    }
}
