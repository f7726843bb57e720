package io.caretaker.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"tick_seconds"}) int tickSeconds,
    @JsonAlias({"history_file"}) String historyFile,
    @JsonAlias({"time_zone"}) String timeZone
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(10, "~/.caretaker/history/job-runs.json", "");
    }
}
