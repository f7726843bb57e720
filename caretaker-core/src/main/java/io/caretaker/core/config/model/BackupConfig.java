package io.caretaker.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BackupConfig(
    @JsonAlias({"database_url"}) String databaseUrl,
    @JsonAlias({"backup_dir"}) String backupDir,
    @JsonAlias({"log_dir"}) String logDir,
    @JsonAlias({"log_pattern"}) String logPattern,
    @JsonAlias({"retention_days"}) int retentionDays,
    @JsonAlias({"backup_time"}) String backupTime,
    @JsonAlias({"dump_timeout_seconds"}) int dumpTimeoutSeconds,
    @JsonAlias({"dump_command"}) String dumpCommand,
    @JsonAlias({"log_only_archive_on_dump_failure"}) boolean logOnlyArchiveOnDumpFailure
) {

    public static BackupConfig defaults() {
        return new BackupConfig(
            "",
            "backups",
            "logs",
            "*.log*",
            7,
            "00:00",
            300,
            "pg_dump",
            false
        );
    }

    public BackupConfig withDatabaseUrl(String value) {
        return new BackupConfig(
            value,
            backupDir,
            logDir,
            logPattern,
            retentionDays,
            backupTime,
            dumpTimeoutSeconds,
            dumpCommand,
            logOnlyArchiveOnDumpFailure
        );
    }
}
