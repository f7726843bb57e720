package io.caretaker.core.backup;

import io.caretaker.core.scheduler.JobHandler;
import io.caretaker.core.scheduler.JobResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class BackupJob implements JobHandler {
    private final BackupManager manager;
    private final int retentionDays;

    public BackupJob(BackupManager manager, int retentionDays) {
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.retentionDays = retentionDays;
    }

    @Override
    public JobResult run() {
        BackupRecord record = manager.createBackup(retentionDays);
        if (!record.success()) {
            JobResult failed = JobResult.error(record.error(), record.timestamp());
            Map<String, Object> detail = new LinkedHashMap<>(failed.detail());
            detail.put("swept", record.sweep().deletedCount());
            return new JobResult(failed.status(), detail, failed.timestamp());
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("archive", record.archivePath().getFileName().toString());
        detail.put("db_kind", record.dbKind().name());
        detail.put("size_bytes", record.sizeBytes());
        detail.put("logs", record.logCount());
        detail.put("duration_seconds", record.durationSeconds());
        detail.put("swept", record.sweep().deletedCount());
        detail.put("freed_bytes", record.sweep().freedBytes());
        return JobResult.ok(detail, record.timestamp());
    }
}
