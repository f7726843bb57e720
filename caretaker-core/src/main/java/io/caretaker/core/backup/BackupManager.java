package io.caretaker.core.backup;

import io.caretaker.core.config.ConfigException;
import io.caretaker.core.database.DatabaseTarget;
import io.caretaker.core.database.DbKind;
import io.caretaker.core.notify.NotificationSink;
import io.caretaker.core.notify.NotificationSinks;
import io.caretaker.core.notify.SendResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one backup: dump, verify, package, sweep, notify. The manager is the only writer of the
 * backup directory while a run is in progress; overlapping calls are rejected.
 */
public final class BackupManager {
    private static final Logger LOG = LoggerFactory.getLogger(BackupManager.class);
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final BackupSettings settings;
    private final Map<DbKind, DatabaseDumper> dumpers;
    private final ArchivePackager packager;
    private final RetentionSweeper sweeper;
    private final NotificationSink sink;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BackupManager(
        BackupSettings settings,
        Map<DbKind, DatabaseDumper> dumpers,
        ArchivePackager packager,
        RetentionSweeper sweeper,
        NotificationSink sink,
        Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(dumpers, "dumpers must not be null");
        this.dumpers = dumpers.isEmpty() ? new EnumMap<>(DbKind.class) : new EnumMap<>(dumpers);
        this.packager = Objects.requireNonNull(packager, "packager must not be null");
        this.sweeper = Objects.requireNonNull(sweeper, "sweeper must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Standard dumpers: {@code pg_dump} for PostgreSQL and a gzip copy for SQLite.
     */
    public static Map<DbKind, DatabaseDumper> defaultDumpers(CommandRunner runner, String dumpCommand, Duration timeout) {
        Map<DbKind, DatabaseDumper> dumpers = new EnumMap<>(DbKind.class);
        dumpers.put(DbKind.POSTGRES, new PgDumpDumper(runner, dumpCommand, timeout));
        dumpers.put(DbKind.SQLITE, new SqliteFileDumper());
        return dumpers;
    }

    /**
     * Failures of the run itself are reported in the returned record, never thrown. The retention
     * sweep runs whether or not the dump succeeded.
     *
     * @throws BackupInProgressException if another backup is running
     */
    public BackupRecord createBackup(int retentionDays) {
        if (!running.compareAndSet(false, true)) {
            throw new BackupInProgressException();
        }
        try {
            return runBackup(retentionDays);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private BackupRecord runBackup(int retentionDays) {
        Instant startedAt = clock.instant();
        String timestamp = TIMESTAMP_FORMAT.format(startedAt.atZone(clock.getZone()));
        Path backupDir = settings.backupDir();

        DbKind kind = null;
        Path archive = null;
        long size = 0L;
        int logCount = 0;
        String error = null;

        try {
            DatabaseTarget target = DatabaseTarget.parse(settings.databaseUrl());
            kind = target.kind();
            DatabaseDumper dumper = dumpers.get(kind);
            if (dumper == null) {
                throw new ConfigException("no dumper available for " + kind);
            }
            Files.createDirectories(backupDir);
            LOG.info("Starting {} backup of {}", kind, target.describe());

            Path dump = dumper.dump(target, backupDir, timestamp);
            verify(dump);
            if (kind == DbKind.SQLITE) {
                archive = dump;
            } else {
                PackResult packed;
                try {
                    packed = packager.pack(
                        dump,
                        settings.logDir(),
                        settings.logPattern(),
                        backupDir.resolve("backup_" + timestamp + ".zip")
                    );
                } finally {
                    deleteQuietly(dump);
                }
                verify(packed.archive());
                archive = packed.archive();
                logCount = packed.logCount();
            }
            size = Files.size(archive);
            LOG.info("Backup created: {} ({} bytes)", archive.getFileName(), size);
        } catch (DumpException e) {
            error = e.getMessage();
            LOG.error("Database dump failed: {}", error);
            if (settings.logOnlyArchiveOnDumpFailure()) {
                PackResult logOnly = packLogsOnly(backupDir, timestamp);
                if (logOnly != null) {
                    archive = logOnly.archive();
                    logCount = logOnly.logCount();
                    size = sizeOf(archive);
                    error = error + " (log-only archive kept: " + archive.getFileName() + ")";
                }
            }
        } catch (BackupException e) {
            error = e.getMessage();
            LOG.error("Backup failed: {}", error);
        } catch (ConfigException e) {
            error = "configuration error: " + e.getMessage();
            LOG.error("Backup not attempted: {}", e.getMessage());
        } catch (IOException e) {
            error = "I/O error: " + e.getMessage();
            LOG.error("Backup failed", e);
        } catch (RuntimeException e) {
            error = "unexpected error: " + e;
            LOG.error("Backup failed", e);
        }

        SweepResult sweep = sweep(backupDir, retentionDays);
        double durationSeconds = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
        boolean success = error == null;
        BackupRecord record = new BackupRecord(
            startedAt,
            kind,
            archive,
            size,
            durationSeconds,
            success,
            error,
            logCount,
            sweep
        );
        notify(record, retentionDays);
        return record;
    }

    private PackResult packLogsOnly(Path backupDir, String timestamp) {
        try {
            Files.createDirectories(backupDir);
            PackResult packed = packager.pack(
                null,
                settings.logDir(),
                settings.logPattern(),
                backupDir.resolve("backup_" + timestamp + ".zip")
            );
            verify(packed.archive());
            return packed;
        } catch (IOException | BackupVerificationException e) {
            LOG.error("Log-only archive could not be created: {}", e.getMessage());
            return null;
        }
    }

    static void verify(Path artifact) throws BackupVerificationException, IOException {
        if (!Files.exists(artifact)) {
            throw new BackupVerificationException("backup file was not created: " + artifact.getFileName());
        }
        if (Files.size(artifact) == 0L) {
            Files.deleteIfExists(artifact);
            throw new BackupVerificationException("backup file is empty (0 bytes): " + artifact.getFileName());
        }
    }

    private SweepResult sweep(Path backupDir, int retentionDays) {
        try {
            return sweeper.sweep(backupDir, retentionDays);
        } catch (RuntimeException e) {
            LOG.error("Retention sweep of {} failed", backupDir, e);
            return new SweepResult(0, 0L, 1, retentionDays > 0);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete raw dump {}: {}", path.getFileName(), e.getMessage());
        }
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            LOG.warn("Could not read size of {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    private void notify(BackupRecord record, int retentionDays) {
        SendResult result = NotificationSinks.sendQuietly(sink, message(record, retentionDays));
        if (!result.ok()) {
            LOG.warn("Backup notification failed via {}: {}", sink.name(), result.error());
        }
    }

    static String message(BackupRecord record, int retentionDays) {
        StringBuilder text = new StringBuilder();
        if (record.success()) {
            text.append("*Backup completed*\n")
                .append("- Database: ").append(record.dbKind()).append('\n')
                .append("- File: ").append(record.archivePath().getFileName()).append('\n')
                .append("- Size: ").append(megabytes(record.sizeBytes())).append('\n')
                .append("- Logs included: ").append(record.logCount()).append('\n');
        } else {
            text.append("*Backup failed*\n")
                .append("- Error: ").append(record.error()).append('\n');
            if (record.archivePath() != null) {
                text.append("- Kept: ").append(record.archivePath().getFileName()).append('\n');
            }
        }
        text.append("- Duration: ").append(String.format(Locale.ROOT, "%.2fs", record.durationSeconds())).append('\n');
        SweepResult sweep = record.sweep();
        if (sweep.enabled()) {
            text.append("- Retention (").append(retentionDays).append(" days): deleted ")
                .append(sweep.deletedCount()).append(" file(s), freed ")
                .append(megabytes(sweep.freedBytes()));
        } else {
            text.append("- Retention: disabled");
        }
        return text.toString();
    }

    private static String megabytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
    }
}
