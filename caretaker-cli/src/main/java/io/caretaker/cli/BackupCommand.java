package io.caretaker.cli;

import io.caretaker.core.backup.BackupRecord;
import io.caretaker.core.runtime.CaretakerRuntime;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "backup", description = "Run one database backup and the retention sweep")
public final class BackupCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--retention-days", description = "Delete backups older than this many days (<= 0 disables the sweep)")
    Integer retentionDays;

    public BackupCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CaretakerRuntime runtime = context.loadRuntime();
            int days = retentionDays == null ? runtime.config().backup().retentionDays() : retentionDays;
            BackupRecord record = runtime.backupManager().createBackup(days);

            if (record.success()) {
                System.out.println("Backup created: " + record.archivePath());
                System.out.println("Database: " + record.dbKind());
                System.out.println("Size: " + record.sizeBytes() + " bytes");
                System.out.println("Logs included: " + record.logCount());
            } else {
                System.err.println("Backup failed: " + record.error());
                if (record.archivePath() != null) {
                    System.out.println("Kept: " + record.archivePath());
                }
            }
            System.out.println("Duration: " + String.format(Locale.ROOT, "%.2fs", record.durationSeconds()));
            if (record.sweep().enabled()) {
                System.out.println("Retention: deleted " + record.sweep().deletedCount()
                    + " file(s), freed " + record.sweep().freedBytes() + " bytes");
            } else {
                System.out.println("Retention: disabled");
            }
            return record.success() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Backup command failed: " + e.getMessage());
            return 1;
        }
    }
}
