package io.caretaker.core.backup;

import io.caretaker.core.config.ConfigPaths;
import io.caretaker.core.config.model.BackupConfig;
import java.nio.file.Path;

public record BackupSettings(
    String databaseUrl,
    Path backupDir,
    Path logDir,
    String logPattern,
    boolean logOnlyArchiveOnDumpFailure
) {

    public static BackupSettings from(BackupConfig config) {
        return new BackupSettings(
            config.databaseUrl(),
            ConfigPaths.resolve(config.backupDir()),
            ConfigPaths.resolve(config.logDir()),
            config.logPattern(),
            config.logOnlyArchiveOnDumpFailure()
        );
    }
}
