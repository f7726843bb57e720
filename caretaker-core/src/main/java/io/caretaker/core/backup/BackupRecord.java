package io.caretaker.core.backup;

import io.caretaker.core.database.DbKind;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Result of one backup run.
 *
 * @param dbKind null when the database target could not be resolved
 * @param archivePath the final artifact, or null when none was kept
 * @param error null on success
 */
public record BackupRecord(
    Instant timestamp,
    DbKind dbKind,
    Path archivePath,
    long sizeBytes,
    double durationSeconds,
    boolean success,
    String error,
    int logCount,
    SweepResult sweep
) {
}
