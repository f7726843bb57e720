package io.caretaker.core.backup;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes backup artifacts older than the retention window. Only files whose name matches
 * {@code *backup_*} are considered; anything else in the directory is left alone.
 */
public final class RetentionSweeper {
    private static final Logger LOG = LoggerFactory.getLogger(RetentionSweeper.class);
    static final String BACKUP_GLOB = "*backup_*";

    private final Clock clock;

    public RetentionSweeper(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public SweepResult sweep(Path backupDir, int retentionDays) {
        if (retentionDays <= 0) {
            LOG.warn("Retention sweep disabled (retentionDays={})", retentionDays);
            return SweepResult.disabled();
        }
        if (!Files.isDirectory(backupDir)) {
            return SweepResult.empty();
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = 0;
        int failed = 0;
        long freed = 0L;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir, BACKUP_GLOB)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    Instant modified = Files.getLastModifiedTime(file).toInstant();
                    if (!modified.isBefore(cutoff)) {
                        continue;
                    }
                    long size = Files.size(file);
                    Files.delete(file);
                    deleted++;
                    freed += size;
                    LOG.info("Deleted expired backup {} ({} bytes)", file.getFileName(), size);
                } catch (NoSuchFileException e) {
                    LOG.debug("Backup {} already removed", file.getFileName());
                } catch (IOException e) {
                    failed++;
                    LOG.warn("Could not delete expired backup {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            LOG.error("Retention sweep of {} failed: {}", backupDir, e.getMessage());
            return new SweepResult(deleted, freed, failed + 1, true);
        }

        if (deleted > 0) {
            LOG.info("Retention sweep removed {} file(s), freed {} bytes", deleted, freed);
        }
        return new SweepResult(deleted, freed, failed, true);
    }
}
