package io.caretaker.core.backup;

import io.caretaker.core.database.DatabaseTarget;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PostgreSQL dump in custom format ({@code pg_dump -F c -b}). The password is passed through
 * {@code PGPASSWORD}, never on the command line.
 */
public final class PgDumpDumper implements DatabaseDumper {
    private static final Logger LOG = LoggerFactory.getLogger(PgDumpDumper.class);
    private static final int OUTPUT_TAIL_CHARS = 500;

    private final CommandRunner runner;
    private final String dumpCommand;
    private final Duration timeout;

    public PgDumpDumper(CommandRunner runner, String dumpCommand, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.dumpCommand = dumpCommand == null || dumpCommand.isBlank() ? "pg_dump" : dumpCommand;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public Path dump(DatabaseTarget target, Path backupDir, String timestamp) throws BackupException {
        Path output = backupDir.resolve("db_backup_" + timestamp + ".dump");
        List<String> command = List.of(
            dumpCommand,
            "-h", target.host(),
            "-p", String.valueOf(target.port()),
            "-U", target.user(),
            "-F", "c",
            "-b",
            "-f", output.toString(),
            target.database()
        );
        Map<String, String> environment = target.password() == null
            ? Map.of()
            : Map.of("PGPASSWORD", target.password());

        LOG.info("Starting {} for {}", dumpCommand, target.describe());
        CommandResult result;
        try {
            result = runner.run(command, environment, timeout);
        } catch (TimeoutException e) {
            discard(output);
            throw new DumpTimeoutException(dumpCommand, timeout);
        } catch (IOException e) {
            discard(output);
            throw new DumpException(dumpCommand + " could not be started (is the PostgreSQL client installed?): "
                + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            discard(output);
            throw new DumpException(dumpCommand + " was interrupted", e);
        }

        if (!result.succeeded()) {
            discard(output);
            throw new DumpException(
                dumpCommand + " exited with code " + result.exitCode() + ": " + tail(result.output()),
                result.exitCode()
            );
        }
        LOG.info("{} finished: {}", dumpCommand, output.getFileName());
        return output;
    }

    private void discard(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            LOG.warn("Could not remove partial dump {}: {}", output, e.getMessage());
        }
    }

    private String tail(String output) {
        if (output == null || output.isBlank()) {
            return "(no output)";
        }
        String trimmed = output.trim();
        return trimmed.length() <= OUTPUT_TAIL_CHARS ? trimmed : "..." + trimmed.substring(trimmed.length() - OUTPUT_TAIL_CHARS);
    }
}
