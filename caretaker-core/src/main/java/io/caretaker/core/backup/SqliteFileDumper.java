package io.caretaker.core.backup;

import io.caretaker.core.database.DatabaseTarget;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies an SQLite database file into {@code sqlite_backup_<timestamp>.db.gz}.
 */
public final class SqliteFileDumper implements DatabaseDumper {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteFileDumper.class);

    @Override
    public Path dump(DatabaseTarget target, Path backupDir, String timestamp) throws BackupException, IOException {
        Path source = target.file();
        if (source == null || !Files.isRegularFile(source)) {
            throw new SourceNotFoundException(source);
        }

        Path output = backupDir.resolve("sqlite_backup_" + timestamp + ".db.gz");
        Path partial = output.resolveSibling(output.getFileName() + ".part");
        LOG.info("Compressing SQLite database {}", source);
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(partial))) {
            in.transferTo(out);
        } catch (IOException e) {
            Files.deleteIfExists(partial);
            throw e;
        }
        Files.move(partial, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return output;
    }
}
