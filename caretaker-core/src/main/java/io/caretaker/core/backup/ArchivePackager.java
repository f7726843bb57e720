package io.caretaker.core.backup;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the zip archive for a server-engine backup: the dump at the root and matching log files
 * under {@code logs/}. The archive is written to a {@code .part} file and renamed into place.
 */
public final class ArchivePackager {
    private static final Logger LOG = LoggerFactory.getLogger(ArchivePackager.class);
    static final String LOG_ENTRY_PREFIX = "logs/";

    /**
     * @param dump the raw dump to include, or {@code null} for a log-only archive
     */
    public PackResult pack(Path dump, Path logDir, String logPattern, Path archive) throws IOException {
        Path partial = archive.resolveSibling(archive.getFileName() + ".part");
        List<Path> logs = collectLogs(logDir, logPattern);
        try (OutputStream out = Files.newOutputStream(partial);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            if (dump != null) {
                addEntry(zip, dump.getFileName().toString(), dump);
            }
            for (Path log : logs) {
                addEntry(zip, LOG_ENTRY_PREFIX + log.getFileName(), log);
            }
        } catch (IOException e) {
            Files.deleteIfExists(partial);
            throw e;
        }
        try {
            Files.move(partial, archive, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(partial);
            throw e;
        }
        LOG.info("Packaged {} with {} log file(s)", archive.getFileName(), logs.size());
        return new PackResult(archive, logs.size());
    }

    private List<Path> collectLogs(Path logDir, String logPattern) throws IOException {
        List<Path> logs = new ArrayList<>();
        if (logDir == null || !Files.isDirectory(logDir)) {
            LOG.debug("Log directory {} does not exist; archiving without logs", logDir);
            return logs;
        }
        String glob = logPattern == null || logPattern.isBlank() ? "*.log*" : logPattern;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logDir, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    logs.add(path);
                }
            }
        }
        logs.sort(null);
        return logs;
    }

    private void addEntry(ZipOutputStream zip, String name, Path file) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        Files.copy(file, zip);
        zip.closeEntry();
    }
}
