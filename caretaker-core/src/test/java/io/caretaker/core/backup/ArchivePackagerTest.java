package io.caretaker.core.backup;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchivePackagerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStoreDumpAtRootAndLogsUnderLogsFolder() throws Exception {
        Path dump = tempDir.resolve("db_backup_20260101_000000.dump");
        Files.writeString(dump, "dump-bytes");
        Path logs = Files.createDirectories(tempDir.resolve("logs"));
        Files.writeString(logs.resolve("caretaker.log"), "line one");
        Files.writeString(logs.resolve("caretaker.2026-01-01.0.log"), "rotated");
        Files.writeString(logs.resolve("readme.md"), "skip");
        Path archive = tempDir.resolve("backup_20260101_000000.zip");

        PackResult result = new ArchivePackager().pack(dump, logs, "*.log*", archive);

        assertThat(result.logCount()).isEqualTo(2);
        assertThat(Files.exists(tempDir.resolve("backup_20260101_000000.zip.part"))).isFalse();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            assertThat(zip.size()).isEqualTo(3);
            assertThat(read(zip, "db_backup_20260101_000000.dump")).isEqualTo("dump-bytes");
            assertThat(read(zip, "logs/caretaker.log")).isEqualTo("line one");
            assertThat(zip.getEntry("logs/caretaker.2026-01-01.0.log")).isNotNull();
            assertThat(zip.getEntry("logs/readme.md")).isNull();
        }
    }

    @Test
    void shouldArchiveWithoutLogsWhenLogDirectoryIsMissing() throws Exception {
        Path dump = tempDir.resolve("db_backup_20260101_000000.dump");
        Files.writeString(dump, "dump-bytes");
        Path archive = tempDir.resolve("backup_20260101_000000.zip");

        PackResult result = new ArchivePackager().pack(dump, tempDir.resolve("no-logs"), "*.log*", archive);

        assertThat(result.logCount()).isZero();
        assertThat(Files.size(archive)).isPositive();
    }

    private String read(ZipFile zip, String entry) throws IOException {
        return new String(zip.getInputStream(zip.getEntry(entry)).readAllBytes(), StandardCharsets.UTF_8);
    }
}
