package io.caretaker.core.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.caretaker.core.backup.CommandResult;
import io.caretaker.core.config.ConfigException;
import io.caretaker.core.config.model.BackupConfig;
import io.caretaker.core.config.model.CaretakerConfig;
import io.caretaker.core.feedback.FeedbackCounts;
import io.caretaker.core.feedback.FeedbackRatio;
import io.caretaker.core.history.FileJobHistoryStore;
import io.caretaker.core.history.JobRunRecord;
import io.caretaker.core.model.Status;
import io.caretaker.core.monitor.ResourceProbe;
import io.caretaker.core.scheduler.Job;
import io.caretaker.core.scheduler.JobScheduler;
import io.caretaker.core.scheduler.ShutdownToken;
import io.caretaker.core.support.MutableClock;
import io.caretaker.core.support.RecordingSink;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CaretakerRuntimeTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.now(), ZoneOffset.UTC);
    private final RecordingSink sink = new RecordingSink();
    private final List<FeedbackRatio> requests = new ArrayList<>();
    private final ResourceProbe calmProbe = new ResourceProbe() {
        @Override
        public double cpuPercent(Duration window) {
            return 10;
        }

        @Override
        public double memoryPercent() {
            return 20;
        }

        @Override
        public double diskPercent(Path path) {
            return 30;
        }
    };

    @Test
    void shouldRegisterOnlyHealthCheckWithoutDatabases() {
        CaretakerRuntime runtime = runtime(config(""), false);

        JobScheduler scheduler = runtime.newScheduler(new ShutdownToken());

        assertThat(scheduler.jobs()).extracting(Job::name).containsExactly(CaretakerRuntime.HEALTH_JOB);
    }

    @Test
    void shouldRegisterAllStandardJobs() throws Exception {
        Path database = Files.writeString(tempDir.resolve("app.db"), "sqlite-bytes");
        CaretakerRuntime runtime = runtime(config("sqlite:" + database.toAbsolutePath()), true);

        JobScheduler scheduler = runtime.newScheduler(new ShutdownToken());

        assertThat(scheduler.jobs()).extracting(Job::name).containsExactly(
            CaretakerRuntime.HEALTH_JOB,
            CaretakerRuntime.BACKUP_JOB,
            CaretakerRuntime.FEEDBACK_JOB
        );
        Job backup = scheduler.jobs().get(1);
        assertThat(backup.trigger().describe()).isEqualTo("daily at 00:00");
    }

    @Test
    void malformedDatabaseUrlShouldFailBeforeTheLoopStarts() {
        CaretakerRuntime runtime = runtime(config("oracle://scott@db/orcl"), false);

        assertThatThrownBy(() -> runtime.newScheduler(new ShutdownToken()))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("oracle");
    }

    @Test
    void oneShotRunShouldRecordEveryJobInHistory() throws Exception {
        Path database = Files.writeString(tempDir.resolve("app.db"), "sqlite-bytes");
        CaretakerRuntime runtime = runtime(config("sqlite:" + database.toAbsolutePath()), true);
        JobScheduler scheduler = runtime.newScheduler(new ShutdownToken());

        int executed = scheduler.runAll();

        assertThat(executed).isEqualTo(3);
        List<JobRunRecord> history = runtime.history().recent(10);
        assertThat(history).hasSize(3);
        assertThat(history).allMatch(run -> run.status() == Status.OK);
        assertThat(requests).isEmpty();
        try (Stream<Path> files = Files.list(tempDir.resolve("backups"))) {
            assertThat(files.map(p -> p.getFileName().toString()).toList())
                .anyMatch(name -> name.startsWith("sqlite_backup_"));
        }
    }

    private CaretakerRuntime runtime(CaretakerConfig config, boolean withFeedback) {
        return new CaretakerRuntime(
            config,
            clock,
            sink,
            calmProbe,
            (command, environment, timeout) -> new CommandResult(1, "pg_dump should not run"),
            withFeedback ? () -> new FeedbackCounts(80, 20) : null,
            requests::add,
            new FileJobHistoryStore(tempDir.resolve("history/job-runs.json"))
        );
    }

    private CaretakerConfig config(String databaseUrl) {
        BackupConfig defaults = BackupConfig.defaults();
        BackupConfig backup = new BackupConfig(
            databaseUrl,
            tempDir.resolve("backups").toString(),
            tempDir.resolve("logs").toString(),
            defaults.logPattern(),
            defaults.retentionDays(),
            defaults.backupTime(),
            defaults.dumpTimeoutSeconds(),
            defaults.dumpCommand(),
            false
        );
        return CaretakerConfig.defaults().withBackup(backup);
    }
}
