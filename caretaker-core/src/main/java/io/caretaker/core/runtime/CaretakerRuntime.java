package io.caretaker.core.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.caretaker.core.backup.ArchivePackager;
import io.caretaker.core.backup.BackupJob;
import io.caretaker.core.backup.BackupManager;
import io.caretaker.core.backup.BackupSettings;
import io.caretaker.core.backup.CommandRunner;
import io.caretaker.core.backup.ProcessCommandRunner;
import io.caretaker.core.backup.RetentionSweeper;
import io.caretaker.core.config.ConfigPaths;
import io.caretaker.core.config.model.BackupConfig;
import io.caretaker.core.config.model.CaretakerConfig;
import io.caretaker.core.config.model.MonitorConfig;
import io.caretaker.core.database.DatabaseTarget;
import io.caretaker.core.feedback.FeedbackCountSource;
import io.caretaker.core.feedback.FeedbackLoopJob;
import io.caretaker.core.feedback.FeedbackThresholdEvaluator;
import io.caretaker.core.feedback.JdbcFeedbackCountSource;
import io.caretaker.core.feedback.RetrainingRequester;
import io.caretaker.core.history.FileJobHistoryStore;
import io.caretaker.core.history.HistoryRecordingListener;
import io.caretaker.core.history.JobHistoryService;
import io.caretaker.core.history.JobHistoryStore;
import io.caretaker.core.monitor.HealthCheckJob;
import io.caretaker.core.monitor.HealthMonitor;
import io.caretaker.core.monitor.ResourceProbe;
import io.caretaker.core.monitor.SystemResourceProbe;
import io.caretaker.core.monitor.Thresholds;
import io.caretaker.core.notify.NotificationSink;
import io.caretaker.core.notify.NotificationSinks;
import io.caretaker.core.scheduler.AlertingResultListener;
import io.caretaker.core.scheduler.Job;
import io.caretaker.core.scheduler.JobScheduler;
import io.caretaker.core.scheduler.ShutdownToken;
import io.caretaker.core.scheduler.Trigger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds every component once from the loaded configuration and hands the same instances to the
 * scheduler and to the one-shot CLI commands.
 */
public final class CaretakerRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(CaretakerRuntime.class);

    public static final String HEALTH_JOB = "health-check";
    public static final String BACKUP_JOB = "database-backup";
    public static final String FEEDBACK_JOB = "feedback-loop";

    private final CaretakerConfig config;
    private final Clock clock;
    private final NotificationSink sink;
    private final Thresholds thresholds;
    private final HealthMonitor healthMonitor;
    private final BackupManager backupManager;
    private final FeedbackThresholdEvaluator evaluator;
    private final FeedbackCountSource feedbackSource;
    private final RetrainingRequester requester;
    private final JobHistoryService history;

    /**
     * @param feedbackSource null when no feedback database is configured
     */
    public CaretakerRuntime(
        CaretakerConfig config,
        Clock clock,
        NotificationSink sink,
        ResourceProbe probe,
        CommandRunner commandRunner,
        FeedbackCountSource feedbackSource,
        RetrainingRequester requester,
        JobHistoryStore historyStore
    ) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.requester = Objects.requireNonNull(requester, "requester must not be null");
        this.feedbackSource = feedbackSource;

        MonitorConfig monitor = config.monitor();
        this.thresholds = Thresholds.from(monitor);
        Path diskPath = monitor.diskPath() == null || monitor.diskPath().isBlank()
            ? HealthMonitor.defaultDiskPath()
            : ConfigPaths.resolve(monitor.diskPath());
        this.healthMonitor = new HealthMonitor(
            probe,
            sink,
            diskPath,
            Duration.ofMillis(Math.max(1, monitor.cpuSampleMillis())),
            clock
        );

        BackupConfig backup = config.backup();
        this.backupManager = new BackupManager(
            BackupSettings.from(backup),
            BackupManager.defaultDumpers(commandRunner, backup.dumpCommand(), Duration.ofSeconds(backup.dumpTimeoutSeconds())),
            new ArchivePackager(),
            new RetentionSweeper(clock),
            sink,
            clock
        );
        this.evaluator = new FeedbackThresholdEvaluator();
        this.history = new JobHistoryService(Objects.requireNonNull(historyStore, "historyStore must not be null"), clock);
    }

    /**
     * Production wiring: system clock, real probes, {@code pg_dump} through a child process and a
     * Slack sink when one is configured.
     */
    public static CaretakerRuntime create(CaretakerConfig config, RetrainingRequester requester) {
        Objects.requireNonNull(config, "config must not be null");
        FeedbackCountSource feedbackSource = config.feedback().configured()
            ? new JdbcFeedbackCountSource(DatabaseTarget.parse(config.feedback().databaseUrl()))
            : null;
        return new CaretakerRuntime(
            config,
            systemClock(config),
            NotificationSinks.fromConfig(config.notification(), new ObjectMapper()),
            new SystemResourceProbe(),
            new ProcessCommandRunner(),
            feedbackSource,
            requester,
            new FileJobHistoryStore(ConfigPaths.resolve(config.scheduler().historyFile()))
        );
    }

    static Clock systemClock(CaretakerConfig config) {
        String zone = config.scheduler().timeZone();
        return zone == null || zone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(zone));
    }

    /**
     * Scheduler with the standard jobs registered and history and failure alerts attached.
     */
    public JobScheduler newScheduler(ShutdownToken shutdown) {
        JobScheduler scheduler = JobScheduler.create(clock, Duration.ofSeconds(config.scheduler().tickSeconds()), shutdown);
        registerJobs(scheduler);
        scheduler.addListener(new HistoryRecordingListener(history));
        scheduler.addListener(new AlertingResultListener(sink));
        return scheduler;
    }

    /**
     * Registers {@value #HEALTH_JOB}, {@value #BACKUP_JOB} when a database URL is set and
     * {@value #FEEDBACK_JOB} when a feedback source is available. A configured but malformed
     * database URL fails here, before the loop starts.
     */
    public List<Job> registerJobs(JobScheduler scheduler) {
        List<Job> registered = new ArrayList<>();
        registered.add(scheduler.register(
            HEALTH_JOB,
            Trigger.everyMinutes(config.monitor().intervalMinutes()),
            new HealthCheckJob(healthMonitor, thresholds)
        ));

        BackupConfig backup = config.backup();
        if (backup.databaseUrl() == null || backup.databaseUrl().isBlank()) {
            LOG.warn("No database URL configured; job {} is not scheduled", BACKUP_JOB);
        } else {
            DatabaseTarget.parse(backup.databaseUrl());
            registered.add(scheduler.register(
                BACKUP_JOB,
                Trigger.dailyAt(backup.backupTime()),
                new BackupJob(backupManager, backup.retentionDays())
            ));
        }

        if (feedbackSource == null) {
            LOG.info("No feedback database configured; job {} is not scheduled", FEEDBACK_JOB);
        } else {
            registered.add(scheduler.register(
                FEEDBACK_JOB,
                Trigger.everyMinutes(config.feedback().intervalMinutes()),
                newFeedbackLoopJob()
            ));
        }
        return registered;
    }

    public FeedbackLoopJob newFeedbackLoopJob() {
        return newFeedbackLoopJob(config.feedback().threshold());
    }

    public FeedbackLoopJob newFeedbackLoopJob(double threshold) {
        if (feedbackSource == null) {
            throw new IllegalStateException("no feedback database configured");
        }
        return new FeedbackLoopJob(feedbackSource, evaluator, threshold, sink, requester, clock);
    }

    public CaretakerConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public NotificationSink notificationSink() {
        return sink;
    }

    public Thresholds thresholds() {
        return thresholds;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public BackupManager backupManager() {
        return backupManager;
    }

    public FeedbackThresholdEvaluator feedbackEvaluator() {
        return evaluator;
    }

    public Optional<FeedbackCountSource> feedbackSource() {
        return Optional.ofNullable(feedbackSource);
    }

    public JobHistoryService history() {
        return history;
    }
}
