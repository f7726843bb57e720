package io.caretaker.cli;

import io.caretaker.core.config.model.CaretakerConfig;
import io.caretaker.core.history.JobRunRecord;
import io.caretaker.core.runtime.CaretakerRuntime;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration and recent job runs")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--limit", description = "Number of recent job runs to show", defaultValue = "10")
    int limit;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CaretakerRuntime runtime = context.loadRuntime();
            CaretakerConfig config = runtime.config();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database configured: " + !isBlank(config.backup().databaseUrl()));
            System.out.println("Backup dir: " + config.backup().backupDir());
            System.out.println("Backup time: " + config.backup().backupTime());
            System.out.println("Retention days: " + config.backup().retentionDays());
            System.out.println("Health interval: " + config.monitor().intervalMinutes() + " min");
            System.out.println("Feedback configured: " + config.feedback().configured());
            System.out.println("Notifications: " + runtime.notificationSink().name());

            List<JobRunRecord> recent = runtime.history().recent(limit);
            System.out.println("Recent runs: " + recent.size());
            for (JobRunRecord run : recent) {
                System.out.println("  " + run.startedAt() + " " + run.jobName() + " " + run.status().label()
                    + (run.detail().containsKey("error") ? " " + run.detail().get("error") : ""));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
